package work.lcod.scriptgen.graph;

public enum PortDirection {
    INPUT,
    OUTPUT
}
