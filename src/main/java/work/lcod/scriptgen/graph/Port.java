package work.lcod.scriptgen.graph;

import java.util.Objects;

public record Port(String name, PortDirection direction, PortType type) {
    public static final String DEFAULT_INPUT = "In";
    public static final String DEFAULT_OUTPUT = "Out";

    public Port {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(direction, "direction");
        type = type == null ? PortType.PIPELINE : type;
    }

    public static Port input(String name) {
        return new Port(name, PortDirection.INPUT, PortType.PIPELINE);
    }

    public static Port output(String name) {
        return new Port(name, PortDirection.OUTPUT, PortType.PIPELINE);
    }
}
