package work.lcod.scriptgen.graph;

import java.util.Objects;

/**
 * Directed edge from an output port of one block to an input port of another.
 */
public record Connection(String sourceBlock, String sourcePort, String targetBlock, String targetPort) {
    public Connection {
        Objects.requireNonNull(sourceBlock, "sourceBlock");
        Objects.requireNonNull(targetBlock, "targetBlock");
        sourcePort = sourcePort == null || sourcePort.isBlank() ? Port.DEFAULT_OUTPUT : sourcePort;
        targetPort = targetPort == null || targetPort.isBlank() ? Port.DEFAULT_INPUT : targetPort;
    }

    public static Connection between(String sourceBlock, String targetBlock) {
        return new Connection(sourceBlock, Port.DEFAULT_OUTPUT, targetBlock, Port.DEFAULT_INPUT);
    }

    public String describe() {
        return sourceBlock + "." + sourcePort + " -> " + targetBlock + "." + targetPort;
    }
}
