package work.lcod.scriptgen.graph;

import java.util.Locale;

/**
 * Value shape a port carries. The generator treats every port as a pipeline value.
 */
public enum PortType {
    STRING,
    OBJECT,
    ARRAY,
    PIPELINE;

    public static PortType from(String value) {
        if (value == null || value.isBlank()) {
            return PIPELINE;
        }
        try {
            return PortType.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported port type: " + value);
        }
    }
}
