package work.lcod.scriptgen.graph;

import java.util.Objects;

/**
 * A typed block parameter. The effective value is the user value when present, otherwise the default.
 */
public record Parameter(String name, ParamType type, String value, String defaultValue) {
    public Parameter {
        Objects.requireNonNull(name, "name");
        type = type == null ? ParamType.STRING : type;
        value = value == null ? "" : value;
        defaultValue = defaultValue == null ? "" : defaultValue;
    }

    public static Parameter of(String name, ParamType type, String value) {
        return new Parameter(name, type, value, "");
    }

    public String effectiveValue() {
        var raw = value.isBlank() ? defaultValue : value;
        return raw.trim();
    }
}
