package work.lcod.scriptgen.graph;

import java.util.Locale;

public enum ParamType {
    STRING,
    INT,
    BOOL,
    STRING_ARRAY,
    SCRIPT_BLOCK,
    PATH,
    CREDENTIAL,
    ENUM;

    /**
     * Accepts both the enum constant ({@code SCRIPT_BLOCK}) and the editor spelling ({@code ScriptBlock}).
     */
    public static ParamType from(String value) {
        if (value == null || value.isBlank()) {
            return STRING;
        }
        var normalized = value.trim()
            .replaceAll("([a-z])([A-Z])", "$1_$2")
            .replace('-', '_')
            .toUpperCase(Locale.ROOT);
        try {
            return ParamType.valueOf(normalized);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported parameter type: " + value);
        }
    }
}
