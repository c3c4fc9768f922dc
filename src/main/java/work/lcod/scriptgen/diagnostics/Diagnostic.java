package work.lcod.scriptgen.diagnostics;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A single anomaly found while validating or generating. {@code blockId} is {@code null} when no block applies.
 */
public record Diagnostic(DiagnosticCode code, String blockId, String message) {
    public Diagnostic {
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(message, "message");
    }

    public static Diagnostic of(DiagnosticCode code, String blockId, String message) {
        return new Diagnostic(code, blockId, message);
    }

    public Severity severity() {
        return code.severity();
    }

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("severity", severity().name().toLowerCase());
        map.put("code", code.name().toLowerCase());
        if (blockId != null) {
            map.put("block", blockId);
        }
        map.put("message", message);
        return map;
    }

    @Override
    public String toString() {
        var where = blockId == null ? "" : " [" + blockId + "]";
        return severity() + " " + code + where + ": " + message;
    }
}
