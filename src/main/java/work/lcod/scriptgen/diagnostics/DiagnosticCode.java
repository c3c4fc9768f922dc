package work.lcod.scriptgen.diagnostics;

/**
 * Anomaly categories reported by snapshot validation and code generation.
 */
public enum DiagnosticCode {
    CYCLE(Severity.ERROR),
    MALFORMED_REFERENCE(Severity.WARNING),
    DUPLICATE_CONNECTION(Severity.WARNING),
    PORT_ALREADY_CONNECTED(Severity.WARNING),
    DUPLICATE_ZONE_MEMBERSHIP(Severity.WARNING),
    AMBIGUOUS_UPSTREAM(Severity.WARNING),
    UNHOISTED_CALLABLE(Severity.WARNING),
    DUPLICATE_BINDING_NAME(Severity.WARNING);

    private final Severity severity;

    DiagnosticCode(Severity severity) {
        this.severity = severity;
    }

    public Severity severity() {
        return severity;
    }
}
