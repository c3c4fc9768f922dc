package work.lcod.scriptgen.diagnostics;

public enum Severity {
    WARNING,
    ERROR
}
