package work.lcod.scriptgen.api;

import java.util.Locale;

/**
 * Threshold for generator logging. Diagnostics are logged at {@link #WARN} or {@link #ERROR}, so the default
 * shows them; {@link #FATAL} silences warnings and keeps only errors.
 */
public enum LogLevel {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR,
    FATAL;

    public static final LogLevel DEFAULT = WARN;

    /** Parses a level name case-insensitively; {@code warning} is accepted for {@link #WARN}. */
    public static LogLevel from(String value) {
        if (value == null || value.isBlank()) {
            return DEFAULT;
        }
        var normalized = value.trim().toUpperCase(Locale.ROOT);
        if ("WARNING".equals(normalized)) {
            return WARN;
        }
        for (var level : values()) {
            if (level.name().equals(normalized)) {
                return level;
            }
        }
        throw new IllegalArgumentException("Unknown log level '" + value + "' (expected trace|debug|info|warn|error|fatal)");
    }
}
