package work.lcod.preview.api;

import java.util.Locale;

/**
 * Thresholds for diagnostics printed by the command line. The pipeline itself never prints.
 */
public enum LogLevel {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR,
    FATAL;

    public static LogLevel from(String value) {
        if (value == null || value.isBlank()) {
            return WARN;
        }
        try {
            return LogLevel.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported log level: " + value);
        }
    }

    /** True when a message at {@code level} passes this threshold. */
    public boolean allows(LogLevel level) {
        return level.ordinal() >= ordinal();
    }
}
