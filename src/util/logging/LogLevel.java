package util.logging;

/**
 * Log levels ordered from least to most specific
 */
public enum LogLevel {
    TRACE(0),
    DEBUG(1),
    INFO(2),
    WARN(3),
    ERROR(4),
    FATAL(5),
    OFF(6);

    private final int value;

    LogLevel(int value) {
        this.value = value;
    }

    public int getValue() {
        return value;
    }

    /**
     * @return true if this level would be filtered out by a logger set to {@code other}
     */
    public boolean isLessSpecificThan(LogLevel other) {
        return value < other.value;
    }

    /**
     * Parse a level name, falling back to {@code fallback} for unknown names
     */
    public static LogLevel parse(String name, LogLevel fallback) {
        if (name == null || name.isBlank()) {
            return fallback;
        }
        for (LogLevel level : values()) {
            if (level.name().equalsIgnoreCase(name.trim())) {
                return level;
            }
        }
        return fallback;
    }
}
