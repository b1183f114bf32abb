package util.logging;

import java.util.function.Supplier;

/**
 * Logger facade used across the restructurer.
 * Messages use {} placeholders, filled from the arguments in order.
 */
public interface Logger {

    String getName();

    boolean isEnabled(LogLevel level);

    void log(LogLevel level, String format, Object... args);

    default void trace(String format, Object... args) {
        log(LogLevel.TRACE, format, args);
    }

    default void debug(String format, Object... args) {
        log(LogLevel.DEBUG, format, args);
    }

    /**
     * Debug message built only when debug output is on; graph dumps go through here.
     */
    default void debug(Supplier<String> message) {
        if (isDebugEnabled()) {
            log(LogLevel.DEBUG, message.get());
        }
    }

    default void info(String format, Object... args) {
        log(LogLevel.INFO, format, args);
    }

    default void warn(String format, Object... args) {
        log(LogLevel.WARN, format, args);
    }

    default void error(String format, Object... args) {
        log(LogLevel.ERROR, format, args);
    }

    default void fatal(String format, Object... args) {
        log(LogLevel.FATAL, format, args);
    }

    default boolean isTraceEnabled() {
        return isEnabled(LogLevel.TRACE);
    }

    default boolean isDebugEnabled() {
        return isEnabled(LogLevel.DEBUG);
    }
}
