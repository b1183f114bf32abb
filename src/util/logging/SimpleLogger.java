package util.logging;

import driver.ScfgDriver;

import java.text.SimpleDateFormat;
import java.util.Date;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Implementation of the Logger interface
 */
public class SimpleLogger implements Logger {
    private final String name;
    // null: follow the root level of LogManager
    private final LogLevel level;
    private static final Pattern PLACEHOLDER_PATTERN = Pattern.compile("\\{}");

    public SimpleLogger(String name, LogLevel level) {
        this.name = name;
        this.level = level;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public boolean isEnabled(LogLevel level) {
        return level != LogLevel.OFF && !level.isLessSpecificThan(effectiveLevel());
    }

    @Override
    public void log(LogLevel level, String format, Object... args) {
        if (!isEnabled(level)) {
            return;
        }

        // Get caller information
        StackTraceElement caller = getCaller();
        String methodInfo = "";

        if (caller != null) {
            methodInfo = String.format("[%s:%d] ", caller.getMethodName(), caller.getLineNumber());
        }

        String source = ScfgDriver.getInstance().getSource();
        String timestamp = new SimpleDateFormat("yyyy-MM-dd HH:mm:ss,SSS").format(new Date());
        String logMessage = String.format("%s %s [%s] %s - %s%s",
                source != null ? source : "scfg",
                timestamp,
                level,
                name,
                methodInfo,
                formatMessage(format, args));

        LogManager.writeLog(level, logMessage);
    }

    private LogLevel effectiveLevel() {
        return level != null ? level : LogManager.getRootLevel();
    }

    /**
     * Gets the calling class/method from the stack trace
     */
    private StackTraceElement getCaller() {
        StackTraceElement[] stackTrace = Thread.currentThread().getStackTrace();
        boolean foundLogger = false;

        for (StackTraceElement element : stackTrace) {
            String className = element.getClassName();
            boolean loggingFrame = className.startsWith(Logger.class.getName())
                    || className.equals(SimpleLogger.class.getName());
            if (foundLogger && !loggingFrame && !className.startsWith("java.lang.reflect.")) {
                return element;
            }
            if (loggingFrame) {
                foundLogger = true;
            }
        }

        return null;
    }

    static String formatMessage(String format, Object... args) {
        if (format == null) {
            return "null";
        }
        if (args == null || args.length == 0) {
            return format;
        }

        StringBuilder result = new StringBuilder();
        int argIndex = 0;
        Matcher matcher = PLACEHOLDER_PATTERN.matcher(format);

        while (matcher.find()) {
            if (argIndex < args.length) {
                matcher.appendReplacement(result, Matcher.quoteReplacement(String.valueOf(args[argIndex++])));
            } else {
                matcher.appendReplacement(result, "{}");
            }
        }
        matcher.appendTail(result);

        return result.toString();
    }
}
