package util.logging;

import driver.Config;
import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Manager for creating and configuring Logger instances
 */
public class LogManager {
    private static final String LOG_DIRECTORY = "logs";
    private static final Map<String, Logger> loggers = new ConcurrentHashMap<>();
    private static volatile LogLevel rootLevel = LogLevel.INFO;
    private static boolean initialized = false;

    // appenders, both off unless configured
    private static boolean consoleEnabled = false;
    private static boolean fileEnabled = false;
    private static PrintWriter fileWriter;
    private static final Object FILE_LOCK = new Object();

    private LogManager() {
    }

    /**
     * Get a logger following the root level
     * @param clazz The class requesting the logger
     * @return A Logger instance
     */
    public static Logger getLogger(Class<?> clazz) {
        return getLogger(clazz.getName(), null);
    }

    /**
     * Get a logger pinned to a level
     * @param clazz The class requesting the logger
     * @param level fixed level of the logger
     * @return A Logger instance
     */
    public static Logger getLogger(Class<?> clazz, LogLevel level) {
        return getLogger(clazz.getName(), level);
    }

    /**
     * Get a logger for the specified name
     * @param name The logger name
     * @param level fixed level, or null to follow the root level
     * @return A Logger instance
     */
    public static synchronized Logger getLogger(String name, LogLevel level) {
        if (!initialized) {
            init();
        }
        String key = level == null ? name : name + "@" + level;
        return loggers.computeIfAbsent(key, n -> new SimpleLogger(name, level));
    }

    /**
     * Initialize the logging system from the configuration
     */
    public static synchronized void init() {
        if (initialized) {
            return;
        }

        Config config = Config.getInstance();
        rootLevel = config.isDebug ? LogLevel.DEBUG : config.logLevel;
        consoleEnabled = config.logConsole;
        fileEnabled = config.logFile;

        if (fileEnabled) {
            openLogFile();
        }

        initialized = true;
    }

    private static void openLogFile() {
        File logDir = new File(LOG_DIRECTORY);
        if (!logDir.exists() && !logDir.mkdirs()) {
            System.err.println("[scfg] cannot create log directory " + logDir.getAbsolutePath());
            fileEnabled = false;
            return;
        }
        try {
            File logFile = new File(logDir, "scfg" + System.currentTimeMillis() + ".log");
            synchronized (FILE_LOCK) {
                fileWriter = new PrintWriter(new FileWriter(logFile, true), true);
            }
        } catch (IOException e) {
            System.err.println("[scfg] file logging disabled: " + e.getMessage());
            fileEnabled = false;
        }
    }

    public static void setRootLevel(LogLevel level) {
        rootLevel = level;
    }

    public static LogLevel getRootLevel() {
        return rootLevel;
    }

    /**
     * Write log message to configured appenders
     * @param level Log level of the message
     * @param message The formatted log message
     */
    static void writeLog(LogLevel level, String message) {
        if (consoleEnabled) {
            if (level.getValue() >= LogLevel.WARN.getValue()) {
                System.err.println(message);
            } else {
                System.out.println(message);
            }
        }

        if (fileEnabled) {
            synchronized (FILE_LOCK) {
                if (fileWriter != null) {
                    fileWriter.println(message);
                }
            }
        }
    }

    public static void enableConsole() {
        consoleEnabled = true;
    }

    public static void disableConsole() {
        consoleEnabled = false;
    }

    public static synchronized void enableFile() {
        fileEnabled = true;
        if (fileWriter == null) {
            openLogFile();
        }
    }

    public static void disableFile() {
        fileEnabled = false;
        shutdown();
    }

    /**
     * Close the file appender
     */
    public static void shutdown() {
        synchronized (FILE_LOCK) {
            if (fileWriter != null) {
                fileWriter.close();
                fileWriter = null;
            }
        }
    }
}
