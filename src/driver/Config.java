package driver;

import util.logging.LogLevel;

/*
 * configuration of the restructurer, read from system properties
 */
public class Config {
    private static Config config = new Config();

    public boolean isDebug;
    public boolean isVerify;
    public boolean logConsole;
    public boolean logFile;
    public LogLevel logLevel;

    private Config() {
        isDebug = getFlag("debug");
        isVerify = getFlag("verify");
        logConsole = getFlag("log.console");
        logFile = getFlag("log.file");
        logLevel = LogLevel.parse(System.getProperty("log.level"), LogLevel.INFO);
    }

    /**
     * Check if a boolean system property is set to "true" (case-insensitive).
     * @param name the system property name
     * @return true if the property is exactly "true", false otherwise
     */
    public static boolean getFlag(String name) {
        String raw = System.getProperty(name);
        return raw != null && raw.equalsIgnoreCase("true");
    }

    public static Config getInstance() {
        return config;
    }

    /**
     * Re-read the system properties (used by tests that flip flags)
     */
    public static void reload() {
        config = new Config();
    }
}
