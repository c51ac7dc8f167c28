package com.qaplatform.util;

import java.io.IOException;
import java.util.logging.*;

/**
 * Central logging facade for the formula engine.
 * Wraps java.util.logging with a small static interface and configures
 * console and file handlers from {@link EngineConfig}.
 */
public class LoggingUtil {
    public enum ConsoleOutputMode {
        ALL_TO_OUT,
        ALL_TO_ERR,
        SPLIT_SEVERE_TO_ERR
    }

    private static final Logger logger = Logger.getLogger("com.qaplatform.formula");
    private static boolean initialized = false;
    private static Level currentLevel = Level.INFO;
    private static String logFileName = "formula-engine.log";
    private static boolean fileLogging = false;
    private static ConsoleOutputMode consoleOutputMode = ConsoleOutputMode.SPLIT_SEVERE_TO_ERR;

    private static class ConsoleHandler extends StreamHandler {
        ConsoleHandler(java.io.OutputStream out, Level level) {
            super(out, new SimpleFormatter());
            setLevel(level);
        }

        @Override
        public synchronized void publish(LogRecord record) {
            super.publish(record);
            flush();
        }
    }

    public static synchronized void setConsoleOutputMode(ConsoleOutputMode mode) {
        consoleOutputMode = mode;
    }

    /**
     * Initialize logging from the engine configuration. Later calls are ignored.
     */
    public static void initialize(EngineConfig config) {
        initialize(config.getLoggingLevel(), config.isConsoleLoggingEnabled(),
                config.isFileLoggingEnabled(), config.getLogFileName());
    }

    public static synchronized void initialize(String levelStr, boolean consoleEnabled,
                                               boolean fileEnabled, String fileName) {
        if (initialized) {
            return;
        }

        currentLevel = parseLevel(levelStr);

        for (Handler handler : logger.getHandlers()) {
            logger.removeHandler(handler);
        }

        if (consoleEnabled) {
            setupConsoleHandlers();
        }

        if (fileEnabled && fileName != null && !fileName.isEmpty()) {
            try {
                FileHandler fileHandler = new FileHandler(fileName, true);
                fileHandler.setFormatter(new SimpleFormatter());
                fileHandler.setLevel(currentLevel);
                logger.addHandler(fileHandler);
                fileLogging = true;
                logFileName = fileName;
            } catch (IOException e) {
                logger.log(Level.SEVERE, "Failed to create log file: " + fileName, e);
                fileLogging = false;
            }
        }

        logger.setLevel(currentLevel);
        logger.setUseParentHandlers(false);
        initialized = true;

        logger.fine("Logging initialized: level=" + currentLevel +
                ", console=" + consoleEnabled +
                ", file=" + (fileLogging ? logFileName : "disabled"));
    }

    static Level parseLevel(String levelStr) {
        if (levelStr == null) {
            return Level.INFO;
        }
        switch (levelStr.trim().toUpperCase()) {
            case "SEVERE":
            case "ERROR":
                return Level.SEVERE;
            case "WARNING":
            case "WARN":
                return Level.WARNING;
            case "DEBUG":
                return Level.FINE;
            case "TRACE":
                return Level.FINEST;
            case "OFF":
                return Level.OFF;
            default:
                return Level.INFO;
        }
    }

    private static void setupConsoleHandlers() {
        switch (consoleOutputMode) {
            case ALL_TO_OUT:
                logger.addHandler(new ConsoleHandler(System.out, currentLevel));
                break;
            case ALL_TO_ERR:
                logger.addHandler(new ConsoleHandler(System.err, currentLevel));
                break;
            case SPLIT_SEVERE_TO_ERR:
                ConsoleHandler out = new ConsoleHandler(System.out, currentLevel);
                out.setFilter(record -> record.getLevel().intValue() < Level.SEVERE.intValue());
                logger.addHandler(out);
                logger.addHandler(new ConsoleHandler(System.err, Level.SEVERE));
                break;
        }
    }

    public static void debug(String message) {
        ensureInitialized();
        logger.fine(message);
    }

    public static void debug(String format, Object... args) {
        ensureInitialized();
        if (logger.isLoggable(Level.FINE)) {
            logger.fine(String.format(format, args));
        }
    }

    public static void info(String message) {
        ensureInitialized();
        logger.info(message);
    }

    public static void warn(String message) {
        ensureInitialized();
        logger.warning(message);
    }

    public static void warn(String message, Throwable t) {
        ensureInitialized();
        logger.log(Level.WARNING, message, t);
    }

    public static void error(String message) {
        ensureInitialized();
        logger.severe(message);
    }

    public static void error(String message, Throwable t) {
        ensureInitialized();
        logger.log(Level.SEVERE, message, t);
    }

    public static boolean isDebugEnabled() {
        return currentLevel.intValue() <= Level.FINE.intValue();
    }

    private static void ensureInitialized() {
        if (!initialized) {
            initialize("INFO", true, false, logFileName);
        }
    }
}
