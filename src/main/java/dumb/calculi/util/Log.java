package dumb.calculi.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Static logging entry points used across the engines. Messages go to SLF4J under
 * the {@code dumb.calculi} logger.
 */
public class Log {

    private static final Logger logger = LoggerFactory.getLogger("dumb.calculi");

    public static void message(String message) {
        message(message, LogLevel.INFO);
    }

    public static void error(String message) {
        message(message, LogLevel.ERROR);
    }

    public static void warning(String message) {
        message(message, LogLevel.WARNING);
    }

    public static void debug(String message) {
        message(message, LogLevel.DEBUG);
    }

    public static boolean debugging() {
        return logger.isDebugEnabled();
    }

    public static void message(String message, LogLevel level) {
        switch (level) {
            case DEBUG -> logger.debug(message);
            case INFO -> logger.info(message);
            case WARNING -> logger.warn(message);
            case ERROR -> logger.error(message);
        }
    }

    public enum LogLevel {
        DEBUG, INFO, WARNING, ERROR
    }
}
