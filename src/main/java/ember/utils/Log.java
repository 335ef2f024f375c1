package ember.utils;

import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

public class Log {
    private static final Logger logger = Logger.getLogger("Ember");
    private static final ConsoleHandler handler = new ConsoleHandler();

    static {
        logger.setUseParentHandlers(false);
        handler.setFormatter(new SimpleFormatter() {
            @Override
            public synchronized String format(LogRecord record) {
                String levelStr = record.getLevel() == Level.SEVERE ? "ERROR" :
                                  record.getLevel() == Level.WARNING ? "WARN" :
                                  record.getLevel() == Level.INFO ? "INFO" : "DEBUG";

                String line = String.format("[%s] [%s] %s%n", levelStr, Thread.currentThread().getName(), record.getMessage());
                if (record.getThrown() != null) {
                    java.io.StringWriter sw = new java.io.StringWriter();
                    record.getThrown().printStackTrace(new java.io.PrintWriter(sw));
                    line += sw;
                }
                return line;
            }
        });
        logger.addHandler(handler);
        setLevel(Level.INFO);
    }

    /**
     * Accepts the names used in configuration files: DEBUG, INFO, WARN, ERROR
     * (case-insensitive). Unknown names fall back to INFO.
     */
    public static void setLevel(String name) {
        if (name == null) {
            setLevel(Level.INFO);
            return;
        }
        switch (name.trim().toUpperCase()) {
            case "DEBUG": setLevel(Level.FINE); break;
            case "WARN": setLevel(Level.WARNING); break;
            case "ERROR": setLevel(Level.SEVERE); break;
            default: setLevel(Level.INFO);
        }
    }

    private static void setLevel(Level level) {
        logger.setLevel(level);
        handler.setLevel(level);
    }

    public static boolean isDebugEnabled() {
        return logger.isLoggable(Level.FINE);
    }

    public static void info(String msg) {
        logger.info(msg);
    }

    public static void warn(String msg) {
        logger.warning(msg);
    }

    public static void warn(String msg, Throwable t) {
        logger.log(Level.WARNING, msg, t);
    }

    public static void error(String msg) {
        logger.severe(msg);
    }

    public static void error(String msg, Throwable t) {
        logger.log(Level.SEVERE, msg, t);
    }

    public static void debug(String msg) {
        logger.fine(msg);
    }
}
