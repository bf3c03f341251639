package com.e2eq.amper.util;

import org.jboss.logging.Logger;

import java.io.PrintWriter;
import java.io.StringWriter;

/**
 * Utility class for consistent exception logging across amper.
 * Every method logs through the caller's own {@link Logger} so the log category stays meaningful.
 */
public final class ExceptionLoggingUtils {

    private ExceptionLoggingUtils() {}

    /**
     * Log exception with full stack trace at ERROR level
     *
     * @param log the caller's logger
     * @param exception the exception to log
     * @param message the message format string
     * @param args optional arguments for message formatting
     */
    public static void logError(Logger log, Throwable exception, String message, Object... args) {
        log(log, Logger.Level.ERROR, exception, message, args);
    }

    /**
     * Log exception with full stack trace at WARN level
     *
     * @param log the caller's logger
     * @param exception the exception to log
     * @param message the message format string
     * @param args optional arguments for message formatting
     */
    public static void logWarn(Logger log, Throwable exception, String message, Object... args) {
        log(log, Logger.Level.WARN, exception, message, args);
    }

    /**
     * Log exception with full stack trace at DEBUG level. Does nothing when DEBUG is disabled.
     *
     * @param log the caller's logger
     * @param exception the exception to log
     * @param message the message format string
     * @param args optional arguments for message formatting
     */
    public static void logDebug(Logger log, Throwable exception, String message, Object... args) {
        if (!log.isDebugEnabled()) {
            return;
        }
        log(log, Logger.Level.DEBUG, exception, message, args);
    }

    /**
     * Get stack trace as string
     *
     * @param exception the exception
     * @return stack trace as string, empty for a null exception
     */
    public static String getStackTrace(Throwable exception) {
        if (exception == null) {
            return "";
        }
        StringWriter sw = new StringWriter();
        PrintWriter pw = new PrintWriter(sw);
        exception.printStackTrace(pw);
        return sw.toString();
    }

    /**
     * Describe an exception by its message, falling back to the class name when it has none.
     */
    public static String describe(Throwable exception) {
        if (exception == null) {
            return "";
        }
        return exception.getMessage() != null ? exception.getMessage() : exception.getClass().getName();
    }

    private static void log(Logger log, Logger.Level level, Throwable exception, String message, Object... args) {
        String formattedMessage = args.length > 0 ? String.format(message, args) : message;
        if (exception == null) {
            log.log(level, formattedMessage);
            return;
        }
        log.logf(level, "%s: %s%n%s", formattedMessage, describe(exception), getStackTrace(exception));
    }
}
