package com.logosk.semanticdb.util;

import org.jboss.logging.Logger;

import java.io.PrintWriter;
import java.io.StringWriter;

/**
 * Utility class for consistent exception logging across the modules.
 * Callers pass their own {@link Logger} so the category stays the calling class.
 */
public class ExceptionLoggingUtils {

    /**
     * Log exception with full stack trace at WARN level
     *
     * @param log the logger of the calling class
     * @param exception the exception to log
     * @param message the message format string
     * @param args optional arguments for message formatting
     */
    public static void logWarn(Logger log, Throwable exception, String message, Object... args) {
        if (exception == null) {
            if (args.length > 0) {
                log.warnf(message, args);
            } else {
                log.warn(message);
            }
            return;
        }

        String formattedMessage = args.length > 0 ? String.format(message, args) : message;
        log.warnf("%s: %s%n%s", formattedMessage, describe(exception), getStackTrace(exception));
    }

    /**
     * Log an ignored exception at DEBUG level with context information
     *
     * @param log the logger of the calling class
     * @param exception the exception that was ignored
     * @param context the context where the exception was ignored (e.g., method name, operation)
     */
    public static void logIgnoredException(Logger log, Throwable exception, String context) {
        if (log.isDebugEnabled() && exception != null) {
            log.debugf(exception, "Exception ignored in %s: %s", context, describe(exception));
        }
    }

    /**
     * Get stack trace as string
     *
     * @param exception the exception
     * @return stack trace as string
     */
    public static String getStackTrace(Throwable exception) {
        if (exception == null) {
            return "";
        }
        StringWriter sw = new StringWriter();
        exception.printStackTrace(new PrintWriter(sw));
        return sw.toString();
    }

    private static String describe(Throwable exception) {
        return exception.getMessage() != null ? exception.getMessage() : exception.getClass().getSimpleName();
    }
}
