package net.papermentat.util;

import org.slf4j.Logger;

import java.util.Arrays;

/**
 * Helpers for logging warnings and errors with an attached cause.
 * SLF4J treats a trailing {@link Throwable} argument as the stack trace to print.
 */
public final class LoggingUtils {

    private LoggingUtils() {
    }

    public static void error(Logger logger, Throwable throwable, String message, Object... args) {
        if (logger != null && message != null) {
            logger.error(message, withCause(throwable, args));
        }
    }

    public static void warn(Logger logger, Throwable throwable, String message, Object... args) {
        if (logger != null && message != null) {
            logger.warn(message, withCause(throwable, args));
        }
    }

    /**
     * Short description of a failure for single-line log output and error messages.
     */
    public static String describe(Throwable throwable) {
        if (throwable == null) {
            return "unknown error";
        }
        String detail = throwable.getMessage();
        return detail == null || detail.isBlank()
            ? throwable.getClass().getSimpleName()
            : throwable.getClass().getSimpleName() + ": " + detail;
    }

    private static Object[] withCause(Throwable throwable, Object[] args) {
        Object[] base = args == null ? new Object[0] : args;
        if (throwable == null) {
            return base;
        }
        Object[] combined = Arrays.copyOf(base, base.length + 1);
        combined[base.length] = throwable;
        return combined;
    }
}
