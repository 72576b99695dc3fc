package net.plantmatch.util;

import java.util.Arrays;
import org.slf4j.Logger;

/**
 * Helpers for logging warnings and errors with an optional cause appended after the format arguments.
 */
public final class LoggingUtils {
    private LoggingUtils() {
    }

    public static void error(Logger logger, Throwable throwable, String message, Object... args) {
        log(logger, Level.ERROR, throwable, message, args);
    }

    public static void warn(Logger logger, Throwable throwable, String message, Object... args) {
        log(logger, Level.WARN, throwable, message, args);
    }

    private static void log(Logger logger, Level level, Throwable throwable, String message, Object... args) {
        if (logger == null || message == null) {
            return;
        }
        Object[] finalArgs = withCause(args, throwable);
        if (level == Level.ERROR) {
            logger.error(message, finalArgs);
        } else {
            logger.warn(message, finalArgs);
        }
    }

    private static Object[] withCause(Object[] args, Throwable throwable) {
        Object[] base = args == null ? new Object[0] : args;
        if (throwable == null) {
            return base;
        }
        Object[] extended = Arrays.copyOf(base, base.length + 1);
        extended[base.length] = throwable;
        return extended;
    }

    private enum Level {
        ERROR,
        WARN
    }
}
