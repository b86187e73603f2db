package com.williamcallahan.research_engine.util;

import org.slf4j.Logger;

import java.util.Arrays;

/**
 * Logging helpers that attach a throwable's root cause to a formatted message. The full stack
 * trace is only written for {@code error}; {@code warn} keeps it at debug level so expected
 * provider or storage hiccups do not flood the log.
 */
public final class LoggingUtils {

    private LoggingUtils() {
    }

    public static void warn(Logger log, Throwable throwable, String format, Object... args) {
        if (!log.isWarnEnabled()) {
            return;
        }
        log.warn(format + " - {}", append(args, describe(throwable)));
        if (throwable != null && log.isDebugEnabled()) {
            log.debug("Stack trace for previous warning", throwable);
        }
    }

    public static void error(Logger log, Throwable throwable, String format, Object... args) {
        if (!log.isErrorEnabled()) {
            return;
        }
        Object[] withCause = append(args, describe(throwable));
        if (throwable != null) {
            log.error(format + " - {}", append(withCause, throwable));
        } else {
            log.error(format + " - {}", withCause);
        }
    }

    /**
     * Root-cause class and message, e.g. {@code ConnectException: Connection refused}.
     */
    public static String describe(Throwable throwable) {
        if (throwable == null) {
            return "unknown error";
        }
        Throwable root = throwable;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        String message = root.getMessage();
        return root.getClass().getSimpleName() + (message != null ? ": " + message : "");
    }

    private static Object[] append(Object[] args, Object extra) {
        Object[] source = args != null ? args : new Object[0];
        Object[] result = Arrays.copyOf(source, source.length + 1);
        result[source.length] = extra;
        return result;
    }
}
