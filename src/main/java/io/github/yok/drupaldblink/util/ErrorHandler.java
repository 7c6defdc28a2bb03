package io.github.yok.drupaldblink.util;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.exception.ExceptionUtils;

/**
 * Reports fatal start-up errors: logs them and echoes a concise message to {@code System.err}.
 *
 * <p>
 * The JVM is not terminated here; Spring Boot ends the process once the runner returns. Tests can
 * switch the current thread to "throw instead of report" through
 * {@link #disableExitForCurrentThread()}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ErrorHandler {

    private static final ThreadLocal<Boolean> EXIT_DISABLED =
            ThreadLocal.withInitial(() -> Boolean.FALSE);

    private ErrorHandler() {}

    /**
     * Makes {@code errorAndExit} throw {@link IllegalStateException} on the current thread.
     */
    public static void disableExitForCurrentThread() {
        EXIT_DISABLED.set(Boolean.TRUE);
    }

    /**
     * Restores normal reporting on the current thread.
     */
    public static void restoreExitForCurrentThread() {
        EXIT_DISABLED.remove();
    }

    /**
     * Logs a fatal error with its root cause and prints a one-line summary to {@code System.err}.
     *
     * @param message message to log
     * @param cause failure
     */
    public static void errorAndExit(String message, Throwable cause) {
        log.error(message, cause);
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new IllegalStateException(message, cause);
        }
        System.err.println("ERROR: " + message + " (" + ExceptionUtils.getRootCauseMessage(cause)
                + ")");
    }

    /**
     * Logs a fatal error without cause and prints it to {@code System.err}.
     *
     * @param message message to log
     */
    public static void errorAndExit(String message) {
        log.error(message);
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new IllegalStateException(message);
        }
        System.err.println("ERROR: " + message);
    }
}
