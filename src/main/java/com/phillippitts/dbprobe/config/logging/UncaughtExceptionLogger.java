package com.phillippitts.dbprobe.config.logging;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.PrintStream;

/**
 * JVM-wide handler that records every uncaught throwable as a single FATAL log event.
 *
 * <p>Operator interrupts ({@link InterruptedException} escaping a thread) are not logged; they
 * get the JVM's default treatment, a stack trace on standard error. If logging itself fails,
 * the same fallback is used so the failure is never lost.
 */
public final class UncaughtExceptionLogger implements Thread.UncaughtExceptionHandler {

    static final String MESSAGE = "Uncaught exception";

    private final Logger logger;
    private final PrintStream fallback;

    public UncaughtExceptionLogger(Logger logger, PrintStream fallback) {
        this.logger = logger;
        this.fallback = fallback;
    }

    /**
     * Installs a handler logging to this class's logger as the default uncaught-exception
     * handler. Called once from {@code main} before the application starts.
     */
    public static UncaughtExceptionLogger install() {
        UncaughtExceptionLogger handler = new UncaughtExceptionLogger(
                LogManager.getLogger(UncaughtExceptionLogger.class), System.err);
        Thread.setDefaultUncaughtExceptionHandler(handler);
        return handler;
    }

    @Override
    public void uncaughtException(Thread thread, Throwable error) {
        if (error instanceof InterruptedException) {
            printDefault(thread, error);
            return;
        }
        try {
            logger.fatal(MESSAGE + " in thread {}", thread.getName(), error);
        } catch (RuntimeException loggingFailure) {
            printDefault(thread, error);
        }
    }

    // Same output as ThreadGroup#uncaughtException without a default handler
    private void printDefault(Thread thread, Throwable error) {
        fallback.print("Exception in thread \"" + thread.getName() + "\" ");
        error.printStackTrace(fallback);
    }
}
