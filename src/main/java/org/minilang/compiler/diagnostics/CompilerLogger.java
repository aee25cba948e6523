package org.minilang.compiler.diagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Progress logging of the compiler phases, gated by an integer verbosity on top of
 * the SLF4J level. Levels: 0=ERROR, 1=WARN, 2=INFO, 3=DEBUG, 4=TRACE.
 * Errors themselves are not logged here; they travel as exceptions.
 */
public final class CompilerLogger {

    public static final int ERROR = 0;
    public static final int DEBUG = 3;
    public static final int TRACE = 4;

    private static volatile int level = 2;

    private static final Logger logger = LoggerFactory.getLogger(CompilerLogger.class);

    private CompilerLogger() {}

    /**
     * @param newLevel The new verbosity, clamped to {@link #ERROR}..{@link #TRACE}.
     */
    public static void setLevel(int newLevel) { level = Math.max(ERROR, Math.min(TRACE, newLevel)); }

    /**
     * @return The current verbosity.
     */
    public static int getLevel() { return level; }

    /**
     * Logs phase progress such as token and function counts.
     * @param msg The message to log.
     */
    public static void debug(String msg) {
        if (level >= DEBUG) logger.debug(msg);
    }

    /**
     * Logs per-function details.
     * @param msg The message to log.
     */
    public static void trace(String msg) {
        if (level >= TRACE) logger.trace(msg);
    }
}
