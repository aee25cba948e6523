package org.minilang.compiler.diagnostics;

import org.minilang.compiler.frontend.CompilerPhase;

/**
 * Base class of the errors that abort a pipeline phase. Every phase stops at its
 * first error; there is no recovery and no accumulation of further errors.
 */
public abstract class PhaseException extends RuntimeException {

    private final CompilerPhase phase;
    private final int line;
    private final int column;

    /**
     * @param phase The phase that failed.
     * @param message The error message, without position.
     * @param line The line of the offending construct, or 0 if unknown.
     * @param column The column of the offending construct, or 0 if unknown.
     */
    protected PhaseException(CompilerPhase phase, String message, int line, int column) {
        super(message);
        this.phase = phase;
        this.line = line;
        this.column = column;
    }

    public CompilerPhase getPhase() {
        return phase;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    /**
     * @return {@code true} if the error carries a source position.
     */
    public boolean hasPosition() {
        return line > 0;
    }

    /**
     * @return The message followed by {@code at LINE:COL} when a position is known.
     */
    public String describe() {
        return hasPosition() ? getMessage() + " at " + line + ":" + column : getMessage();
    }
}
