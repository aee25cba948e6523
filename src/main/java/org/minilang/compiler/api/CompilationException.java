package org.minilang.compiler.api;

import org.minilang.compiler.diagnostics.PhaseException;
import org.minilang.compiler.frontend.CompilerPhase;

/**
 * An exception that is thrown when a pipeline stage fails.
 * <p>
 * It is part of the public API and hides the internal exception types of the phases;
 * the phase exception is kept as the cause.
 */
public class CompilationException extends Exception {

    private final CompilerPhase phase;
    private final int line;
    private final int column;

    /**
     * Wraps the error that aborted a phase.
     * @param cause The phase error.
     */
    public CompilationException(PhaseException cause) {
        super(cause.getPhase() + ": " + cause.describe(), cause);
        this.phase = cause.getPhase();
        this.line = cause.getLine();
        this.column = cause.getColumn();
    }

    /**
     * Constructs a new compilation exception with the specified detail message and cause.
     * @param phase The phase that failed.
     * @param message The detail message.
     * @param cause The cause.
     */
    public CompilationException(CompilerPhase phase, String message, Throwable cause) {
        super(message, cause);
        this.phase = phase;
        this.line = 0;
        this.column = 0;
    }

    public CompilerPhase getPhase() {
        return phase;
    }

    /**
     * @return The line of the error, or 0 if unknown.
     */
    public int getLine() {
        return line;
    }

    /**
     * @return The column of the error, or 0 if unknown.
     */
    public int getColumn() {
        return column;
    }
}
