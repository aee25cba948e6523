package org.minilang.runtime;

import org.minilang.compiler.diagnostics.PhaseException;
import org.minilang.compiler.frontend.CompilerPhase;

/**
 * A fatal error while executing a program: unbound names, operand kinds the
 * operators do not accept, division by zero or too deep recursion.
 * Most of these cannot happen for a program that passed semantic analysis.
 */
public class InterpreterException extends PhaseException {

    public InterpreterException(String message, int line, int column) {
        super(CompilerPhase.EXECUTION, message, line, column);
    }

    public InterpreterException(String message) {
        this(message, 0, 0);
    }
}
