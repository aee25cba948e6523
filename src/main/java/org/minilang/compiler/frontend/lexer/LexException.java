package org.minilang.compiler.frontend.lexer;

import org.minilang.compiler.diagnostics.PhaseException;
import org.minilang.compiler.frontend.CompilerPhase;

/**
 * Thrown by the {@link Lexer} for a character sequence that starts no token.
 */
public class LexException extends PhaseException {

    public LexException(String message, int line, int column) {
        super(CompilerPhase.LEXING, message, line, column);
    }
}
