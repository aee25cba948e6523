package org.minilang.compiler.frontend.parser;

import org.minilang.compiler.diagnostics.PhaseException;
import org.minilang.compiler.frontend.CompilerPhase;

/**
 * Thrown by the {@link Parser} at the first token that does not fit the grammar.
 */
public class ParseException extends PhaseException {

    public ParseException(String message, int line, int column) {
        super(CompilerPhase.PARSING, message, line, column);
    }
}
