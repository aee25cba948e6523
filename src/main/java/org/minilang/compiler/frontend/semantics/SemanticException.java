package org.minilang.compiler.frontend.semantics;

import org.minilang.compiler.diagnostics.PhaseException;
import org.minilang.compiler.frontend.CompilerPhase;

/**
 * Thrown by the {@link SemanticAnalyzer} for redeclarations, unresolved names,
 * type mismatches and a missing entry point.
 */
public class SemanticException extends PhaseException {

    public SemanticException(String message, int line, int column) {
        super(CompilerPhase.SEMANTIC_ANALYSIS, message, line, column);
    }
}
