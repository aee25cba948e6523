package org.minilang.compiler.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An engine for collecting diagnostic messages that occur in the pipeline.
 * <p>
 * Phases report into the engine right before they abort, so a caller holding the
 * engine sees exactly the error that stopped the phase.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     *
     * @param message    The error message.
     * @param lineNumber The line number of the error.
     * @param columnNumber The column number of the error.
     */
    public void reportError(String message, int lineNumber, int columnNumber) {
        diagnostics.add(new Diagnostic(message, lineNumber, columnNumber));
    }

    /**
     * @return {@code true} if at least one error was reported.
     */
    public boolean hasErrors() {
        return !diagnostics.isEmpty();
    }

    /**
     * @return An unmodifiable list of the reported errors, in order.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }
}
