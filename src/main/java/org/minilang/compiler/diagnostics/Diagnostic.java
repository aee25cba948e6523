package org.minilang.compiler.diagnostics;

/**
 * The error that stopped a pipeline phase.
 *
 * @param message The diagnostic message.
 * @param lineNumber The line number of the issue, or 0 if unknown.
 * @param columnNumber The column number of the issue, or 0 if unknown.
 */
public record Diagnostic(String message, int lineNumber, int columnNumber) {

    @Override
    public String toString() {
        return String.format("%d:%d: %s", lineNumber, columnNumber, message);
    }
}
