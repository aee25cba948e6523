package org.minilang.compiler.frontend.parser.ast;

/**
 * A single formal parameter of a function declaration.
 *
 * @param name The parameter name.
 * @param typeName The declared type name.
 * @param line The line of the parameter name.
 * @param column The column of the parameter name.
 */
public record Parameter(String name, String typeName, int line, int column) {
}
