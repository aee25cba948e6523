package org.minilang.compiler.frontend.parser.ast;

/**
 * An AST node that reads a variable.
 *
 * @param name The variable name.
 * @param line The line of the identifier.
 * @param column The column of the identifier.
 */
public record VariableNode(String name, int line, int column) implements Expression {

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitVariable(this);
    }
}
