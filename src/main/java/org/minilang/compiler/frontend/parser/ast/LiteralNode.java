package org.minilang.compiler.frontend.parser.ast;

/**
 * An AST node that represents a literal.
 *
 * @param value A {@link Long}, {@link Boolean} or {@link String}.
 * @param line The line of the literal.
 * @param column The column of the literal.
 */
public record LiteralNode(Object value, int line, int column) implements Expression {

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitLiteral(this);
    }
}
