package org.minilang.compiler.frontend.parser.ast;

import java.util.List;

/**
 * An AST node for a prefix operator ({@code -} or {@code !}).
 *
 * @param operator The operator lexeme.
 * @param operand The operand.
 * @param line The line of the operator token.
 * @param column The column of the operator token.
 */
public record UnaryOpNode(String operator, Expression operand, int line, int column) implements Expression {

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitUnaryOp(this);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(operand);
    }
}
