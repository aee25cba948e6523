package org.minilang.compiler.frontend.parser.ast;

import java.util.List;

/**
 * An AST node for a binary operator application.
 *
 * @param operator The operator lexeme, e.g. {@code +} or {@code &&}.
 * @param left The left operand.
 * @param right The right operand.
 * @param line The line of the operator token.
 * @param column The column of the operator token.
 */
public record BinaryOpNode(String operator, Expression left, Expression right, int line, int column) implements Expression {

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitBinaryOp(this);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(left, right);
    }
}
