package org.minilang.compiler.frontend.parser.ast;

/**
 * A node that produces a value.
 */
public sealed interface Expression extends Statement
        permits LiteralNode, VariableNode, BinaryOpNode, UnaryOpNode, CallNode {

    /**
     * Dispatches this expression to the matching method of the visitor.
     * @param visitor The visitor.
     * @param <R> The result type of the visitor.
     * @return The visitor's result.
     */
    <R> R accept(ExpressionVisitor<R> visitor);

    @Override
    default <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitExpressionStatement(this);
    }
}
