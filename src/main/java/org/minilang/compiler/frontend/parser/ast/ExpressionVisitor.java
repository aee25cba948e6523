package org.minilang.compiler.frontend.parser.ast;

/**
 * A visitor over all expression kinds.
 *
 * @param <R> The return type of the visit methods.
 */
public interface ExpressionVisitor<R> {
    R visitLiteral(LiteralNode node);
    R visitVariable(VariableNode node);
    R visitBinaryOp(BinaryOpNode node);
    R visitUnaryOp(UnaryOpNode node);
    R visitCall(CallNode node);
}
