package org.minilang.compiler.frontend.parser.ast;

import java.util.List;

/**
 * An AST node for a call of a builtin or user function.
 *
 * @param name The callee name.
 * @param arguments The argument expressions, evaluated left to right.
 * @param line The line of the callee identifier.
 * @param column The column of the callee identifier.
 */
public record CallNode(String name, List<Expression> arguments, int line, int column) implements Expression {

    public CallNode {
        arguments = List.copyOf(arguments);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitCall(this);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.copyOf(arguments);
    }
}
