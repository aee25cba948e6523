package org.minilang.compiler.frontend.parser.ast;

import java.util.List;

/**
 * {@code while (COND) BODY}
 *
 * @param condition The loop condition, evaluated before every iteration.
 * @param body The loop body.
 * @param line The line of the {@code while} keyword.
 * @param column The column of the {@code while} keyword.
 */
public record WhileNode(Expression condition, BlockNode body, int line, int column) implements Statement {

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitWhile(this);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(condition, body);
    }
}
