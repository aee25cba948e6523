package org.minilang.compiler.frontend.parser.ast;

import java.util.List;

/**
 * {@code NAME = VALUE;}
 *
 * @param name The assigned variable.
 * @param value The assigned expression.
 * @param line The line of the target identifier.
 * @param column The column of the target identifier.
 */
public record AssignNode(String name, Expression value, int line, int column) implements Statement {

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitAssign(this);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(value);
    }
}
