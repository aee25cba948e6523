package org.minilang.compiler.frontend.parser.ast;

import java.util.List;
import java.util.Optional;

/**
 * {@code return VALUE?;}
 *
 * @param value The returned expression, or {@code null} for a bare {@code return;}.
 * @param line The line of the {@code return} keyword.
 * @param column The column of the {@code return} keyword.
 */
public record ReturnNode(Expression value, int line, int column) implements Statement {

    public Optional<Expression> returnValue() {
        return Optional.ofNullable(value);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitReturn(this);
    }

    @Override
    public List<AstNode> getChildren() {
        return value == null ? List.of() : List.of(value);
    }
}
