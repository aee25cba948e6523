package org.minilang.compiler.frontend.parser.ast;

import java.util.List;
import java.util.Optional;

/**
 * {@code if (COND) THEN (else ELSE)?}
 *
 * @param condition The condition.
 * @param thenBlock The block executed when the condition holds.
 * @param elseBlock The alternative block, or {@code null} if absent.
 * @param line The line of the {@code if} keyword.
 * @param column The column of the {@code if} keyword.
 */
public record IfNode(Expression condition, BlockNode thenBlock, BlockNode elseBlock, int line, int column) implements Statement {

    public Optional<BlockNode> elseBranch() {
        return Optional.ofNullable(elseBlock);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitIf(this);
    }

    @Override
    public List<AstNode> getChildren() {
        return elseBlock == null ? List.of(condition, thenBlock) : List.of(condition, thenBlock, elseBlock);
    }
}
