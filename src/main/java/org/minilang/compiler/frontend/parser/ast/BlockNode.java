package org.minilang.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A braced statement list. Each block opens its own scope.
 *
 * @param statements The statements in source order.
 * @param line The line of the opening brace.
 * @param column The column of the opening brace.
 */
public record BlockNode(List<Statement> statements, int line, int column) implements Statement {

    public BlockNode {
        statements = List.copyOf(statements);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitBlock(this);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.copyOf(statements);
    }
}
