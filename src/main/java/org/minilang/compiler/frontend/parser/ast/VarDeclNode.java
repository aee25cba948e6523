package org.minilang.compiler.frontend.parser.ast;

import java.util.List;
import java.util.Optional;

/**
 * {@code let NAME: TYPE (= INIT)?;}
 *
 * @param name The declared variable.
 * @param typeName The declared type name.
 * @param initializer The initializer, or {@code null} if absent.
 * @param line The line of the {@code let} keyword.
 * @param column The column of the {@code let} keyword.
 */
public record VarDeclNode(String name, String typeName, Expression initializer, int line, int column) implements Statement {

    public Optional<Expression> init() {
        return Optional.ofNullable(initializer);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitVarDecl(this);
    }

    @Override
    public List<AstNode> getChildren() {
        return initializer == null ? List.of() : List.of(initializer);
    }
}
