package org.minilang.compiler.frontend.parser.ast;

import java.util.List;

/**
 * An AST node that represents a function declaration
 * ({@code fn NAME(PARAMS) -> TYPE BLOCK}).
 *
 * @param name The function name.
 * @param parameters The formal parameters in declaration order.
 * @param returnType The declared return type name.
 * @param body The function body.
 * @param line The line of the {@code fn} keyword.
 * @param column The column of the {@code fn} keyword.
 */
public record FunctionDeclNode(
        String name,
        List<Parameter> parameters,
        String returnType,
        BlockNode body,
        int line,
        int column
) implements AstNode {

    public FunctionDeclNode {
        parameters = List.copyOf(parameters);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(body);
    }
}
