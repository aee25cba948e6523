package org.minilang.compiler.frontend.parser.ast;

import java.util.List;

/**
 * The root of the AST: all function declarations of one source text, in source order.
 *
 * @param functions The declared functions.
 * @param line The line of the first token of the source.
 * @param column The column of the first token of the source.
 */
public record ProgramNode(List<FunctionDeclNode> functions, int line, int column) implements AstNode {

    public ProgramNode {
        functions = List.copyOf(functions);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.copyOf(functions);
    }
}
