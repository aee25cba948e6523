package org.minilang.compiler.frontend.parser.ast;

import java.util.Collections;
import java.util.List;

/**
 * The base interface for all nodes in the Abstract Syntax Tree (AST).
 * Every node remembers the position of the token that defines it.
 */
public sealed interface AstNode permits ProgramNode, FunctionDeclNode, Statement {

    /**
     * @return The line of the node's defining token.
     */
    int line();

    /**
     * @return The column of the node's defining token.
     */
    int column();

    /**
     * Returns a list of the direct child nodes.
     * This allows generic printers to traverse the tree
     * without knowing the specific structure of each node.
     *
     * @return A list of child nodes. Returns an empty list if the node has no children.
     */
    default List<AstNode> getChildren() {
        return Collections.emptyList();
    }
}
