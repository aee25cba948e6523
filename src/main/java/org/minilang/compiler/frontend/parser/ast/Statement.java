package org.minilang.compiler.frontend.parser.ast;

/**
 * A node that can appear in a block. Expressions are statements too
 * (expression statements such as a call to {@code println}).
 */
public sealed interface Statement extends AstNode
        permits BlockNode, VarDeclNode, IfNode, WhileNode, ReturnNode, AssignNode, Expression {

    /**
     * Dispatches this statement to the matching method of the visitor.
     * @param visitor The visitor.
     * @param <R> The result type of the visitor.
     * @return The visitor's result.
     */
    <R> R accept(StatementVisitor<R> visitor);
}
