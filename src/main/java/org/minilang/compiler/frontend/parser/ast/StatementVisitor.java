package org.minilang.compiler.frontend.parser.ast;

/**
 * A visitor over all statement kinds. Adding a statement kind breaks every
 * implementation until it handles the new kind.
 *
 * @param <R> The return type of the visit methods.
 */
public interface StatementVisitor<R> {
    R visitBlock(BlockNode node);
    R visitVarDecl(VarDeclNode node);
    R visitIf(IfNode node);
    R visitWhile(WhileNode node);
    R visitReturn(ReturnNode node);
    R visitAssign(AssignNode node);
    R visitExpressionStatement(Expression node);
}
