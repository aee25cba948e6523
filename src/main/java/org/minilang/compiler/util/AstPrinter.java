package org.minilang.compiler.util;

import org.minilang.compiler.frontend.parser.ast.*;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders an AST as an indented ASCII tree, one node per line.
 */
public final class AstPrinter {

    private static final StatementVisitor<String> STATEMENTS = new StatementVisitor<>() {
        @Override public String visitBlock(BlockNode node) { return "Block"; }
        @Override public String visitVarDecl(VarDeclNode node) { return "VarDecl " + node.name() + ": " + node.typeName(); }
        @Override public String visitIf(IfNode node) { return node.elseBlock() == null ? "If" : "If/Else"; }
        @Override public String visitWhile(WhileNode node) { return "While"; }
        @Override public String visitReturn(ReturnNode node) { return "Return"; }
        @Override public String visitAssign(AssignNode node) { return "Assign " + node.name(); }
        @Override public String visitExpressionStatement(Expression node) { return node.accept(EXPRESSIONS); }
    };

    private static final ExpressionVisitor<String> EXPRESSIONS = new ExpressionVisitor<>() {
        @Override public String visitLiteral(LiteralNode node) { return "Literal " + Literals.render(node.value()); }
        @Override public String visitVariable(VariableNode node) { return "Var " + node.name(); }
        @Override public String visitBinaryOp(BinaryOpNode node) { return "BinOp " + node.operator(); }
        @Override public String visitUnaryOp(UnaryOpNode node) { return "UnOp " + node.operator(); }
        @Override public String visitCall(CallNode node) { return "Call " + node.name(); }
    };

    private AstPrinter() {}

    /**
     * @param root The node to print.
     * @return The tree, lines separated by {@code \n}, without trailing newline.
     */
    public static String print(AstNode root) {
        StringBuilder sb = new StringBuilder();
        append(sb, root, "", true);
        return sb.toString().stripTrailing();
    }

    /**
     * @param node Any AST node.
     * @return The one-line label used for the node in the tree.
     */
    public static String describe(AstNode node) {
        if (node instanceof ProgramNode) {
            return "Program";
        }
        if (node instanceof FunctionDeclNode fn) {
            String params = fn.parameters().stream()
                    .map(p -> p.name() + ": " + p.typeName())
                    .collect(Collectors.joining(", "));
            return "FuncDecl " + fn.name() + "(" + params + ") -> " + fn.returnType();
        }
        return ((Statement) node).accept(STATEMENTS);
    }

    private static void append(StringBuilder sb, AstNode node, String prefix, boolean last) {
        sb.append(prefix).append(last ? "└─" : "├─").append(describe(node))
                .append(" @").append(node.line()).append(':').append(node.column()).append('\n');
        String childPrefix = prefix + (last ? "  " : "│ ");
        List<AstNode> children = node.getChildren();
        for (int i = 0; i < children.size(); i++) {
            append(sb, children.get(i), childPrefix, i == children.size() - 1);
        }
    }
}
