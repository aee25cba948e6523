package org.minilang.compiler.frontend.semantics;

import org.minilang.compiler.diagnostics.CompilerLogger;
import org.minilang.compiler.diagnostics.DiagnosticsEngine;
import org.minilang.compiler.frontend.parser.ast.*;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Performs semantic analysis on the AST: scope resolution and type checking.
 * <p>
 * It performs two passes: one to collect every function signature and to require
 * the {@code main} entry point, and a second one that checks each function body
 * against a stack of scopes. The first error aborts the analysis with a
 * {@link SemanticException}.
 * <p>
 * Calls of user functions yield the callee's declared return type. Their argument
 * expressions are checked on their own, but neither their number nor their types are
 * compared with the callee's parameter list.
 */
public class SemanticAnalyzer {

    /** The name of the entry point function. */
    public static final String ENTRY_POINT = "main";

    /** Output builtins, callable with any arguments. */
    public static final Set<String> BUILTINS = Set.of("print", "println");

    private static final Set<String> ARITHMETIC = Set.of("+", "-", "*", "/");
    private static final Set<String> COMPARISON = Set.of("<", ">", "<=", ">=", "==", "!=");
    private static final Set<String> LOGICAL = Set.of("&&", "||");

    private final DiagnosticsEngine diagnostics;
    private final SymbolTable symbolTable;
    private final Map<String, FunctionSignature> functions = new LinkedHashMap<>();
    private final StatementChecker statementChecker = new StatementChecker();
    private final ExpressionChecker expressionChecker = new ExpressionChecker();

    /**
     * Constructs a new semantic analyzer.
     * @param diagnostics The diagnostics engine for reporting errors.
     * @param symbolTable The symbol table to use for analysis.
     */
    public SemanticAnalyzer(DiagnosticsEngine diagnostics, SymbolTable symbolTable) {
        this.diagnostics = diagnostics;
        this.symbolTable = symbolTable;
    }

    /**
     * Analyzes the given program. This is the main entry point for the semantic analysis phase.
     * @param program The parsed program.
     * @throws SemanticException at the first semantic error.
     */
    public void analyze(ProgramNode program) {
        collectSignatures(program.functions());
        if (!functions.containsKey(ENTRY_POINT)) {
            throw error("No entry point: fn main() -> int {...}", 0, 0);
        }
        for (FunctionDeclNode function : program.functions()) {
            checkFunction(function);
        }
        CompilerLogger.debug("Semantic analysis passed for " + functions.size() + " function(s)");
    }

    /**
     * @return The function table collected by the first pass, in declaration order.
     */
    public Map<String, FunctionSignature> getFunctions() {
        return Collections.unmodifiableMap(functions);
    }

    private void collectSignatures(List<FunctionDeclNode> declarations) {
        for (FunctionDeclNode declaration : declarations) {
            if (functions.containsKey(declaration.name()) || BUILTINS.contains(declaration.name())) {
                throw error("Redeclaration of function " + declaration.name(), declaration.line(), declaration.column());
            }
            functions.put(declaration.name(), FunctionSignature.of(declaration));
        }
    }

    private void checkFunction(FunctionDeclNode function) {
        symbolTable.enterScope();
        for (Parameter parameter : function.parameters()) {
            declare(parameter.name(), parameter.typeName(), parameter.line(), parameter.column());
        }
        function.body().accept(statementChecker);
        symbolTable.leaveScope();
    }

    private void declare(String name, String type, int line, int column) {
        if (!symbolTable.declare(name, type)) {
            throw error("Redeclaration of " + name, line, column);
        }
    }

    private String lookup(String name, int line, int column) {
        return symbolTable.resolve(name)
                .orElseThrow(() -> error("Undefined identifier " + name, line, column));
    }

    private String typeOf(Expression expression) {
        return expression.accept(expressionChecker);
    }

    private SemanticException error(String message, int line, int column) {
        diagnostics.reportError(message, line, column);
        return new SemanticException(message, line, column);
    }

    private final class StatementChecker implements StatementVisitor<Void> {

        @Override
        public Void visitBlock(BlockNode node) {
            symbolTable.enterScope();
            for (Statement statement : node.statements()) {
                statement.accept(this);
            }
            symbolTable.leaveScope();
            return null;
        }

        @Override
        public Void visitVarDecl(VarDeclNode node) {
            if (node.initializer() != null) {
                String actual = typeOf(node.initializer());
                if (!actual.equals(node.typeName())) {
                    throw error("Type mismatch for " + node.name() + ": " + node.typeName() + " != " + actual,
                            node.line(), node.column());
                }
            }
            declare(node.name(), node.typeName(), node.line(), node.column());
            return null;
        }

        @Override
        public Void visitIf(IfNode node) {
            requireCondition(node.condition(), "if");
            node.thenBlock().accept(this);
            if (node.elseBlock() != null) {
                node.elseBlock().accept(this);
            }
            return null;
        }

        @Override
        public Void visitWhile(WhileNode node) {
            requireCondition(node.condition(), "while");
            node.body().accept(this);
            return null;
        }

        @Override
        public Void visitReturn(ReturnNode node) {
            if (node.value() != null) {
                typeOf(node.value());
            }
            return null;
        }

        @Override
        public Void visitAssign(AssignNode node) {
            String target = lookup(node.name(), node.line(), node.column());
            String value = typeOf(node.value());
            if (!target.equals(value)) {
                throw error("Type mismatch in assignment to " + node.name() + ": " + target + " != " + value,
                        node.line(), node.column());
            }
            return null;
        }

        @Override
        public Void visitExpressionStatement(Expression node) {
            typeOf(node);
            return null;
        }

        private void requireCondition(Expression condition, String keyword) {
            if (!Types.BOOL.equals(typeOf(condition))) {
                throw error(keyword + " condition must be bool", condition.line(), condition.column());
            }
        }
    }

    private final class ExpressionChecker implements ExpressionVisitor<String> {

        @Override
        public String visitLiteral(LiteralNode node) {
            return Types.ofLiteral(node.value());
        }

        @Override
        public String visitVariable(VariableNode node) {
            return lookup(node.name(), node.line(), node.column());
        }

        @Override
        public String visitBinaryOp(BinaryOpNode node) {
            String left = node.left().accept(this);
            String right = node.right().accept(this);
            String op = node.operator();
            if (ARITHMETIC.contains(op)) {
                if (Types.INT.equals(left) && Types.INT.equals(right)) return Types.INT;
                throw error("Arithmetic operator " + op + " expects int operands, got " + left + " and " + right,
                        node.line(), node.column());
            }
            if (COMPARISON.contains(op)) {
                if (left.equals(right)) return Types.BOOL;
                throw error("Comparison " + op + " type mismatch: " + left + " vs " + right, node.line(), node.column());
            }
            if (LOGICAL.contains(op)) {
                if (Types.BOOL.equals(left) && Types.BOOL.equals(right)) return Types.BOOL;
                throw error("Logical operator " + op + " expects bool operands, got " + left + " and " + right,
                        node.line(), node.column());
            }
            throw error("Unknown operator " + op, node.line(), node.column());
        }

        @Override
        public String visitUnaryOp(UnaryOpNode node) {
            String operand = node.operand().accept(this);
            if ("!".equals(node.operator())) {
                if (Types.BOOL.equals(operand)) return Types.BOOL;
                throw error("! expects bool, got " + operand, node.line(), node.column());
            }
            if ("-".equals(node.operator())) {
                if (Types.INT.equals(operand)) return Types.INT;
                throw error("Unary - expects int, got " + operand, node.line(), node.column());
            }
            throw error("Unknown operator " + node.operator(), node.line(), node.column());
        }

        @Override
        public String visitCall(CallNode node) {
            for (Expression argument : node.arguments()) {
                argument.accept(this);
            }
            if (BUILTINS.contains(node.name())) {
                return Types.VOID;
            }
            FunctionSignature callee = functions.get(node.name());
            if (callee == null) {
                throw error("Undefined function " + node.name(), node.line(), node.column());
            }
            return callee.returnType();
        }
    }
}
