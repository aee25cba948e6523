package org.minilang.runtime;

import org.minilang.compiler.frontend.parser.ast.*;
import org.minilang.compiler.frontend.semantics.SemanticAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.LongSupplier;
import java.util.stream.Collectors;

/**
 * A tree-walking interpreter for semantically checked MiniLang programs.
 * <p>
 * It executes the AST directly and never looks at the TAC or CFG artifacts. A
 * {@code return} travels outwards as a {@link Completion.Returned} value through every
 * enclosing block and loop until the call that owns it. An instance runs one program
 * and is not thread-safe.
 */
public final class Interpreter {

    private static final Logger LOG = LoggerFactory.getLogger(Interpreter.class);

    private static final Long ZERO = 0L;

    /** Stack size of the thread that runs {@code main}, deep enough for the default call depth. */
    private static final long EXECUTION_STACK_BYTES = 512L * 1024 * 1024;

    private final Map<String, FunctionDeclNode> functions = new HashMap<>();
    private final PrintWriter out;
    private final InterpreterOptions options;
    private int callDepth = 0;

    /**
     * @param program A program that passed semantic analysis.
     * @param out The sink for {@code print}/{@code println}.
     * @param options Execution limits.
     */
    public Interpreter(ProgramNode program, PrintWriter out, InterpreterOptions options) {
        for (FunctionDeclNode function : program.functions()) {
            functions.put(function.name(), function);
        }
        this.out = out;
        this.options = options;
    }

    /**
     * @param program A program that passed semantic analysis.
     * @param out The sink for {@code print}/{@code println}.
     */
    public Interpreter(ProgramNode program, PrintWriter out) {
        this(program, out, InterpreterOptions.defaults());
    }

    /**
     * Calls {@code main} without arguments on a dedicated thread with a large stack, so
     * that recursion up to {@link InterpreterOptions#maxCallDepth()} fits.
     * @return The exit code derived from the value {@code main} returned.
     * @throws InterpreterException at the first runtime error.
     */
    public int run() {
        LOG.debug("Executing {}()", SemanticAnalyzer.ENTRY_POINT);
        AtomicReference<Object> result = new AtomicReference<>();
        AtomicReference<Throwable> failure = new AtomicReference<>();
        Thread executor = new Thread(null, () -> {
            try {
                result.set(call(SemanticAnalyzer.ENTRY_POINT, List.of(), 0, 0));
            } catch (RuntimeException | StackOverflowError e) {
                failure.set(e);
            }
        }, "minilang-main", EXECUTION_STACK_BYTES);
        executor.start();
        try {
            executor.join();
        } catch (InterruptedException e) {
            executor.interrupt();
            Thread.currentThread().interrupt();
            throw new InterpreterException("Interrupted while running " + SemanticAnalyzer.ENTRY_POINT);
        } finally {
            out.flush();
        }

        Throwable thrown = failure.get();
        if (thrown instanceof RuntimeException e) {
            throw e;
        }
        if (thrown instanceof StackOverflowError e) {
            throw e;
        }
        LOG.debug("{}() returned {}", SemanticAnalyzer.ENTRY_POINT, result.get());
        return Values.toExitCode(result.get());
    }

    /**
     * Calls a builtin or user function.
     * @param name The callee name.
     * @param arguments The evaluated arguments.
     * @param line The line of the call site, for errors.
     * @param column The column of the call site, for errors.
     * @return The returned value; {@code 0} for builtins and for bodies that finish without {@code return}.
     */
    public Object call(String name, List<Object> arguments, int line, int column) {
        if ("print".equals(name) || "println".equals(name)) {
            out.print(arguments.stream().map(Values::display).collect(Collectors.joining(" ")));
            if ("println".equals(name)) {
                out.print('\n');
            }
            out.flush();
            return ZERO;
        }
        FunctionDeclNode function = functions.get(name);
        if (function == null) {
            throw new InterpreterException("Undefined function " + name, line, column);
        }
        if (callDepth >= options.maxCallDepth()) {
            throw new InterpreterException("Maximum call depth of " + options.maxCallDepth() + " exceeded in " + name, line, column);
        }

        Environment frame = Environment.root();
        List<Parameter> parameters = function.parameters();
        for (int i = 0; i < Math.min(parameters.size(), arguments.size()); i++) {
            frame.define(parameters.get(i).name(), arguments.get(i));
        }

        callDepth++;
        try {
            Completion completion = new Executor(frame).visitBlock(function.body());
            if (completion instanceof Completion.Returned returned) {
                return returned.value();
            }
            return ZERO;
        } finally {
            callDepth--;
        }
    }

    /**
     * Executes statements against one environment frame.
     */
    private final class Executor implements StatementVisitor<Completion> {

        private final Environment env;
        private final Evaluator evaluator;

        Executor(Environment env) {
            this.env = env;
            this.evaluator = new Evaluator(env);
        }

        private Object eval(Expression expression) {
            return expression.accept(evaluator);
        }

        @Override
        public Completion visitBlock(BlockNode node) {
            Executor inner = new Executor(env.child());
            for (Statement statement : node.statements()) {
                Completion completion = statement.accept(inner);
                if (completion.isReturn()) {
                    return completion;
                }
            }
            return Completion.NORMAL;
        }

        @Override
        public Completion visitVarDecl(VarDeclNode node) {
            Object value = node.initializer() != null ? eval(node.initializer()) : ZERO;
            env.define(node.name(), value);
            return Completion.NORMAL;
        }

        @Override
        public Completion visitIf(IfNode node) {
            if (Values.isTruthy(eval(node.condition()))) {
                return visitBlock(node.thenBlock());
            }
            if (node.elseBlock() != null) {
                return visitBlock(node.elseBlock());
            }
            return Completion.NORMAL;
        }

        @Override
        public Completion visitWhile(WhileNode node) {
            while (Values.isTruthy(eval(node.condition()))) {
                Completion completion = visitBlock(node.body());
                if (completion.isReturn()) {
                    return completion;
                }
            }
            return Completion.NORMAL;
        }

        @Override
        public Completion visitReturn(ReturnNode node) {
            Object value = node.value() != null ? eval(node.value()) : ZERO;
            return new Completion.Returned(value);
        }

        @Override
        public Completion visitAssign(AssignNode node) {
            env.assign(node.name(), eval(node.value()));
            return Completion.NORMAL;
        }

        @Override
        public Completion visitExpressionStatement(Expression node) {
            eval(node);
            return Completion.NORMAL;
        }
    }

    /**
     * Evaluates expressions against one environment frame.
     */
    private final class Evaluator implements ExpressionVisitor<Object> {

        private final Environment env;

        Evaluator(Environment env) {
            this.env = env;
        }

        @Override
        public Object visitLiteral(LiteralNode node) {
            return node.value();
        }

        @Override
        public Object visitVariable(VariableNode node) {
            return env.lookup(node.name())
                    .orElseThrow(() -> new InterpreterException("Unbound identifier " + node.name(), node.line(), node.column()));
        }

        @Override
        public Object visitBinaryOp(BinaryOpNode node) {
            String op = node.operator();
            Object left = node.left().accept(this);
            // The right operand of && and || is only evaluated when it decides the result.
            if ("&&".equals(op)) {
                return Values.isTruthy(left) && Values.isTruthy(node.right().accept(this));
            }
            if ("||".equals(op)) {
                return Values.isTruthy(left) || Values.isTruthy(node.right().accept(this));
            }
            Object right = node.right().accept(this);
            switch (op) {
                case "+": return exact(() -> Math.addExact(integer(left, node), integer(right, node)), node);
                case "-": return exact(() -> Math.subtractExact(integer(left, node), integer(right, node)), node);
                case "*": return exact(() -> Math.multiplyExact(integer(left, node), integer(right, node)), node);
                case "/": {
                    long dividend = integer(left, node);
                    long divisor = integer(right, node);
                    if (divisor == 0L) {
                        throw new InterpreterException("Division by zero", node.line(), node.column());
                    }
                    if (dividend == Long.MIN_VALUE && divisor == -1L) {
                        throw new InterpreterException("Integer overflow", node.line(), node.column());
                    }
                    return Math.floorDiv(dividend, divisor);
                }
                case "<": return compare(left, right, node) < 0;
                case ">": return compare(left, right, node) > 0;
                case "<=": return compare(left, right, node) <= 0;
                case ">=": return compare(left, right, node) >= 0;
                case "==": return Objects.equals(left, right);
                case "!=": return !Objects.equals(left, right);
                default:
                    throw new InterpreterException("Unknown operator " + op, node.line(), node.column());
            }
        }

        @Override
        public Object visitUnaryOp(UnaryOpNode node) {
            Object operand = node.operand().accept(this);
            if ("-".equals(node.operator())) {
                return exact(() -> Math.negateExact(integer(operand, node)), node);
            }
            if ("!".equals(node.operator())) {
                return !Values.isTruthy(operand);
            }
            throw new InterpreterException("Unknown operator " + node.operator(), node.line(), node.column());
        }

        @Override
        public Object visitCall(CallNode node) {
            List<Object> arguments = new ArrayList<>(node.arguments().size());
            for (Expression argument : node.arguments()) {
                arguments.add(argument.accept(this));
            }
            return call(node.name(), arguments, node.line(), node.column());
        }

        private long exact(LongSupplier operation, Expression node) {
            try {
                return operation.getAsLong();
            } catch (ArithmeticException e) {
                throw new InterpreterException("Integer overflow", node.line(), node.column());
            }
        }

        private long integer(Object value, Expression node) {
            if (value instanceof Long l) {
                return l;
            }
            throw new InterpreterException("Expected an integer but got " + Values.display(value), node.line(), node.column());
        }

        private int compare(Object left, Object right, BinaryOpNode node) {
            if (left instanceof Long l && right instanceof Long r) return Long.compare(l, r);
            if (left instanceof String l && right instanceof String r) return l.compareTo(r);
            if (left instanceof Boolean l && right instanceof Boolean r) return Boolean.compare(l, r);
            throw new InterpreterException("Cannot compare " + Values.display(left) + " with " + Values.display(right),
                    node.line(), node.column());
        }
    }
}
