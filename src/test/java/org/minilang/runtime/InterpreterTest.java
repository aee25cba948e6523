package org.minilang.runtime;

import org.minilang.compiler.diagnostics.DiagnosticsEngine;
import org.minilang.compiler.frontend.lexer.Lexer;
import org.minilang.compiler.frontend.parser.Parser;
import org.minilang.compiler.frontend.parser.ast.ProgramNode;
import org.minilang.compiler.frontend.semantics.SemanticAnalyzer;
import org.minilang.compiler.frontend.semantics.SymbolTable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the tree-walking {@link Interpreter}.
 * Every program is lexed, parsed and analyzed first, as the interpreter expects.
 */
public class InterpreterTest {

    private StringWriter output;

    @BeforeEach
    void setUp() {
        output = new StringWriter();
    }

    private int run(String source) {
        return run(source, InterpreterOptions.defaults());
    }

    private int run(String source, InterpreterOptions options) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        ProgramNode program = new Parser(new Lexer(source, diagnostics).scanTokens(), diagnostics).parse();
        new SemanticAnalyzer(diagnostics, new SymbolTable()).analyze(program);
        return new Interpreter(program, new PrintWriter(output), options).run();
    }

    /**
     * Verifies print and println output: arguments joined by a space, println adds a newline.
     */
    @Test
    @Tag("unit")
    void testPrintOutput() {
        int exit = run("fn main() -> int { print(1, true, \"a b\"); println(); println(1 + 2); return 7; }");

        assertThat(exit).isEqualTo(7);
        assertThat(output.toString()).isEqualTo("1 true a b\n3\n");
    }

    /**
     * Verifies that the right operand of && and || is skipped when the left one decides.
     */
    @Test
    @Tag("unit")
    void testShortCircuit() {
        String source = String.join("\n",
                "fn f() -> bool { print(\"f\"); return true; }",
                "fn main() -> int {",
                "  let a: bool = false && f();",
                "  let b: bool = true || f();",
                "  let c: bool = true && f();",
                "  return 0;",
                "}");

        run(source);

        assertThat(output.toString()).isEqualTo("f");
    }

    /**
     * Verifies that integer division rounds towards negative infinity.
     */
    @Test
    @Tag("unit")
    void testFloorDivision() {
        assertThat(run("fn main() -> int { return -7 / 2; }")).isEqualTo(-4);
        assertThat(run("fn main() -> int { return 7 / -2; }")).isEqualTo(-4);
        assertThat(run("fn main() -> int { return 7 / 2; }")).isEqualTo(3);
    }

    /**
     * Verifies that division by zero is a runtime error with the operator position.
     */
    @Test
    @Tag("unit")
    void testDivisionByZero() {
        assertThatThrownBy(() -> run("fn main() -> int {\n  let z: int = 0;\n  return 1 / z;\n}"))
                .isInstanceOf(InterpreterException.class)
                .hasMessage("Division by zero")
                .satisfies(e -> assertThat(((InterpreterException) e).getLine()).isEqualTo(3));
    }

    /**
     * Verifies that an assignment inside a nested block updates the outer variable, while a
     * declaration in the block stays local to it.
     */
    @Test
    @Tag("unit")
    void testBlockScoping() {
        String source = String.join("\n",
                "fn main() -> int {",
                "  let x: int = 1;",
                "  let y: int = 10;",
                "  if (true) { x = 2; let y: int = 20; y = 30; }",
                "  { x = x + y; }",
                "  return x;",
                "}");

        assertThat(run(source)).isEqualTo(12);
    }

    /**
     * Verifies that a return inside a loop leaves the loop and the function at once.
     */
    @Test
    @Tag("unit")
    void testReturnFromLoop() {
        String source = String.join("\n",
                "fn firstOver(limit: int) -> int {",
                "  let i: int = 0;",
                "  while (true) {",
                "    if (i * i > limit) { return i; }",
                "    i = i + 1;",
                "  }",
                "  return -1;",
                "}",
                "fn main() -> int { print(firstOver(50)); return firstOver(10); }");

        assertThat(run(source)).isEqualTo(4);
        assertThat(output.toString()).isEqualTo("8");
    }

    /**
     * Verifies recursion with independent frames per call.
     */
    @Test
    @Tag("unit")
    void testRecursion() {
        String source = String.join("\n",
                "fn fib(n: int) -> int { if (n < 2) { return n; } return fib(n - 1) + fib(n - 2); }",
                "fn main() -> int { return fib(15); }");

        assertThat(run(source)).isEqualTo(610);
    }

    /**
     * Verifies that a body without return yields zero and that booleans map to exit codes.
     */
    @Test
    @Tag("unit")
    void testExitCodes() {
        assertThat(run("fn main() -> int { let x: int = 5; }")).isZero();
        assertThat(run("fn main() -> bool { return true; }")).isEqualTo(1);
        assertThat(run("fn main() -> string { return \"x\"; }")).isZero();
    }

    /**
     * Verifies string comparison and equality across values.
     */
    @Test
    @Tag("unit")
    void testComparisons() {
        String source = String.join("\n",
                "fn main() -> int {",
                "  print(\"abc\" < \"abd\", 2 >= 2, \"a\" == \"a\", 1 != 1, !false);",
                "  return 0;",
                "}");

        run(source);

        assertThat(output.toString()).isEqualTo("true true true false true");
    }

    /**
     * Verifies that the configured call depth stops unbounded recursion.
     */
    @Test
    @Tag("unit")
    void testCallDepthLimit() {
        String source = String.join("\n",
                "fn down(n: int) -> int { return down(n + 1); }",
                "fn main() -> int { return down(0); }");

        assertThatThrownBy(() -> run(source, new InterpreterOptions(50)))
                .isInstanceOf(InterpreterException.class)
                .hasMessageContaining("Maximum call depth of 50");
    }

    /**
     * Verifies that recursion just below the default call depth runs to completion, through
     * nested blocks and loops in every frame.
     */
    @Test
    @Tag("unit")
    void testDeepRecursionWithinDefaultLimit() {
        String source = String.join("\n",
                "fn depth(n: int) -> int {",
                "  let a: int = 1;",
                "  if (n == 0) { return 0; }",
                "  while (true) {",
                "    { return (depth(n - 1) + a) * 1; }",
                "  }",
                "  return -1;",
                "}",
                "fn main() -> int { print(depth(990)); return 0; }");

        assertThat(run(source)).isZero();
        assertThat(output.toString()).isEqualTo("990");
    }

    /**
     * Verifies that integer arithmetic that leaves the 64-bit range is a runtime error
     * instead of wrapping around.
     */
    @Test
    @Tag("unit")
    void testIntegerOverflow() {
        assertThatThrownBy(() -> run("fn main() -> int {\n  print(-9223372036854775807 - 2);\n  return 0;\n}"))
                .isInstanceOf(InterpreterException.class)
                .hasMessage("Integer overflow")
                .satisfies(e -> assertThat(((InterpreterException) e).getLine()).isEqualTo(2));
        assertThatThrownBy(() -> run("fn main() -> int { return 9223372036854775807 + 1; }"))
                .isInstanceOf(InterpreterException.class)
                .hasMessage("Integer overflow");
        assertThatThrownBy(() -> run("fn main() -> int { return 4611686018427387904 * 2; }"))
                .isInstanceOf(InterpreterException.class)
                .hasMessage("Integer overflow");
        assertThatThrownBy(() -> run("fn main() -> int { let m: int = -9223372036854775807 - 1; return -m; }"))
                .isInstanceOf(InterpreterException.class)
                .hasMessage("Integer overflow");
        assertThatThrownBy(() -> run("fn main() -> int { let m: int = -9223372036854775807 - 1; return m / -1; }"))
                .isInstanceOf(InterpreterException.class)
                .hasMessage("Integer overflow");
        assertThat(run("fn main() -> int { let m: int = -9223372036854775807 - 1; print(m); return 0; }")).isZero();
        assertThat(output.toString()).isEqualTo("-9223372036854775808");
    }

    /**
     * Verifies that extra call arguments are ignored, since arity is not checked.
     */
    @Test
    @Tag("unit")
    void testExtraArgumentsAreIgnored() {
        String source = String.join("\n",
                "fn id(n: int) -> int { return n; }",
                "fn main() -> int { return id(3, 4, 5); }");

        assertThat(run(source)).isEqualTo(3);
    }
}
