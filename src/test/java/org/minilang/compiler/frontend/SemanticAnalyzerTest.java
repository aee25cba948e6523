package org.minilang.compiler.frontend;

import org.minilang.compiler.diagnostics.DiagnosticsEngine;
import org.minilang.compiler.frontend.lexer.Lexer;
import org.minilang.compiler.frontend.parser.Parser;
import org.minilang.compiler.frontend.parser.ast.ProgramNode;
import org.minilang.compiler.frontend.semantics.SemanticAnalyzer;
import org.minilang.compiler.frontend.semantics.SemanticException;
import org.minilang.compiler.frontend.semantics.SymbolTable;
import org.minilang.compiler.frontend.semantics.Types;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link SemanticAnalyzer}.
 * These tests check the entry point rule, scoping and the typing rules of statements
 * and expressions.
 */
public class SemanticAnalyzerTest {

    private DiagnosticsEngine diagnostics;

    private SemanticAnalyzer analyze(String source) {
        diagnostics = new DiagnosticsEngine();
        ProgramNode program = new Parser(new Lexer(source, diagnostics).scanTokens(), diagnostics).parse();
        SemanticAnalyzer analyzer = new SemanticAnalyzer(diagnostics, new SymbolTable());
        analyzer.analyze(program);
        return analyzer;
    }

    private static String main(String body) {
        return "fn main() -> int {\n" + body + "\nreturn 0;\n}";
    }

    /**
     * Verifies that a program without main is rejected before any body is checked.
     */
    @Test
    @Tag("unit")
    void testMissingEntryPoint() {
        assertThatThrownBy(() -> analyze("fn helper() -> int { return undefinedName; }"))
                .isInstanceOf(SemanticException.class)
                .hasMessage("No entry point: fn main() -> int {...}");
        assertThat(diagnostics.getDiagnostics()).hasSize(1);
    }

    /**
     * Verifies that a well-typed program passes and its signatures are collected in order.
     */
    @Test
    @Tag("unit")
    void testValidProgram() {
        // Arrange
        String source = String.join("\n",
                "fn isPositive(n: int) -> bool { return n > 0; }",
                "fn main() -> int {",
                "  let s: string = \"hi\";",
                "  let ok: bool = isPositive(3) && s == \"hi\";",
                "  if (ok) { println(s, 1, true); }",
                "  return 0;",
                "}");

        // Act
        SemanticAnalyzer analyzer = analyze(source);

        // Assert
        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(analyzer.getFunctions()).containsOnlyKeys("isPositive", "main");
        assertThat(analyzer.getFunctions().get("isPositive").returnType()).isEqualTo(Types.BOOL);
    }

    /**
     * Verifies that a name cannot be declared twice in the same scope.
     */
    @Test
    @Tag("unit")
    void testRedeclarationInSameScope() {
        assertThatThrownBy(() -> analyze(main("let x: int = 1; let x: int = 2;")))
                .isInstanceOf(SemanticException.class)
                .hasMessage("Redeclaration of x");
    }

    /**
     * Verifies that a nested block may shadow a name of an enclosing scope.
     */
    @Test
    @Tag("unit")
    void testShadowingInNestedBlock() {
        assertThatCode(() -> analyze(main("let x: int = 1; { let x: bool = true; } if (true) { let x: string = \"s\"; }")))
                .doesNotThrowAnyException();
    }

    /**
     * Verifies that a variable declared in a block is gone after the block.
     */
    @Test
    @Tag("unit")
    void testBlockScopeEnds() {
        assertThatThrownBy(() -> analyze(main("{ let y: int = 1; } y = 2;")))
                .isInstanceOf(SemanticException.class)
                .hasMessage("Undefined identifier y");
    }

    /**
     * Verifies that a variable is not visible in its own initializer.
     */
    @Test
    @Tag("unit")
    void testDeclarationNotVisibleInInitializer() {
        assertThatThrownBy(() -> analyze(main("let x: int = x + 1;")))
                .isInstanceOf(SemanticException.class)
                .hasMessage("Undefined identifier x");
    }

    /**
     * Verifies that the initializer type must equal the declared type.
     */
    @Test
    @Tag("unit")
    void testInitializerTypeMismatch() {
        assertThatThrownBy(() -> analyze(main("let x: int = true;")))
                .isInstanceOf(SemanticException.class)
                .hasMessageStartingWith("Type mismatch for x");
    }

    /**
     * Verifies that assignments keep the declared type of the target.
     */
    @Test
    @Tag("unit")
    void testAssignmentTypeMismatch() {
        assertThatThrownBy(() -> analyze(main("let x: int = 1; x = \"s\";")))
                .isInstanceOf(SemanticException.class)
                .hasMessageStartingWith("Type mismatch in assignment to x");
    }

    /**
     * Verifies that conditions of if and while must be booleans.
     */
    @Test
    @Tag("unit")
    void testConditionsMustBeBool() {
        assertThatThrownBy(() -> analyze(main("if (1) { }")))
                .isInstanceOf(SemanticException.class)
                .hasMessage("if condition must be bool");
        assertThatThrownBy(() -> analyze(main("while (\"s\") { }")))
                .isInstanceOf(SemanticException.class)
                .hasMessage("while condition must be bool");
    }

    /**
     * Verifies the operand rules of arithmetic, comparison, logical and unary operators.
     */
    @Test
    @Tag("unit")
    void testOperatorTyping() {
        assertThatThrownBy(() -> analyze(main("let x: int = 1 + true;"))).isInstanceOf(SemanticException.class);
        assertThatThrownBy(() -> analyze(main("let b: bool = 1 < \"a\";"))).isInstanceOf(SemanticException.class);
        assertThatThrownBy(() -> analyze(main("let b: bool = 1 && true;"))).isInstanceOf(SemanticException.class);
        assertThatThrownBy(() -> analyze(main("let b: bool = !1;"))).isInstanceOf(SemanticException.class);
        assertThatThrownBy(() -> analyze(main("let x: int = -false;"))).isInstanceOf(SemanticException.class);
        assertThatCode(() -> analyze(main("let b: bool = \"a\" < \"b\" && !(1 == 2); let n: int = -(3 / 2);")))
                .doesNotThrowAnyException();
    }

    /**
     * Verifies that a call has the callee's declared return type while its argument list is
     * not matched against the parameters.
     */
    @Test
    @Tag("unit")
    void testCallTyping() {
        String source = String.join("\n",
                "fn name(n: int) -> string { return \"n\"; }",
                "fn main() -> int { let s: string = name(1, true); let t: string = name(); return 0; }");
        assertThatCode(() -> analyze(source)).doesNotThrowAnyException();

        String mismatch = String.join("\n",
                "fn name(n: int) -> string { return \"n\"; }",
                "fn main() -> int { let i: int = name(1); return 0; }");
        assertThatThrownBy(() -> analyze(mismatch)).isInstanceOf(SemanticException.class);
    }

    /**
     * Verifies that calling an unknown function and using an unknown variable in an argument
     * are both errors.
     */
    @Test
    @Tag("unit")
    void testUndefinedCallees() {
        assertThatThrownBy(() -> analyze(main("missing(1);")))
                .isInstanceOf(SemanticException.class)
                .hasMessage("Undefined function missing");
        assertThatThrownBy(() -> analyze(main("print(nope);")))
                .isInstanceOf(SemanticException.class)
                .hasMessage("Undefined identifier nope");
    }

    /**
     * Verifies that functions may not share a name with each other or with a builtin.
     */
    @Test
    @Tag("unit")
    void testFunctionRedeclaration() {
        assertThatThrownBy(() -> analyze("fn main() -> int { return 0; } fn main() -> int { return 1; }"))
                .isInstanceOf(SemanticException.class)
                .hasMessage("Redeclaration of function main");
        assertThatThrownBy(() -> analyze("fn print() -> int { return 0; } fn main() -> int { return 0; }"))
                .isInstanceOf(SemanticException.class)
                .hasMessage("Redeclaration of function print");
    }

    /**
     * Verifies that parameters are in scope in the body and that functions may call each
     * other regardless of declaration order.
     */
    @Test
    @Tag("unit")
    void testParametersAndForwardCalls() {
        String source = String.join("\n",
                "fn main() -> int { return twice(2); }",
                "fn twice(n: int) -> int { return n * 2; }");
        assertThatCode(() -> analyze(source)).doesNotThrowAnyException();
    }
}
