package org.minilang.compiler.frontend;

import org.minilang.compiler.diagnostics.DiagnosticsEngine;
import org.minilang.compiler.frontend.irgen.TacGenerator;
import org.minilang.compiler.frontend.lexer.Lexer;
import org.minilang.compiler.frontend.parser.Parser;
import org.minilang.compiler.frontend.parser.ast.ProgramNode;
import org.minilang.compiler.frontend.semantics.SemanticAnalyzer;
import org.minilang.compiler.frontend.semantics.SymbolTable;
import org.minilang.compiler.ir.TacInstruction;
import org.minilang.compiler.ir.TacOpcode;
import org.minilang.compiler.ir.TacProgram;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link TacGenerator}.
 * These tests pin down the canonical text of simple functions and the label structure
 * of control flow.
 */
public class TacGeneratorTest {

    private static TacProgram lower(String source) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        ProgramNode program = new Parser(new Lexer(source, diagnostics).scanTokens(), diagnostics).parse();
        new SemanticAnalyzer(diagnostics, new SymbolTable()).analyze(program);
        return new TacGenerator().generate(program);
    }

    private static List<TacInstruction> main(String source) {
        return lower(source).asMap().get("main");
    }

    /**
     * Verifies the canonical text of a function with declarations, arithmetic and a call.
     */
    @Test
    @Tag("unit")
    void testCanonicalText() {
        // Arrange
        String source = "fn main() -> int { let x: int = 1 + 2; let s: string; println(x, \"a\\n\"); return x; }";

        // Act
        String text = lower(source).render();

        // Assert
        assertThat(text).isEqualTo(String.join("\n",
                "func main()",
                "entry:",
                "  t1 = const 1",
                "  t2 = const 2",
                "  t3 = add t1, t2",
                "  x = mov t3",
                "  s = mov 0",
                "  t4 = mov x",
                "  t5 = const \"a\\n\"",
                "  t6 = call println, t4, t5",
                "  t7 = mov x",
                "  ret t7",
                ""));
    }

    /**
     * Verifies that an if statement lowers to exactly one conditional branch, three distinct
     * labels, and that every branch target is a label of the function.
     */
    @Test
    @Tag("unit")
    void testIfLowering() {
        List<TacInstruction> code = main("fn main() -> int { if (1 < 2) { print(1); } else { print(2); } return 0; }");

        List<TacInstruction> branches = code.stream().filter(i -> i.opcode() == TacOpcode.CBR).collect(Collectors.toList());
        assertThat(branches).hasSize(1);
        assertThat(branches.get(0).args()).hasSize(3);
        assertThat(branches.get(0).args().subList(1, 3)).containsExactly("then1", "else2");

        Set<String> labels = labels(code);
        assertThat(labels).contains("entry", "then1", "else2", "endif3");
        assertThat(branchTargets(code)).allSatisfy(target -> assertThat(labels).contains(target));
    }

    /**
     * Verifies the shape of a while loop: jump to the condition, test, body, jump back.
     */
    @Test
    @Tag("unit")
    void testWhileLowering() {
        List<TacInstruction> code = main("fn main() -> int { let i: int = 0; while (i < 3) { i = i + 1; } return i; }");
        String text = code.stream().map(TacInstruction::render).collect(Collectors.joining("\n"));

        assertThat(text).contains(
                "  br while_cond1\nwhile_cond1:\n",
                "  cbr t4, while_body2, while_end3\nwhile_body2:\n",
                "  br while_cond1\nwhile_end3:\n");
        assertThat(branchTargets(code)).allSatisfy(target -> assertThat(labels(code)).contains(target));
    }

    /**
     * Verifies that temporaries and labels restart for every function.
     */
    @Test
    @Tag("unit")
    void testCountersResetPerFunction() {
        TacProgram program = lower(String.join("\n",
                "fn f(n: int) -> int { if (n > 0) { return 1; } return 0; }",
                "fn main() -> int { if (true) { return f(1); } return 0; }"));

        assertThat(program.functions()).extracting(f -> f.name()).containsExactly("f", "main");
        for (String name : List.of("f", "main")) {
            List<TacInstruction> code = program.asMap().get(name);
            assertThat(code.get(0).isLabel()).isTrue();
            assertThat(code.get(0).label()).isEqualTo("entry");
            assertThat(code.get(1).dst()).isEqualTo("t1");
            assertThat(labels(code)).contains("then1");
        }
    }

    /**
     * Verifies that a bare return lowers to returning zero and that unary operators map to
     * their opcodes.
     */
    @Test
    @Tag("unit")
    void testBareReturnAndUnary() {
        List<TacInstruction> code = main("fn main() -> int { let b: bool = !true; let n: int = -5; return; }");

        assertThat(code).extracting(TacInstruction::opcode).contains(TacOpcode.LNOT, TacOpcode.NEG);
        assertThat(code.get(code.size() - 1).render()).isEqualTo("  ret 0");
    }

    private static Set<String> labels(List<TacInstruction> code) {
        return code.stream().filter(TacInstruction::isLabel).map(TacInstruction::label).collect(Collectors.toSet());
    }

    private static List<String> branchTargets(List<TacInstruction> code) {
        return code.stream()
                .flatMap(i -> {
                    if (i.opcode() == TacOpcode.BR) return i.args().stream();
                    if (i.opcode() == TacOpcode.CBR) return i.args().subList(1, 3).stream();
                    return Stream.<String>empty();
                })
                .collect(Collectors.toList());
    }
}
