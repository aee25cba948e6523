package org.minilang.cli;

import com.google.gson.JsonArray;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests the picocli command tree in-process, capturing stdout and stderr.
 */
public class CommandLineInterfaceTest {

    @TempDir
    Path tempDir;

    private StringWriter out;
    private StringWriter err;
    private CommandLine commandLine;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
        commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
    }

    private Path source(String text) throws IOException {
        Path file = tempDir.resolve("prog.ml");
        Files.writeString(file, text, StandardCharsets.UTF_8);
        return file;
    }

    private int execute(String... args) {
        return commandLine.execute(args);
    }

    /**
     * Verifies that run prints the program output and exits with main's result.
     */
    @Test
    @Tag("unit")
    void testRun() throws IOException {
        // Arrange
        Path file = source("fn main() -> int { println(\"hi\", 2); return 3; }");

        // Act
        int exit = execute("run", file.toString());

        // Assert
        assertThat(exit).isEqualTo(3);
        assertThat(out.toString()).isEqualTo("hi 2\n");
        assertThat(err.toString()).isEmpty();
    }

    /**
     * Verifies that check accepts a valid program and reports the first error of an invalid one.
     */
    @Test
    @Tag("unit")
    void testCheck() throws IOException {
        Path valid = source("fn main() -> int { return 0; }");
        assertThat(execute("check", valid.toString())).isZero();
        assertThat(out.toString().trim()).isEqualTo("OK");

        Path invalid = source("fn main() -> int {\n  let x: int = y;\n  return 0;\n}");
        assertThat(execute("check", invalid.toString())).isEqualTo(1);
        assertThat(err.toString().trim()).isEqualTo("error: SEMANTIC_ANALYSIS: Undefined identifier y at 2:16");
    }

    /**
     * Verifies the token table and its JSON form.
     */
    @Test
    @Tag("unit")
    void testTokens() throws IOException {
        Path file = source("fn main");

        assertThat(execute("tokens", file.toString())).isZero();
        assertThat(out.toString().lines()).containsExactly("1:1 FN fn", "1:4 IDENTIFIER main", "1:8 END_OF_FILE ");

        out.getBuffer().setLength(0);
        assertThat(execute("tokens", "--json", file.toString())).isZero();
        JsonArray tokens = JsonParser.parseString(out.toString()).getAsJsonArray();
        assertThat(tokens).hasSize(3);
        assertThat(tokens.get(1).getAsJsonObject().get("text").getAsString()).isEqualTo("main");
    }

    /**
     * Verifies that ast prints the tree without requiring semantic validity.
     */
    @Test
    @Tag("unit")
    void testAst() throws IOException {
        Path file = source("fn helper() -> int { return 1; }");

        assertThat(execute("ast", file.toString())).isZero();
        assertThat(out.toString()).contains("FuncDecl helper() -> int", "Literal 1");

        out.getBuffer().setLength(0);
        assertThat(execute("ast", "--json", file.toString())).isZero();
        assertThat(JsonParser.parseString(out.toString()).getAsJsonObject().get("_type").getAsString()).isEqualTo("Program");
    }

    /**
     * Verifies the TAC text and the CFG of a selected function.
     */
    @Test
    @Tag("unit")
    void testTacAndCfg() throws IOException {
        Path file = source("fn main() -> int { if (true) { return 1; } return 0; }");

        assertThat(execute("tac", file.toString())).isZero();
        assertThat(out.toString()).startsWith("func main()\nentry:\n  t1 = const true\n  cbr t1, then1, else2\n");

        out.getBuffer().setLength(0);
        assertThat(execute("cfg", "--function", "main", file.toString())).isZero();
        assertThat(out.toString()).contains("entry: -> then1, else2");

        assertThat(execute("cfg", "--function", "nope", file.toString())).isEqualTo(1);
        assertThat(err.toString()).contains("no function named nope");
    }

    /**
     * Verifies the interpreter limits are read from a configuration file given with --config.
     */
    @Test
    @Tag("unit")
    void testConfigFileSetsCallDepth() throws IOException {
        Path file = source("fn down(n: int) -> int { return down(n + 1); }\nfn main() -> int { return down(0); }");
        Path conf = tempDir.resolve("test.conf");
        Files.writeString(conf, "minilang.interpreter.max-call-depth = 5\n", StandardCharsets.UTF_8);

        int exit = execute("--config", conf.toString(), "run", file.toString());

        assertThat(exit).isEqualTo(1);
        assertThat(err.toString()).contains("error: EXECUTION: Maximum call depth of 5");
    }

    /**
     * Verifies that unreadable inputs fail with exit code 1 and a missing config file is a usage error.
     */
    @Test
    @Tag("unit")
    void testMissingFiles() throws IOException {
        assertThat(execute("run", tempDir.resolve("absent.ml").toString())).isEqualTo(1);
        assertThat(err.toString()).contains("error: cannot read");

        Path file = source("fn main() -> int { return 0; }");
        assertThat(execute("--config", tempDir.resolve("absent.conf").toString(), "check", file.toString())).isEqualTo(2);
        assertThat(err.toString()).contains("was not found");
    }
}
