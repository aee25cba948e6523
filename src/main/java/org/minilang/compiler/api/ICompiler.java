package org.minilang.compiler.api;

import org.minilang.compiler.backend.cfg.ControlFlowGraph;
import org.minilang.compiler.frontend.lexer.Token;
import org.minilang.compiler.frontend.parser.ast.ProgramNode;
import org.minilang.compiler.ir.TacInstruction;
import org.minilang.compiler.ir.TacProgram;

import java.io.PrintWriter;
import java.util.List;

/**
 * Defines the public interface of the MiniLang pipeline. Consumers call the stages in
 * order; {@link #analyze(ProgramNode)} must succeed before a program is lowered or run.
 */
public interface ICompiler {

    /**
     * @param source The source text.
     * @return The tokens, ending with the end-of-file token.
     * @throws CompilationException for an unrecognized character.
     */
    List<Token> tokenize(String source) throws CompilationException;

    /**
     * @param source The source text.
     * @return The AST.
     * @throws CompilationException for lexical or syntax errors.
     */
    ProgramNode parse(String source) throws CompilationException;

    /**
     * Checks scopes and types and marks the program as analyzed.
     * @param program The AST.
     * @throws CompilationException at the first semantic error.
     */
    void analyze(ProgramNode program) throws CompilationException;

    /**
     * @param program An analyzed program.
     * @return The per-function three-address code.
     * @throws CompilationException if lowering fails.
     * @throws IllegalStateException if the program was not analyzed.
     */
    TacProgram lowerToTac(ProgramNode program) throws CompilationException;

    /**
     * @param instructions The instructions of one function.
     * @return The basic-block graph, for display.
     */
    ControlFlowGraph buildCfg(List<TacInstruction> instructions);

    /**
     * Runs {@code main}.
     * @param program An analyzed program.
     * @param out The sink for the program's output.
     * @return The exit code.
     * @throws CompilationException at the first runtime error.
     * @throws IllegalStateException if the program was not analyzed.
     */
    int run(ProgramNode program, PrintWriter out) throws CompilationException;

    /**
     * Sets the verbosity level for log output.
     * @param level The verbosity level (0=errors only ... 4=trace).
     */
    void setVerbosity(int level);
}
