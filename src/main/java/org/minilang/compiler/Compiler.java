package org.minilang.compiler;

import org.minilang.compiler.api.CompilationException;
import org.minilang.compiler.api.ICompiler;
import org.minilang.compiler.backend.cfg.CfgBuilder;
import org.minilang.compiler.backend.cfg.ControlFlowGraph;
import org.minilang.compiler.diagnostics.CompilerLogger;
import org.minilang.compiler.diagnostics.DiagnosticsEngine;
import org.minilang.compiler.diagnostics.PhaseException;
import org.minilang.compiler.frontend.CompilerPhase;
import org.minilang.compiler.frontend.irgen.TacGenerator;
import org.minilang.compiler.frontend.lexer.Lexer;
import org.minilang.compiler.frontend.lexer.Token;
import org.minilang.compiler.frontend.parser.Parser;
import org.minilang.compiler.frontend.parser.ast.ProgramNode;
import org.minilang.compiler.frontend.semantics.SemanticAnalyzer;
import org.minilang.compiler.frontend.semantics.SymbolTable;
import org.minilang.compiler.ir.TacInstruction;
import org.minilang.compiler.ir.TacProgram;
import org.minilang.runtime.Interpreter;
import org.minilang.runtime.InterpreterOptions;

import java.io.PrintWriter;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * The main pipeline implementation. This class orchestrates lexing, parsing, semantic
 * analysis, TAC lowering, CFG construction and execution, and turns the unchecked phase
 * errors into {@link CompilationException}s. It is not thread-safe.
 */
public class Compiler implements ICompiler {

    private final InterpreterOptions interpreterOptions;
    private final Set<ProgramNode> analyzed = Collections.newSetFromMap(new IdentityHashMap<>());
    private DiagnosticsEngine diagnostics = new DiagnosticsEngine();
    private Integer verbosity;

    public Compiler() {
        this(InterpreterOptions.defaults());
    }

    /**
     * @param interpreterOptions The limits for {@link #run(ProgramNode, PrintWriter)}.
     */
    public Compiler(InterpreterOptions interpreterOptions) {
        this.interpreterOptions = interpreterOptions;
    }

    @Override
    public List<Token> tokenize(String source) throws CompilationException {
        begin();
        try {
            List<Token> tokens = new Lexer(source, diagnostics).scanTokens();
            CompilerLogger.debug("Lexed " + tokens.size() + " token(s)");
            return tokens;
        } catch (PhaseException e) {
            throw failure(e);
        }
    }

    @Override
    public ProgramNode parse(String source) throws CompilationException {
        List<Token> tokens = tokenize(source);
        try {
            ProgramNode program = new Parser(tokens, diagnostics).parse();
            CompilerLogger.debug("Parsed " + program.functions().size() + " function(s)");
            return program;
        } catch (PhaseException e) {
            throw failure(e);
        }
    }

    @Override
    public void analyze(ProgramNode program) throws CompilationException {
        begin();
        try {
            new SemanticAnalyzer(diagnostics, new SymbolTable()).analyze(program);
            analyzed.add(program);
        } catch (PhaseException e) {
            throw failure(e);
        }
    }

    @Override
    public TacProgram lowerToTac(ProgramNode program) throws CompilationException {
        requireAnalyzed(program);
        try {
            return new TacGenerator().generate(program);
        } catch (PhaseException e) {
            throw failure(e);
        }
    }

    @Override
    public ControlFlowGraph buildCfg(List<TacInstruction> instructions) {
        return new CfgBuilder().build(instructions);
    }

    @Override
    public int run(ProgramNode program, PrintWriter out) throws CompilationException {
        requireAnalyzed(program);
        try {
            return new Interpreter(program, out, interpreterOptions).run();
        } catch (PhaseException e) {
            out.flush();
            throw failure(e);
        } catch (StackOverflowError e) {
            out.flush();
            throw new CompilationException(CompilerPhase.EXECUTION,
                    "EXECUTION: stack overflow, lower minilang.interpreter.max-call-depth", e);
        }
    }

    /**
     * Runs the whole pipeline on a source text: parse, analyze and execute.
     * @param source The source text.
     * @param out The sink for the program's output.
     * @return The exit code of {@code main}.
     * @throws CompilationException at the first error of any stage.
     */
    public int compileAndRun(String source, PrintWriter out) throws CompilationException {
        ProgramNode program = parse(source);
        analyze(program);
        return run(program, out);
    }

    @Override
    public void setVerbosity(int level) {
        this.verbosity = level;
    }

    /**
     * @return The diagnostics of the most recent stage invocation.
     */
    public DiagnosticsEngine getDiagnostics() {
        return diagnostics;
    }

    private void begin() {
        if (verbosity != null) {
            CompilerLogger.setLevel(verbosity);
        }
        diagnostics = new DiagnosticsEngine();
    }

    private void requireAnalyzed(ProgramNode program) {
        if (!analyzed.contains(program)) {
            throw new IllegalStateException("Program must pass analyze() before it is lowered or run");
        }
    }

    private CompilationException failure(PhaseException e) {
        CompilerLogger.debug(e.getPhase() + " failed: " + e.describe());
        return new CompilationException(e);
    }
}
