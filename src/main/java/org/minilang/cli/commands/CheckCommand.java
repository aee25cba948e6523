package org.minilang.cli.commands;

import org.minilang.compiler.Compiler;
import org.minilang.compiler.api.CompilationException;
import org.minilang.compiler.frontend.parser.ast.ProgramNode;
import picocli.CommandLine.Command;

import java.io.PrintWriter;

@Command(name = "check", description = "Lexes, parses and analyzes a program without running it.")
public class CheckCommand extends SourceCommand {

    @Override
    protected int execute(Compiler compiler, String source, PrintWriter out) throws CompilationException {
        ProgramNode program = compiler.parse(source);
        compiler.analyze(program);
        out.println("OK");
        out.flush();
        return 0;
    }
}
