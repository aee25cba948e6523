package org.minilang.cli.commands;

import org.minilang.compiler.Compiler;
import org.minilang.compiler.api.CompilationException;
import org.minilang.compiler.frontend.parser.ast.ProgramNode;
import picocli.CommandLine.Command;

import java.io.PrintWriter;

@Command(name = "tac", description = "Prints the three-address code of every function.")
public class TacCommand extends SourceCommand {

    @Override
    protected int execute(Compiler compiler, String source, PrintWriter out) throws CompilationException {
        ProgramNode program = compiler.parse(source);
        compiler.analyze(program);
        out.print(compiler.lowerToTac(program).render());
        out.flush();
        return 0;
    }
}
