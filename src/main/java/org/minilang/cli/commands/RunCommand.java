package org.minilang.cli.commands;

import org.minilang.compiler.Compiler;
import org.minilang.compiler.api.CompilationException;
import picocli.CommandLine.Command;

import java.io.PrintWriter;

@Command(name = "run", description = "Checks and runs a program. The exit code is the value main returns.")
public class RunCommand extends SourceCommand {

    @Override
    protected int execute(Compiler compiler, String source, PrintWriter out) throws CompilationException {
        int exitCode = compiler.compileAndRun(source, out);
        out.flush();
        return exitCode;
    }
}
