package org.minilang.cli.commands;

import org.minilang.compiler.Compiler;
import org.minilang.compiler.api.CompilationException;
import org.minilang.compiler.frontend.parser.ast.ProgramNode;
import org.minilang.compiler.ir.TacFunction;
import org.minilang.compiler.ir.TacProgram;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.PrintWriter;
import java.util.List;

@Command(name = "cfg", description = "Prints the basic blocks and their successors.")
public class CfgCommand extends SourceCommand {

    @Option(names = "--function", paramLabel = "NAME", description = "Only print the graph of this function.")
    private String function;

    @Override
    protected int execute(Compiler compiler, String source, PrintWriter out) throws CompilationException {
        ProgramNode program = compiler.parse(source);
        compiler.analyze(program);
        TacProgram tac = compiler.lowerToTac(program);

        List<TacFunction> selected = tac.functions();
        if (function != null) {
            TacFunction only = tac.function(function).orElse(null);
            if (only == null) {
                err().println("error: no function named " + function);
                err().flush();
                return 1;
            }
            selected = List.of(only);
        }
        for (TacFunction fn : selected) {
            out.println("func " + fn.name() + "()");
            out.print(compiler.buildCfg(fn.instructions()).render());
        }
        out.flush();
        return 0;
    }
}
