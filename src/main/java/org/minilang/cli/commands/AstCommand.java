package org.minilang.cli.commands;

import org.minilang.compiler.Compiler;
import org.minilang.compiler.api.CompilationException;
import org.minilang.compiler.frontend.parser.ast.ProgramNode;
import org.minilang.compiler.util.AstJson;
import org.minilang.compiler.util.AstPrinter;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.PrintWriter;

@Command(name = "ast", description = "Prints the syntax tree of a source file.")
public class AstCommand extends SourceCommand {

    @Option(names = "--json", description = "Print JSON instead of an ASCII tree.")
    private boolean json;

    @Override
    protected int execute(Compiler compiler, String source, PrintWriter out) throws CompilationException {
        ProgramNode program = compiler.parse(source);
        out.println(json ? AstJson.toJson(program) : AstPrinter.print(program));
        out.flush();
        return 0;
    }
}
