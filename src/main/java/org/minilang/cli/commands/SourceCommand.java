package org.minilang.cli.commands;

import org.minilang.cli.CommandLineInterface;
import org.minilang.compiler.Compiler;
import org.minilang.compiler.api.CompilationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.concurrent.Callable;

/**
 * Base of the subcommands that work on one source file. Pipeline failures are printed as
 * {@code error: PHASE: message at LINE:COL} and yield exit code 1.
 */
abstract class SourceCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(SourceCommand.class);

    @Parameters(index = "0", paramLabel = "FILE", description = "The MiniLang source file.")
    File file;

    @ParentCommand
    CommandLineInterface parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        String source;
        try {
            source = Files.readString(file.toPath(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            err().println("error: cannot read " + file + ": " + e.getMessage());
            err().flush();
            return 1;
        }
        LOG.debug("Read {} character(s) from {}", source.length(), file);
        try {
            return execute(parent.createCompiler(), source, out());
        } catch (CompilationException e) {
            out().flush();
            err().println("error: " + e.getMessage());
            err().flush();
            return 1;
        }
    }

    /**
     * @param compiler A configured compiler.
     * @param source The source text.
     * @param out The standard output of the command.
     * @return The exit code.
     * @throws CompilationException at the first pipeline error.
     */
    protected abstract int execute(Compiler compiler, String source, PrintWriter out) throws CompilationException;

    protected PrintWriter out() {
        return spec.commandLine().getOut();
    }

    protected PrintWriter err() {
        return spec.commandLine().getErr();
    }
}
