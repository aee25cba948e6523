package org.minilang.cli.commands;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.minilang.compiler.Compiler;
import org.minilang.compiler.api.CompilationException;
import org.minilang.compiler.frontend.lexer.Token;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.PrintWriter;
import java.util.List;

@Command(name = "tokens", description = "Prints the token stream of a source file.")
public class TokensCommand extends SourceCommand {

    @Option(names = "--json", description = "Print a JSON array instead of a table.")
    private boolean json;

    @Override
    protected int execute(Compiler compiler, String source, PrintWriter out) throws CompilationException {
        List<Token> tokens = compiler.tokenize(source);
        if (json) {
            Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();
            out.println(gson.toJson(toJson(tokens)));
        } else {
            for (Token token : tokens) {
                out.println(token.line() + ":" + token.column() + " " + token.type() + " " + token.text());
            }
        }
        out.flush();
        return 0;
    }

    private static JsonArray toJson(List<Token> tokens) {
        JsonArray array = new JsonArray();
        for (Token token : tokens) {
            JsonObject object = new JsonObject();
            object.addProperty("type", token.type().name());
            object.addProperty("text", token.text());
            if (token.value() instanceof Long number) {
                object.addProperty("value", number);
            } else if (token.value() != null) {
                object.addProperty("value", token.value().toString());
            }
            object.addProperty("line", token.line());
            object.addProperty("column", token.column());
            array.add(object);
        }
        return array;
    }
}
