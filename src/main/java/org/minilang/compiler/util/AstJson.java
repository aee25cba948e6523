package org.minilang.compiler.util;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import org.minilang.compiler.frontend.parser.ast.*;

/**
 * Converts an AST into a JSON tree. Every node becomes an object with {@code _type},
 * {@code line}, {@code column} and its own fields.
 */
public final class AstJson {

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().serializeNulls().create();

    private AstJson() {}

    /**
     * @param program The AST root.
     * @return Pretty-printed JSON.
     */
    public static String toJson(ProgramNode program) {
        return GSON.toJson(toTree(program));
    }

    /**
     * @param program The AST root.
     * @return The JSON tree.
     */
    public static JsonObject toTree(ProgramNode program) {
        JsonObject json = node("Program", program);
        JsonArray functions = new JsonArray();
        for (FunctionDeclNode function : program.functions()) {
            functions.add(function(function));
        }
        json.add("functions", functions);
        return json;
    }

    private static JsonObject function(FunctionDeclNode function) {
        JsonObject json = node("FuncDecl", function);
        json.addProperty("name", function.name());
        JsonArray params = new JsonArray();
        for (Parameter parameter : function.parameters()) {
            JsonObject param = new JsonObject();
            param.addProperty("name", parameter.name());
            param.addProperty("type", parameter.typeName());
            params.add(param);
        }
        json.add("params", params);
        json.addProperty("retType", function.returnType());
        json.add("body", function.body().accept(new StatementJson()));
        return json;
    }

    private static JsonObject node(String type, AstNode node) {
        JsonObject json = new JsonObject();
        json.addProperty("_type", type);
        json.addProperty("line", node.line());
        json.addProperty("column", node.column());
        return json;
    }

    private static final class StatementJson implements StatementVisitor<JsonElement> {

        private final ExpressionJson expressions = new ExpressionJson();

        private JsonElement optional(Expression expression) {
            return expression == null ? JsonNull.INSTANCE : expression.accept(expressions);
        }

        @Override
        public JsonElement visitBlock(BlockNode node) {
            JsonObject json = node("Block", node);
            JsonArray statements = new JsonArray();
            for (Statement statement : node.statements()) {
                statements.add(statement.accept(this));
            }
            json.add("statements", statements);
            return json;
        }

        @Override
        public JsonElement visitVarDecl(VarDeclNode node) {
            JsonObject json = node("VarDecl", node);
            json.addProperty("name", node.name());
            json.addProperty("type", node.typeName());
            json.add("init", optional(node.initializer()));
            return json;
        }

        @Override
        public JsonElement visitIf(IfNode node) {
            JsonObject json = node("IfStmt", node);
            json.add("cond", node.condition().accept(expressions));
            json.add("then", visitBlock(node.thenBlock()));
            json.add("else", node.elseBlock() == null ? JsonNull.INSTANCE : visitBlock(node.elseBlock()));
            return json;
        }

        @Override
        public JsonElement visitWhile(WhileNode node) {
            JsonObject json = node("WhileStmt", node);
            json.add("cond", node.condition().accept(expressions));
            json.add("body", visitBlock(node.body()));
            return json;
        }

        @Override
        public JsonElement visitReturn(ReturnNode node) {
            JsonObject json = node("ReturnStmt", node);
            json.add("value", optional(node.value()));
            return json;
        }

        @Override
        public JsonElement visitAssign(AssignNode node) {
            JsonObject json = node("Assign", node);
            json.addProperty("name", node.name());
            json.add("value", node.value().accept(expressions));
            return json;
        }

        @Override
        public JsonElement visitExpressionStatement(Expression node) {
            return node.accept(expressions);
        }
    }

    private static final class ExpressionJson implements ExpressionVisitor<JsonElement> {

        @Override
        public JsonElement visitLiteral(LiteralNode node) {
            JsonObject json = node("Literal", node);
            Object value = node.value();
            if (value instanceof Long l) {
                json.add("value", new JsonPrimitive(l));
            } else if (value instanceof Boolean b) {
                json.add("value", new JsonPrimitive(b));
            } else {
                json.add("value", new JsonPrimitive(String.valueOf(value)));
            }
            return json;
        }

        @Override
        public JsonElement visitVariable(VariableNode node) {
            JsonObject json = node("Var", node);
            json.addProperty("name", node.name());
            return json;
        }

        @Override
        public JsonElement visitBinaryOp(BinaryOpNode node) {
            JsonObject json = node("BinOp", node);
            json.addProperty("op", node.operator());
            json.add("left", node.left().accept(this));
            json.add("right", node.right().accept(this));
            return json;
        }

        @Override
        public JsonElement visitUnaryOp(UnaryOpNode node) {
            JsonObject json = node("UnOp", node);
            json.addProperty("op", node.operator());
            json.add("operand", node.operand().accept(this));
            return json;
        }

        @Override
        public JsonElement visitCall(CallNode node) {
            JsonObject json = node("Call", node);
            json.addProperty("name", node.name());
            JsonArray args = new JsonArray();
            for (Expression argument : node.arguments()) {
                args.add(argument.accept(this));
            }
            json.add("args", args);
            return json;
        }
    }
}
