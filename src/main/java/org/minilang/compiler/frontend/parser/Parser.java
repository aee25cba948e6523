package org.minilang.compiler.frontend.parser;

import org.minilang.compiler.diagnostics.DiagnosticsEngine;
import org.minilang.compiler.frontend.lexer.Token;
import org.minilang.compiler.frontend.lexer.TokenType;
import org.minilang.compiler.frontend.parser.ast.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * The parser for MiniLang. It consumes the token list produced by the
 * {@link org.minilang.compiler.frontend.lexer.Lexer} and produces an Abstract Syntax Tree (AST).
 * <p>
 * Statements are parsed by recursive descent with one token of lookahead; the token after
 * that is only inspected to tell an assignment ({@code ID =}) from an expression statement.
 * Binary expressions use precedence climbing. The first mismatch aborts with a
 * {@link ParseException}; there is no error recovery.
 */
public class Parser {

    /** Binding powers of the binary operators. All of them are left-associative. */
    private static final Map<String, Integer> BINDING_POWER = Map.ofEntries(
            Map.entry("||", 1),
            Map.entry("&&", 2),
            Map.entry("==", 3), Map.entry("!=", 3),
            Map.entry("<", 4), Map.entry(">", 4), Map.entry("<=", 4), Map.entry(">=", 4),
            Map.entry("+", 5), Map.entry("-", 5),
            Map.entry("*", 6), Map.entry("/", 6)
    );

    private final List<Token> tokens;
    private final DiagnosticsEngine diagnostics;
    private int current = 0;

    /**
     * Constructs a new Parser.
     * @param tokens The list of tokens to parse, terminated by {@link TokenType#END_OF_FILE}.
     * @param diagnostics The engine for reporting errors.
     */
    public Parser(List<Token> tokens, DiagnosticsEngine diagnostics) {
        this.tokens = tokens;
        this.diagnostics = diagnostics;
    }

    /**
     * Parses the entire token stream.
     * @return The program node holding every function declaration.
     */
    public ProgramNode parse() {
        Token first = peek();
        List<FunctionDeclNode> functions = new ArrayList<>();
        while (!isAtEnd()) {
            functions.add(functionDeclaration());
        }
        return new ProgramNode(functions, first.line(), first.column());
    }

    private FunctionDeclNode functionDeclaration() {
        Token keyword = consume(TokenType.FN, "Expected 'fn'");
        Token name = consume(TokenType.IDENTIFIER, "Expected function name");
        consume(TokenType.LEFT_PAREN, "Expected '(' after function name");
        List<Parameter> parameters = new ArrayList<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                parameters.add(parameter());
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RIGHT_PAREN, "Expected ')' after parameters");
        consume(TokenType.ARROW, "Expected '->' before return type");
        String returnType = typeName();
        BlockNode body = block();
        return new FunctionDeclNode(name.text(), parameters, returnType, body, keyword.line(), keyword.column());
    }

    private Parameter parameter() {
        Token name = consume(TokenType.IDENTIFIER, "Expected parameter name");
        consume(TokenType.COLON, "Expected ':' after parameter name");
        return new Parameter(name.text(), typeName(), name.line(), name.column());
    }

    private String typeName() {
        Token type = peek();
        if (type.type().isTypeKeyword() || type.type() == TokenType.IDENTIFIER) {
            advance();
            return type.text();
        }
        throw error(type, "Expected type");
    }

    private BlockNode block() {
        Token brace = consume(TokenType.LEFT_BRACE, "Expected '{'");
        List<Statement> statements = new ArrayList<>();
        while (!check(TokenType.RIGHT_BRACE) && !isAtEnd()) {
            statements.add(statement());
        }
        consume(TokenType.RIGHT_BRACE, "Expected '}'");
        return new BlockNode(statements, brace.line(), brace.column());
    }

    private Statement statement() {
        switch (peek().type()) {
            case LET: return varDeclaration();
            case IF: return ifStatement();
            case WHILE: return whileStatement();
            case RETURN: return returnStatement();
            case LEFT_BRACE: return block();
            default:
                break;
        }
        if (check(TokenType.IDENTIFIER) && checkNext(TokenType.ASSIGN)) {
            return assignStatement();
        }
        Expression expression = expression();
        consume(TokenType.SEMICOLON, "Expected ';' after expression");
        return expression;
    }

    private VarDeclNode varDeclaration() {
        Token keyword = advance();
        Token name = consume(TokenType.IDENTIFIER, "Expected variable name");
        consume(TokenType.COLON, "Expected ':' after variable name");
        String type = typeName();
        Expression initializer = null;
        if (match(TokenType.ASSIGN)) {
            initializer = expression();
        }
        consume(TokenType.SEMICOLON, "Expected ';' after variable declaration");
        return new VarDeclNode(name.text(), type, initializer, keyword.line(), keyword.column());
    }

    private IfNode ifStatement() {
        Token keyword = advance();
        consume(TokenType.LEFT_PAREN, "Expected '(' after 'if'");
        Expression condition = expression();
        consume(TokenType.RIGHT_PAREN, "Expected ')' after condition");
        BlockNode thenBlock = block();
        BlockNode elseBlock = null;
        if (match(TokenType.ELSE)) {
            elseBlock = block();
        }
        return new IfNode(condition, thenBlock, elseBlock, keyword.line(), keyword.column());
    }

    private WhileNode whileStatement() {
        Token keyword = advance();
        consume(TokenType.LEFT_PAREN, "Expected '(' after 'while'");
        Expression condition = expression();
        consume(TokenType.RIGHT_PAREN, "Expected ')' after condition");
        return new WhileNode(condition, block(), keyword.line(), keyword.column());
    }

    private ReturnNode returnStatement() {
        Token keyword = advance();
        Expression value = null;
        if (!check(TokenType.SEMICOLON)) {
            value = expression();
        }
        consume(TokenType.SEMICOLON, "Expected ';' after return");
        return new ReturnNode(value, keyword.line(), keyword.column());
    }

    private AssignNode assignStatement() {
        Token name = advance();
        advance(); // '='
        Expression value = expression();
        consume(TokenType.SEMICOLON, "Expected ';' after assignment");
        return new AssignNode(name.text(), value, name.line(), name.column());
    }

    /**
     * Parses a complete expression.
     * @return The parsed {@link Expression}.
     */
    public Expression expression() {
        return binary(0);
    }

    private Expression binary(int minBindingPower) {
        Expression left = primary();
        while (check(TokenType.OPERATOR)) {
            Token operator = peek();
            int bindingPower = BINDING_POWER.getOrDefault(operator.text(), -1);
            if (bindingPower < minBindingPower) {
                break;
            }
            advance();
            Expression right = binary(bindingPower + 1);
            left = new BinaryOpNode(operator.text(), left, right, operator.line(), operator.column());
        }
        return left;
    }

    private Expression primary() {
        Token token = peek();
        switch (token.type()) {
            case NUMBER:
            case STRING:
                advance();
                return new LiteralNode(token.value(), token.line(), token.column());
            case TRUE:
                advance();
                return new LiteralNode(Boolean.TRUE, token.line(), token.column());
            case FALSE:
                advance();
                return new LiteralNode(Boolean.FALSE, token.line(), token.column());
            case IDENTIFIER:
                advance();
                if (match(TokenType.LEFT_PAREN)) {
                    return call(token);
                }
                return new VariableNode(token.text(), token.line(), token.column());
            case LEFT_PAREN:
                advance();
                Expression inner = expression();
                consume(TokenType.RIGHT_PAREN, "Expected ')' after expression");
                return inner;
            case OPERATOR:
                if ("-".equals(token.text()) || "!".equals(token.text())) {
                    advance();
                    return new UnaryOpNode(token.text(), primary(), token.line(), token.column());
                }
                break;
            default:
                break;
        }
        throw error(token, "Unexpected token " + describe(token));
    }

    private CallNode call(Token name) {
        List<Expression> arguments = new ArrayList<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                arguments.add(expression());
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RIGHT_PAREN, "Expected ')' after arguments");
        return new CallNode(name.text(), arguments, name.line(), name.column());
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    /**
     * Checks the type of the token after the current one without consuming anything.
     * @param type The token type to check.
     * @return true if the next token is of the given type, false otherwise.
     */
    private boolean checkNext(TokenType type) {
        if (current + 1 >= tokens.size()) return false;
        return tokens.get(current + 1).type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return tokens.get(current - 1);
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.END_OF_FILE;
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token consume(TokenType type, String errorMessage) {
        if (check(type)) return advance();
        throw error(peek(), errorMessage + ", got " + describe(peek()));
    }

    private ParseException error(Token token, String message) {
        diagnostics.reportError(message, token.line(), token.column());
        return new ParseException(message, token.line(), token.column());
    }

    private static String describe(Token token) {
        if (token.type() == TokenType.END_OF_FILE) {
            return "end of input";
        }
        return token.type() + " '" + token.text() + "'";
    }
}
