package org.minilang.compiler.frontend.lexer;

import org.minilang.compiler.diagnostics.DiagnosticsEngine;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * The Lexer (also known as Tokenizer or Scanner) is responsible for converting
 * a sequence of characters (source code) into a sequence of tokens.
 * <p>
 * Tokens are produced on demand through the {@link Iterator} interface. The sequence
 * is finite, ends with exactly one {@link TokenType#END_OF_FILE} token and cannot be
 * restarted. The first unrecognized character aborts the scan with a {@link LexException}.
 */
public class Lexer implements Iterator<Token> {

    private final String source;
    private final DiagnosticsEngine diagnostics;
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;
    private int startLine = 1;
    private int startColumn = 1;
    private boolean finished = false;

    /**
     * Creates a new Lexer.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics) {
        this.source = source;
        this.diagnostics = diagnostics;
    }

    /**
     * Performs the tokenization of the remaining source code.
     * @return A list of the recognized tokens, ending with {@link TokenType#END_OF_FILE}.
     */
    public List<Token> scanTokens() {
        List<Token> tokens = new ArrayList<>();
        while (hasNext()) {
            tokens.add(next());
        }
        return tokens;
    }

    @Override
    public boolean hasNext() {
        return !finished;
    }

    @Override
    public Token next() {
        if (finished) {
            throw new NoSuchElementException("Token stream is exhausted");
        }
        skipTrivia();
        start = current;
        startLine = line;
        startColumn = column;
        if (isAtEnd()) {
            finished = true;
            return new Token(TokenType.END_OF_FILE, "", null, line, column);
        }
        return scanToken();
    }

    private void skipTrivia() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ' || c == '\t' || c == '\r' || c == '\f' || c == '\n') {
                advance();
            } else if (c == '/' && peekNext() == '/') {
                // A comment goes until the end of the line.
                while (peek() != '\n' && !isAtEnd()) advance();
            } else {
                return;
            }
        }
    }

    private Token scanToken() {
        char c = advance();
        switch (c) {
            case '"': return string();
            case '(': return token(TokenType.LEFT_PAREN);
            case ')': return token(TokenType.RIGHT_PAREN);
            case '{': return token(TokenType.LEFT_BRACE);
            case '}': return token(TokenType.RIGHT_BRACE);
            case ',': return token(TokenType.COMMA);
            case ':': return token(TokenType.COLON);
            case ';': return token(TokenType.SEMICOLON);
            case '-':
                // The arrow is matched before the generic operator set.
                if (match('>')) return token(TokenType.ARROW);
                return token(TokenType.OPERATOR);
            case '=':
                if (match('=')) return token(TokenType.OPERATOR);
                return token(TokenType.ASSIGN);
            case '!', '<', '>':
                match('=');
                return token(TokenType.OPERATOR);
            case '&':
                if (match('&')) return token(TokenType.OPERATOR);
                throw error("Unknown character '" + c + "'");
            case '|':
                if (match('|')) return token(TokenType.OPERATOR);
                throw error("Unknown character '" + c + "'");
            case '+', '*', '/':
                return token(TokenType.OPERATOR);
            default:
                if (isDigit(c)) {
                    return number();
                } else if (isAlpha(c)) {
                    return identifier();
                }
                throw error("Unknown character '" + c + "'");
        }
    }

    private Token identifier() {
        while (isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);
        return token(TokenType.keywordOrIdentifier(text));
    }

    private Token number() {
        while (isDigit(peek())) advance();
        String numberString = source.substring(start, current);
        try {
            return token(TokenType.NUMBER, Long.parseLong(numberString));
        } catch (NumberFormatException e) {
            throw error("Integer literal out of range: " + numberString);
        }
    }

    private Token string() {
        StringBuilder value = new StringBuilder();
        while (peek() != '"') {
            if (isAtEnd() || peek() == '\n') {
                throw error("Unterminated string literal");
            }
            char c = advance();
            if (c == '\\') {
                if (isAtEnd() || peek() == '\n') {
                    throw error("Unterminated string literal");
                }
                value.append(unescape(advance()));
            } else {
                value.append(c);
            }
        }

        // The closing "
        advance();
        return token(TokenType.STRING, value.toString());
    }

    private char unescape(char escaped) {
        return switch (escaped) {
            case 'n' -> '\n';
            case 't' -> '\t';
            case 'r' -> '\r';
            case '0' -> '\0';
            default -> escaped;
        };
    }

    private LexException error(String message) {
        diagnostics.reportError(message, startLine, startColumn);
        return new LexException(message, startLine, startColumn);
    }

    private Token token(TokenType type) {
        return token(type, null);
    }

    private Token token(TokenType type, Object value) {
        return new Token(type, source.substring(start, current), value, startLine, startColumn);
    }

    private char advance() {
        char c = source.charAt(current++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private boolean match(char expected) {
        if (isAtEnd() || source.charAt(current) != expected) return false;
        advance();
        return true;
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) return '\0';
        return source.charAt(current + 1);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
                (c >= 'A' && c <= 'Z') ||
                c == '_';
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }
}
