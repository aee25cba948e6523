package org.minilang.compiler.frontend.lexer;

import java.util.Map;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    // Keywords.
    /** The {@code fn} keyword. */
    FN,
    /** The {@code let} keyword. */
    LET,
    /** The {@code if} keyword. */
    IF,
    /** The {@code else} keyword. */
    ELSE,
    /** The {@code while} keyword. */
    WHILE,
    /** The {@code return} keyword. */
    RETURN,
    /** The {@code true} literal. */
    TRUE,
    /** The {@code false} literal. */
    FALSE,
    /** The {@code int} type keyword. */
    TYPE_INT,
    /** The {@code bool} type keyword. */
    TYPE_BOOL,
    /** The {@code string} type keyword. */
    TYPE_STRING,

    // Literals.
    /** An identifier, such as a variable, function or custom type name. */
    IDENTIFIER,
    /** A decimal integer literal. */
    NUMBER,
    /** A double-quoted string literal. */
    STRING,

    // Operators and punctuation.
    /** An arithmetic, comparison or logical operator; the text tells which one. */
    OPERATOR,
    /** The {@code ->} separating a parameter list from the return type. */
    ARROW,
    LEFT_PAREN,
    RIGHT_PAREN,
    LEFT_BRACE,
    RIGHT_BRACE,
    COMMA,
    COLON,
    SEMICOLON,
    /** A single {@code =}. */
    ASSIGN,

    /** Represents the end of the source text. */
    END_OF_FILE;

    private static final Map<String, TokenType> KEYWORDS = Map.ofEntries(
            Map.entry("fn", FN),
            Map.entry("let", LET),
            Map.entry("if", IF),
            Map.entry("else", ELSE),
            Map.entry("while", WHILE),
            Map.entry("return", RETURN),
            Map.entry("true", TRUE),
            Map.entry("false", FALSE),
            Map.entry("int", TYPE_INT),
            Map.entry("bool", TYPE_BOOL),
            Map.entry("string", TYPE_STRING)
    );

    /**
     * Looks up the keyword type for an identifier-shaped word.
     * @param word The scanned word.
     * @return The keyword type, or {@link #IDENTIFIER} if the word is not reserved.
     */
    public static TokenType keywordOrIdentifier(String word) {
        return KEYWORDS.getOrDefault(word, IDENTIFIER);
    }

    /**
     * @return {@code true} for the three built-in type keywords.
     */
    public boolean isTypeKeyword() {
        return this == TYPE_INT || this == TYPE_BOOL || this == TYPE_STRING;
    }
}
