package org.minilang.compiler.frontend.lexer;

/**
 * Represents a single token extracted from the source code by the {@link Lexer}.
 *
 * @param type The type of the token (e.g., keyword, identifier, operator).
 * @param text The exact text of the token from the source code. String literals keep
 *             their quotes and escape sequences.
 * @param value The processed value of the token: a {@link Long} for numbers, the decoded
 *              content for string literals, {@code null} otherwise.
 * @param line The line number where the token was found.
 * @param column The column number where the token begins.
 */
public record Token(
        TokenType type,
        String text,
        Object value,
        int line,
        int column
) {
}
