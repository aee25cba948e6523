package org.minilang.compiler.util;

/**
 * Source-like rendering of literal values.
 */
public final class Literals {

    private Literals() {}

    /**
     * Renders a literal the way it would be written in MiniLang source: integers in
     * decimal, booleans as {@code true}/{@code false}, strings double-quoted with
     * escapes re-applied.
     * @param value A {@link Long}, {@link Boolean} or {@link String}.
     * @return The rendered literal.
     */
    public static String render(Object value) {
        if (value instanceof String s) {
            return quote(s);
        }
        return String.valueOf(value);
    }

    /**
     * @param s Raw string content.
     * @return The content in double quotes, with quotes, backslashes and control characters escaped.
     */
    public static String quote(String s) {
        StringBuilder sb = new StringBuilder(s.length() + 2).append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                case '\r' -> sb.append("\\r");
                case '\0' -> sb.append("\\0");
                default -> sb.append(c);
            }
        }
        return sb.append('"').toString();
    }
}
