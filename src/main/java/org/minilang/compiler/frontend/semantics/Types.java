package org.minilang.compiler.frontend.semantics;

/**
 * Names of the types the checker distinguishes. Any other type name is accepted
 * in declarations but only ever equals itself.
 */
public final class Types {

    public static final String INT = "int";
    public static final String BOOL = "bool";
    public static final String STRING = "string";
    /** Result type of the output builtins; cannot be written in source. */
    public static final String VOID = "void";

    private Types() {}

    /**
     * Infers the type of a literal value.
     * @param value A {@link Long}, {@link Boolean} or {@link String}.
     * @return The type name.
     * @throws IllegalArgumentException for any other value.
     */
    public static String ofLiteral(Object value) {
        if (value instanceof Boolean) return BOOL;
        if (value instanceof Long) return INT;
        if (value instanceof String) return STRING;
        throw new IllegalArgumentException("Not a literal value: " + value);
    }
}
