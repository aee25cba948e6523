package org.minilang.runtime;

/**
 * Helpers for the runtime value kinds: {@link Long}, {@link Boolean} and {@link String}.
 */
public final class Values {

    private Values() {}

    /**
     * Truthiness used by conditions and logical operators: booleans as they are,
     * integers when non-zero, strings when non-empty.
     * @param value The value.
     * @return Its truth value.
     */
    public static boolean isTruthy(Object value) {
        if (value instanceof Boolean b) return b;
        if (value instanceof Long l) return l != 0L;
        if (value instanceof String s) return !s.isEmpty();
        return value != null;
    }

    /**
     * Renders a value for {@code print}/{@code println}.
     * @param value The value.
     * @return Decimal integers, {@code true}/{@code false}, or the raw string text.
     */
    public static String display(Object value) {
        return String.valueOf(value);
    }

    /**
     * Converts the result of {@code main} into a process exit code.
     * @param value The value returned by {@code main}.
     * @return The integer value, 1/0 for booleans, 0 otherwise.
     */
    public static int toExitCode(Object value) {
        if (value instanceof Long l) return l.intValue();
        if (value instanceof Boolean b) return b ? 1 : 0;
        return 0;
    }
}
