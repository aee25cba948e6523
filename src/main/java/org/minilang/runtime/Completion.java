package org.minilang.runtime;

/**
 * How a statement finished: normally, or by a {@code return} that has to unwind every
 * enclosing block and loop up to the current call.
 */
public sealed interface Completion permits Completion.Normal, Completion.Returned {

    /** Shared instance for statements that finished normally. */
    Completion NORMAL = new Normal();

    /**
     * @return {@code true} if execution of the enclosing statement list must stop.
     */
    default boolean isReturn() {
        return this instanceof Returned;
    }

    /**
     * Normal completion; execution continues with the next statement.
     */
    final class Normal implements Completion {
        private Normal() {}

        @Override
        public String toString() {
            return "NORMAL";
        }
    }

    /**
     * A {@code return} was executed.
     *
     * @param value The returned value.
     */
    record Returned(Object value) implements Completion {}
}
