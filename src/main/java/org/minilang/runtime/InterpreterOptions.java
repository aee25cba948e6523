package org.minilang.runtime;

import com.typesafe.config.Config;

/**
 * Tunables of the {@link Interpreter}.
 *
 * @param maxCallDepth The deepest allowed nesting of user function calls.
 */
public record InterpreterOptions(int maxCallDepth) {

    /** Configuration path of the interpreter section. */
    public static final String CONFIG_PATH = "minilang.interpreter";

    public InterpreterOptions {
        if (maxCallDepth < 1) {
            throw new IllegalArgumentException("maxCallDepth must be positive: " + maxCallDepth);
        }
    }

    /**
     * @return The defaults shipped in {@code reference.conf}.
     */
    public static InterpreterOptions defaults() {
        return new InterpreterOptions(1000);
    }

    /**
     * Reads the options from the {@code minilang.interpreter} section.
     * @param config The application configuration.
     * @return The options; missing keys fall back to {@link #defaults()}.
     */
    public static InterpreterOptions fromConfig(Config config) {
        if (!config.hasPath(CONFIG_PATH)) {
            return defaults();
        }
        Config section = config.getConfig(CONFIG_PATH);
        int depth = section.hasPath("max-call-depth") ? section.getInt("max-call-depth") : defaults().maxCallDepth();
        return new InterpreterOptions(depth);
    }
}
