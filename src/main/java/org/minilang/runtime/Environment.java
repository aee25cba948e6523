package org.minilang.runtime;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One frame of the runtime scope chain. A block or a call owns its frame; frames of a
 * call have no parent, so a callee never sees its caller's variables.
 */
public final class Environment {

    private final Environment parent;
    private final Map<String, Object> values = new HashMap<>();

    private Environment(Environment parent) {
        this.parent = parent;
    }

    /**
     * @return A parentless frame, as created for every function call.
     */
    public static Environment root() {
        return new Environment(null);
    }

    /**
     * @return A child frame whose lookups fall back to this frame.
     */
    public Environment child() {
        return new Environment(this);
    }

    /**
     * Binds a name in this frame, replacing any binding of this frame.
     * @param name The variable name.
     * @param value The value.
     */
    public void define(String name, Object value) {
        values.put(name, value);
    }

    /**
     * Upsert assignment: updates the innermost frame of the chain that already binds the
     * name, or creates the binding in this frame if no frame does.
     * @param name The variable name.
     * @param value The new value.
     */
    public void assign(String name, Object value) {
        for (Environment frame = this; frame != null; frame = frame.parent) {
            if (frame.values.containsKey(name)) {
                frame.values.put(name, value);
                return;
            }
        }
        values.put(name, value);
    }

    /**
     * Looks a name up along the chain, innermost first.
     * @param name The variable name.
     * @return The bound value, or empty if no frame binds the name.
     */
    public Optional<Object> lookup(String name) {
        for (Environment frame = this; frame != null; frame = frame.parent) {
            if (frame.values.containsKey(name)) {
                return Optional.of(frame.values.get(name));
            }
        }
        return Optional.empty();
    }

    /**
     * @param name The variable name.
     * @return {@code true} if this frame itself binds the name.
     */
    public boolean bindsLocally(String name) {
        return values.containsKey(name);
    }
}
