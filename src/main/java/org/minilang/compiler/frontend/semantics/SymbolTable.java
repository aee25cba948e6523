package org.minilang.compiler.frontend.semantics;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A stack of lexical scopes mapping variable names to their declared types.
 * Shadowing a name from an enclosing scope is allowed; declaring it twice in the
 * same scope is not.
 */
public class SymbolTable {

    private final Deque<Map<String, String>> scopes = new ArrayDeque<>();

    /**
     * Enters a new innermost scope.
     */
    public void enterScope() {
        scopes.push(new HashMap<>());
    }

    /**
     * Leaves the innermost scope, discarding its declarations.
     */
    public void leaveScope() {
        if (scopes.isEmpty()) {
            throw new IllegalStateException("No scope to leave");
        }
        scopes.pop();
    }

    /**
     * @return The number of currently open scopes.
     */
    public int depth() {
        return scopes.size();
    }

    /**
     * Declares a name in the innermost scope.
     * @param name The variable name.
     * @param type The declared type.
     * @return {@code false} if the innermost scope already declares the name.
     */
    public boolean declare(String name, String type) {
        Map<String, String> innermost = scopes.peek();
        if (innermost == null) {
            throw new IllegalStateException("No open scope");
        }
        return innermost.putIfAbsent(name, type) == null;
    }

    /**
     * Resolves a name, searching from the innermost scope outwards.
     * @param name The variable name.
     * @return The declared type, or empty if no open scope declares the name.
     */
    public Optional<String> resolve(String name) {
        for (Map<String, String> scope : scopes) {
            String type = scope.get(name);
            if (type != null) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
