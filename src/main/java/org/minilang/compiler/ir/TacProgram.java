package org.minilang.compiler.ir;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Linear IR program container. Functions keep their declaration order.
 *
 * @param functions The lowered functions.
 */
public record TacProgram(List<TacFunction> functions) {

    public TacProgram {
        functions = List.copyOf(functions);
    }

    /**
     * @param name A function name.
     * @return The lowered function, if declared.
     */
    public Optional<TacFunction> function(String name) {
        return functions.stream().filter(f -> f.name().equals(name)).findFirst();
    }

    /**
     * @return The instruction lists keyed by function name, in declaration order.
     */
    public Map<String, List<TacInstruction>> asMap() {
        Map<String, List<TacInstruction>> map = new LinkedHashMap<>();
        for (TacFunction function : functions) {
            map.put(function.name(), function.instructions());
        }
        return Collections.unmodifiableMap(map);
    }

    /**
     * @return The canonical text of all functions, concatenated.
     */
    public String render() {
        StringBuilder sb = new StringBuilder();
        for (TacFunction function : functions) {
            sb.append(function.render());
        }
        return sb.toString();
    }
}
