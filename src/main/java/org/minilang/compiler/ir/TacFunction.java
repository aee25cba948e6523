package org.minilang.compiler.ir;

import java.util.List;

/**
 * The lowered instruction stream of one function.
 *
 * @param name The function name.
 * @param instructions The instructions in emission order.
 */
public record TacFunction(String name, List<TacInstruction> instructions) {

    public TacFunction {
        instructions = List.copyOf(instructions);
    }

    /**
     * Renders the function as {@code func NAME()} followed by one line per instruction.
     * @return The canonical text, each line terminated by {@code \n}.
     */
    public String render() {
        StringBuilder sb = new StringBuilder("func ").append(name).append("()\n");
        for (TacInstruction instruction : instructions) {
            sb.append(instruction.render()).append('\n');
        }
        return sb.toString();
    }
}
