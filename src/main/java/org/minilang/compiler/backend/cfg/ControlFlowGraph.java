package org.minilang.compiler.backend.cfg;

import org.minilang.compiler.ir.TacInstruction;

import java.util.Collections;
import java.util.Map;

/**
 * The basic blocks of one function, keyed by label in the order they were opened.
 * Used for display only; execution never reads it.
 *
 * @param blocks The blocks keyed by label.
 */
public record ControlFlowGraph(Map<String, BasicBlock> blocks) {

    public ControlFlowGraph {
        blocks = Collections.unmodifiableMap(blocks);
    }

    /**
     * @param label A block name.
     * @return The block, or {@code null} if there is none of that name.
     */
    public BasicBlock block(String label) {
        return blocks.get(label);
    }

    /**
     * Renders each block as {@code NAME: -> SUCC1, SUCC2} followed by its instructions.
     * @return The text form, each line terminated by {@code \n}.
     */
    public String render() {
        StringBuilder sb = new StringBuilder();
        for (BasicBlock block : blocks.values()) {
            sb.append(block.name()).append(':');
            if (!block.successors().isEmpty()) {
                sb.append(" -> ").append(String.join(", ", block.successors()));
            }
            sb.append('\n');
            for (TacInstruction instruction : block.instructions()) {
                sb.append(instruction.render()).append('\n');
            }
        }
        return sb.toString();
    }
}
