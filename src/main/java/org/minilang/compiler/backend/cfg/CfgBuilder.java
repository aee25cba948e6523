package org.minilang.compiler.backend.cfg;

import org.minilang.compiler.diagnostics.CompilerLogger;
import org.minilang.compiler.ir.TacInstruction;
import org.minilang.compiler.ir.TacOpcode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Splits one function's instruction stream into basic blocks.
 * <p>
 * A label opens the block of that name; {@code br}, {@code cbr} and {@code ret} close the
 * open block. An instruction that arrives while no block is open goes to the
 * {@code entry} block. A non-empty block that does not end in a terminator falls through
 * to the next label of the stream in emission order. An {@code entry} block without a
 * label of its own takes its place in that order where its first instruction appears.
 * That is a textual rule, not a reachability analysis.
 */
public final class CfgBuilder {

    /** Name of the implicit first block. */
    public static final String ENTRY = "entry";

    /**
     * Builds the block graph.
     * @param instructions The instructions of one function in emission order.
     * @return The graph.
     */
    public ControlFlowGraph build(List<TacInstruction> instructions) {
        Map<String, BasicBlock> blocks = new LinkedHashMap<>();
        List<String> order = new ArrayList<>();
        BasicBlock current = null;

        for (TacInstruction instruction : instructions) {
            if (instruction.isLabel()) {
                order.add(instruction.label());
                current = blocks.computeIfAbsent(instruction.label(), BasicBlock::new);
                continue;
            }
            if (current == null) {
                if (!order.contains(ENTRY)) {
                    order.add(ENTRY);
                }
                current = blocks.computeIfAbsent(ENTRY, BasicBlock::new);
            }
            current.add(instruction);
            List<String> args = instruction.args();
            if (instruction.opcode() == TacOpcode.BR) {
                if (!args.isEmpty()) {
                    current.addSuccessor(args.get(0));
                }
                current = null;
            } else if (instruction.opcode() == TacOpcode.CBR) {
                if (args.size() >= 3) {
                    current.addSuccessor(args.get(1));
                    current.addSuccessor(args.get(2));
                }
                current = null;
            } else if (instruction.opcode() == TacOpcode.RET) {
                current = null;
            }
        }

        linkFallthroughs(order, blocks);
        CompilerLogger.trace("CFG: " + blocks.size() + " block(s)");
        return new ControlFlowGraph(blocks);
    }

    private void linkFallthroughs(List<String> order, Map<String, BasicBlock> blocks) {
        for (int i = 0; i < order.size(); i++) {
            BasicBlock block = blocks.get(order.get(i));
            if (block.fallsThrough() && i + 1 < order.size()) {
                block.addSuccessor(order.get(i + 1));
            }
        }
    }
}
