package org.minilang.compiler.backend.cfg;

import org.minilang.compiler.ir.TacInstruction;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A run of instructions entered only at its label and left only at its end.
 * Label pseudo-instructions are not stored; the label is the block's name.
 */
public final class BasicBlock {

    private final String name;
    private final List<TacInstruction> instructions = new ArrayList<>();
    private final List<String> successors = new ArrayList<>();

    BasicBlock(String name) {
        this.name = name;
    }

    public String name() {
        return name;
    }

    public List<TacInstruction> instructions() {
        return Collections.unmodifiableList(instructions);
    }

    /**
     * @return The names of the successor blocks, in branch order.
     */
    public List<String> successors() {
        return Collections.unmodifiableList(successors);
    }

    void add(TacInstruction instruction) {
        instructions.add(instruction);
    }

    void addSuccessor(String label) {
        successors.add(label);
    }

    /**
     * @return {@code true} if the block has instructions and the last one is not
     *         {@code br}, {@code cbr} or {@code ret}.
     */
    boolean fallsThrough() {
        return !instructions.isEmpty() && !instructions.get(instructions.size() - 1).opcode().isTerminator();
    }

    @Override
    public String toString() {
        return "BasicBlock{" + name + ", " + instructions.size() + " instr, succs=" + successors + '}';
    }
}
