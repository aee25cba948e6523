package org.minilang.compiler.ir;

import java.util.List;

/**
 * A single three-address instruction.
 *
 * @param opcode The operation.
 * @param dst The result temp or variable, or {@code null} if the instruction has no result.
 * @param args The operands: temps, variable names, immediates, callee or label names.
 * @param label The label name for {@link TacOpcode#LABEL}, {@code null} otherwise.
 */
public record TacInstruction(TacOpcode opcode, String dst, List<String> args, String label) {

    public TacInstruction {
        args = List.copyOf(args);
    }

    /**
     * @param name The label name.
     * @return A label pseudo-instruction.
     */
    public static TacInstruction label(String name) {
        return new TacInstruction(TacOpcode.LABEL, null, List.of(), name);
    }

    /**
     * @param opcode The operation.
     * @param dst The result, or {@code null}.
     * @param args The operands.
     * @return A regular instruction.
     */
    public static TacInstruction of(TacOpcode opcode, String dst, String... args) {
        return new TacInstruction(opcode, dst, List.of(args), null);
    }

    public boolean isLabel() {
        return opcode == TacOpcode.LABEL;
    }

    /**
     * Renders the instruction in the canonical text form: {@code LABEL:} for labels,
     * otherwise two spaces, {@code dst = } when present, the mnemonic and the
     * comma-separated operands.
     * @return The rendered line without line terminator.
     */
    public String render() {
        if (isLabel()) {
            return label + ":";
        }
        StringBuilder sb = new StringBuilder("  ");
        if (dst != null) {
            sb.append(dst).append(" = ");
        }
        sb.append(opcode.mnemonic()).append(' ').append(String.join(", ", args));
        return sb.toString().stripTrailing();
    }

    @Override
    public String toString() {
        return render().strip();
    }
}
