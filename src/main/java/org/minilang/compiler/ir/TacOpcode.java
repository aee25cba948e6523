package org.minilang.compiler.ir;

import java.util.Map;

/**
 * The opcodes of the three-address code, plus the {@link #LABEL} pseudo-op.
 */
public enum TacOpcode {
    CONST("const"),
    MOV("mov"),
    ADD("add"),
    SUB("sub"),
    MUL("mul"),
    DIV("div"),
    LT("lt"),
    GT("gt"),
    LE("le"),
    GE("ge"),
    EQ("eq"),
    NE("ne"),
    LAND("land"),
    LOR("lor"),
    NEG("neg"),
    LNOT("lnot"),
    CALL("call"),
    /** {@code br L} */
    BR("br"),
    /** {@code cbr t, Ltrue, Lfalse} */
    CBR("cbr"),
    RET("ret"),
    /** Marks the start of a labelled instruction run; carries no operands. */
    LABEL("label");

    private static final Map<String, TacOpcode> BINARY = Map.ofEntries(
            Map.entry("+", ADD), Map.entry("-", SUB), Map.entry("*", MUL), Map.entry("/", DIV),
            Map.entry("<", LT), Map.entry(">", GT), Map.entry("<=", LE), Map.entry(">=", GE),
            Map.entry("==", EQ), Map.entry("!=", NE),
            Map.entry("&&", LAND), Map.entry("||", LOR)
    );

    private final String mnemonic;

    TacOpcode(String mnemonic) {
        this.mnemonic = mnemonic;
    }

    public String mnemonic() {
        return mnemonic;
    }

    /**
     * @return {@code true} for the instructions that end a basic block.
     */
    public boolean isTerminator() {
        return this == BR || this == CBR || this == RET;
    }

    /**
     * Maps a binary source operator to its opcode.
     * @param operator The operator lexeme.
     * @return The opcode.
     * @throws IllegalArgumentException if the operator is not a binary operator.
     */
    public static TacOpcode forBinary(String operator) {
        TacOpcode opcode = BINARY.get(operator);
        if (opcode == null) {
            throw new IllegalArgumentException("No opcode for binary operator " + operator);
        }
        return opcode;
    }

    /**
     * Maps a unary source operator to its opcode.
     * @param operator {@code -} or {@code !}.
     * @return {@link #NEG} or {@link #LNOT}.
     * @throws IllegalArgumentException for any other operator.
     */
    public static TacOpcode forUnary(String operator) {
        return switch (operator) {
            case "-" -> NEG;
            case "!" -> LNOT;
            default -> throw new IllegalArgumentException("No opcode for unary operator " + operator);
        };
    }

    @Override
    public String toString() {
        return mnemonic;
    }
}
