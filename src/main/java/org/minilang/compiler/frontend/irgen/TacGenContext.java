package org.minilang.compiler.frontend.irgen;

import org.minilang.compiler.ir.TacFunction;
import org.minilang.compiler.ir.TacInstruction;
import org.minilang.compiler.ir.TacOpcode;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable context for lowering one function. Temp and label counters live here, so
 * every function starts again at {@code t1} and at label suffix {@code 1}.
 */
public final class TacGenContext {

	private final String functionName;
	private final List<TacInstruction> out = new ArrayList<>();
	private int tempCounter = 0;
	private int labelCounter = 0;

	/**
	 * @param functionName The name of the function being lowered.
	 */
	public TacGenContext(String functionName) {
		this.functionName = functionName;
	}

	/**
	 * @return A fresh temp name ({@code t1}, {@code t2}, ...).
	 */
	public String newTemp() {
		tempCounter++;
		return "t" + tempCounter;
	}

	/**
	 * @param base The label prefix, e.g. {@code then} or {@code while_cond}.
	 * @return A fresh label name made of the prefix and the next label number.
	 */
	public String newLabel(String base) {
		labelCounter++;
		return base + labelCounter;
	}

	/**
	 * Emits a new instruction.
	 * @param opcode The operation.
	 * @param dst The result, or {@code null}.
	 * @param args The operands.
	 * @return The result name, for chaining expression lowering.
	 */
	public String emit(TacOpcode opcode, String dst, String... args) {
		out.add(TacInstruction.of(opcode, dst, args));
		return dst;
	}

	/**
	 * Emits a label pseudo-instruction.
	 * @param name The label name.
	 */
	public void emitLabel(String name) {
		out.add(TacInstruction.label(name));
	}

	/**
	 * Builds the final {@link TacFunction} from the emitted instructions.
	 * @return The lowered function.
	 */
	public TacFunction build() {
		return new TacFunction(functionName, out);
	}
}
