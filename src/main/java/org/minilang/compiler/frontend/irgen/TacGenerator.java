package org.minilang.compiler.frontend.irgen;

import org.minilang.compiler.diagnostics.CompilerLogger;
import org.minilang.compiler.frontend.parser.ast.*;
import org.minilang.compiler.ir.TacFunction;
import org.minilang.compiler.ir.TacOpcode;
import org.minilang.compiler.ir.TacProgram;
import org.minilang.compiler.util.Literals;

import java.util.ArrayList;
import java.util.List;

/**
 * Phase: lowers a semantically validated AST to three-address code, one
 * {@link TacFunction} per declared function.
 * <p>
 * Lowering is purely syntax directed. Every sub-expression gets exactly one fresh temp
 * and one instruction; nothing is folded or shared.
 */
public final class TacGenerator {

	/**
	 * Lowers every function of the program in declaration order.
	 *
	 * @param program The semantically validated program.
	 * @return The lowered program.
	 */
	public TacProgram generate(ProgramNode program) {
		List<TacFunction> functions = new ArrayList<>();
		for (FunctionDeclNode function : program.functions()) {
			functions.add(lower(function));
		}
		CompilerLogger.debug("Lowered " + functions.size() + " function(s) to TAC");
		return new TacProgram(functions);
	}

	/**
	 * Lowers a single function with a fresh {@link TacGenContext}.
	 *
	 * @param function The function declaration.
	 * @return The lowered function, starting with the {@code entry} label.
	 */
	public TacFunction lower(FunctionDeclNode function) {
		TacGenContext ctx = new TacGenContext(function.name());
		ExpressionLowering expressions = new ExpressionLowering(ctx);
		ctx.emitLabel("entry");
		function.body().accept(new StatementLowering(ctx, expressions));
		TacFunction lowered = ctx.build();
		CompilerLogger.trace("Function " + function.name() + ": " + lowered.instructions().size() + " instruction(s)");
		return lowered;
	}

	private static final class StatementLowering implements StatementVisitor<Void> {

		private final TacGenContext ctx;
		private final ExpressionLowering expressions;

		StatementLowering(TacGenContext ctx, ExpressionLowering expressions) {
			this.ctx = ctx;
			this.expressions = expressions;
		}

		private String lower(Expression expression) {
			return expression.accept(expressions);
		}

		@Override
		public Void visitBlock(BlockNode node) {
			for (Statement statement : node.statements()) {
				statement.accept(this);
			}
			return null;
		}

		@Override
		public Void visitVarDecl(VarDeclNode node) {
			String value = node.initializer() != null ? lower(node.initializer()) : "0";
			ctx.emit(TacOpcode.MOV, node.name(), value);
			return null;
		}

		@Override
		public Void visitIf(IfNode node) {
			String condition = lower(node.condition());
			String thenLabel = ctx.newLabel("then");
			String elseLabel = ctx.newLabel("else");
			String endLabel = ctx.newLabel("endif");
			ctx.emit(TacOpcode.CBR, null, condition, thenLabel, elseLabel);
			ctx.emitLabel(thenLabel);
			node.thenBlock().accept(this);
			ctx.emit(TacOpcode.BR, null, endLabel);
			ctx.emitLabel(elseLabel);
			if (node.elseBlock() != null) {
				node.elseBlock().accept(this);
			}
			ctx.emitLabel(endLabel);
			return null;
		}

		@Override
		public Void visitWhile(WhileNode node) {
			String condLabel = ctx.newLabel("while_cond");
			String bodyLabel = ctx.newLabel("while_body");
			String endLabel = ctx.newLabel("while_end");
			ctx.emit(TacOpcode.BR, null, condLabel);
			ctx.emitLabel(condLabel);
			String condition = lower(node.condition());
			ctx.emit(TacOpcode.CBR, null, condition, bodyLabel, endLabel);
			ctx.emitLabel(bodyLabel);
			node.body().accept(this);
			ctx.emit(TacOpcode.BR, null, condLabel);
			ctx.emitLabel(endLabel);
			return null;
		}

		@Override
		public Void visitReturn(ReturnNode node) {
			// A bare return lowers to 0 whatever the declared return type is.
			String value = node.value() != null ? lower(node.value()) : "0";
			ctx.emit(TacOpcode.RET, null, value);
			return null;
		}

		@Override
		public Void visitAssign(AssignNode node) {
			ctx.emit(TacOpcode.MOV, node.name(), lower(node.value()));
			return null;
		}

		@Override
		public Void visitExpressionStatement(Expression node) {
			lower(node);
			return null;
		}
	}

	private static final class ExpressionLowering implements ExpressionVisitor<String> {

		private final TacGenContext ctx;

		ExpressionLowering(TacGenContext ctx) {
			this.ctx = ctx;
		}

		@Override
		public String visitLiteral(LiteralNode node) {
			return ctx.emit(TacOpcode.CONST, ctx.newTemp(), Literals.render(node.value()));
		}

		@Override
		public String visitVariable(VariableNode node) {
			return ctx.emit(TacOpcode.MOV, ctx.newTemp(), node.name());
		}

		@Override
		public String visitBinaryOp(BinaryOpNode node) {
			String left = node.left().accept(this);
			String right = node.right().accept(this);
			return ctx.emit(TacOpcode.forBinary(node.operator()), ctx.newTemp(), left, right);
		}

		@Override
		public String visitUnaryOp(UnaryOpNode node) {
			String operand = node.operand().accept(this);
			return ctx.emit(TacOpcode.forUnary(node.operator()), ctx.newTemp(), operand);
		}

		@Override
		public String visitCall(CallNode node) {
			String[] args = new String[node.arguments().size() + 1];
			args[0] = node.name();
			for (int i = 0; i < node.arguments().size(); i++) {
				args[i + 1] = node.arguments().get(i).accept(this);
			}
			return ctx.emit(TacOpcode.CALL, ctx.newTemp(), args);
		}
	}
}
