package org.javai.cdlexport.sxl;

import java.util.ArrayList;
import java.util.List;
import org.javai.cdlexport.expr.ExpressionNode;
import org.javai.cdlexport.model.InnerOuter;
import org.javai.cdlexport.value.ArrayValue;
import org.javai.cdlexport.value.BooleanValue;
import org.javai.cdlexport.value.EnumValue;
import org.javai.cdlexport.value.NumberValue;
import org.javai.cdlexport.value.StringValue;
import org.javai.cdlexport.value.Value;

/**
 * Renders an expression tree back to the notation read by {@link ExpressionReader}.
 * Output is compact and deterministic, suitable for diagnostics and exported documents.
 */
public final class ExpressionPrinter {

	private ExpressionPrinter() {
	}

	public static String print(ExpressionNode node) {
		StringBuilder out = new StringBuilder();
		append(out, node);
		return out.toString();
	}

	private static void append(StringBuilder out, ExpressionNode node) {
		if (node instanceof ExpressionNode.Literal literal) {
			appendValue(out, literal.value());
		} else if (node instanceof ExpressionNode.VariableRef ref) {
			if (ref.kind() == InnerOuter.INNER || ref.kind() == InnerOuter.OUTER) {
				out.append('(').append(ref.kind() == InnerOuter.INNER ? "inner " : "outer ").append(ref.path()).append(')');
			} else {
				out.append(ref.path());
			}
		} else if (node instanceof ExpressionNode.UnaryOp unary) {
			list(out, unary.operator().symbol(), List.of(unary.operand()));
		} else if (node instanceof ExpressionNode.BinaryOp binary) {
			list(out, binary.operator().symbol(), List.of(binary.left(), binary.right()));
		} else if (node instanceof ExpressionNode.Conditional conditional) {
			List<ExpressionNode> args = new ArrayList<>();
			for (ExpressionNode.Branch branch : conditional.branches()) {
				args.add(branch.condition());
				args.add(branch.result());
			}
			args.add(conditional.otherwise());
			list(out, "if", args);
		} else if (node instanceof ExpressionNode.ArrayConstruct array) {
			list(out, "array", array.elements());
		} else if (node instanceof ExpressionNode.ForLoop loop) {
			out.append("(for ").append(loop.index()).append(' ');
			append(out, loop.range());
			out.append(' ');
			append(out, loop.body());
			out.append(')');
		} else if (node instanceof ExpressionNode.Range range) {
			List<ExpressionNode> args = new ArrayList<>();
			args.add(range.start());
			if (range.step() != null) {
				args.add(range.step());
			}
			args.add(range.stop());
			list(out, "range", args);
		} else if (node instanceof ExpressionNode.ArrayIndex subscript) {
			list(out, "index", List.of(subscript.array(), subscript.index()));
		} else if (node instanceof ExpressionNode.FunctionCall call) {
			list(out, call.name(), call.arguments());
		} else if (node instanceof ExpressionNode.Opaque opaque) {
			out.append("(opaque '").append(escape(opaque.text())).append("')");
		}
	}

	private static void list(StringBuilder out, String head, List<ExpressionNode> args) {
		out.append('(').append(head);
		for (ExpressionNode arg : args) {
			out.append(' ');
			append(out, arg);
		}
		out.append(')');
	}

	private static void appendValue(StringBuilder out, Value value) {
		if (value instanceof NumberValue number) {
			out.append(number.render());
		} else if (value instanceof BooleanValue bool) {
			out.append(bool.value());
		} else if (value instanceof StringValue string) {
			out.append('\'').append(escape(string.value())).append('\'');
		} else if (value instanceof EnumValue tag) {
			out.append("(enum ");
			if (!tag.type().isEmpty()) {
				out.append(tag.type()).append(' ');
			}
			out.append(tag.literal()).append(')');
		} else if (value instanceof ArrayValue array) {
			out.append("(array");
			for (Value element : array.elements()) {
				out.append(' ');
				appendValue(out, element);
			}
			out.append(')');
		}
	}

	private static String escape(String value) {
		return value.replace("\\", "\\\\")
			.replace("'", "\\'")
			.replace("\n", "\\n")
			.replace("\t", "\\t")
			.replace("\r", "\\r");
	}
}
