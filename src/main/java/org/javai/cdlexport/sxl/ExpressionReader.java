package org.javai.cdlexport.sxl;

import java.util.ArrayList;
import java.util.List;
import org.javai.cdlexport.expr.BinaryOperator;
import org.javai.cdlexport.expr.ExpressionNode;
import org.javai.cdlexport.expr.UnaryOperator;
import org.javai.cdlexport.model.InnerOuter;
import org.javai.cdlexport.model.ModelPath;
import org.javai.cdlexport.value.BooleanValue;
import org.javai.cdlexport.value.EnumValue;
import org.javai.cdlexport.value.NumberValue;
import org.javai.cdlexport.value.StringValue;

/**
 * Reads binding expressions written in s-expression notation.
 * <p>
 * Examples:
 * <pre>
 * (/ secOutRel.mAirSup_flow_nominal 1.2)
 * (if (== typSecOut (enum SecOut SingleDamper)) (enum Damper CommonDamper) (enum Damper CommonDamper))
 * (for i (range 1 nZon) (* i 2))
 * (outer datAll.TOut_nominal)
 * </pre>
 * Operators: {@code + - * / ^ == <> < <= > >= and or not}. Forms: {@code if}, {@code array},
 * {@code for}, {@code range}, {@code index}, {@code enum}, {@code inner}, {@code outer},
 * {@code opaque}. Any other head symbol is a function call.
 */
public final class ExpressionReader {

	private ExpressionReader() {
	}

	/**
	 * Parses exactly one expression.
	 *
	 * @throws SxlParseException on syntax errors or malformed forms
	 */
	public static ExpressionNode read(String text) {
		List<SxlNode> nodes = new SxlParser(new SxlTokenizer(text).tokenize()).parse();
		if (nodes.size() != 1) {
			throw new SxlParseException("Expected exactly one expression but found " + nodes.size() + " in: " + text);
		}
		return convert(nodes.get(0));
	}

	static ExpressionNode convert(SxlNode node) {
		return switch (node.kind()) {
			case NUMBER -> parseNumber(node.literalValue());
			case STRING -> ExpressionNode.literal(new StringValue(node.literalValue()));
			case ATOM -> atom(node.symbol());
			case LIST -> form(node.symbol(), node.args());
		};
	}

	private static ExpressionNode parseNumber(String text) {
		try {
			return ExpressionNode.literal(NumberValue.parse(text));
		} catch (NumberFormatException e) {
			throw new SxlParseException("Malformed number: " + text, e);
		}
	}

	private static ExpressionNode atom(String symbol) {
		return switch (symbol) {
			case "true" -> ExpressionNode.literal(BooleanValue.TRUE);
			case "false" -> ExpressionNode.literal(BooleanValue.FALSE);
			default -> {
				if (!Character.isLetter(symbol.charAt(0)) && symbol.charAt(0) != '_') {
					throw new SxlParseException("Operator '" + symbol + "' must be applied inside parentheses");
				}
				yield new ExpressionNode.VariableRef(ModelPath.of(symbol), InnerOuter.NONE);
			}
		};
	}

	private static ExpressionNode form(String head, List<SxlNode> args) {
		switch (head) {
			case "+":
			case "*":
				return foldLeft(head, args, head.equals("+") ? BinaryOperator.ADD : BinaryOperator.MULTIPLY, true);
			case "-":
				if (args.size() == 1) {
					return new ExpressionNode.UnaryOp(UnaryOperator.NEGATE, convert(args.get(0)));
				}
				return binary(head, BinaryOperator.SUBTRACT, args);
			case "/":
				return binary(head, BinaryOperator.DIVIDE, args);
			case "^":
				return binary(head, BinaryOperator.POWER, args);
			case "and":
				return foldLeft(head, args, BinaryOperator.AND, false);
			case "or":
				return foldLeft(head, args, BinaryOperator.OR, false);
			case "not":
				expectArity(head, args, 1);
				return new ExpressionNode.UnaryOp(UnaryOperator.NOT, convert(args.get(0)));
			case "if":
				return conditional(args);
			case "array":
				return new ExpressionNode.ArrayConstruct(convertAll(args));
			case "for":
				expectArity(head, args, 3);
				return new ExpressionNode.ForLoop(name(head, args.get(0)), convert(args.get(1)), convert(args.get(2)));
			case "range":
				if (args.size() == 2) {
					return new ExpressionNode.Range(convert(args.get(0)), null, convert(args.get(1)));
				}
				expectArity(head, args, 3);
				return new ExpressionNode.Range(convert(args.get(0)), convert(args.get(1)), convert(args.get(2)));
			case "index":
				expectArity(head, args, 2);
				return new ExpressionNode.ArrayIndex(convert(args.get(0)), convert(args.get(1)));
			case "enum":
				if (args.size() == 1) {
					return ExpressionNode.literal(new EnumValue("", name(head, args.get(0))));
				}
				expectArity(head, args, 2);
				return ExpressionNode.literal(new EnumValue(name(head, args.get(0)), name(head, args.get(1))));
			case "inner":
			case "outer":
				expectArity(head, args, 1);
				return new ExpressionNode.VariableRef(ModelPath.of(name(head, args.get(0))),
						head.equals("inner") ? InnerOuter.INNER : InnerOuter.OUTER);
			case "opaque":
				expectArity(head, args, 1);
				if (args.get(0).kind() != SxlNode.Kind.STRING) {
					throw new SxlParseException("opaque expects a quoted source text");
				}
				return new ExpressionNode.Opaque(args.get(0).literalValue());
			default:
				BinaryOperator relational = BinaryOperator.fromSymbol(head).orElse(null);
				if (relational != null && relational.isRelational()) {
					return binary(head, relational, args);
				}
				if (!Character.isLetter(head.charAt(0)) && head.charAt(0) != '_') {
					throw new SxlParseException("Unknown operator '" + head + "'");
				}
				return new ExpressionNode.FunctionCall(head, convertAll(args));
		}
	}

	private static ExpressionNode conditional(List<SxlNode> args) {
		if (args.size() < 3 || args.size() % 2 == 0) {
			throw new SxlParseException("if expects condition/result pairs followed by an else result, got "
					+ args.size() + " argument(s)");
		}
		List<ExpressionNode.Branch> branches = new ArrayList<>();
		for (int i = 0; i + 1 < args.size(); i += 2) {
			branches.add(new ExpressionNode.Branch(convert(args.get(i)), convert(args.get(i + 1))));
		}
		return new ExpressionNode.Conditional(branches, convert(args.get(args.size() - 1)));
	}

	private static ExpressionNode binary(String head, BinaryOperator operator, List<SxlNode> args) {
		expectArity(head, args, 2);
		return new ExpressionNode.BinaryOp(operator, convert(args.get(0)), convert(args.get(1)));
	}

	private static ExpressionNode foldLeft(String head, List<SxlNode> args, BinaryOperator operator, boolean unaryPlus) {
		if (args.isEmpty()) {
			throw new SxlParseException("'" + head + "' expects at least one argument");
		}
		if (args.size() == 1) {
			if (unaryPlus && operator == BinaryOperator.ADD) {
				return new ExpressionNode.UnaryOp(UnaryOperator.PLUS, convert(args.get(0)));
			}
			throw new SxlParseException("'" + head + "' expects at least two arguments");
		}
		ExpressionNode result = convert(args.get(0));
		for (int i = 1; i < args.size(); i++) {
			result = new ExpressionNode.BinaryOp(operator, result, convert(args.get(i)));
		}
		return result;
	}

	private static List<ExpressionNode> convertAll(List<SxlNode> args) {
		List<ExpressionNode> converted = new ArrayList<>(args.size());
		for (SxlNode arg : args) {
			converted.add(convert(arg));
		}
		return converted;
	}

	private static String name(String head, SxlNode node) {
		if (node.kind() != SxlNode.Kind.ATOM) {
			throw new SxlParseException("'" + head + "' expects a name, got " + node.kind());
		}
		return node.symbol();
	}

	private static void expectArity(String head, List<SxlNode> args, int expected) {
		if (args.size() != expected) {
			throw new SxlParseException("'" + head + "' expects " + expected + " argument(s), got " + args.size());
		}
	}
}
