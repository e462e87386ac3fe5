package org.javai.cdlexport.expr;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.javai.cdlexport.model.InnerOuter;
import org.javai.cdlexport.value.ArrayValue;
import org.javai.cdlexport.value.BooleanValue;
import org.javai.cdlexport.value.EnumValue;
import org.javai.cdlexport.value.NumberValue;
import org.javai.cdlexport.value.ParameterValue;
import org.javai.cdlexport.value.RecordFieldReference;
import org.javai.cdlexport.value.StringValue;
import org.javai.cdlexport.value.Value;

/**
 * Folds an expression tree into a single literal.
 * <p>
 * The evaluator knows nothing about instances: every reference leaf is handed to a
 * {@link LeafResolver}, and only the leaves on the evaluated path are requested, so
 * an untaken conditional branch never has its references resolved. Loop indices of
 * {@link ExpressionNode.ForLoop} shadow references of the same name inside the body.
 */
public class ExpressionEvaluator {

	/** Longest array a range or an array builder may produce. */
	static final int MAX_ARRAY_LENGTH = 1_000_000;

	private final FunctionLibrary functions;

	public ExpressionEvaluator() {
		this(FunctionLibrary.standard());
	}

	public ExpressionEvaluator(FunctionLibrary functions) {
		this.functions = Objects.requireNonNull(functions, "functions must not be null");
	}

	/**
	 * Evaluates {@code node}, resolving reference leaves on demand.
	 *
	 * @throws UnsupportedConstructException for unsupported nodes or calls
	 * @throws NonLiteralOperandException when a leaf resolves to a record field reference
	 * @throws EvaluationException when operands cannot be combined
	 */
	public Value evaluate(ExpressionNode node, LeafResolver leaves) {
		Objects.requireNonNull(node, "node must not be null");
		Objects.requireNonNull(leaves, "leaves must not be null");
		return eval(node, leaves, Map.of());
	}

	/**
	 * Evaluates {@code node} against leaves resolved ahead of time.
	 */
	public Value evaluate(ExpressionNode node, Map<ExpressionNode.VariableRef, ? extends ParameterValue> resolvedLeaves) {
		return evaluate(node, LeafResolver.of(resolvedLeaves));
	}

	private Value eval(ExpressionNode node, LeafResolver leaves, Map<String, Value> locals) {
		if (node instanceof ExpressionNode.Literal literal) {
			return literal.value();
		}
		if (node instanceof ExpressionNode.VariableRef ref) {
			return reference(ref, leaves, locals);
		}
		if (node instanceof ExpressionNode.UnaryOp unary) {
			return unary(unary.operator(), eval(unary.operand(), leaves, locals));
		}
		if (node instanceof ExpressionNode.BinaryOp binary) {
			return binary(binary, leaves, locals);
		}
		if (node instanceof ExpressionNode.Conditional conditional) {
			for (ExpressionNode.Branch branch : conditional.branches()) {
				if (condition(eval(branch.condition(), leaves, locals))) {
					return eval(branch.result(), leaves, locals);
				}
			}
			return eval(conditional.otherwise(), leaves, locals);
		}
		if (node instanceof ExpressionNode.ArrayConstruct array) {
			List<Value> elements = new ArrayList<>(array.elements().size());
			for (ExpressionNode element : array.elements()) {
				elements.add(eval(element, leaves, locals));
			}
			return new ArrayValue(elements);
		}
		if (node instanceof ExpressionNode.Range range) {
			return range(range, leaves, locals);
		}
		if (node instanceof ExpressionNode.ForLoop loop) {
			Value range = eval(loop.range(), leaves, locals);
			if (!(range instanceof ArrayValue iterations)) {
				throw new EvaluationException("For-loop range of '" + loop.index() + "' is not an array: "
						+ range.typeName());
			}
			List<Value> elements = new ArrayList<>(iterations.size());
			for (Value indexValue : iterations.elements()) {
				Map<String, Value> scope = new HashMap<>(locals);
				scope.put(loop.index(), indexValue);
				elements.add(eval(loop.body(), leaves, scope));
			}
			return new ArrayValue(elements);
		}
		if (node instanceof ExpressionNode.ArrayIndex subscript) {
			return subscript(subscript, leaves, locals);
		}
		if (node instanceof ExpressionNode.FunctionCall call) {
			return call(call, leaves, locals);
		}
		if (node instanceof ExpressionNode.Opaque opaque) {
			throw new UnsupportedConstructException("Unsupported expression: " + opaque.text());
		}
		throw new UnsupportedConstructException("Unsupported expression node: " + node.getClass().getSimpleName());
	}

	private Value reference(ExpressionNode.VariableRef ref, LeafResolver leaves, Map<String, Value> locals) {
		if (ref.kind() == InnerOuter.NONE && ref.path().depth() == 1 && locals.containsKey(ref.path().head())) {
			return locals.get(ref.path().head());
		}
		ParameterValue resolved = leaves.resolve(ref);
		if (resolved instanceof Value value) {
			return value;
		}
		throw new NonLiteralOperandException(ref, (RecordFieldReference) resolved);
	}

	private boolean condition(Value value) {
		if (value instanceof BooleanValue b) {
			return b.value();
		}
		throw new EvaluationException("Condition must be Boolean, got " + value.typeName());
	}

	private Value unary(UnaryOperator operator, Value operand) {
		return switch (operator) {
			case NOT -> BooleanValue.of(!condition(operand));
			case PLUS -> {
				requireNumeric(operator.symbol(), operand);
				yield operand;
			}
			case NEGATE -> negate(operand);
		};
	}

	private Value negate(Value operand) {
		if (operand instanceof NumberValue number) {
			return number.negate();
		}
		if (operand instanceof ArrayValue array) {
			List<Value> negated = new ArrayList<>(array.size());
			for (Value element : array.elements()) {
				negated.add(negate(element));
			}
			return new ArrayValue(negated);
		}
		throw new EvaluationException("Cannot negate " + operand.typeName());
	}

	private Value binary(ExpressionNode.BinaryOp binary, LeafResolver leaves, Map<String, Value> locals) {
		BinaryOperator operator = binary.operator();
		if (operator == BinaryOperator.AND || operator == BinaryOperator.OR) {
			boolean left = condition(eval(binary.left(), leaves, locals));
			if (operator == BinaryOperator.AND && !left) {
				return BooleanValue.FALSE;
			}
			if (operator == BinaryOperator.OR && left) {
				return BooleanValue.TRUE;
			}
			return BooleanValue.of(condition(eval(binary.right(), leaves, locals)));
		}
		Value left = eval(binary.left(), leaves, locals);
		Value right = eval(binary.right(), leaves, locals);
		if (operator.isRelational()) {
			return BooleanValue.of(compare(operator, left, right));
		}
		return arithmetic(operator, left, right);
	}

	private Value arithmetic(BinaryOperator operator, Value left, Value right) {
		if (left instanceof NumberValue l && right instanceof NumberValue r) {
			try {
				return switch (operator) {
					case ADD -> l.add(r);
					case SUBTRACT -> l.subtract(r);
					case MULTIPLY -> l.multiply(r);
					case DIVIDE -> l.divide(r);
					case POWER -> l.pow(r);
					default -> throw new IllegalStateException("Not an arithmetic operator: " + operator);
				};
			} catch (ArithmeticException e) {
				throw new EvaluationException("Cannot evaluate " + l.render() + " " + operator.symbol() + " "
						+ r.render() + ": " + e.getMessage(), e);
			}
		}
		if (operator == BinaryOperator.ADD && left instanceof StringValue l && right instanceof StringValue r) {
			return new StringValue(l.value() + r.value());
		}
		if (left instanceof ArrayValue l && right instanceof ArrayValue r
				&& (operator == BinaryOperator.ADD || operator == BinaryOperator.SUBTRACT)) {
			if (l.size() != r.size()) {
				throw new EvaluationException("Array size mismatch for '" + operator.symbol() + "': "
						+ l.size() + " vs " + r.size());
			}
			List<Value> result = new ArrayList<>(l.size());
			for (int i = 0; i < l.size(); i++) {
				result.add(arithmetic(operator, l.get(i), r.get(i)));
			}
			return new ArrayValue(result);
		}
		if (left instanceof ArrayValue l && right instanceof NumberValue
				&& (operator == BinaryOperator.MULTIPLY || operator == BinaryOperator.DIVIDE)) {
			List<Value> result = new ArrayList<>(l.size());
			for (Value element : l.elements()) {
				result.add(arithmetic(operator, element, right));
			}
			return new ArrayValue(result);
		}
		if (left instanceof NumberValue && right instanceof ArrayValue r && operator == BinaryOperator.MULTIPLY) {
			List<Value> result = new ArrayList<>(r.size());
			for (Value element : r.elements()) {
				result.add(arithmetic(operator, left, element));
			}
			return new ArrayValue(result);
		}
		throw new EvaluationException("Operator '" + operator.symbol() + "' is not defined for "
				+ left.typeName() + " and " + right.typeName());
	}

	private boolean compare(BinaryOperator operator, Value left, Value right) {
		if (operator == BinaryOperator.EQUAL || operator == BinaryOperator.NOT_EQUAL) {
			boolean equal = equalValues(left, right);
			return operator == BinaryOperator.EQUAL ? equal : !equal;
		}
		int order;
		if (left instanceof NumberValue l && right instanceof NumberValue r) {
			order = l.compareTo(r);
		} else if (left instanceof StringValue l && right instanceof StringValue r) {
			order = l.value().compareTo(r.value());
		} else if (left instanceof BooleanValue l && right instanceof BooleanValue r) {
			order = Boolean.compare(l.value(), r.value());
		} else {
			throw new EvaluationException("Operator '" + operator.symbol() + "' is not defined for "
					+ left.typeName() + " and " + right.typeName());
		}
		return switch (operator) {
			case LESS -> order < 0;
			case LESS_EQUAL -> order <= 0;
			case GREATER -> order > 0;
			case GREATER_EQUAL -> order >= 0;
			default -> throw new IllegalStateException("Not an ordering operator: " + operator);
		};
	}

	private boolean equalValues(Value left, Value right) {
		if (left instanceof NumberValue l && right instanceof NumberValue r) {
			return l.compareTo(r) == 0;
		}
		if (left instanceof EnumValue l && right instanceof EnumValue r) {
			return l.sameTag(r);
		}
		if (left instanceof BooleanValue || left instanceof StringValue) {
			if (left.getClass() != right.getClass()) {
				throw new EvaluationException("Cannot compare " + left.typeName() + " with " + right.typeName());
			}
			return left.equals(right);
		}
		throw new EvaluationException("Equality is not defined for " + left.typeName() + " and " + right.typeName());
	}

	private Value range(ExpressionNode.Range range, LeafResolver leaves, Map<String, Value> locals) {
		NumberValue start = requireNumeric("range", eval(range.start(), leaves, locals));
		NumberValue stop = requireNumeric("range", eval(range.stop(), leaves, locals));
		NumberValue step = range.step() != null
				? requireNumeric("range", eval(range.step(), leaves, locals))
				: NumberValue.ONE;
		if (step.signum() == 0) {
			throw new EvaluationException("Range step must not be zero");
		}
		List<Value> values = new ArrayList<>();
		NumberValue current = start;
		while (step.signum() > 0 ? current.compareTo(stop) <= 0 : current.compareTo(stop) >= 0) {
			if (values.size() >= MAX_ARRAY_LENGTH) {
				throw new EvaluationException("Range " + start.render() + ":" + stop.render() + " is too long");
			}
			values.add(current);
			current = current.add(step);
		}
		return new ArrayValue(values);
	}

	private Value subscript(ExpressionNode.ArrayIndex subscript, LeafResolver leaves, Map<String, Value> locals) {
		Value target = eval(subscript.array(), leaves, locals);
		if (!(target instanceof ArrayValue array)) {
			throw new EvaluationException("Cannot subscript " + target.typeName());
		}
		NumberValue index = requireNumeric("subscript", eval(subscript.index(), leaves, locals));
		if (!index.isInteger() || index.signum() <= 0 || index.compareTo(NumberValue.of(array.size())) > 0) {
			throw new EvaluationException("Subscript " + index.render() + " out of range 1.." + array.size());
		}
		return array.get(index.intValueExact() - 1);
	}

	private Value call(ExpressionNode.FunctionCall call, LeafResolver leaves, Map<String, Value> locals) {
		FunctionLibrary.LibraryFunction function = functions.lookup(call.name())
				.orElseThrow(() -> new UnsupportedConstructException("Function '" + call.name() + "' is not supported"));
		List<Value> arguments = new ArrayList<>(call.arguments().size());
		for (ExpressionNode argument : call.arguments()) {
			try {
				arguments.add(eval(argument, leaves, locals));
			} catch (NonLiteralOperandException e) {
				throw new UnsupportedConstructException("Function '" + call.name()
						+ "' requires literal arguments: " + e.getMessage());
			}
		}
		try {
			return function.apply(arguments);
		} catch (ArithmeticException e) {
			throw new EvaluationException("Cannot evaluate " + call.name() + ": " + e.getMessage(), e);
		}
	}

	private NumberValue requireNumeric(String context, Value value) {
		if (value instanceof NumberValue number) {
			return number;
		}
		throw new EvaluationException("'" + context + "' requires a number, got " + value.typeName());
	}
}
