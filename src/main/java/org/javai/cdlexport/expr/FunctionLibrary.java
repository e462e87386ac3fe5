package org.javai.cdlexport.expr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.DoubleUnaryOperator;
import org.javai.cdlexport.value.ArrayValue;
import org.javai.cdlexport.value.NumberValue;
import org.javai.cdlexport.value.Value;

/**
 * Pure functions the evaluator may call once every argument is a literal.
 * <p>
 * {@link #standard()} registers the numeric and array built-ins; projects can
 * register further side-effect free functions under their qualified names.
 */
public final class FunctionLibrary {

	/**
	 * A pure function over literal arguments.
	 */
	@FunctionalInterface
	public interface LibraryFunction {
		Value apply(List<Value> arguments);
	}

	private final Map<String, LibraryFunction> functions = new ConcurrentHashMap<>();

	public static FunctionLibrary empty() {
		return new FunctionLibrary();
	}

	public static FunctionLibrary standard() {
		FunctionLibrary library = new FunctionLibrary();
		library.register("abs", args -> number("abs", args, 0).abs());
		library.register("sign", args -> NumberValue.of(number("sign", args, 0).signum()));
		library.register("floor", args -> number("floor", args, 0).floor());
		library.register("ceil", args -> number("ceil", args, 0).ceil());
		library.register("integer", args -> number("integer", args, 0).floor());
		library.register("sqrt", args -> {
			NumberValue x = number("sqrt", args, 0);
			if (x.signum() < 0) {
				throw new EvaluationException("sqrt of negative number " + x.render());
			}
			return transcendental(Math::sqrt, x);
		});
		library.register("exp", args -> transcendental(Math::exp, number("exp", args, 0)));
		library.register("log", args -> positiveLog("log", Math::log, args));
		library.register("log10", args -> positiveLog("log10", Math::log10, args));
		library.register("sin", args -> transcendental(Math::sin, number("sin", args, 0)));
		library.register("cos", args -> transcendental(Math::cos, number("cos", args, 0)));
		library.register("tan", args -> transcendental(Math::tan, number("tan", args, 0)));
		library.register("div", args -> {
			NumberValue q = divide("div", args);
			return q.signum() < 0 ? q.ceil() : q.floor();
		});
		library.register("mod", args -> {
			NumberValue x = number("mod", args, 0);
			NumberValue y = number("mod", args, 1);
			return x.subtract(divide("mod", args).floor().multiply(y));
		});
		library.register("rem", args -> {
			NumberValue x = number("rem", args, 0);
			NumberValue y = number("rem", args, 1);
			NumberValue q = divide("rem", args);
			return x.subtract((q.signum() < 0 ? q.ceil() : q.floor()).multiply(y));
		});
		library.register("min", args -> extremum("min", args, -1));
		library.register("max", args -> extremum("max", args, 1));
		library.register("sum", args -> {
			NumberValue total = NumberValue.ZERO;
			for (NumberValue element : numbers("sum", array("sum", args, 0))) {
				total = total.add(element);
			}
			return total;
		});
		library.register("product", args -> {
			NumberValue total = NumberValue.ONE;
			for (NumberValue element : numbers("product", array("product", args, 0))) {
				total = total.multiply(element);
			}
			return total;
		});
		library.register("size", args -> {
			ArrayValue array = array("size", args, 0);
			if (args.size() > 1) {
				int dimension = number("size", args, 1).intValueExact();
				for (int d = 1; d < dimension; d++) {
					if (array.size() == 0 || !(array.get(0) instanceof ArrayValue inner)) {
						throw new EvaluationException("size: array has no dimension " + dimension);
					}
					array = inner;
				}
			}
			return NumberValue.of(array.size());
		});
		library.register("fill", args -> {
			arity("fill", args, 2);
			return repeat(args.get(0), count("fill", args, 1));
		});
		library.register("zeros", args -> repeat(NumberValue.ZERO, count("zeros", args, 0)));
		library.register("ones", args -> repeat(NumberValue.ONE, count("ones", args, 0)));
		return library;
	}

	public FunctionLibrary register(String name, LibraryFunction function) {
		if (name == null || name.isBlank()) {
			throw new IllegalArgumentException("Function name must not be blank");
		}
		if (function == null) {
			throw new IllegalArgumentException("function must not be null");
		}
		functions.put(name, function);
		return this;
	}

	public Optional<LibraryFunction> lookup(String name) {
		return Optional.ofNullable(functions.get(name));
	}

	public boolean contains(String name) {
		return functions.containsKey(name);
	}

	private static void arity(String function, List<Value> args, int expected) {
		if (args.size() != expected) {
			throw new EvaluationException(function + " expects " + expected + " argument(s), got " + args.size());
		}
	}

	private static NumberValue number(String function, List<Value> args, int position) {
		if (position >= args.size()) {
			throw new EvaluationException(function + " is missing argument " + (position + 1));
		}
		if (args.get(position) instanceof NumberValue number) {
			return number;
		}
		throw new EvaluationException(function + " expects a number as argument " + (position + 1)
				+ ", got " + args.get(position).typeName());
	}

	private static ArrayValue array(String function, List<Value> args, int position) {
		if (position < args.size() && args.get(position) instanceof ArrayValue array) {
			return array;
		}
		throw new EvaluationException(function + " expects an array as argument " + (position + 1));
	}

	private static List<NumberValue> numbers(String function, ArrayValue array) {
		List<NumberValue> numbers = new ArrayList<>();
		for (Value element : array.elements()) {
			if (!(element instanceof NumberValue number)) {
				throw new EvaluationException(function + " expects numeric elements, got " + element.typeName());
			}
			numbers.add(number);
		}
		return numbers;
	}

	private static int count(String function, List<Value> args, int position) {
		NumberValue size = number(function, args, position);
		if (!size.isInteger() || size.signum() < 0) {
			throw new EvaluationException(function + " requires a non-negative integer size, got " + size.render());
		}
		if (size.compareTo(NumberValue.of(ExpressionEvaluator.MAX_ARRAY_LENGTH)) > 0) {
			throw new EvaluationException(function + " size " + size.render() + " exceeds the limit of "
					+ ExpressionEvaluator.MAX_ARRAY_LENGTH + " elements");
		}
		return size.intValueExact();
	}

	private static ArrayValue repeat(Value value, int count) {
		return new ArrayValue(Collections.nCopies(count, value));
	}

	private static NumberValue divide(String function, List<Value> args) {
		arity(function, args, 2);
		NumberValue y = number(function, args, 1);
		if (y.signum() == 0) {
			throw new EvaluationException(function + ": division by zero");
		}
		return number(function, args, 0).divide(y);
	}

	private static NumberValue extremum(String function, List<Value> args, int direction) {
		List<NumberValue> candidates;
		if (args.size() == 1) {
			candidates = numbers(function, array(function, args, 0));
		} else {
			arity(function, args, 2);
			candidates = List.of(number(function, args, 0), number(function, args, 1));
		}
		if (candidates.isEmpty()) {
			throw new EvaluationException(function + " of an empty array");
		}
		NumberValue best = candidates.get(0);
		for (NumberValue candidate : candidates) {
			if (candidate.compareTo(best) * direction > 0) {
				best = candidate;
			}
		}
		return best;
	}

	private static NumberValue positiveLog(String function, DoubleUnaryOperator op, List<Value> args) {
		NumberValue x = number(function, args, 0);
		if (x.signum() <= 0) {
			throw new EvaluationException(function + " of non-positive number " + x.render());
		}
		return transcendental(op, x);
	}

	private static NumberValue transcendental(DoubleUnaryOperator op, NumberValue x) {
		try {
			return NumberValue.ofDouble(op.applyAsDouble(x.doubleValue()));
		} catch (ArithmeticException e) {
			throw new EvaluationException(e.getMessage(), e);
		}
	}
}
