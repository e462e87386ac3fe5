package org.javai.cdlexport.expr;

import java.util.List;
import java.util.Objects;
import org.javai.cdlexport.model.InnerOuter;
import org.javai.cdlexport.model.ModelPath;
import org.javai.cdlexport.value.Value;

/**
 * Right-hand side of a parameter binding. Sealed to ensure all node kinds are known.
 * <p>
 * Nodes are:
 * <ul>
 *   <li>{@link Literal} - a literal value</li>
 *   <li>{@link VariableRef} - a dotted reference, optionally redirected inward or outward</li>
 *   <li>{@link UnaryOp} and {@link BinaryOp} - arithmetic, relational and boolean operators</li>
 *   <li>{@link Conditional} - {@code if / elseif / else} chain with a mandatory else</li>
 *   <li>{@link ArrayConstruct}, {@link ForLoop}, {@link Range}, {@link ArrayIndex} - arrays</li>
 *   <li>{@link FunctionCall} - call into the function library</li>
 *   <li>{@link Opaque} - a construct the front-end could not translate</li>
 * </ul>
 */
public sealed interface ExpressionNode {

	static Literal literal(Value value) {
		return new Literal(value);
	}

	static VariableRef ref(String dotted) {
		return new VariableRef(ModelPath.of(dotted), InnerOuter.NONE);
	}

	record Literal(Value value) implements ExpressionNode {
		public Literal {
			Objects.requireNonNull(value, "value must not be null");
		}
	}

	/**
	 * @param path the dotted reference as written
	 * @param kind {@link InnerOuter#INNER} or {@link InnerOuter#OUTER} when the reference is redirected
	 */
	record VariableRef(ModelPath path, InnerOuter kind) implements ExpressionNode {
		public VariableRef {
			Objects.requireNonNull(path, "path must not be null");
			kind = kind != null ? kind : InnerOuter.NONE;
		}
	}

	record UnaryOp(UnaryOperator operator, ExpressionNode operand) implements ExpressionNode {
		public UnaryOp {
			Objects.requireNonNull(operator, "operator must not be null");
			Objects.requireNonNull(operand, "operand must not be null");
		}
	}

	record BinaryOp(BinaryOperator operator, ExpressionNode left, ExpressionNode right) implements ExpressionNode {
		public BinaryOp {
			Objects.requireNonNull(operator, "operator must not be null");
			Objects.requireNonNull(left, "left must not be null");
			Objects.requireNonNull(right, "right must not be null");
		}
	}

	record Branch(ExpressionNode condition, ExpressionNode result) {
		public Branch {
			Objects.requireNonNull(condition, "condition must not be null");
			Objects.requireNonNull(result, "result must not be null");
		}
	}

	record Conditional(List<Branch> branches, ExpressionNode otherwise) implements ExpressionNode {
		public Conditional {
			Objects.requireNonNull(branches, "branches must not be null");
			Objects.requireNonNull(otherwise, "else branch is mandatory");
			if (branches.isEmpty()) {
				throw new IllegalArgumentException("Conditional requires at least one branch");
			}
			branches = List.copyOf(branches);
		}
	}

	record ArrayConstruct(List<ExpressionNode> elements) implements ExpressionNode {
		public ArrayConstruct {
			Objects.requireNonNull(elements, "elements must not be null");
			elements = List.copyOf(elements);
		}
	}

	/**
	 * Array comprehension {@code {body for index in range}}.
	 */
	record ForLoop(String index, ExpressionNode range, ExpressionNode body) implements ExpressionNode {
		public ForLoop {
			Objects.requireNonNull(index, "index must not be null");
			Objects.requireNonNull(range, "range must not be null");
			Objects.requireNonNull(body, "body must not be null");
		}
	}

	/**
	 * Range {@code start:step:stop}; {@code step} is null for unit steps.
	 */
	record Range(ExpressionNode start, ExpressionNode step, ExpressionNode stop) implements ExpressionNode {
		public Range {
			Objects.requireNonNull(start, "start must not be null");
			Objects.requireNonNull(stop, "stop must not be null");
		}
	}

	/**
	 * One-based subscript.
	 */
	record ArrayIndex(ExpressionNode array, ExpressionNode index) implements ExpressionNode {
		public ArrayIndex {
			Objects.requireNonNull(array, "array must not be null");
			Objects.requireNonNull(index, "index must not be null");
		}
	}

	record FunctionCall(String name, List<ExpressionNode> arguments) implements ExpressionNode {
		public FunctionCall {
			Objects.requireNonNull(name, "name must not be null");
			arguments = arguments != null ? List.copyOf(arguments) : List.of();
		}
	}

	/**
	 * @param text the source text of the untranslated construct
	 */
	record Opaque(String text) implements ExpressionNode {
		public Opaque {
			Objects.requireNonNull(text, "text must not be null");
		}
	}
}
