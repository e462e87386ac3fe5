package org.javai.cdlexport.expr;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Utility class for walking expression trees.
 */
public final class ExpressionWalker {

	private ExpressionWalker() {
		// Utility class - no instantiation
	}

	/**
	 * Visits {@code node} and then its children, depth first in declaration order.
	 */
	public static void walkPreOrder(ExpressionNode node, Consumer<ExpressionNode> visitor) {
		if (node == null) {
			return;
		}
		visitor.accept(node);
		for (ExpressionNode child : children(node)) {
			walkPreOrder(child, visitor);
		}
	}

	/**
	 * Collects every node matching {@code filter}, in pre-order.
	 */
	public static List<ExpressionNode> collect(ExpressionNode node, Predicate<ExpressionNode> filter) {
		List<ExpressionNode> found = new ArrayList<>();
		walkPreOrder(node, n -> {
			if (filter.test(n)) {
				found.add(n);
			}
		});
		return found;
	}

	/**
	 * All reference leaves of {@code node}, loop indices included.
	 */
	public static List<ExpressionNode.VariableRef> references(ExpressionNode node) {
		List<ExpressionNode.VariableRef> refs = new ArrayList<>();
		walkPreOrder(node, n -> {
			if (n instanceof ExpressionNode.VariableRef ref) {
				refs.add(ref);
			}
		});
		return refs;
	}

	public static boolean contains(ExpressionNode node, Class<? extends ExpressionNode> kind) {
		return !collect(node, kind::isInstance).isEmpty();
	}

	static List<ExpressionNode> children(ExpressionNode node) {
		if (node instanceof ExpressionNode.UnaryOp unary) {
			return List.of(unary.operand());
		}
		if (node instanceof ExpressionNode.BinaryOp binary) {
			return List.of(binary.left(), binary.right());
		}
		if (node instanceof ExpressionNode.Conditional conditional) {
			List<ExpressionNode> children = new ArrayList<>();
			for (ExpressionNode.Branch branch : conditional.branches()) {
				children.add(branch.condition());
				children.add(branch.result());
			}
			children.add(conditional.otherwise());
			return children;
		}
		if (node instanceof ExpressionNode.ArrayConstruct array) {
			return array.elements();
		}
		if (node instanceof ExpressionNode.ForLoop loop) {
			return List.of(loop.range(), loop.body());
		}
		if (node instanceof ExpressionNode.Range range) {
			List<ExpressionNode> children = new ArrayList<>();
			children.add(range.start());
			if (range.step() != null) {
				children.add(range.step());
			}
			children.add(range.stop());
			return children;
		}
		if (node instanceof ExpressionNode.ArrayIndex subscript) {
			return List.of(subscript.array(), subscript.index());
		}
		if (node instanceof ExpressionNode.FunctionCall call) {
			return call.arguments();
		}
		return List.of();
	}
}
