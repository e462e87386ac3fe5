package org.javai.cdlexport.expr;

import java.util.Map;
import org.javai.cdlexport.value.ParameterValue;

/**
 * Supplies the value of a reference leaf while an expression is folded.
 * The evaluator asks only for the leaves it actually reaches.
 */
@FunctionalInterface
public interface LeafResolver {

	ParameterValue resolve(ExpressionNode.VariableRef reference);

	/**
	 * Resolver backed by leaves resolved ahead of evaluation.
	 */
	static LeafResolver of(Map<ExpressionNode.VariableRef, ? extends ParameterValue> resolvedLeaves) {
		return reference -> {
			ParameterValue value = resolvedLeaves.get(reference);
			if (value == null) {
				throw new IllegalArgumentException("No resolved value supplied for reference " + reference.path());
			}
			return value;
		};
	}
}
