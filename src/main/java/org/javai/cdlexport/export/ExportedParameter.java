package org.javai.cdlexport.export;

import java.util.Objects;
import org.javai.cdlexport.expr.ExpressionNode;
import org.javai.cdlexport.value.ParameterValue;

/**
 * A parameter of an exported instance with the expression it was declared with
 * and the literal or record reference it resolved to.
 */
public record ExportedParameter(String name, ExpressionNode declared, ParameterValue value) {

	public ExportedParameter {
		Objects.requireNonNull(name, "name must not be null");
		Objects.requireNonNull(declared, "declared must not be null");
		Objects.requireNonNull(value, "value must not be null");
	}
}
