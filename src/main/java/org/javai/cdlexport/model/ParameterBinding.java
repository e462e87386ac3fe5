package org.javai.cdlexport.model;

import java.util.Objects;
import org.javai.cdlexport.expr.ExpressionNode;

/**
 * A parameter of an instance together with its declared right-hand side.
 * <p>
 * {@code scope} is the instance the expression was written in: the owner itself
 * for a declaration default, the enclosing instance for a modification.
 *
 * @param owner the instance declaring the parameter
 * @param name the parameter name
 * @param expression the declared right-hand side
 * @param scope the instance whose names the expression refers to
 */
public record ParameterBinding(ModelPath owner, String name, ExpressionNode expression, ModelPath scope) {

	public ParameterBinding {
		Objects.requireNonNull(owner, "owner must not be null");
		Objects.requireNonNull(name, "name must not be null");
		Objects.requireNonNull(expression, "expression must not be null");
		scope = scope != null ? scope : owner;
	}

	public BindingKey key() {
		return new BindingKey(owner, name);
	}
}
