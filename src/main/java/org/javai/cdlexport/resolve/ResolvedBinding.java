package org.javai.cdlexport.resolve;

import java.util.Objects;
import org.javai.cdlexport.CdlExportException;
import org.javai.cdlexport.expr.ExpressionNode;
import org.javai.cdlexport.model.BindingKey;
import org.javai.cdlexport.value.ParameterValue;

/**
 * Outcome of resolving one binding of a qualified instance. Exactly one of
 * {@code value} and {@code failure} is set.
 *
 * @param key the resolved binding
 * @param declared the right-hand side as written
 * @param value the literal or record reference it resolved to
 * @param failure why it could not be resolved
 */
public record ResolvedBinding(BindingKey key, ExpressionNode declared, ParameterValue value,
		CdlExportException failure) {

	public ResolvedBinding {
		Objects.requireNonNull(key, "key must not be null");
		Objects.requireNonNull(declared, "declared must not be null");
		if ((value == null) == (failure == null)) {
			throw new IllegalArgumentException("Exactly one of value and failure must be set for " + key);
		}
	}

	public static ResolvedBinding resolved(BindingKey key, ExpressionNode declared, ParameterValue value) {
		return new ResolvedBinding(key, declared, value, null);
	}

	public static ResolvedBinding failed(BindingKey key, ExpressionNode declared, CdlExportException failure) {
		return new ResolvedBinding(key, declared, null, failure);
	}

	public boolean isResolved() {
		return value != null;
	}

	public BindingState state() {
		return isResolved() ? BindingState.RESOLVED : BindingState.FAILED;
	}
}
