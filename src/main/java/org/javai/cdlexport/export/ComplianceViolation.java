package org.javai.cdlexport.export;

import org.javai.cdlexport.model.BindingKey;

/**
 * A policy finding on an assembled export.
 *
 * @param binding the parameter concerned
 * @param rule the rule that was violated
 * @param message human-readable detail
 */
public record ComplianceViolation(BindingKey binding, Rule rule, String message) {

	public enum Rule {
		/** A conditional expression was declared while conditionals are disallowed. */
		CONDITIONAL_BINDING,
		/** A record reference points at a record the export does not list. */
		UNLISTED_RECORD
	}
}
