package org.javai.cdlexport.value;

/**
 * Outcome of resolving one parameter binding: either a literal {@link Value} or a
 * {@link RecordFieldReference} that is kept symbolic because the record is
 * exported separately.
 */
public sealed interface ParameterValue permits Value, RecordFieldReference {

	/**
	 * Canonical text used for diagnostics and content keys.
	 */
	String render();
}
