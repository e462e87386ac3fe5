package org.javai.cdlexport;

/**
 * Categories of failures that abort an export run.
 */
public enum ExportErrorKind {
	/** A reference names nothing reachable from its scope. */
	UNBOUND_REFERENCE,
	/** A reference chain revisits a binding that is still being resolved. */
	RESOLUTION_CYCLE,
	/** A binding of a qualified instance cannot be folded to a literal or record reference. */
	NON_LITERAL_QUALIFIED_PARAMETER,
	/** An expression node or function call outside the supported subset. */
	UNSUPPORTED_CONSTRUCT,
	/** A reference enters a record that has no such field. */
	RECORD_FIELD_MISMATCH,
	/** Operand type mismatch, division by zero or subscript out of range. */
	EVALUATION_ERROR,
	/** Assembly refused to build a document from partially resolved bindings. */
	EXPORT_ABORTED
}
