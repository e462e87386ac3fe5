package org.javai.cdlexport.config;

/**
 * Class name given to data records referenced from exported parameters.
 */
public enum RecordClassNamePolicy {
	/** Keep the class the record was declared with. */
	ORIGINAL,
	/** Rename into the configured project package, keeping the simple name. */
	PROJECT_SPECIFIC
}
