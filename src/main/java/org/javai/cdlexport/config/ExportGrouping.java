package org.javai.cdlexport.config;

/**
 * How exported sequences are split into documents.
 */
public enum ExportGrouping {
	/** One document per control sequence class; parameter sets are listed separately. */
	PER_SEQUENCE,
	/** One document per distinct combination of sequence class and parameter set. */
	PER_PARAMETER_SET
}
