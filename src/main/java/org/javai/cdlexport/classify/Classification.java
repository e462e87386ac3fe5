package org.javai.cdlexport.classify;

public enum Classification {
	/** Exported as part of the control sequence. */
	QUALIFIED,
	NOT_QUALIFIED;

	public boolean isQualified() {
		return this == QUALIFIED;
	}
}
