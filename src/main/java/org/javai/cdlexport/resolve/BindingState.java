package org.javai.cdlexport.resolve;

/**
 * Resolution state of a binding within one run.
 */
public enum BindingState {
	UNRESOLVED,
	RESOLVED,
	FAILED
}
