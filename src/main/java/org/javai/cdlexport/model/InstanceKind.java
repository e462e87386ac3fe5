package org.javai.cdlexport.model;

/**
 * Structural kind of an instance after flattening.
 */
public enum InstanceKind {
	BLOCK,
	/** Data record exported separately; its fields are referenced symbolically. */
	RECORD,
	CONNECTOR,
	/** Open-ended connector whose signal set is only known from its connections. */
	EXPANDABLE_CONNECTOR
}
