package org.javai.cdlexport.value;

/**
 * Literal value of the expression language.
 */
public sealed interface Value extends ParameterValue
		permits BooleanValue, NumberValue, StringValue, EnumValue, ArrayValue {

	/**
	 * Short type name used in error messages.
	 */
	String typeName();
}
