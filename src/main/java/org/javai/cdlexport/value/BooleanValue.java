package org.javai.cdlexport.value;

public record BooleanValue(boolean value) implements Value {

	public static final BooleanValue TRUE = new BooleanValue(true);
	public static final BooleanValue FALSE = new BooleanValue(false);

	public static BooleanValue of(boolean value) {
		return value ? TRUE : FALSE;
	}

	@Override
	public String typeName() {
		return "Boolean";
	}

	@Override
	public String render() {
		return Boolean.toString(value);
	}
}
