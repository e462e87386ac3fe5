package org.javai.cdlexport.value;

import java.util.Objects;

public record StringValue(String value) implements Value {

	public StringValue {
		Objects.requireNonNull(value, "value must not be null");
	}

	@Override
	public String typeName() {
		return "String";
	}

	@Override
	public String render() {
		return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
	}
}
