package org.javai.cdlexport.value;

import java.util.Objects;

/**
 * Enumeration tag. Two tags denote the same literal when their literal names match
 * and their types match, an empty type matching any type.
 *
 * @param type the enumeration type, may be empty when the front-end did not record it
 * @param literal the literal name
 */
public record EnumValue(String type, String literal) implements Value {

	public EnumValue {
		type = type != null ? type : "";
		Objects.requireNonNull(literal, "literal must not be null");
	}

	public static EnumValue of(String type, String literal) {
		return new EnumValue(type, literal);
	}

	public boolean sameTag(EnumValue other) {
		if (!literal.equals(other.literal)) {
			return false;
		}
		return type.isEmpty() || other.type.isEmpty() || type.equals(other.type);
	}

	@Override
	public String typeName() {
		return type.isEmpty() ? "enumeration" : type;
	}

	@Override
	public String render() {
		return type.isEmpty() ? literal : type + "." + literal;
	}
}
