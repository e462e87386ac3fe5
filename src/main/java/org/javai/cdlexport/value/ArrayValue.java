package org.javai.cdlexport.value;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

public record ArrayValue(List<Value> elements) implements Value {

	public ArrayValue {
		Objects.requireNonNull(elements, "elements must not be null");
		elements = List.copyOf(elements);
	}

	public static ArrayValue of(Value... elements) {
		return new ArrayValue(List.of(elements));
	}

	public int size() {
		return elements.size();
	}

	public Value get(int index) {
		return elements.get(index);
	}

	@Override
	public String typeName() {
		return "array";
	}

	@Override
	public String render() {
		return elements.stream().map(Value::render).collect(Collectors.joining(", ", "{", "}"));
	}
}
