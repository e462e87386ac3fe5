package org.javai.cdlexport.model;

import java.util.Objects;

/**
 * Identity of one parameter binding: the owning instance plus the parameter name.
 */
public record BindingKey(ModelPath instance, String parameter) implements Comparable<BindingKey> {

	public BindingKey {
		Objects.requireNonNull(instance, "instance must not be null");
		Objects.requireNonNull(parameter, "parameter must not be null");
	}

	public static BindingKey of(String instance, String parameter) {
		return new BindingKey(ModelPath.of(instance), parameter);
	}

	@Override
	public int compareTo(BindingKey other) {
		int byInstance = instance.compareTo(other.instance);
		return byInstance != 0 ? byInstance : parameter.compareTo(other.parameter);
	}

	@Override
	public String toString() {
		return instance + "." + parameter;
	}
}
