package org.javai.cdlexport.model;

import java.util.Objects;

/**
 * One side of a connection.
 *
 * @param instance the instance owning the port
 * @param port the port name, dotted when it addresses a signal inside a connector
 * @param expandable whether the port lies under an expandable connector
 */
public record Endpoint(ModelPath instance, String port, boolean expandable) {

	public Endpoint {
		Objects.requireNonNull(instance, "instance must not be null");
		Objects.requireNonNull(port, "port must not be null");
	}

	public static Endpoint of(String instance, String port) {
		return new Endpoint(ModelPath.of(instance), port, false);
	}

	public static Endpoint expandable(String instance, String port) {
		return new Endpoint(ModelPath.of(instance), port, true);
	}

	@Override
	public String toString() {
		return instance + "." + port;
	}
}
