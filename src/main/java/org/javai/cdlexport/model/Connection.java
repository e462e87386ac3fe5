package org.javai.cdlexport.model;

import java.util.Objects;

/**
 * Point-to-point link between two ports.
 *
 * @param from first endpoint
 * @param to second endpoint
 * @param annotated whether the declaration carries a graphical annotation
 */
public record Connection(Endpoint from, Endpoint to, boolean annotated) {

	public Connection {
		Objects.requireNonNull(from, "from must not be null");
		Objects.requireNonNull(to, "to must not be null");
	}

	@Override
	public String toString() {
		return "connect(" + from + ", " + to + ")";
	}
}
