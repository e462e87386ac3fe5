package org.javai.cdlexport.connect;

import java.util.List;
import java.util.Objects;
import org.javai.cdlexport.model.Endpoint;

/**
 * Documents a dropped link between a control sequence and the equipment model.
 *
 * @param name symbolic port name, unique within one prune result
 * @param qualifiedEndpoint the endpoint on the exported side
 * @param externalEndpoint the endpoint on the non-exported side
 * @param viaExpandable whether the link runs through an expandable connector signal
 * @param peers equipment endpoints connected to the same signal, empty for direct links
 */
public record BoundaryPort(String name, Endpoint qualifiedEndpoint, Endpoint externalEndpoint,
		boolean viaExpandable, List<Endpoint> peers) {

	public BoundaryPort {
		Objects.requireNonNull(name, "name must not be null");
		Objects.requireNonNull(qualifiedEndpoint, "qualifiedEndpoint must not be null");
		Objects.requireNonNull(externalEndpoint, "externalEndpoint must not be null");
		peers = peers != null ? List.copyOf(peers) : List.of();
	}
}
