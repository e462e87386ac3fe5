package org.javai.cdlexport.connect;

import java.util.List;
import org.javai.cdlexport.model.Connection;

/**
 * Connections kept for export and the boundary ports documenting the dropped ones.
 *
 * @param retained connections kept, in input order
 * @param boundaryPorts boundary ports, in input order of their connections
 * @param dropped connections removed, in input order
 */
public record PruneResult(List<Connection> retained, List<BoundaryPort> boundaryPorts, List<Connection> dropped) {

	public PruneResult {
		retained = List.copyOf(retained);
		boundaryPorts = List.copyOf(boundaryPorts);
		dropped = List.copyOf(dropped);
	}
}
