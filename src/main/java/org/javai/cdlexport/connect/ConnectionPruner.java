package org.javai.cdlexport.connect;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.javai.cdlexport.classify.ClassificationResult;
import org.javai.cdlexport.model.Connection;
import org.javai.cdlexport.model.Endpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reduces the connection set to what the exported control sequences can express.
 * <ul>
 *   <li>Both endpoints qualified: retained.</li>
 *   <li>One endpoint qualified, connection annotated: retained.</li>
 *   <li>One endpoint qualified, not annotated: dropped, documented by one {@link BoundaryPort}.</li>
 *   <li>Neither endpoint qualified: dropped without a trace.</li>
 * </ul>
 */
public class ConnectionPruner {

	private static final Logger logger = LoggerFactory.getLogger(ConnectionPruner.class);

	public PruneResult prune(List<Connection> connections, ClassificationResult classification) {
		ExpandableConnectorIndex signals = ExpandableConnectorIndex.build(connections);
		List<Connection> retained = new ArrayList<>();
		List<Connection> dropped = new ArrayList<>();
		List<BoundaryPort> boundaryPorts = new ArrayList<>();
		Set<String> usedNames = new HashSet<>();

		for (Connection connection : connections) {
			boolean fromQualified = classification.isQualified(connection.from().instance());
			boolean toQualified = classification.isQualified(connection.to().instance());
			if (fromQualified && toQualified) {
				retained.add(connection);
			} else if (fromQualified != toQualified && connection.annotated()) {
				retained.add(connection);
			} else if (fromQualified != toQualified) {
				Endpoint inside = fromQualified ? connection.from() : connection.to();
				Endpoint outside = fromQualified ? connection.to() : connection.from();
				boundaryPorts.add(boundaryPort(inside, outside, signals, classification, usedNames));
				dropped.add(connection);
			} else {
				dropped.add(connection);
			}
		}
		logger.debug("Pruned {} connections: {} retained, {} dropped, {} boundary ports ({} expandable signals)",
				connections.size(), retained.size(), dropped.size(), boundaryPorts.size(), signals.signalCount());
		return new PruneResult(retained, boundaryPorts, dropped);
	}

	private static BoundaryPort boundaryPort(Endpoint inside, Endpoint outside, ExpandableConnectorIndex signals,
			ClassificationResult classification, Set<String> usedNames) {
		if (outside.expandable()) {
			String name = unique(sanitize(outside.port()), usedNames);
			List<Endpoint> peers = signals.endpointsOf(outside).stream()
					.filter(e -> !classification.isQualified(e.instance()))
					.toList();
			return new BoundaryPort(name, inside, outside, true, peers);
		}
		String name = unique(sanitize(outside.instance().name() + "_" + outside.port()), usedNames);
		return new BoundaryPort(name, inside, outside, false, List.of());
	}

	private static String sanitize(String name) {
		return name.replace('.', '_');
	}

	private static String unique(String base, Set<String> usedNames) {
		String candidate = base;
		int suffix = 2;
		while (!usedNames.add(candidate)) {
			candidate = base + "_" + suffix++;
		}
		return candidate;
	}
}
