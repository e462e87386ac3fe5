package org.javai.cdlexport.connect;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.javai.cdlexport.model.Connection;
import org.javai.cdlexport.model.Endpoint;

/**
 * Signals carried by expandable connectors, enumerated once before pruning.
 * <p>
 * An expandable connector has no fixed set of ports; its signals are whatever
 * connections attach to it. The index maps each signal, identified by the
 * connector instance and the signal name, to the endpoints wired to it.
 */
public final class ExpandableConnectorIndex {

	private final Map<String, List<Endpoint>> endpointsBySignal;

	private ExpandableConnectorIndex(Map<String, List<Endpoint>> endpointsBySignal) {
		this.endpointsBySignal = endpointsBySignal;
	}

	public static ExpandableConnectorIndex build(List<Connection> connections) {
		Map<String, List<Endpoint>> index = new LinkedHashMap<>();
		for (Connection connection : connections) {
			register(index, connection.from(), connection.to());
			register(index, connection.to(), connection.from());
		}
		index.replaceAll((signal, endpoints) -> Collections.unmodifiableList(endpoints));
		return new ExpandableConnectorIndex(Collections.unmodifiableMap(index));
	}

	private static void register(Map<String, List<Endpoint>> index, Endpoint signal, Endpoint other) {
		if (signal.expandable() && !other.expandable()) {
			index.computeIfAbsent(signalKey(signal), k -> new ArrayList<>()).add(other);
		}
	}

	/**
	 * Non-expandable endpoints wired to the signal {@code signal} designates, in connection order.
	 */
	public List<Endpoint> endpointsOf(Endpoint signal) {
		return endpointsBySignal.getOrDefault(signalKey(signal), List.of());
	}

	public int signalCount() {
		return endpointsBySignal.size();
	}

	static String signalKey(Endpoint endpoint) {
		return endpoint.instance() + "." + endpoint.port();
	}
}
