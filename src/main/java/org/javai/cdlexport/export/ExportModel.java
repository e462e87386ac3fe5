package org.javai.cdlexport.export;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.javai.cdlexport.config.ExportGrouping;
import org.javai.cdlexport.connect.BoundaryPort;
import org.javai.cdlexport.model.Connection;
import org.javai.cdlexport.model.ModelPath;

/**
 * Result of one export run: the qualified subtrees with every parameter resolved,
 * the retained connections, the boundary ports, the referenced data records and
 * the parameter sets. Built only when every qualified binding resolved.
 */
public record ExportModel(
		ModelPath sourceRoot,
		List<ExportedSequence> sequences,
		List<Connection> connections,
		List<BoundaryPort> boundaryPorts,
		List<ExportedRecord> records,
		List<ParameterSet> parameterSets
) {

	public ExportModel {
		Objects.requireNonNull(sourceRoot, "sourceRoot must not be null");
		sequences = List.copyOf(sequences);
		connections = List.copyOf(connections);
		boundaryPorts = List.copyOf(boundaryPorts);
		records = List.copyOf(records);
		parameterSets = List.copyOf(parameterSets);
	}

	public Optional<ParameterSet> parameterSet(String id) {
		return parameterSets.stream().filter(p -> p.id().equals(id)).findFirst();
	}

	/**
	 * Finds an exported instance anywhere in the exported sequences.
	 */
	public Optional<ExportedInstance> find(ModelPath path) {
		for (ExportedSequence sequence : sequences) {
			Optional<ExportedInstance> found = find(sequence.root(), path);
			if (found.isPresent()) {
				return found;
			}
		}
		return Optional.empty();
	}

	private static Optional<ExportedInstance> find(ExportedInstance instance, ModelPath path) {
		if (instance.path().equals(path)) {
			return Optional.of(instance);
		}
		if (!path.startsWith(instance.path())) {
			return Optional.empty();
		}
		for (ExportedInstance child : instance.children()) {
			Optional<ExportedInstance> found = find(child, path);
			if (found.isPresent()) {
				return found;
			}
		}
		return Optional.empty();
	}

	/**
	 * Splits the sequences into documents, in order of first appearance.
	 */
	public List<ExportDocument> documents(ExportGrouping grouping) {
		Map<String, List<ExportedSequence>> groups = new LinkedHashMap<>();
		for (ExportedSequence sequence : sequences) {
			String name = switch (grouping) {
				case PER_SEQUENCE -> sequence.classPath();
				case PER_PARAMETER_SET -> sequence.classPath() + "@" + sequence.parameterSetId();
			};
			groups.computeIfAbsent(name, k -> new ArrayList<>()).add(sequence);
		}
		List<ExportDocument> documents = new ArrayList<>(groups.size());
		groups.forEach((name, members) -> {
			List<ParameterSet> sets = members.stream()
					.map(ExportedSequence::parameterSetId)
					.distinct()
					.map(id -> parameterSet(id).orElseThrow())
					.toList();
			documents.add(new ExportDocument(name, members, sets));
		});
		return documents;
	}
}
