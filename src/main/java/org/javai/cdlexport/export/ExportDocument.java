package org.javai.cdlexport.export;

import java.util.List;
import java.util.Objects;

/**
 * One output document of an export, as split by {@link org.javai.cdlexport.config.ExportGrouping}.
 */
public record ExportDocument(String name, List<ExportedSequence> sequences, List<ParameterSet> parameterSets) {

	public ExportDocument {
		Objects.requireNonNull(name, "name must not be null");
		sequences = List.copyOf(sequences);
		parameterSets = List.copyOf(parameterSets);
	}
}
