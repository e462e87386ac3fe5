package org.javai.cdlexport.export;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.javai.cdlexport.model.ModelPath;

/**
 * A qualified instance as it appears in the export: resolved parameters and
 * qualified sub-instances only.
 */
public record ExportedInstance(ModelPath path, String classPath, List<String> annotations,
		List<ExportedParameter> parameters, List<ExportedInstance> children) {

	public ExportedInstance {
		Objects.requireNonNull(path, "path must not be null");
		Objects.requireNonNull(classPath, "classPath must not be null");
		annotations = annotations != null ? List.copyOf(annotations) : List.of();
		parameters = parameters != null ? List.copyOf(parameters) : List.of();
		children = children != null ? List.copyOf(children) : List.of();
	}

	public Optional<ExportedParameter> parameter(String name) {
		return parameters.stream().filter(p -> p.name().equals(name)).findFirst();
	}

	public Optional<ExportedInstance> child(String name) {
		return children.stream().filter(c -> c.path().name().equals(name)).findFirst();
	}
}
