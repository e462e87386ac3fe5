package org.javai.cdlexport.export;

import java.util.Objects;

/**
 * One exported control sequence and the parameter set its values form.
 */
public record ExportedSequence(ExportedInstance root, String parameterSetId) {

	public ExportedSequence {
		Objects.requireNonNull(root, "root must not be null");
		Objects.requireNonNull(parameterSetId, "parameterSetId must not be null");
	}

	public String classPath() {
		return root.classPath();
	}
}
