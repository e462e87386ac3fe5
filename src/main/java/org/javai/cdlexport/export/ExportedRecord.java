package org.javai.cdlexport.export;

import java.util.Objects;
import org.javai.cdlexport.model.ModelPath;

/**
 * Data record referenced by at least one exported parameter.
 *
 * @param path path of the record instance
 * @param originalClassPath class the record was declared with
 * @param className class name it is exported under
 */
public record ExportedRecord(ModelPath path, String originalClassPath, String className) {

	public ExportedRecord {
		Objects.requireNonNull(path, "path must not be null");
		Objects.requireNonNull(originalClassPath, "originalClassPath must not be null");
		Objects.requireNonNull(className, "className must not be null");
	}
}
