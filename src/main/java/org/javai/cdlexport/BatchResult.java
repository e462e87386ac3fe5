package org.javai.cdlexport;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.javai.cdlexport.export.ExportModel;
import org.javai.cdlexport.model.ModelPath;

/**
 * Outcome of an {@link ExportBatch}.
 *
 * @param completed exports that succeeded, in submission order
 * @param failures failed projects by root path, in submission order
 * @param skipped projects not started because cancellation was requested
 */
public record BatchResult(List<ExportModel> completed, Map<ModelPath, CdlExportException> failures,
		List<ModelPath> skipped) {

	public BatchResult {
		completed = List.copyOf(completed);
		failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
		skipped = List.copyOf(skipped);
	}

	public boolean cancelled() {
		return !skipped.isEmpty();
	}

	public boolean successful() {
		return failures.isEmpty() && skipped.isEmpty();
	}
}
