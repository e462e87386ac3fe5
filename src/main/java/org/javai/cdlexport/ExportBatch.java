package org.javai.cdlexport;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.BooleanSupplier;
import org.javai.cdlexport.export.ExportModel;
import org.javai.cdlexport.model.Instance;
import org.javai.cdlexport.model.ModelPath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Exports many project models one after another. A failed project does not stop
 * the batch. Cancellation is cooperative and checked only between projects; a
 * project that has started always runs to completion.
 */
public class ExportBatch {

	private static final Logger logger = LoggerFactory.getLogger(ExportBatch.class);

	private final ControlSequenceExporter exporter;

	public ExportBatch(ControlSequenceExporter exporter) {
		this.exporter = Objects.requireNonNull(exporter, "exporter must not be null");
	}

	public BatchResult exportAll(List<Instance> projects) {
		return exportAll(projects, () -> false);
	}

	public BatchResult exportAll(List<Instance> projects, BooleanSupplier cancelRequested) {
		Objects.requireNonNull(projects, "projects must not be null");
		Objects.requireNonNull(cancelRequested, "cancelRequested must not be null");
		List<ExportModel> completed = new ArrayList<>();
		Map<ModelPath, CdlExportException> failures = new LinkedHashMap<>();
		List<ModelPath> skipped = new ArrayList<>();

		for (Instance project : projects) {
			if (!skipped.isEmpty() || cancelRequested.getAsBoolean()) {
				skipped.add(project.path());
				continue;
			}
			try {
				completed.add(exporter.export(project));
			} catch (CdlExportException e) {
				logger.warn("Export of {} failed: {}", project.path(), e.getMessage());
				failures.put(project.path(), e);
			}
		}
		if (!skipped.isEmpty()) {
			logger.info("Batch cancelled: {} project(s) skipped", skipped.size());
		}
		logger.info("Batch finished: {} exported, {} failed, {} skipped",
				completed.size(), failures.size(), skipped.size());
		return new BatchResult(completed, failures, skipped);
	}
}
