package org.javai.cdlexport.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Configuration of an export run.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * ExportSettings settings = ExportSettings.defaults();
 *
 * ExportSettings settings = ExportSettings.builder()
 *         .qualifyingPrefix("MyProject.Controls.")
 *         .grouping(ExportGrouping.PER_PARAMETER_SET)
 *         .build();
 * }</pre>
 *
 * @param qualifyingPrefixes class-path prefixes of the control-sequence libraries
 * @param markerPrefix annotation prefix marking custom control blocks
 * @param grouping document grouping applied downstream
 * @param recordClassNamePolicy naming of referenced data records
 * @param projectRecordPackage target package for {@link RecordClassNamePolicy#PROJECT_SPECIFIC}
 * @param allowConditionalBindings whether declared conditional expressions pass compliance checks
 * @param parallelism number of threads resolving independent sequences
 */
public record ExportSettings(
		List<String> qualifyingPrefixes,
		String markerPrefix,
		ExportGrouping grouping,
		RecordClassNamePolicy recordClassNamePolicy,
		String projectRecordPackage,
		boolean allowConditionalBindings,
		int parallelism
) {

	public static final String DEFAULT_QUALIFYING_PREFIX = "Buildings.Controls.OBC.";
	public static final String DEFAULT_MARKER_PREFIX = "__ctrlFlow";

	public ExportSettings {
		Objects.requireNonNull(qualifyingPrefixes, "qualifyingPrefixes must not be null");
		qualifyingPrefixes = List.copyOf(qualifyingPrefixes);
		for (String prefix : qualifyingPrefixes) {
			if (prefix == null || prefix.isBlank()) {
				throw new IllegalArgumentException("qualifying prefixes must not be blank");
			}
		}
		grouping = grouping != null ? grouping : ExportGrouping.PER_SEQUENCE;
		recordClassNamePolicy = recordClassNamePolicy != null ? recordClassNamePolicy : RecordClassNamePolicy.ORIGINAL;
		if (recordClassNamePolicy == RecordClassNamePolicy.PROJECT_SPECIFIC
				&& (projectRecordPackage == null || projectRecordPackage.isBlank())) {
			throw new IllegalArgumentException("projectRecordPackage is required for the PROJECT_SPECIFIC record policy");
		}
		if (parallelism < 1) {
			throw new IllegalArgumentException("parallelism must be >= 1");
		}
	}

	public static ExportSettings defaults() {
		return builder().build();
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Builder for {@link ExportSettings}.
	 */
	public static class Builder {
		private final List<String> qualifyingPrefixes = new ArrayList<>();
		private String markerPrefix = DEFAULT_MARKER_PREFIX;
		private ExportGrouping grouping = ExportGrouping.PER_SEQUENCE;
		private RecordClassNamePolicy recordClassNamePolicy = RecordClassNamePolicy.ORIGINAL;
		private String projectRecordPackage;
		private boolean allowConditionalBindings = true;
		private int parallelism = 1;

		private Builder() {}

		/**
		 * Adds a qualifying class-path prefix. When none is added the standard
		 * control-sequence library prefix is used.
		 */
		public Builder qualifyingPrefix(String prefix) {
			this.qualifyingPrefixes.add(prefix);
			return this;
		}

		public Builder qualifyingPrefixes(List<String> prefixes) {
			this.qualifyingPrefixes.clear();
			this.qualifyingPrefixes.addAll(prefixes);
			return this;
		}

		public Builder markerPrefix(String markerPrefix) {
			this.markerPrefix = markerPrefix;
			return this;
		}

		public Builder grouping(ExportGrouping grouping) {
			this.grouping = grouping;
			return this;
		}

		public Builder recordClassNamePolicy(RecordClassNamePolicy policy) {
			this.recordClassNamePolicy = policy;
			return this;
		}

		public Builder projectRecordPackage(String projectRecordPackage) {
			this.projectRecordPackage = projectRecordPackage;
			return this;
		}

		public Builder allowConditionalBindings(boolean allow) {
			this.allowConditionalBindings = allow;
			return this;
		}

		public Builder parallelism(int parallelism) {
			this.parallelism = parallelism;
			return this;
		}

		public ExportSettings build() {
			List<String> prefixes = qualifyingPrefixes.isEmpty()
					? List.of(DEFAULT_QUALIFYING_PREFIX)
					: qualifyingPrefixes;
			return new ExportSettings(prefixes, markerPrefix, grouping, recordClassNamePolicy,
					projectRecordPackage, allowConditionalBindings, parallelism);
		}
	}
}
