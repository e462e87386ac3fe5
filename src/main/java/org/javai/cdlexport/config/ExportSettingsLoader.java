package org.javai.cdlexport.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

/**
 * Reads {@link ExportSettings} from YAML.
 * <pre>
 * export:
 *   qualifying_prefixes: [Buildings.Controls.OBC.]
 *   marker_prefix: __ctrlFlow
 *   grouping: per_sequence
 *   allow_conditional_bindings: true
 *   parallelism: 4
 *   records:
 *     class_name_policy: project_specific
 *     project_package: MyProject.Data
 * </pre>
 * Missing keys keep their defaults.
 */
public class ExportSettingsLoader {

	/** Classpath resource consulted by {@link #loadDefault()}. */
	public static final String DEFAULT_RESOURCE = "cdl-export.yaml";

	private static final Logger logger = LoggerFactory.getLogger(ExportSettingsLoader.class);

	private final Yaml yaml = new Yaml();

	/**
	 * Loads {@value #DEFAULT_RESOURCE} from the classpath, or the built-in defaults when absent.
	 */
	public ExportSettings loadDefault() {
		InputStream stream = ExportSettingsLoader.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE);
		if (stream == null) {
			logger.debug("No {} on the classpath, using built-in defaults", DEFAULT_RESOURCE);
			return ExportSettings.defaults();
		}
		try (stream) {
			return load(stream);
		} catch (IOException e) {
			throw new InvalidSettingsException("Failed to read " + DEFAULT_RESOURCE, e);
		}
	}

	public ExportSettings load(Path path) {
		try (var reader = Files.newBufferedReader(path)) {
			return load(reader);
		} catch (InvalidSettingsException e) {
			throw e;
		} catch (Exception e) {
			throw new InvalidSettingsException("Failed to read export settings from path: " + path, e);
		}
	}

	public ExportSettings load(InputStream inputStream) {
		try {
			return build(yaml.load(inputStream));
		} catch (InvalidSettingsException e) {
			throw e;
		} catch (Exception e) {
			throw new InvalidSettingsException("Failed to read export settings from input stream", e);
		}
	}

	public ExportSettings load(Reader reader) {
		try {
			return build(yaml.load(reader));
		} catch (InvalidSettingsException e) {
			throw e;
		} catch (Exception e) {
			throw new InvalidSettingsException("Failed to read export settings from reader", e);
		}
	}

	public ExportSettings loadString(String yamlContent) {
		try {
			return build(yaml.load(yamlContent));
		} catch (InvalidSettingsException e) {
			throw e;
		} catch (Exception e) {
			throw new InvalidSettingsException("Failed to read export settings from string", e);
		}
	}

	@SuppressWarnings("unchecked")
	private ExportSettings build(Object document) {
		ExportSettings.Builder builder = ExportSettings.builder();
		if (document == null) {
			return builder.build();
		}
		if (!(document instanceof Map<?, ?> root)) {
			throw new InvalidSettingsException("Export settings must be a YAML mapping");
		}
		Object section = root.get("export");
		if (section == null) {
			return builder.build();
		}
		if (!(section instanceof Map<?, ?>)) {
			throw new InvalidSettingsException("'export' must be a mapping");
		}
		Map<String, Object> export = (Map<String, Object>) section;

		Object prefixes = export.get("qualifying_prefixes");
		if (prefixes instanceof List<?> list) {
			builder.qualifyingPrefixes(list.stream().map(String::valueOf).toList());
		} else if (prefixes instanceof String single) {
			builder.qualifyingPrefixes(List.of(single));
		} else if (prefixes != null) {
			throw new InvalidSettingsException("'qualifying_prefixes' must be a list of strings");
		}
		if (export.containsKey("marker_prefix")) {
			builder.markerPrefix(toString(export.get("marker_prefix")));
		}
		if (export.containsKey("grouping")) {
			builder.grouping(toEnum(ExportGrouping.class, "grouping", export.get("grouping")));
		}
		if (export.containsKey("allow_conditional_bindings")) {
			builder.allowConditionalBindings(Boolean.parseBoolean(toString(export.get("allow_conditional_bindings"))));
		}
		if (export.containsKey("parallelism")) {
			builder.parallelism(toInt("parallelism", export.get("parallelism")));
		}
		Object records = export.get("records");
		if (records instanceof Map<?, ?> recordMap) {
			if (recordMap.containsKey("class_name_policy")) {
				builder.recordClassNamePolicy(
						toEnum(RecordClassNamePolicy.class, "class_name_policy", recordMap.get("class_name_policy")));
			}
			if (recordMap.containsKey("project_package")) {
				builder.projectRecordPackage(toString(recordMap.get("project_package")));
			}
		}
		try {
			return builder.build();
		} catch (IllegalArgumentException e) {
			throw new InvalidSettingsException("Invalid export settings: " + e.getMessage(), e);
		}
	}

	private static <E extends Enum<E>> E toEnum(Class<E> type, String key, Object raw) {
		String text = toString(raw);
		try {
			return Enum.valueOf(type, text.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
		} catch (IllegalArgumentException e) {
			throw new InvalidSettingsException("Unknown value for '" + key + "': " + text, e);
		}
	}

	private static int toInt(String key, Object raw) {
		if (raw instanceof Number number) {
			return number.intValue();
		}
		try {
			return Integer.parseInt(toString(raw).trim());
		} catch (NumberFormatException e) {
			throw new InvalidSettingsException("'" + key + "' must be an integer: " + raw, e);
		}
	}

	private static String toString(Object value) {
		return value != null ? value.toString() : null;
	}
}
