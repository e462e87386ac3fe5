package org.javai.cdlexport.classify;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import org.javai.cdlexport.config.ExportSettings;
import org.javai.cdlexport.model.Instance;
import org.javai.cdlexport.model.InstanceTree;
import org.javai.cdlexport.model.ModelPath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether an instance belongs to the exportable control sequence.
 * <p>
 * An instance is qualified when its class path starts with one of the configured
 * namespace prefixes, or when one of its annotations starts with the marker prefix.
 * The decision looks only at the instance itself; prefix matches are cached per
 * distinct class path.
 */
public class InstanceClassifier {

	private static final Logger logger = LoggerFactory.getLogger(InstanceClassifier.class);

	private final List<String> qualifyingPrefixes;
	private final String markerPrefix;
	private final Map<String, Boolean> classPathMatches = new ConcurrentHashMap<>();

	public InstanceClassifier(ExportSettings settings) {
		Objects.requireNonNull(settings, "settings must not be null");
		this.qualifyingPrefixes = settings.qualifyingPrefixes();
		this.markerPrefix = settings.markerPrefix();
	}

	public Classification classify(Instance instance) {
		Objects.requireNonNull(instance, "instance must not be null");
		if (classPathMatches.computeIfAbsent(instance.classPath(), this::matchesNamespace)) {
			return Classification.QUALIFIED;
		}
		if (markerPrefix != null && !markerPrefix.isEmpty()) {
			for (String annotation : instance.annotations()) {
				if (annotation.startsWith(markerPrefix)) {
					return Classification.QUALIFIED;
				}
			}
		}
		return Classification.NOT_QUALIFIED;
	}

	public ClassificationResult classifyTree(InstanceTree tree) {
		Objects.requireNonNull(tree, "tree must not be null");
		Map<ModelPath, Classification> byPath = new LinkedHashMap<>();
		int qualified = 0;
		for (Instance instance : tree.instances()) {
			Classification classification = classify(instance);
			byPath.put(instance.path(), classification);
			if (classification.isQualified()) {
				qualified++;
			}
		}
		logger.debug("Classified {} instance(s): {} qualified", byPath.size(), qualified);
		return new ClassificationResult(tree, byPath);
	}

	private boolean matchesNamespace(String classPath) {
		for (String prefix : qualifyingPrefixes) {
			if (classPath.startsWith(prefix)) {
				return true;
			}
		}
		return false;
	}
}
