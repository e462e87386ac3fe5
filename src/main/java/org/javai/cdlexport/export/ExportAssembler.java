package org.javai.cdlexport.export;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.javai.cdlexport.CdlExportException;
import org.javai.cdlexport.ExportErrorKind;
import org.javai.cdlexport.classify.ClassificationResult;
import org.javai.cdlexport.config.ExportSettings;
import org.javai.cdlexport.config.RecordClassNamePolicy;
import org.javai.cdlexport.connect.PruneResult;
import org.javai.cdlexport.model.BindingKey;
import org.javai.cdlexport.model.Instance;
import org.javai.cdlexport.model.InstanceTree;
import org.javai.cdlexport.model.ModelPath;
import org.javai.cdlexport.model.ParameterBinding;
import org.javai.cdlexport.resolve.ResolvedBinding;
import org.javai.cdlexport.value.ParameterValue;
import org.javai.cdlexport.value.RecordFieldReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Composes the export model from classification, resolved bindings and pruned
 * connections. Nothing is computed here beyond naming records and keying
 * parameter sets; if any qualified binding is missing or failed, assembly is
 * aborted with every failure listed.
 */
public class ExportAssembler {

	private static final Logger logger = LoggerFactory.getLogger(ExportAssembler.class);

	private final ExportSettings settings;

	public ExportAssembler(ExportSettings settings) {
		this.settings = Objects.requireNonNull(settings, "settings must not be null");
	}

	/**
	 * @throws ExportAbortedException when a qualified binding is unresolved
	 */
	public ExportModel assemble(ClassificationResult classification, List<ResolvedBinding> resolvedBindings,
			PruneResult pruned) {
		Map<BindingKey, ResolvedBinding> byKey = new HashMap<>();
		for (ResolvedBinding binding : resolvedBindings) {
			byKey.put(binding.key(), binding);
		}
		List<CdlExportException> failures = collectFailures(classification, byKey);
		if (!failures.isEmpty()) {
			logger.debug("Aborting assembly with {} failure(s)", failures.size());
			throw new ExportAbortedException(failures);
		}

		InstanceTree tree = classification.tree();
		Map<ModelPath, ExportedRecord> records = new LinkedHashMap<>();
		Map<String, ParameterSet> parameterSets = new LinkedHashMap<>();
		List<ExportedSequence> sequences = new ArrayList<>();
		for (Instance root : classification.qualifiedRoots()) {
			ExportedInstance exported = export(root, classification, byKey);
			Map<String, ParameterValue> values = new LinkedHashMap<>();
			collect(exported, exported.path(), values, tree, records);
			ParameterSet set = ParameterSet.of(root.classPath(), values);
			parameterSets.putIfAbsent(set.id(), set);
			sequences.add(new ExportedSequence(exported, set.id()));
		}
		logger.debug("Assembled {} sequence(s), {} parameter set(s), {} record(s)",
				sequences.size(), parameterSets.size(), records.size());
		return new ExportModel(tree.root().path(), sequences, pruned.retained(), pruned.boundaryPorts(),
				List.copyOf(records.values()), List.copyOf(parameterSets.values()));
	}

	private static List<CdlExportException> collectFailures(ClassificationResult classification,
			Map<BindingKey, ResolvedBinding> byKey) {
		List<CdlExportException> failures = new ArrayList<>();
		for (Instance instance : classification.qualified()) {
			for (ParameterBinding binding : instance.bindings()) {
				ResolvedBinding resolved = byKey.get(binding.key());
				if (resolved == null) {
					failures.add(new CdlExportException(ExportErrorKind.NON_LITERAL_QUALIFIED_PARAMETER,
							"Qualified parameter " + binding.key() + " was not resolved", List.of(binding.key())));
				} else if (!resolved.isResolved()) {
					failures.add(resolved.failure());
				}
			}
		}
		return failures;
	}

	private ExportedInstance export(Instance instance, ClassificationResult classification,
			Map<BindingKey, ResolvedBinding> byKey) {
		List<ExportedParameter> parameters = new ArrayList<>(instance.bindings().size());
		for (ParameterBinding binding : instance.bindings()) {
			ResolvedBinding resolved = byKey.get(binding.key());
			parameters.add(new ExportedParameter(binding.name(), binding.expression(), resolved.value()));
		}
		List<ExportedInstance> children = new ArrayList<>();
		exportQualifiedDescendants(instance, classification, byKey, children);
		return new ExportedInstance(instance.path(), instance.classPath(), instance.annotations(), parameters, children);
	}

	/**
	 * Qualified instances below an unqualified one (a wrapper, a plant block) still belong
	 * to the enclosing sequence: they are attached to their nearest qualified ancestor and
	 * keep their full path.
	 */
	private void exportQualifiedDescendants(Instance instance, ClassificationResult classification,
			Map<BindingKey, ResolvedBinding> byKey, List<ExportedInstance> into) {
		for (Instance child : instance.children()) {
			if (classification.isQualified(child.path())) {
				into.add(export(child, classification, byKey));
			} else {
				exportQualifiedDescendants(child, classification, byKey, into);
			}
		}
	}

	private void collect(ExportedInstance instance, ModelPath root, Map<String, ParameterValue> values,
			InstanceTree tree, Map<ModelPath, ExportedRecord> records) {
		ModelPath relative = instance.path().relativeTo(root);
		for (ExportedParameter parameter : instance.parameters()) {
			String name = relative == null ? parameter.name() : relative + "." + parameter.name();
			values.put(name, parameter.value());
			if (parameter.value() instanceof RecordFieldReference reference) {
				records.computeIfAbsent(reference.record(), path -> record(path, tree));
			}
		}
		for (ExportedInstance child : instance.children()) {
			collect(child, root, values, tree, records);
		}
	}

	private ExportedRecord record(ModelPath path, InstanceTree tree) {
		String classPath = tree.find(path).map(Instance::classPath).orElseThrow(
				() -> new IllegalStateException("Referenced record " + path + " is not part of the model"));
		return new ExportedRecord(path, classPath, recordClassName(classPath));
	}

	String recordClassName(String classPath) {
		if (settings.recordClassNamePolicy() == RecordClassNamePolicy.ORIGINAL) {
			return classPath;
		}
		String simpleName = classPath.substring(classPath.lastIndexOf('.') + 1);
		return settings.projectRecordPackage() + "." + simpleName;
	}
}
