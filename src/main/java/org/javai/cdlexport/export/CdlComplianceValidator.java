package org.javai.cdlexport.export;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import org.javai.cdlexport.config.ExportSettings;
import org.javai.cdlexport.expr.ExpressionNode;
import org.javai.cdlexport.expr.ExpressionWalker;
import org.javai.cdlexport.model.BindingKey;
import org.javai.cdlexport.model.ModelPath;
import org.javai.cdlexport.value.RecordFieldReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks an assembled export against configurable output policies. Violations are
 * reported and logged; the export itself is left untouched.
 */
public class CdlComplianceValidator {

	private static final Logger logger = LoggerFactory.getLogger(CdlComplianceValidator.class);

	private final ExportSettings settings;

	public CdlComplianceValidator(ExportSettings settings) {
		this.settings = Objects.requireNonNull(settings, "settings must not be null");
	}

	public List<ComplianceViolation> validate(ExportModel model) {
		Set<ModelPath> listedRecords = model.records().stream()
				.map(ExportedRecord::path)
				.collect(Collectors.toSet());
		List<ComplianceViolation> violations = new ArrayList<>();
		for (ExportedSequence sequence : model.sequences()) {
			check(sequence.root(), listedRecords, violations);
		}
		for (ComplianceViolation violation : violations) {
			logger.warn("{} on {}: {}", violation.rule(), violation.binding(), violation.message());
		}
		return violations;
	}

	private void check(ExportedInstance instance, Set<ModelPath> listedRecords, List<ComplianceViolation> violations) {
		for (ExportedParameter parameter : instance.parameters()) {
			BindingKey key = new BindingKey(instance.path(), parameter.name());
			if (!settings.allowConditionalBindings()
					&& ExpressionWalker.contains(parameter.declared(), ExpressionNode.Conditional.class)) {
				violations.add(new ComplianceViolation(key, ComplianceViolation.Rule.CONDITIONAL_BINDING,
						"declared expression contains a conditional"));
			}
			if (parameter.value() instanceof RecordFieldReference reference
					&& !listedRecords.contains(reference.record())) {
				violations.add(new ComplianceViolation(key, ComplianceViolation.Rule.UNLISTED_RECORD,
						"record " + reference.record() + " is not exported"));
			}
		}
		for (ExportedInstance child : instance.children()) {
			check(child, listedRecords, violations);
		}
	}
}
