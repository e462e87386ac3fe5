package org.javai.cdlexport.resolve;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.javai.cdlexport.CdlExportException;
import org.javai.cdlexport.expr.ExpressionEvaluator;
import org.javai.cdlexport.expr.ExpressionNode;
import org.javai.cdlexport.expr.UnsupportedConstructException;
import org.javai.cdlexport.model.BindingKey;
import org.javai.cdlexport.model.Instance;
import org.javai.cdlexport.model.InstanceTree;
import org.javai.cdlexport.model.ModelPath;
import org.javai.cdlexport.model.ParameterBinding;
import org.javai.cdlexport.value.ParameterValue;
import org.javai.cdlexport.value.RecordFieldReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves parameter bindings to literals or record-field references.
 * <p>
 * A literal right-hand side is returned as is. A bare reference is followed to
 * whatever it denotes: a record field stays symbolic, another parameter is
 * resolved and its result passed through. Any other expression is folded by the
 * {@link ExpressionEvaluator}, which asks this resolver for each reference leaf it
 * reaches; each leaf is located by the {@link ScopeResolver} from the scope the
 * expression was written in and then resolved recursively, crossing freely
 * between control sequences and the surrounding equipment model.
 * <p>
 * Instances are safe for concurrent use; all memoized state lives in the
 * {@link ResolutionRun} and is discarded with it.
 */
public class BindingResolver {

	private static final Logger logger = LoggerFactory.getLogger(BindingResolver.class);

	private final InstanceTree tree;
	private final ScopeResolver scopes;
	private final ExpressionEvaluator evaluator;
	private final ResolutionRun run;

	public BindingResolver(InstanceTree tree) {
		this(tree, new ExpressionEvaluator());
	}

	public BindingResolver(InstanceTree tree, ExpressionEvaluator evaluator) {
		this(tree, new ScopeResolver(tree), evaluator, new ResolutionRun());
	}

	public BindingResolver(InstanceTree tree, ScopeResolver scopes, ExpressionEvaluator evaluator, ResolutionRun run) {
		this.tree = Objects.requireNonNull(tree, "tree must not be null");
		this.scopes = Objects.requireNonNull(scopes, "scopes must not be null");
		this.evaluator = Objects.requireNonNull(evaluator, "evaluator must not be null");
		this.run = Objects.requireNonNull(run, "run must not be null");
	}

	public ParameterValue resolveBinding(ModelPath instance, String parameter) {
		return resolveBinding(new BindingKey(instance, parameter));
	}

	/**
	 * Resolves one binding, memoized for the lifetime of this resolver's run.
	 *
	 * @throws CdlExportException when the binding or anything it depends on cannot be resolved
	 */
	public ParameterValue resolveBinding(BindingKey key) {
		Objects.requireNonNull(key, "key must not be null");
		return resolve(key, ResolutionTrace.empty());
	}

	/**
	 * Resolves every binding of {@code instance} in declaration order, recording
	 * failures instead of stopping at the first one.
	 */
	public List<ResolvedBinding> resolveInstance(Instance instance) {
		List<ResolvedBinding> results = new ArrayList<>(instance.bindings().size());
		for (ParameterBinding binding : instance.bindings()) {
			BindingKey key = binding.key();
			try {
				results.add(ResolvedBinding.resolved(key, binding.expression(), resolveBinding(key)));
			} catch (CdlExportException e) {
				logger.debug("Failed to resolve {}: {}", key, e.getMessage());
				results.add(ResolvedBinding.failed(key, binding.expression(), e));
			}
		}
		return results;
	}

	public ResolutionRun run() {
		return run;
	}

	private ParameterValue resolve(BindingKey key, ResolutionTrace trace) {
		return run.resolve(key, trace, inner -> compute(key, inner));
	}

	private ParameterValue compute(BindingKey key, ResolutionTrace trace) {
		Instance owner = tree.find(key.instance())
				.orElseThrow(() -> new UnboundReferenceException("Instance " + key.instance() + " is not part of the model"));
		ParameterBinding binding = owner.binding(key.parameter())
				.orElseThrow(() -> new UnboundReferenceException(
						"Instance " + key.instance() + " declares no parameter '" + key.parameter() + "'"));
		ExpressionNode expression = binding.expression();

		ParameterValue value;
		if (expression instanceof ExpressionNode.Literal literal) {
			value = literal.value();
		} else if (expression instanceof ExpressionNode.VariableRef reference) {
			value = leaf(reference, binding.scope(), trace);
		} else {
			value = evaluator.evaluate(expression, leaf -> leaf(leaf, binding.scope(), trace));
		}
		if (logger.isTraceEnabled()) {
			logger.trace("{} = {} (depth {})", key, value.render(), trace.depth());
		}
		return value;
	}

	private ParameterValue leaf(ExpressionNode.VariableRef reference, ModelPath scope, ResolutionTrace trace) {
		ScopeBinding target = scopes.resolve(reference, scope);
		if (target instanceof ScopeBinding.BoundParameter parameter) {
			return resolve(parameter.binding().key(), trace);
		}
		if (target instanceof ScopeBinding.BoundRecordField field) {
			return new RecordFieldReference(field.record(), field.field());
		}
		if (target instanceof ScopeBinding.MissingRecordField missing) {
			throw new RecordFieldMismatchException(missing.record(), missing.field());
		}
		if (target instanceof ScopeBinding.BoundInstance component) {
			throw new UnsupportedConstructException("Reference '" + reference.path()
					+ "' denotes component " + component.instance().path() + ", not a parameter");
		}
		ScopeBinding.Unbound unbound = (ScopeBinding.Unbound) target;
		throw new UnboundReferenceException("Cannot resolve '" + reference.path() + "' from " + scope
				+ ": " + unbound.reason());
	}
}
