package org.javai.cdlexport.resolve;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.javai.cdlexport.expr.ExpressionNode;
import org.javai.cdlexport.model.Instance;
import org.javai.cdlexport.model.InstanceTree;
import org.javai.cdlexport.model.ModelPath;
import org.javai.cdlexport.model.ParameterBinding;

/**
 * Maps a reference written inside one instance to the declaration it denotes.
 * <p>
 * Lookup is lexical and always starts from an explicit origin instance:
 * <ul>
 *   <li>a plain or {@code inner} reference is looked up among the origin's own
 *   parameters and sub-instances, then followed segment by segment;</li>
 *   <li>an {@code outer} reference, or a path whose first segment is a local
 *   sub-instance declared {@code outer}, is redirected to the nearest ancestor
 *   that owns an {@code inner} (or {@code inner outer}) element of that name.</li>
 * </ul>
 * The ancestor chain is read from the immutable {@link InstanceTree}; there is no
 * shared symbol table.
 */
public class ScopeResolver {

	private final InstanceTree tree;

	public ScopeResolver(InstanceTree tree) {
		this.tree = Objects.requireNonNull(tree, "tree must not be null");
	}

	public ScopeBinding resolve(ExpressionNode.VariableRef reference, ModelPath origin) {
		Objects.requireNonNull(reference, "reference must not be null");
		Objects.requireNonNull(origin, "origin must not be null");
		Optional<Instance> originInstance = tree.find(origin);
		if (originInstance.isEmpty()) {
			return new ScopeBinding.Unbound("Origin instance " + origin + " is not part of the model");
		}
		ModelPath path = reference.path();
		if (reference.kind().redirectsOutward()) {
			return outward(originInstance.get(), path);
		}

		Instance scope = originInstance.get();
		String head = path.head();
		if (path.depth() == 1) {
			Optional<ParameterBinding> local = scope.binding(head);
			if (local.isPresent()) {
				return field(scope, local.get());
			}
		}
		Optional<Instance> child = scope.child(head);
		if (child.isPresent() && child.get().prefix().redirectsOutward()) {
			return outward(scope, path);
		}
		return descend(scope, path.segments(), 0, reference);
	}

	private ScopeBinding outward(Instance origin, ModelPath path) {
		String head = path.head();
		Optional<Instance> declaration = findInnerDeclaration(origin, head);
		if (declaration.isEmpty()) {
			return new ScopeBinding.Unbound("No enclosing instance of " + origin.path()
					+ " declares an inner element '" + head + "'");
		}
		return follow(declaration.get(), path.segments(), 1, path);
	}

	/**
	 * Walks the ancestors of {@code origin}, nearest first, for a child named
	 * {@code name} declared {@code inner}.
	 */
	Optional<Instance> findInnerDeclaration(Instance origin, String name) {
		Optional<Instance> ancestor = tree.parentOf(origin);
		while (ancestor.isPresent()) {
			Optional<Instance> candidate = ancestor.get().child(name)
					.filter(c -> c.prefix().declaresInner());
			if (candidate.isPresent()) {
				return candidate;
			}
			ancestor = tree.parentOf(ancestor.get());
		}
		return Optional.empty();
	}

	private ScopeBinding descend(Instance scope, List<String> segments, int index, ExpressionNode.VariableRef reference) {
		String name = segments.get(index);
		Optional<Instance> child = scope.child(name);
		if (child.isEmpty()) {
			if (scope.isRecord()) {
				return new ScopeBinding.MissingRecordField(scope.path(), name);
			}
			return new ScopeBinding.Unbound("'" + reference.path() + "' is not declared in " + scope.path());
		}
		return follow(child.get(), segments, index + 1, reference.path());
	}

	/**
	 * Continues a path inside {@code current}, whose segments up to {@code index} are consumed.
	 */
	private ScopeBinding follow(Instance current, List<String> segments, int index, ModelPath fullPath) {
		Instance scope = current;
		for (int i = index; i < segments.size(); i++) {
			String name = segments.get(i);
			boolean last = i == segments.size() - 1;
			if (last) {
				Optional<ParameterBinding> parameter = scope.binding(name);
				if (parameter.isPresent()) {
					return field(scope, parameter.get());
				}
			}
			Optional<Instance> child = scope.child(name);
			if (child.isEmpty()) {
				if (scope.isRecord()) {
					return new ScopeBinding.MissingRecordField(scope.path(), name);
				}
				return new ScopeBinding.Unbound("'" + fullPath + "' is not declared: " + scope.path()
						+ " has no element '" + name + "'");
			}
			scope = child.get();
		}
		return new ScopeBinding.BoundInstance(scope);
	}

	private static ScopeBinding field(Instance scope, ParameterBinding binding) {
		if (scope.isRecord()) {
			return new ScopeBinding.BoundRecordField(scope.path(), binding.name());
		}
		return new ScopeBinding.BoundParameter(binding);
	}
}
