package org.javai.cdlexport.classify;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.javai.cdlexport.model.Instance;
import org.javai.cdlexport.model.InstanceTree;
import org.javai.cdlexport.model.ModelPath;

/**
 * Classification of every instance of one tree, in tree order.
 */
public final class ClassificationResult {

	private final InstanceTree tree;
	private final Map<ModelPath, Classification> byPath;

	ClassificationResult(InstanceTree tree, Map<ModelPath, Classification> byPath) {
		this.tree = tree;
		this.byPath = Collections.unmodifiableMap(new LinkedHashMap<>(byPath));
	}

	/**
	 * Classification of the instance at {@code path}; paths outside the tree are not qualified.
	 */
	public Classification classificationOf(ModelPath path) {
		return byPath.getOrDefault(path, Classification.NOT_QUALIFIED);
	}

	public boolean isQualified(ModelPath path) {
		return classificationOf(path).isQualified();
	}

	/**
	 * Every qualified instance, in tree order.
	 */
	public List<Instance> qualified() {
		List<Instance> qualified = new ArrayList<>();
		for (Instance instance : tree.instances()) {
			if (isQualified(instance.path())) {
				qualified.add(instance);
			}
		}
		return qualified;
	}

	/**
	 * Qualified instances that have no qualified ancestor, in tree order. Each one heads
	 * an exported control sequence.
	 */
	public List<Instance> qualifiedRoots() {
		List<Instance> roots = new ArrayList<>();
		for (Instance instance : qualified()) {
			if (nearestQualifiedAncestor(instance.path()) == null) {
				roots.add(instance);
			}
		}
		return roots;
	}

	/**
	 * Nearest strict ancestor of {@code path} that is qualified, or {@code null}.
	 */
	public ModelPath nearestQualifiedAncestor(ModelPath path) {
		ModelPath ancestor = path.parent();
		while (ancestor != null) {
			if (isQualified(ancestor)) {
				return ancestor;
			}
			ancestor = ancestor.parent();
		}
		return null;
	}

	public InstanceTree tree() {
		return tree;
	}

	public Map<ModelPath, Classification> asMap() {
		return byPath;
	}
}
