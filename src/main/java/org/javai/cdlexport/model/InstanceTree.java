package org.javai.cdlexport.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Path index over an immutable instance tree, giving the parent links the
 * instances themselves do not carry.
 */
public final class InstanceTree {

	private final Instance root;
	private final Map<ModelPath, Instance> byPath = new LinkedHashMap<>();
	private final List<Connection> connections = new ArrayList<>();

	private InstanceTree(Instance root) {
		this.root = root;
		index(root);
	}

	public static InstanceTree of(Instance root) {
		Objects.requireNonNull(root, "root must not be null");
		return new InstanceTree(root);
	}

	private void index(Instance instance) {
		if (byPath.put(instance.path(), instance) != null) {
			throw new IllegalArgumentException("Duplicate instance path: " + instance.path());
		}
		connections.addAll(instance.connections());
		for (Instance child : instance.children()) {
			if (!instance.path().equals(child.path().parent())) {
				throw new IllegalArgumentException(
						"Instance " + child.path() + " is not a direct child of " + instance.path());
			}
			index(child);
		}
	}

	public Instance root() {
		return root;
	}

	public Optional<Instance> find(ModelPath path) {
		return Optional.ofNullable(byPath.get(path));
	}

	public Optional<Instance> parentOf(Instance instance) {
		ModelPath parent = instance.path().parent();
		return parent == null ? Optional.empty() : find(parent);
	}

	/**
	 * All instances in pre-order (parents before children, declaration order).
	 */
	public List<Instance> instances() {
		return List.copyOf(byPath.values());
	}

	/**
	 * Connections declared anywhere in the tree, in pre-order of their declaring instance.
	 */
	public List<Connection> connections() {
		return Collections.unmodifiableList(connections);
	}

	public int size() {
		return byPath.size();
	}
}
