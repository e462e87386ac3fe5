package org.javai.cdlexport.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.javai.cdlexport.expr.ExpressionNode;

/**
 * A node of the flattened instance tree. Sub-instances are exclusively owned, so the
 * tree is acyclic by construction; instances are immutable once built.
 *
 * @param path dotted identity of this instance
 * @param classPath fully qualified class of the instance
 * @param kind structural kind
 * @param prefix inner/outer declaration prefix
 * @param annotations annotation tags attached to the declaration
 * @param bindings parameter bindings in declaration order
 * @param children owned sub-instances in declaration order
 * @param connections connections declared within this instance
 */
public record Instance(
		ModelPath path,
		String classPath,
		InstanceKind kind,
		InnerOuter prefix,
		List<String> annotations,
		List<ParameterBinding> bindings,
		List<Instance> children,
		List<Connection> connections
) {

	public Instance {
		Objects.requireNonNull(path, "path must not be null");
		Objects.requireNonNull(classPath, "classPath must not be null");
		kind = kind != null ? kind : InstanceKind.BLOCK;
		prefix = prefix != null ? prefix : InnerOuter.NONE;
		annotations = annotations != null ? List.copyOf(annotations) : List.of();
		bindings = bindings != null ? List.copyOf(bindings) : List.of();
		children = children != null ? List.copyOf(children) : List.of();
		connections = connections != null ? List.copyOf(connections) : List.of();
	}

	public String name() {
		return path.name();
	}

	public boolean isRecord() {
		return kind == InstanceKind.RECORD;
	}

	public Optional<Instance> child(String name) {
		return children.stream().filter(c -> c.name().equals(name)).findFirst();
	}

	public Optional<ParameterBinding> binding(String name) {
		return bindings.stream().filter(b -> b.name().equals(name)).findFirst();
	}

	public static Builder builder(String name, String classPath) {
		return new Builder(name, classPath);
	}

	/**
	 * Builds an instance tree from local names; paths are derived from nesting.
	 */
	public static final class Builder {
		private final String name;
		private final String classPath;
		private InstanceKind kind = InstanceKind.BLOCK;
		private InnerOuter prefix = InnerOuter.NONE;
		private final List<String> annotations = new ArrayList<>();
		private final List<PendingBinding> bindings = new ArrayList<>();
		private final List<Builder> children = new ArrayList<>();
		private final List<Connection> connections = new ArrayList<>();

		private Builder(String name, String classPath) {
			this.name = Objects.requireNonNull(name, "name must not be null");
			this.classPath = Objects.requireNonNull(classPath, "classPath must not be null");
		}

		public Builder kind(InstanceKind kind) {
			this.kind = kind;
			return this;
		}

		public Builder prefix(InnerOuter prefix) {
			this.prefix = prefix;
			return this;
		}

		public Builder annotation(String annotation) {
			this.annotations.add(annotation);
			return this;
		}

		/**
		 * Declaration binding: the expression refers to names of this instance.
		 */
		public Builder parameter(String parameter, ExpressionNode expression) {
			this.bindings.add(new PendingBinding(parameter, expression, false));
			return this;
		}

		/**
		 * Modification binding: the expression refers to names of the enclosing instance.
		 */
		public Builder modifier(String parameter, ExpressionNode expression) {
			this.bindings.add(new PendingBinding(parameter, expression, true));
			return this;
		}

		public Builder child(Builder child) {
			this.children.add(child);
			return this;
		}

		public Builder connect(Endpoint from, Endpoint to, boolean annotated) {
			this.connections.add(new Connection(from, to, annotated));
			return this;
		}

		public Instance build() {
			return build(null);
		}

		Instance build(ModelPath parentPath) {
			ModelPath path = parentPath != null ? parentPath.child(name) : ModelPath.root(name);
			List<ParameterBinding> built = new ArrayList<>();
			for (PendingBinding pending : bindings) {
				if (pending.modifier() && parentPath == null) {
					throw new IllegalStateException("Root instance '" + name + "' cannot carry modifier " + pending.name());
				}
				ModelPath scope = pending.modifier() ? parentPath : path;
				built.add(new ParameterBinding(path, pending.name(), pending.expression(), scope));
			}
			List<Instance> builtChildren = new ArrayList<>();
			for (Builder child : children) {
				builtChildren.add(child.build(path));
			}
			return new Instance(path, classPath, kind, prefix, annotations, built, builtChildren, connections);
		}

		private record PendingBinding(String name, ExpressionNode expression, boolean modifier) {
		}
	}
}
