package org.javai.cdlexport.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Dotted path identifying an instance in the flattened tree, or a reference
 * written in a binding expression.
 *
 * @param segments the path segments, outermost first
 */
public record ModelPath(List<String> segments) implements Comparable<ModelPath> {

	public ModelPath {
		Objects.requireNonNull(segments, "segments must not be null");
		segments = List.copyOf(segments);
		for (String segment : segments) {
			if (segment == null || segment.isBlank()) {
				throw new IllegalArgumentException("Path segments must not be blank: " + segments);
			}
		}
	}

	/**
	 * Parses a dotted path such as {@code ahu.ctl.kPro}.
	 */
	public static ModelPath of(String dotted) {
		Objects.requireNonNull(dotted, "dotted must not be null");
		if (dotted.isBlank()) {
			throw new IllegalArgumentException("Path must not be blank");
		}
		return new ModelPath(List.of(dotted.split("\\.", -1)));
	}

	public static ModelPath root(String name) {
		return new ModelPath(List.of(name));
	}

	public ModelPath child(String name) {
		List<String> extended = new ArrayList<>(segments);
		extended.add(name);
		return new ModelPath(extended);
	}

	/**
	 * Returns the enclosing path, or {@code null} for a single-segment path.
	 */
	public ModelPath parent() {
		if (segments.size() <= 1) {
			return null;
		}
		return new ModelPath(segments.subList(0, segments.size() - 1));
	}

	public String head() {
		return segments.get(0);
	}

	public String name() {
		return segments.get(segments.size() - 1);
	}

	/**
	 * Returns the path without its first segment, or {@code null} when nothing remains.
	 */
	public ModelPath tail() {
		if (segments.size() <= 1) {
			return null;
		}
		return new ModelPath(segments.subList(1, segments.size()));
	}

	public int depth() {
		return segments.size();
	}

	public boolean startsWith(ModelPath prefix) {
		return prefix.segments.size() <= segments.size()
				&& segments.subList(0, prefix.segments.size()).equals(prefix.segments);
	}

	/**
	 * Returns this path relative to {@code ancestor}, or {@code null} when the paths are equal.
	 */
	public ModelPath relativeTo(ModelPath ancestor) {
		if (!startsWith(ancestor)) {
			throw new IllegalArgumentException(this + " is not inside " + ancestor);
		}
		if (segments.size() == ancestor.segments.size()) {
			return null;
		}
		return new ModelPath(segments.subList(ancestor.segments.size(), segments.size()));
	}

	@Override
	public int compareTo(ModelPath other) {
		return toString().compareTo(other.toString());
	}

	@Override
	public String toString() {
		return String.join(".", segments);
	}
}
