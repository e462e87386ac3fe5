package org.javai.cdlexport.resolve;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.javai.cdlexport.model.BindingKey;

/**
 * Immutable chain of the bindings currently being resolved on one call path,
 * innermost last. Each recursive step extends the chain instead of mutating a
 * shared in-progress set, so concurrent resolutions never see each other's state.
 */
final class ResolutionTrace {

	private static final ResolutionTrace EMPTY = new ResolutionTrace(null, null, 0);

	private final BindingKey key;
	private final ResolutionTrace parent;
	private final int depth;

	private ResolutionTrace(BindingKey key, ResolutionTrace parent, int depth) {
		this.key = key;
		this.parent = parent;
		this.depth = depth;
	}

	static ResolutionTrace empty() {
		return EMPTY;
	}

	ResolutionTrace push(BindingKey next) {
		return new ResolutionTrace(next, this, depth + 1);
	}

	boolean contains(BindingKey candidate) {
		for (ResolutionTrace t = this; t.key != null; t = t.parent) {
			if (t.key.equals(candidate)) {
				return true;
			}
		}
		return false;
	}

	int depth() {
		return depth;
	}

	/**
	 * Keys on the chain, outermost first.
	 */
	List<BindingKey> keys() {
		List<BindingKey> keys = new ArrayList<>(depth);
		for (ResolutionTrace t = this; t.key != null; t = t.parent) {
			keys.add(t.key);
		}
		Collections.reverse(keys);
		return keys;
	}

	/**
	 * The cycle closed by revisiting {@code revisited}: the chain from its first
	 * occurrence to the end, followed by {@code revisited} again.
	 */
	List<BindingKey> cycleTo(BindingKey revisited) {
		List<BindingKey> keys = keys();
		int start = keys.indexOf(revisited);
		List<BindingKey> cycle = new ArrayList<>(keys.subList(Math.max(start, 0), keys.size()));
		cycle.add(revisited);
		return cycle;
	}
}
