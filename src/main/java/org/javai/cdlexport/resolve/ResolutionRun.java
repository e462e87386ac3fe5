package org.javai.cdlexport.resolve;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;
import org.javai.cdlexport.CdlExportException;
import org.javai.cdlexport.model.BindingKey;
import org.javai.cdlexport.value.ParameterValue;

/**
 * Memo table of one export run.
 * <p>
 * Each (instance, parameter) key is computed at most once: the first thread to
 * claim a key computes it, later callers wait on that key alone and receive the
 * same value or the same failure. A caller that finds its key on its own
 * resolution chain has closed a cycle. A caller about to wait on a key owned by
 * another thread first follows the wait-for edges between threads; if they lead
 * back to itself the threads are resolving one cycle from different ends, and the
 * caller fails with {@link ResolutionCycleException} instead of blocking.
 */
public final class ResolutionRun {

	private final ConcurrentMap<BindingKey, Slot> memo = new ConcurrentHashMap<>();

	/** Key each blocked thread is waiting on; guarded by itself. */
	private final Map<Thread, BindingKey> waiting = new HashMap<>();

	ParameterValue resolve(BindingKey key, ResolutionTrace trace,
			Function<ResolutionTrace, ParameterValue> computation) {
		if (trace.contains(key)) {
			throw new ResolutionCycleException(trace.cycleTo(key));
		}
		Slot claim = new Slot(Thread.currentThread());
		Slot existing = memo.putIfAbsent(key, claim);
		if (existing == null) {
			return compute(key, claim, trace, computation);
		}
		if (!existing.result.isDone()) {
			return await(key, existing, trace);
		}
		return existing.outcome();
	}

	public boolean isMemoized(BindingKey key) {
		Slot slot = memo.get(key);
		return slot != null && slot.result.isDone();
	}

	public int size() {
		return memo.size();
	}

	private ParameterValue compute(BindingKey key, Slot claim, ResolutionTrace trace,
			Function<ResolutionTrace, ParameterValue> computation) {
		ResolutionTrace inner = trace.push(key);
		try {
			ParameterValue value = computation.apply(inner);
			claim.result.complete(value);
			return value;
		} catch (CdlExportException e) {
			e.withChainIfAbsent(inner.keys());
			claim.result.completeExceptionally(e);
			throw e;
		} catch (RuntimeException | Error e) {
			claim.result.completeExceptionally(e);
			throw e;
		}
	}

	private ParameterValue await(BindingKey key, Slot owned, ResolutionTrace trace) {
		Thread current = Thread.currentThread();
		synchronized (waiting) {
			List<BindingKey> cycle = waitCycle(current, key, owned, trace);
			if (cycle != null) {
				throw new ResolutionCycleException(cycle);
			}
			waiting.put(current, key);
		}
		try {
			return owned.outcome();
		} finally {
			synchronized (waiting) {
				waiting.remove(current);
			}
		}
	}

	/**
	 * Follows owner and wait-for edges from {@code key}; returns the closed chain
	 * when they reach {@code current}, otherwise {@code null}.
	 */
	private List<BindingKey> waitCycle(Thread current, BindingKey key, Slot owned, ResolutionTrace trace) {
		List<BindingKey> path = new ArrayList<>();
		path.add(key);
		Thread owner = owned.owner;
		for (int hops = 0; hops <= waiting.size(); hops++) {
			if (owner == current) {
				List<BindingKey> cycle = new ArrayList<>(trace.keys());
				cycle.addAll(path);
				return cycle;
			}
			BindingKey next = waiting.get(owner);
			if (next == null) {
				return null;
			}
			Slot slot = memo.get(next);
			if (slot == null || slot.result.isDone()) {
				return null;
			}
			path.add(next);
			owner = slot.owner;
		}
		return null;
	}

	private static final class Slot {
		private final Thread owner;
		private final CompletableFuture<ParameterValue> result = new CompletableFuture<>();

		private Slot(Thread owner) {
			this.owner = owner;
		}

		private ParameterValue outcome() {
			try {
				return result.join();
			} catch (CompletionException e) {
				Throwable cause = e.getCause();
				if (cause instanceof RuntimeException runtime) {
					throw runtime;
				}
				if (cause instanceof Error error) {
					throw error;
				}
				throw e;
			}
		}
	}
}
