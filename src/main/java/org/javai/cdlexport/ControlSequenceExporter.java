package org.javai.cdlexport;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.javai.cdlexport.classify.ClassificationResult;
import org.javai.cdlexport.classify.InstanceClassifier;
import org.javai.cdlexport.config.ExportSettings;
import org.javai.cdlexport.connect.ConnectionPruner;
import org.javai.cdlexport.connect.PruneResult;
import org.javai.cdlexport.export.ExportAssembler;
import org.javai.cdlexport.export.ExportModel;
import org.javai.cdlexport.expr.ExpressionEvaluator;
import org.javai.cdlexport.model.Instance;
import org.javai.cdlexport.model.InstanceTree;
import org.javai.cdlexport.model.ModelFlattener;
import org.javai.cdlexport.resolve.BindingResolver;
import org.javai.cdlexport.resolve.ResolvedBinding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one export: flatten, classify, resolve every binding of every qualified
 * instance, prune connections, assemble.
 * <p>
 * Each call to {@link #export(Instance)} is an independent run with its own memo
 * table. With {@code parallelism > 1} the control sequences are resolved on a
 * fixed pool, one task per sequence; results are collected in tree order, so the
 * export does not depend on scheduling.
 *
 * <pre>{@code
 * ControlSequenceExporter exporter = new ControlSequenceExporter(ExportSettings.defaults());
 * ExportModel model = exporter.export(new ModelYamlReader().read(path));
 * }</pre>
 */
public class ControlSequenceExporter {

	private static final Logger logger = LoggerFactory.getLogger(ControlSequenceExporter.class);
	private static final AtomicInteger THREADS = new AtomicInteger(1);

	private final ExportSettings settings;
	private final ModelFlattener flattener;
	private final ExpressionEvaluator evaluator;
	private final InstanceClassifier classifier;
	private final ConnectionPruner pruner;
	private final ExportAssembler assembler;

	public ControlSequenceExporter(ExportSettings settings) {
		this(settings, ModelFlattener.IDENTITY, new ExpressionEvaluator());
	}

	public ControlSequenceExporter(ExportSettings settings, ModelFlattener flattener, ExpressionEvaluator evaluator) {
		this.settings = Objects.requireNonNull(settings, "settings must not be null");
		this.flattener = Objects.requireNonNull(flattener, "flattener must not be null");
		this.evaluator = Objects.requireNonNull(evaluator, "evaluator must not be null");
		this.classifier = new InstanceClassifier(settings);
		this.pruner = new ConnectionPruner();
		this.assembler = new ExportAssembler(settings);
	}

	/**
	 * @throws org.javai.cdlexport.export.ExportAbortedException when any qualified binding fails
	 */
	public ExportModel export(Instance model) {
		Objects.requireNonNull(model, "model must not be null");
		long started = System.nanoTime();
		InstanceTree tree = InstanceTree.of(flattener.flatten(model));
		ClassificationResult classification = classifier.classifyTree(tree);
		List<Instance> sequences = classification.qualifiedRoots();
		logger.debug("Model {}: {} instances, {} control sequence(s)", tree.root().path(), tree.size(), sequences.size());

		BindingResolver resolver = new BindingResolver(tree, evaluator);
		List<ResolvedBinding> resolved = resolve(sequences, classification, resolver);
		PruneResult pruned = pruner.prune(tree.connections(), classification);
		ExportModel exported = assembler.assemble(classification, resolved, pruned);

		logger.info("Exported {}: {} sequence(s), {} parameter(s), {} connection(s), {} boundary port(s) in {} ms",
				tree.root().path(), exported.sequences().size(), resolved.size(), exported.connections().size(),
				exported.boundaryPorts().size(), (System.nanoTime() - started) / 1_000_000);
		return exported;
	}

	public ExportSettings settings() {
		return settings;
	}

	private List<ResolvedBinding> resolve(List<Instance> sequences, ClassificationResult classification,
			BindingResolver resolver) {
		int threads = Math.min(settings.parallelism(), sequences.size());
		if (threads <= 1) {
			List<ResolvedBinding> resolved = new ArrayList<>();
			for (Instance sequence : sequences) {
				resolved.addAll(resolveSequence(sequence, classification, resolver));
			}
			return resolved;
		}

		ExecutorService pool = Executors.newFixedThreadPool(threads, daemonThreads());
		try {
			List<Future<List<ResolvedBinding>>> futures = new ArrayList<>(sequences.size());
			for (Instance sequence : sequences) {
				futures.add(pool.submit(() -> resolveSequence(sequence, classification, resolver)));
			}
			List<ResolvedBinding> resolved = new ArrayList<>();
			for (Future<List<ResolvedBinding>> future : futures) {
				resolved.addAll(future.get());
			}
			return resolved;
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new CdlExportException(ExportErrorKind.EXPORT_ABORTED,
					"Interrupted while resolving " + classification.tree().root().path(), List.of(), e);
		} catch (ExecutionException e) {
			if (e.getCause() instanceof RuntimeException runtime) {
				throw runtime;
			}
			throw new IllegalStateException("Resolution failed for " + classification.tree().root().path(), e.getCause());
		} finally {
			pool.shutdownNow();
		}
	}

	private static List<ResolvedBinding> resolveSequence(Instance sequence, ClassificationResult classification,
			BindingResolver resolver) {
		List<ResolvedBinding> resolved = new ArrayList<>();
		for (Instance instance : classification.qualified()) {
			if (instance.path().startsWith(sequence.path())) {
				resolved.addAll(resolver.resolveInstance(instance));
			}
		}
		return resolved;
	}

	private static ThreadFactory daemonThreads() {
		return runnable -> {
			Thread thread = new Thread(runnable, "cdl-resolve-" + THREADS.getAndIncrement());
			thread.setDaemon(true);
			return thread;
		};
	}
}
