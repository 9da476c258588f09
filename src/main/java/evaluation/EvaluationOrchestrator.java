package evaluation;

import alignment.UmeyamaAlignment;
import groundtruth.Dataset;
import groundtruth.GroundtruthCatalog;
import groundtruth.SequenceCatalog;
import groundtruth.SequenceSet;
import utilities.EvalLogger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Entry point of the evaluation: serves a run from its snapshot when possible, otherwise loads the
 * groundtruth, aggregates all cells and stores a new snapshot.
 */
public final class EvaluationOrchestrator {

    private final SequenceCatalog catalog;
    private final ResultAggregator aggregator;
    private final ResultCache cache;

    public EvaluationOrchestrator(SequenceCatalog catalog, ResultAggregator aggregator, ResultCache cache) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator");
        this.cache = Objects.requireNonNull(cache, "cache");
    }

    public static EvaluationOrchestrator withDefaults(Path groundtruthRoot) {
        return new EvaluationOrchestrator(new GroundtruthCatalog(groundtruthRoot),
                new ResultAggregator(new UmeyamaAlignment()), new ResultCache());
    }

    public RunEvaluation evaluateRun(Path runFolder, Dataset dataset, int numIter) throws IOException {
        return evaluateRun(runFolder, dataset, numIter, null, false);
    }

    /**
     * Evaluates all sequences and iterations of a run.
     *
     * @param name             display name for both results, {@code null} to leave them unnamed
     * @param alwaysReevaluate ignore an existing snapshot
     * @return estimated-scale result first, groundtruth-scale result second
     * @throws groundtruth.CatalogLoadException if the groundtruth of the dataset cannot be loaded
     * @throws IOException                      if the snapshot cannot be written
     */
    public RunEvaluation evaluateRun(Path runFolder, Dataset dataset, int numIter, String name,
                                     boolean alwaysReevaluate) throws IOException {
        Objects.requireNonNull(runFolder, "runFolder");
        Objects.requireNonNull(dataset, "dataset");
        if (numIter < 1) {
            throw new IllegalArgumentException("numIter must be at least 1, got " + numIter);
        }

        if (!alwaysReevaluate) {
            Optional<RunEvaluation> cached = cache.tryLoad(runFolder, dataset, numIter);
            if (cached.isPresent()) {
                EvalLogger.info("Loaded pre-evaluated results from " + ResultCache.snapshotFile(runFolder));
                RunEvaluation evaluation = cached.get();
                if (name != null) evaluation.rename(name);
                return evaluation;
            }
        }

        System.out.printf(Locale.ROOT, "Evaluating %s (%s, %d iterations)%n",
                runFolder, dataset.displayName(), numIter);
        SequenceSet sequences = catalog.sequences(dataset);
        RunEvaluation evaluation = aggregator.aggregate(runFolder, dataset, sequences, numIter);
        cache.save(runFolder, evaluation);

        if (name != null) evaluation.rename(name);
        return evaluation;
    }

    public RunEvaluation evaluateWithConfig(RunDescriptor run) throws IOException {
        return evaluateWithConfig(run, false);
    }

    /**
     * Evaluates a run described by its setup: {@code dataset} selects the dataset, {@code num_iter}
     * the number of iterations.
     *
     * @throws UnknownDatasetException if the dataset setting matches no dataset
     */
    public RunEvaluation evaluateWithConfig(RunDescriptor run, boolean alwaysReevaluate) throws IOException {
        String label = run.setting("dataset").orElse(null);
        Dataset dataset = Dataset.match(label).orElseThrow(() -> new UnknownDatasetException(label));
        String iterations = run.setting("num_iter")
                .orElseThrow(() -> new IllegalArgumentException("Setup of " + run.folder() + " has no num_iter"));
        int numIter;
        try {
            numIter = Integer.parseInt(iterations);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid num_iter '" + iterations + "' in setup of " + run.folder(), ex);
        }
        return evaluateRun(run.folder(), dataset, numIter, null, alwaysReevaluate);
    }
}
