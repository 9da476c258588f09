package evaluation;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import groundtruth.Dataset;
import utilities.EvalLogger;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Memo of a run's evaluation in {@code {run}/setup/evaluation_results.txt}. The snapshot is never
 * checked against the files it was computed from; delete it or re-evaluate to refresh it.
 *
 * <p>Format version 2 stores the scale grid under {@code scale}. Unversioned snapshots stored the
 * error grid there, so they are not loaded.
 */
public class ResultCache {
    public static final int FORMAT_VERSION = 2;
    static final String SETUP_DIR = "setup";
    static final String FILE_NAME = "evaluation_results.txt";

    private final Gson gson = new GsonBuilder()
            .serializeSpecialFloatingPointValues()
            .setPrettyPrinting()
            .create();

    public static Path snapshotFile(Path runFolder) {
        return runFolder.resolve(SETUP_DIR).resolve(FILE_NAME);
    }

    /**
     * Loads the snapshot of {@code runFolder}. Any problem with it (absent, unreadable, legacy format,
     * missing keys, inconsistent shapes, other iteration count) is a miss, never an error.
     */
    public Optional<RunEvaluation> tryLoad(Path runFolder, Dataset dataset, int expectedIterations) {
        Path file = snapshotFile(runFolder);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }

        Snapshot snapshot;
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            snapshot = gson.fromJson(reader, Snapshot.class);
        } catch (IOException | RuntimeException e) {
            EvalLogger.warning("Ignoring unreadable evaluation snapshot " + file + ": " + e.getMessage());
            return Optional.empty();
        }
        if (snapshot == null) {
            EvalLogger.warning("Ignoring empty evaluation snapshot " + file);
            return Optional.empty();
        }
        if (snapshot.formatVersion == null || snapshot.formatVersion != FORMAT_VERSION) {
            EvalLogger.warning("Ignoring evaluation snapshot " + file + " with format version "
                    + snapshot.formatVersion + ", expected " + FORMAT_VERSION);
            return Optional.empty();
        }
        if (snapshot.sequenceNames == null || snapshot.results == null || snapshot.resultsGtScale == null) {
            EvalLogger.warning("Ignoring incomplete evaluation snapshot " + file);
            return Optional.empty();
        }

        try {
            EvaluationResult result = snapshot.results.toResult(runFolder, dataset, snapshot.sequenceNames);
            EvaluationResult resultGtScale = snapshot.resultsGtScale.toResult(runFolder, dataset, snapshot.sequenceNames);
            if (result.numIterations() != expectedIterations || resultGtScale.numIterations() != expectedIterations) {
                EvalLogger.info("Evaluation snapshot " + file + " holds " + result.numIterations()
                        + " iterations, " + expectedIterations + " requested --> re-evaluating");
                return Optional.empty();
            }
            return Optional.of(new RunEvaluation(result, resultGtScale));
        } catch (IllegalArgumentException | NullPointerException e) {
            EvalLogger.warning("Ignoring inconsistent evaluation snapshot " + file + ": " + e.getMessage());
            return Optional.empty();
        }
    }

    /** Writes the snapshot of {@code evaluation}, replacing any earlier one. */
    public void save(Path runFolder, RunEvaluation evaluation) throws IOException {
        Path file = snapshotFile(runFolder);
        Files.createDirectories(file.getParent());

        Snapshot snapshot = new Snapshot();
        snapshot.formatVersion = FORMAT_VERSION;
        snapshot.sequenceNames = evaluation.estimatedScale().sequenceNames();
        snapshot.results = GridSet.of(evaluation.estimatedScale());
        snapshot.resultsGtScale = GridSet.of(evaluation.groundtruthScale());

        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            gson.toJson(snapshot, writer);
        }
        EvalLogger.debug("Saved evaluation snapshot " + file);
    }

    // Field names are the on-disk keys.
    static final class Snapshot {
        Integer formatVersion;
        List<String> sequenceNames;
        GridSet results;
        GridSet resultsGtScale;
    }

    static final class GridSet {
        double[][] error;
        double[][] scale;
        double[][] scaleError;
        double[][] percentageDone;

        static GridSet of(EvaluationResult result) {
            GridSet set = new GridSet();
            set.error = result.errors().toArray();
            set.scale = result.scales().toArray();
            set.scaleError = result.scaleErrors().toArray();
            set.percentageDone = result.percentageDone().toArray();
            return set;
        }

        EvaluationResult toResult(Path runFolder, Dataset dataset, List<String> sequenceNames) {
            return new EvaluationResult(runFolder, dataset, sequenceNames,
                    MeasurementGrid.of(error),
                    MeasurementGrid.of(scale),
                    MeasurementGrid.of(scaleError),
                    MeasurementGrid.of(percentageDone));
        }
    }
}
