package evaluation;

import alignment.AlignmentAdapter;
import alignment.AlignmentException;
import alignment.AlignmentOutcome;
import alignment.AlignmentResult;
import groundtruth.Dataset;
import groundtruth.Sequence;
import groundtruth.SequenceSet;
import utilities.EvalLogger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Fills the (iteration x sequence) grids of a run. Every cell is evaluated on its own: a missing or
 * broken input leaves that cell unmeasured and is logged, it never aborts the run. Cells that cover
 * less than the dataset's completion threshold of their sequence are invalidated.
 */
public final class ResultAggregator {
    static final String RESULTS_DIR = "results";
    static final String SCALE_FILE = "scalesdso.txt";
    static final double DEFAULT_SCALE = 1.0;

    private final AlignmentAdapter alignment;
    private final ScaleReader scaleReader;
    private final double maxTimeDifference;

    public ResultAggregator(AlignmentAdapter alignment) {
        this(alignment, new ScaleReader(), AlignmentAdapter.DEFAULT_MAX_TIME_DIFFERENCE);
    }

    public ResultAggregator(AlignmentAdapter alignment, ScaleReader scaleReader, double maxTimeDifference) {
        this.alignment = Objects.requireNonNull(alignment, "alignment");
        this.scaleReader = Objects.requireNonNull(scaleReader, "scaleReader");
        this.maxTimeDifference = maxTimeDifference;
    }

    public static Path estimateFile(Path runFolder, String sequenceName, int iteration) {
        return runFolder.resolve(RESULTS_DIR).resolve(sequenceName + "_" + iteration + ".txt");
    }

    public static Path scaleFile(Path runFolder, String sequenceName, int iteration) {
        return runFolder.resolve(sequenceName + "_" + iteration).resolve(SCALE_FILE);
    }

    /**
     * Symmetric scale error in percent: a factor-two over- and underestimate both give 100.
     */
    public static double scaleError(double estimatedScale, double groundtruthScale) {
        double ratio = groundtruthScale / estimatedScale;
        if (ratio < 1) {
            ratio = 1.0 / ratio;
        }
        return (ratio - 1) * 100;
    }

    public RunEvaluation aggregate(Path runFolder, Dataset dataset, SequenceSet sequenceSet, int numIter) {
        Objects.requireNonNull(runFolder, "runFolder");
        Objects.requireNonNull(dataset, "dataset");
        Objects.requireNonNull(sequenceSet, "sequenceSet");
        if (numIter < 1) {
            throw new IllegalArgumentException("numIter must be at least 1, got " + numIter);
        }

        List<Sequence> sequences = sequenceSet.sequences();
        int numSeq = sequences.size();
        Grids grids = new Grids(numIter, numSeq);

        for (int i = 0; i < numSeq; i++) {
            Sequence sequence = sequences.get(i);
            System.out.printf(Locale.ROOT, "  [%d/%d] %s%n", i + 1, numSeq, sequence.name());
            for (int k = 0; k < numIter; k++) {
                evaluateCell(runFolder, dataset, sequence, sequenceSet.completionThreshold(), k, i, grids);
            }
        }

        List<String> names = sequenceSet.names();
        EvaluationResult result = new EvaluationResult(runFolder, dataset, names,
                grids.error, grids.scale, grids.scaleError, grids.percentageDone);
        EvaluationResult resultGtScale = new EvaluationResult(runFolder, dataset, names,
                grids.errorGtScale, grids.gtScale, grids.scaleErrorGtScale, grids.percentageDone);
        return new RunEvaluation(result, resultGtScale);
    }

    private void evaluateCell(Path runFolder, Dataset dataset, Sequence sequence, double completionThreshold,
                              int k, int i, Grids grids) {
        Path estimate = estimateFile(runFolder, sequence.name(), k);
        if (!Files.exists(estimate)) {
            EvalLogger.warning("Skipping because it does not exist: " + estimate);
            return;
        }

        double scale;
        Path scaleFile = scaleFile(runFolder, sequence.name(), k);
        if (!Files.exists(scaleFile)) {
            EvalLogger.warning("No scale file " + scaleFile + " --> assuming scale of " + DEFAULT_SCALE);
            scale = DEFAULT_SCALE;
        } else {
            try {
                scale = scaleReader.readScale(scaleFile);
            } catch (IOException e) {
                EvalLogger.warning("Could not get scale for " + estimate + " --> skipping: " + e.getMessage());
                return;
            }
        }

        AlignmentResult aligned;
        try {
            aligned = alignment.align(sequence.groundtruth(), estimate, scale, maxTimeDifference,
                    dataset.allowUnassociated());
        } catch (AlignmentException e) {
            EvalLogger.warning("Alignment failed for " + estimate + " --> skipping: " + e.getMessage());
            return;
        }

        double percentageDone = aligned.associatedSpan() / sequence.duration();
        Optional<AlignmentOutcome> result = aligned.estimatedScale();
        AlignmentOutcome resultGtScale = aligned.groundtruthScale();
        // An incomplete trajectory never counts as a success, however small its error.
        if (percentageDone < completionThreshold) {
            EvalLogger.info(String.format(Locale.ROOT, "%s iteration %d covers %.1f%% of the sequence --> invalidated",
                    sequence.name(), k, percentageDone * 100));
            result = result.map(AlignmentOutcome::invalidated);
            resultGtScale = resultGtScale.invalidated();
        }

        double error = MeasurementGrid.UNMEASURED;
        double estimatedScale = MeasurementGrid.UNMEASURED;
        double estimatedScaleError = MeasurementGrid.UNMEASURED;
        if (result.isPresent()) {
            AlignmentOutcome outcome = result.get();
            error = outcome.rmse();
            estimatedScale = outcome.scale();
            estimatedScaleError = scaleError(outcome.scale(), resultGtScale.scale());
        }
        // NaN cannot be stored; the cell is left unmeasured as a whole.
        if (Double.isNaN(percentageDone) || Double.isNaN(error) || Double.isNaN(estimatedScale)
                || Double.isNaN(estimatedScaleError) || Double.isNaN(resultGtScale.rmse())
                || Double.isNaN(resultGtScale.scale())) {
            EvalLogger.warning("Alignment of " + estimate + " produced NaN --> skipping");
            return;
        }

        grids.percentageDone.set(k, i, percentageDone);
        if (result.isPresent()) {
            grids.error.set(k, i, error);
            grids.scale.set(k, i, estimatedScale);
            grids.scaleError.set(k, i, estimatedScaleError);
        } else {
            EvalLogger.warning("Only the groundtruth-scale alignment is available for " + estimate);
        }
        grids.errorGtScale.set(k, i, resultGtScale.rmse());
        grids.gtScale.set(k, i, resultGtScale.scale());
        grids.scaleErrorGtScale.set(k, i, 0.0);
    }

    // Rows are iterations, columns are sequences.
    private static final class Grids {
        final MeasurementGrid error;
        final MeasurementGrid scale;
        final MeasurementGrid scaleError;
        final MeasurementGrid percentageDone;
        final MeasurementGrid errorGtScale;
        final MeasurementGrid gtScale;
        final MeasurementGrid scaleErrorGtScale;

        Grids(int numIter, int numSeq) {
            error = MeasurementGrid.unmeasured(numIter, numSeq);
            scale = MeasurementGrid.unmeasured(numIter, numSeq);
            scaleError = MeasurementGrid.unmeasured(numIter, numSeq);
            percentageDone = MeasurementGrid.unmeasured(numIter, numSeq);
            errorGtScale = MeasurementGrid.unmeasured(numIter, numSeq);
            gtScale = MeasurementGrid.unmeasured(numIter, numSeq);
            scaleErrorGtScale = MeasurementGrid.unmeasured(numIter, numSeq);
        }
    }
}
