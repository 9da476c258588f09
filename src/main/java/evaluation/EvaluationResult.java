package evaluation;

import groundtruth.Dataset;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Evaluation of one run: per (iteration, sequence) grids of error, scale, scale error and completed
 * fraction, plus per-sequence representative statistics.
 *
 * <p>The representative ("median") iteration of a sequence is the one whose error ranks at position
 * {@code iterations / 2} in ascending order, so for an even count the worse of the two middle runs is
 * chosen. {@link #medianScaleErrors()} reports the scale error of that run rather than an independent
 * median of scale errors. {@link #medianErrors()} is the ordinary median of the error column.
 */
public final class EvaluationResult {

    private final Path runFolder;
    private final Dataset dataset;
    private final List<String> sequenceNames;
    private final MeasurementGrid errors;
    private final MeasurementGrid scales;
    private final MeasurementGrid scaleErrors;
    private final MeasurementGrid percentageDone;

    private final double[] medianErrors;
    private final int[] medianIndex;
    private final double[] medianScaleErrors;

    private String displayName;

    public EvaluationResult(Path runFolder,
                            Dataset dataset,
                            List<String> sequenceNames,
                            MeasurementGrid errors,
                            MeasurementGrid scales,
                            MeasurementGrid scaleErrors,
                            MeasurementGrid percentageDone) {
        this.runFolder = Objects.requireNonNull(runFolder, "runFolder");
        this.dataset = Objects.requireNonNull(dataset, "dataset");
        this.sequenceNames = List.copyOf(sequenceNames);
        this.errors = Objects.requireNonNull(errors, "errors").copy();
        this.scales = Objects.requireNonNull(scales, "scales").copy();
        this.scaleErrors = Objects.requireNonNull(scaleErrors, "scaleErrors").copy();
        this.percentageDone = Objects.requireNonNull(percentageDone, "percentageDone").copy();
        if (!errors.sameShape(scales) || !errors.sameShape(scaleErrors) || !errors.sameShape(percentageDone)) {
            throw new IllegalArgumentException("all grids of a result must share one shape");
        }
        if (errors.sequences() != this.sequenceNames.size()) {
            throw new IllegalArgumentException(String.format(
                    "grids have %d sequence columns but %d sequence names were given",
                    errors.sequences(), this.sequenceNames.size()));
        }

        int numSequences = errors.sequences();
        this.medianErrors = new double[numSequences];
        this.medianIndex = new int[numSequences];
        this.medianScaleErrors = new double[numSequences];
        for (int i = 0; i < numSequences; i++) {
            double[] column = errors.column(i);
            medianErrors[i] = median(column);
            medianIndex[i] = upperMedianIndex(column);
            medianScaleErrors[i] = scaleErrors.get(medianIndex[i], i);
        }
    }

    /** Median with numpy semantics; infinite entries sort last. */
    static double median(double[] values) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        int n = sorted.length;
        if (n % 2 == 1) return sorted[n / 2];
        double lower = sorted[n / 2 - 1];
        double upper = sorted[n / 2];
        // avoids inf - inf when both middle values are unmeasured
        return lower == upper ? lower : (lower + upper) / 2.0;
    }

    /** Index of the value ranked {@code n / 2} in ascending order, ties broken by index. */
    static int upperMedianIndex(double[] values) {
        Integer[] order = new Integer[values.length];
        for (int k = 0; k < order.length; k++) order[k] = k;
        Arrays.sort(order, (a, b) -> {
            int byValue = Double.compare(values[a], values[b]);
            return byValue != 0 ? byValue : Integer.compare(a, b);
        });
        return order[values.length / 2];
    }

    public Path runFolder() { return runFolder; }
    public Dataset dataset() { return dataset; }
    public List<String> sequenceNames() { return sequenceNames; }

    public int numIterations() { return errors.iterations(); }
    public int numSequences() { return errors.sequences(); }

    public MeasurementGrid errors() { return errors.copy(); }
    public MeasurementGrid scales() { return scales.copy(); }
    public MeasurementGrid scaleErrors() { return scaleErrors.copy(); }
    public MeasurementGrid percentageDone() { return percentageDone.copy(); }

    public double[] medianErrors() { return medianErrors.clone(); }
    public int[] medianIndex() { return medianIndex.clone(); }
    public double[] medianScaleErrors() { return medianScaleErrors.clone(); }

    public String displayName() { return displayName; }

    public void setDisplayName(String displayName) {
        this.displayName = displayName;
    }

    @Override
    public String toString() {
        return (displayName != null ? displayName : runFolder.getFileName().toString())
                + " (" + dataset.displayName() + ", " + numIterations() + "x" + numSequences() + ")";
    }
}
