package evaluation;

import groundtruth.Dataset;
import groundtruth.SequenceSpec;
import utilities.EvalLogger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

// Derived views used for reporting and plotting.
public final class ResultSummaries {
    private ResultSummaries() {}

    /**
     * All errors of each result, flattened and sorted ascending. Results with more iterations than
     * the smallest one are cut to that count so the curves stay comparable.
     */
    public static List<double[]> sortedErrors(List<EvaluationResult> results) {
        if (results.isEmpty()) return List.of();
        int minIter = results.stream().mapToInt(EvaluationResult::numIterations).min().getAsInt();
        int maxIter = results.stream().mapToInt(EvaluationResult::numIterations).max().getAsInt();
        if (minIter != maxIter) {
            EvalLogger.warning("Not all evaluated results have the same number of iterations. Only using the first "
                    + minIter + " runs for each result");
        }

        List<double[]> sorted = new ArrayList<>(results.size());
        for (EvaluationResult result : results) {
            MeasurementGrid errors = result.errors();
            double[] flat = new double[minIter * errors.sequences()];
            int n = 0;
            for (int k = 0; k < minIter; k++) {
                for (int i = 0; i < errors.sequences(); i++) flat[n++] = errors.get(k, i);
            }
            Arrays.sort(flat);
            sorted.add(flat);
        }
        return sorted;
    }

    public static List<String> shortSequenceNames(Dataset dataset, List<String> sequenceNames) {
        return sequenceNames.stream().map(name -> shortSequenceName(dataset, name)).toList();
    }

    // mav_MH_01_easy -> MH_01, tumvi_dataset-room1_512_16 -> room1, 4seasons_office_... -> office_...
    public static String shortSequenceName(Dataset dataset, String name) {
        return switch (dataset) {
            case EUROC -> name.length() >= 9 ? name.substring(4, 9) : name;
            case TUMVI -> between(name, "tumvi_dataset-", "_512_16");
            case FOUR_SEASONS -> name.startsWith("4seasons_") ? name.substring("4seasons_".length()) : name;
        };
    }

    private static String between(String value, String begin, String end) {
        int from = value.indexOf(begin);
        int to = value.lastIndexOf(end);
        if (from < 0 || to < from + begin.length()) return value;
        return value.substring(from + begin.length(), to);
    }

    /**
     * Per sequence trajectory length / 100: dividing an error by it gives drift in percent of the
     * travelled distance.
     *
     * @throws IllegalArgumentException for datasets without known trajectory lengths, or unknown names
     */
    public static double[] driftNormalizer(EvaluationResult result) {
        Map<String, Double> lengths = new HashMap<>();
        for (SequenceSpec spec : result.dataset().sequences()) {
            if (spec.hasTrajectoryLength()) lengths.put(spec.name(), spec.trajectoryLength());
        }
        if (lengths.isEmpty()) {
            throw new IllegalArgumentException("Unsupported dataset for normalization: " + result.dataset().displayName());
        }
        List<String> names = result.sequenceNames();
        double[] normalizer = new double[names.size()];
        for (int i = 0; i < normalizer.length; i++) {
            Double length = lengths.get(names.get(i));
            if (length == null) {
                throw new IllegalArgumentException("No trajectory length known for " + names.get(i));
            }
            normalizer[i] = length / 100.0;
        }
        return normalizer;
    }

    public static double[] medianDriftPercent(EvaluationResult result) {
        double[] normalizer = driftNormalizer(result);
        double[] medians = result.medianErrors();
        for (int i = 0; i < medians.length; i++) medians[i] /= normalizer[i];
        return medians;
    }
}
