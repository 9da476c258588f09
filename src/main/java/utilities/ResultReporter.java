package utilities;

import evaluation.EvaluationResult;
import evaluation.ResultSummaries;
import evaluation.RunEvaluation;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Console and CSV reporting of evaluated runs.
 */
public final class ResultReporter {
    private ResultReporter() {}

    public static void printConsoleSummary(RunEvaluation evaluation) {
        EvaluationResult result = evaluation.estimatedScale();
        EvaluationResult gtScale = evaluation.groundtruthScale();
        List<String> shortNames = ResultSummaries.shortSequenceNames(result.dataset(), result.sequenceNames());
        double[] medianErrors = result.medianErrors();
        double[] medianScaleErrors = result.medianScaleErrors();
        int[] medianIndex = result.medianIndex();
        double[] medianGtErrors = gtScale.medianErrors();

        System.out.println();
        System.out.printf(Locale.ROOT, "Results for %s (%d iterations)%n", label(result), result.numIterations());
        System.out.printf(Locale.ROOT, "  %-28s %12s %12s %8s %14s %6s%n",
                "sequence", "median_ate", "scale_err_%", "median", "gt_scale_ate", "valid");
        for (int i = 0; i < shortNames.size(); i++) {
            System.out.printf(Locale.ROOT, "  %-28s %12.4f %12.3f %8d %14.4f %3d/%-2d%n",
                    shortNames.get(i), medianErrors[i], medianScaleErrors[i], medianIndex[i], medianGtErrors[i],
                    result.errors().countMeasured(i), result.numIterations());
        }
    }

    public static Path writeCsv(Path csvPath, List<RunEvaluation> evaluations) throws IOException {
        List<List<Object>> rows = new ArrayList<>();
        rows.add(List.of("run", "dataset", "sequence", "median_error", "median_scale_error", "median_index",
                "median_error_gt_scale", "valid_iterations", "iterations"));
        for (RunEvaluation evaluation : evaluations) {
            EvaluationResult result = evaluation.estimatedScale();
            double[] medianErrors = result.medianErrors();
            double[] medianScaleErrors = result.medianScaleErrors();
            int[] medianIndex = result.medianIndex();
            double[] medianGtErrors = evaluation.groundtruthScale().medianErrors();
            for (int i = 0; i < result.numSequences(); i++) {
                List<Object> row = new ArrayList<>();
                row.add(label(result));
                row.add(result.dataset().displayName());
                row.add(result.sequenceNames().get(i));
                row.add(medianErrors[i]);
                row.add(medianScaleErrors[i]);
                row.add(medianIndex[i]);
                row.add(medianGtErrors[i]);
                row.add(result.errors().countMeasured(i));
                row.add(result.numIterations());
                rows.add(row);
            }
        }
        CsvUtil.writeRows(csvPath, rows);
        return csvPath;
    }

    private static String label(EvaluationResult result) {
        return result.displayName() != null ? result.displayName() : String.valueOf(result.runFolder().getFileName());
    }
}
