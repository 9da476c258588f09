import evaluation.EvaluationOrchestrator;
import evaluation.RunDescriptor;
import evaluation.RunEvaluation;
import utilities.EvalLogger;
import utilities.EvaluationOptions;
import utilities.ResultReporter;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Evaluates either a single run ({@code --run-folder --dataset --iterations}) or every run below
 * {@code --results-root}, prints per-sequence medians and optionally writes them to {@code --csv}.
 */
public final class EvaluateRuns {

    public static void main(String[] args) throws Exception {
        EvaluationOptions options = EvaluationOptions.parse(args);
        EvaluationOrchestrator orchestrator = EvaluationOrchestrator.withDefaults(options.groundtruthRoot());

        List<RunEvaluation> evaluations = new ArrayList<>();
        if (options.singleRun()) {
            evaluations.add(orchestrator.evaluateRun(options.runFolder(), options.dataset(), options.iterations(),
                    options.name(), options.reevaluate()));
        } else {
            List<RunDescriptor> runs = RunDescriptor.loadAll(options.resultsRoot());
            System.out.printf(Locale.ROOT, "Found %d run(s) under %s%n", runs.size(), options.resultsRoot());
            for (RunDescriptor run : runs) {
                if (!run.finished()) {
                    EvalLogger.warning("Run " + run.folder() + " has not finished, evaluating what exists");
                }
                RunEvaluation evaluation = orchestrator.evaluateWithConfig(run, options.reevaluate());
                evaluation.rename(run.folder().getFileName().toString());
                evaluations.add(evaluation);
            }
        }

        evaluations.forEach(ResultReporter::printConsoleSummary);
        if (options.csvOutput() != null) {
            Path csv = ResultReporter.writeCsv(options.csvOutput(), evaluations);
            System.out.printf(Locale.ROOT, "%nWrote %s%n", csv);
        }
    }
}
