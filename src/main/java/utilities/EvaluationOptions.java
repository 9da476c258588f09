package utilities;

import groundtruth.Dataset;
import groundtruth.GroundtruthCatalog;

import java.nio.file.Path;

// Parsed options for EvaluateRuns.
public record EvaluationOptions(
        Path runFolder,              // single run to evaluate, or null
        Path resultsRoot,            // folder whose children are runs with setup/setup.yaml, or null
        Dataset dataset,             // required with runFolder
        int iterations,              // required with runFolder
        String name,
        boolean reevaluate,
        Path groundtruthRoot,
        Path csvOutput) {             // null: console only

    public static EvaluationOptions parse(String[] args) {
        Path runFolder = null;
        Path resultsRoot = null;
        Dataset dataset = null;
        int iterations = 0;
        String name = null;
        boolean reevaluate = false;
        Path groundtruthRoot = GroundtruthCatalog.DEFAULT_ROOT;
        Path csvOutput = null;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (!arg.startsWith("--")) throw new IllegalArgumentException("Unexpected argument: " + arg);
            String key; String value;
            int eq = arg.indexOf('=');
            if (eq >= 0) { key = arg.substring(2, eq); value = arg.substring(eq + 1);} else {
                key = arg.substring(2);
                if ("reevaluate".equals(key)) {
                    value = "true";
                } else {
                    if (i + 1 >= args.length) throw new IllegalArgumentException("Missing value for option --" + key);
                    value = args[++i];
                }
            }

            switch (key) {
                case "run-folder", "run" -> runFolder = Path.of(value);
                case "results-root" -> resultsRoot = Path.of(value);
                case "dataset" -> dataset = Dataset.fromString(value);
                case "iterations", "num-iter" -> iterations = Integer.parseInt(value);
                case "name" -> name = value;
                case "reevaluate", "always-reevaluate" -> reevaluate = Boolean.parseBoolean(value);
                case "groundtruth-root", "gt-root" -> groundtruthRoot = Path.of(value);
                case "csv" -> csvOutput = Path.of(value);
                default -> throw new IllegalArgumentException("Unknown option --" + key);
            }
        }

        if ((runFolder == null) == (resultsRoot == null)) {
            throw new IllegalArgumentException("Specify exactly one of --run-folder and --results-root");
        }
        if (runFolder != null) {
            if (dataset == null) throw new IllegalArgumentException("--dataset is required with --run-folder");
            if (iterations < 1) throw new IllegalArgumentException("--iterations must be at least 1");
        }
        return new EvaluationOptions(runFolder, resultsRoot, dataset, iterations, name, reevaluate,
                groundtruthRoot, csvOutput);
    }

    public boolean singleRun() {
        return runFolder != null;
    }
}
