package groundtruth;

import utilities.EvalLogger;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Groundtruth store laid out as {@code {root}/{dataset}/gtFiles/{sequence}.txt} and
 * {@code {root}/{dataset}/timesFiles/{sequence}.txt}. Sequence lists and thresholds come from
 * {@link Dataset}, not from run configs, so different configs are always compared with the same
 * parameters.
 */
public final class GroundtruthCatalog implements SequenceCatalog {
    public static final Path DEFAULT_ROOT = Path.of("groundtruth_files");

    private final Path root;

    public GroundtruthCatalog() {
        this(DEFAULT_ROOT);
    }

    public GroundtruthCatalog(Path root) {
        this.root = Objects.requireNonNull(root, "root");
    }

    public Path root() { return root; }

    public Path groundtruthFile(Dataset dataset, String sequenceName) {
        return root.resolve(dataset.directoryName()).resolve("gtFiles").resolve(sequenceName + ".txt");
    }

    public Path timesFile(Dataset dataset, String sequenceName) {
        return root.resolve(dataset.directoryName()).resolve("timesFiles").resolve(sequenceName + ".txt");
    }

    @Override
    public SequenceSet sequences(Dataset dataset) throws CatalogLoadException {
        Objects.requireNonNull(dataset, "dataset");
        List<SequenceSpec> specs = dataset.sequences();

        // Check everything first so a broken store is reported as a whole.
        List<Path> missing = new ArrayList<>();
        for (SequenceSpec spec : specs) {
            Path gt = groundtruthFile(dataset, spec.name());
            Path times = timesFile(dataset, spec.name());
            if (!Files.isRegularFile(gt)) missing.add(gt);
            if (!Files.isRegularFile(times)) missing.add(times);
        }
        if (!missing.isEmpty()) {
            throw new CatalogLoadException(String.format(Locale.ROOT,
                    "%d groundtruth file(s) missing for %s, e.g. %s", missing.size(), dataset.displayName(), missing.get(0)));
        }

        List<Sequence> sequences = new ArrayList<>(specs.size());
        for (SequenceSpec spec : specs) {
            sequences.add(Sequence.load(spec, timesFile(dataset, spec.name()), groundtruthFile(dataset, spec.name())));
        }
        EvalLogger.debug(String.format(Locale.ROOT, "Loaded %d %s sequences from %s",
                sequences.size(), dataset.displayName(), root));
        return new SequenceSet(sequences, dataset.completionThreshold());
    }
}
