package groundtruth;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Supported benchmarks. Each variant carries its sequence table, the completion threshold below which
 * a run counts as failed, and whether estimate timestamps may stay unassociated during alignment.
 */
public enum Dataset {
    // Threshold taken over from the DSO Matlab evaluation tools.
    EUROC("euroc", "euroc", 0.8, false, DatasetSequences.euroc()),
    // Larger threshold so that both the start and the end of the sequence are evaluated.
    TUMVI("tumvi", "tumvi", 0.9, true, DatasetSequences.tumvi()),
    FOUR_SEASONS("four_seasons", "4seasons", 0.9, true, DatasetSequences.fourSeasons());

    private final String displayName;
    private final String directoryName;
    private final double completionThreshold;
    private final boolean allowUnassociated;
    private final List<SequenceSpec> sequences;

    Dataset(String displayName, String directoryName, double completionThreshold,
            boolean allowUnassociated, List<SequenceSpec> sequences) {
        this.displayName = displayName;
        this.directoryName = directoryName;
        this.completionThreshold = completionThreshold;
        this.allowUnassociated = allowUnassociated;
        this.sequences = sequences;
    }

    public String displayName() { return displayName; }
    public String directoryName() { return directoryName; }
    public double completionThreshold() { return completionThreshold; }
    public boolean allowUnassociated() { return allowUnassociated; }
    public List<SequenceSpec> sequences() { return sequences; }

    /**
     * Maps a free-form dataset label (e.g. {@code "4seasonsCR"}, {@code "tumvi"}) to a dataset by
     * case-insensitive containment, checked in the order tumvi, four_seasons, euroc.
     */
    public static Optional<Dataset> match(String label) {
        if (label == null) return Optional.empty();
        String lower = label.toLowerCase(Locale.ROOT);
        if (lower.contains("tumvi")) return Optional.of(TUMVI);
        if (lower.contains("four_seasons") || lower.contains("4seasons")) return Optional.of(FOUR_SEASONS);
        if (lower.contains("euroc")) return Optional.of(EUROC);
        return Optional.empty();
    }

    // Exact name lookup for command line use.
    public static Dataset fromString(String value) {
        for (Dataset dataset : values()) {
            if (dataset.displayName.equalsIgnoreCase(value) || dataset.directoryName.equalsIgnoreCase(value)) {
                return dataset;
            }
        }
        throw new IllegalArgumentException("Unknown dataset: " + value);
    }
}
