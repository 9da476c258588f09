package groundtruth;

import java.util.List;

// Ordered sequences of a dataset together with its completion threshold.
public record SequenceSet(List<Sequence> sequences, double completionThreshold) {
    public SequenceSet {
        sequences = List.copyOf(sequences);
        if (sequences.isEmpty()) {
            throw new IllegalArgumentException("a sequence set needs at least one sequence");
        }
    }

    public int size() {
        return sequences.size();
    }

    public List<String> names() {
        return sequences.stream().map(Sequence::name).toList();
    }
}
