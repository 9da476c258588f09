package evaluation;

import groundtruth.PoseTrack;
import groundtruth.Sequence;
import groundtruth.SequenceSet;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/** Synthetic run folders and sequences. */
final class RunFixtures {
    static final double DURATION = 10.0;

    private RunFixtures() {}

    static Sequence sequence(String name) {
        PoseTrack track = PoseTrack.ofPositions(new double[]{0, 5, 10},
                new double[][]{{0, 0, 0}, {1, 0, 0}, {2, 1, 0}});
        return new Sequence(name, 0, 2, null, null, track, DURATION);
    }

    static SequenceSet sequences(double threshold, String... names) {
        List<Sequence> sequences = new ArrayList<>();
        for (String name : names) sequences.add(sequence(name));
        return new SequenceSet(sequences, threshold);
    }

    static String estimateName(String sequence, int iteration) {
        return sequence + "_" + iteration + ".txt";
    }

    static Path writeEstimate(Path runFolder, String sequence, int iteration) throws IOException {
        Path file = ResultAggregator.estimateFile(runFolder, sequence, iteration);
        Files.createDirectories(file.getParent());
        Files.writeString(file, "0.0 0 0 0 0 0 0 1\n");
        return file;
    }

    static Path writeScale(Path runFolder, String sequence, int iteration, String content) throws IOException {
        Path file = ResultAggregator.scaleFile(runFolder, sequence, iteration);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        return file;
    }
}
