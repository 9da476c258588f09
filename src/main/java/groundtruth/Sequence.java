package groundtruth;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * One benchmark sequence with its preloaded groundtruth. {@code duration} is the time between the
 * evaluated start and end frame.
 */
public final class Sequence {

    private final String name;
    private final int startFrame;
    private final int endFrame;
    private final Path timesFile;
    private final Path groundtruthFile;
    private final PoseTrack groundtruth;
    private final double duration;

    public Sequence(String name, int startFrame, int endFrame, Path timesFile, Path groundtruthFile,
                    PoseTrack groundtruth, double duration) {
        this.name = Objects.requireNonNull(name, "name");
        this.startFrame = startFrame;
        this.endFrame = endFrame;
        this.timesFile = timesFile;
        this.groundtruthFile = groundtruthFile;
        this.groundtruth = Objects.requireNonNull(groundtruth, "groundtruth");
        if (!(duration > 0.0)) {
            throw new IllegalArgumentException("Sequence " + name + " has non-positive duration " + duration);
        }
        this.duration = duration;
    }

    /**
     * Loads groundtruth and frame times of {@code spec}. The end frame defaults to the last frame of
     * the times file.
     */
    public static Sequence load(SequenceSpec spec, Path timesFile, Path groundtruthFile) throws CatalogLoadException {
        PoseTrack track;
        double[] times;
        try {
            track = TrajectoryFileReader.readTrajectory(groundtruthFile);
        } catch (IOException e) {
            throw new CatalogLoadException("Cannot load groundtruth " + groundtruthFile + " for " + spec.name(), e);
        }
        try {
            times = TrajectoryFileReader.readFrameTimes(timesFile);
        } catch (IOException e) {
            throw new CatalogLoadException("Cannot load times file " + timesFile + " for " + spec.name(), e);
        }
        if (track.isEmpty()) {
            throw new CatalogLoadException("Groundtruth " + groundtruthFile + " contains no poses");
        }

        int endFrame = spec.endFrame() == SequenceSpec.LAST_FRAME ? times.length - 1 : spec.endFrame();
        if (spec.startFrame() < 0 || spec.startFrame() >= times.length || endFrame >= times.length
                || endFrame <= spec.startFrame()) {
            throw new CatalogLoadException(String.format(Locale.ROOT,
                    "Frames [%d, %d] of %s do not fit times file %s with %d frames",
                    spec.startFrame(), endFrame, spec.name(), timesFile, times.length));
        }
        double duration = times[endFrame] - times[spec.startFrame()];
        try {
            return new Sequence(spec.name(), spec.startFrame(), endFrame, timesFile, groundtruthFile, track, duration);
        } catch (IllegalArgumentException e) {
            throw new CatalogLoadException("Invalid frame times in " + timesFile, e);
        }
    }

    public String name() { return name; }
    public int startFrame() { return startFrame; }
    public int endFrame() { return endFrame; }
    public Path timesFile() { return timesFile; }
    public Path groundtruthFile() { return groundtruthFile; }
    public PoseTrack groundtruth() { return groundtruth; }
    public double duration() { return duration; }

    @Override
    public String toString() {
        return name;
    }
}
