package groundtruth;

import java.util.Arrays;
import java.util.Objects;

/**
 * Time-ordered poses of one trajectory. Timestamps are strictly increasing; positions are
 * {@code [x, y, z]} and orientations {@code [qx, qy, qz, qw]}.
 */
public final class PoseTrack {

    private final double[] timestamps;
    private final double[][] positions;
    private final double[][] orientations;

    PoseTrack(double[] timestamps, double[][] positions, double[][] orientations) {
        this.timestamps = Objects.requireNonNull(timestamps, "timestamps");
        this.positions = Objects.requireNonNull(positions, "positions");
        this.orientations = Objects.requireNonNull(orientations, "orientations");
        if (positions.length != timestamps.length || orientations.length != timestamps.length) {
            throw new IllegalArgumentException("timestamps, positions and orientations differ in length");
        }
        for (int i = 1; i < timestamps.length; i++) {
            if (timestamps[i] <= timestamps[i - 1]) {
                throw new IllegalArgumentException("timestamps must be strictly increasing at index " + i);
            }
        }
    }

    // Track with identity orientations, mostly for synthetic data.
    public static PoseTrack ofPositions(double[] timestamps, double[][] positions) {
        double[][] orientations = new double[timestamps.length][];
        for (int i = 0; i < orientations.length; i++) orientations[i] = new double[]{0, 0, 0, 1};
        double[][] copy = new double[positions.length][];
        for (int i = 0; i < positions.length; i++) copy[i] = Arrays.copyOf(positions[i], 3);
        return new PoseTrack(timestamps.clone(), copy, orientations);
    }

    public int size() { return timestamps.length; }
    public boolean isEmpty() { return timestamps.length == 0; }

    public double timestamp(int index) { return timestamps[index]; }

    public double[] position(int index) { return positions[index].clone(); }

    public double[] orientation(int index) { return orientations[index].clone(); }

    /** Index of the first pose with timestamp >= {@code time}; {@code size()} if there is none. */
    public int lowerBound(double time) {
        int lo = 0, hi = timestamps.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (timestamps[mid] < time) lo = mid + 1; else hi = mid;
        }
        return lo;
    }
}
