package groundtruth;

import it.unimi.dsi.fastutil.doubles.Double2ObjectMap;
import it.unimi.dsi.fastutil.doubles.Double2ObjectRBTreeMap;
import it.unimi.dsi.fastutil.doubles.Double2ObjectSortedMap;
import it.unimi.dsi.fastutil.doubles.DoubleArrayList;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Pattern;

/**
 * Readers for the plain-text files of a run: TUM style trajectories
 * ({@code timestamp tx ty tz qx qy qz qw}) and frame times files.
 */
public final class TrajectoryFileReader {
    private static final Pattern SEPARATORS = Pattern.compile("[ \t,]+");

    private TrajectoryFileReader() {}

    /**
     * Reads a trajectory. Comment lines ({@code #}) and blank lines are skipped; a repeated timestamp
     * keeps the last pose. Lines need at least a timestamp and a position, a missing orientation
     * defaults to identity.
     */
    public static PoseTrack readTrajectory(Path file) throws IOException {
        Double2ObjectSortedMap<double[]> poses = new Double2ObjectRBTreeMap<>();
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            int lineNo = 0;
            while ((line = reader.readLine()) != null) {
                lineNo++;
                String trimmed = line.strip();
                if (trimmed.isEmpty() || trimmed.startsWith("#")) continue;
                String[] tokens = SEPARATORS.split(trimmed);
                if (tokens.length < 4) {
                    throw new IOException("Malformed pose in " + file + " at line " + lineNo + ": " + line);
                }
                double[] values = new double[8];
                values[7] = 1.0; // qw
                try {
                    for (int i = 0; i < Math.min(tokens.length, 8); i++) {
                        values[i] = Double.parseDouble(tokens[i]);
                    }
                } catch (NumberFormatException ex) {
                    throw new IOException("Malformed pose in " + file + " at line " + lineNo + ": " + line, ex);
                }
                for (double value : values) {
                    if (!Double.isFinite(value)) {
                        throw new IOException("Non-finite value in " + file + " at line " + lineNo + ": " + line);
                    }
                }
                poses.put(values[0], values);
            }
        }

        int n = poses.size();
        double[] timestamps = new double[n];
        double[][] positions = new double[n][];
        double[][] orientations = new double[n][];
        int i = 0;
        for (Double2ObjectMap.Entry<double[]> entry : poses.double2ObjectEntrySet()) {
            double[] v = entry.getValue();
            timestamps[i] = entry.getDoubleKey();
            positions[i] = new double[]{v[1], v[2], v[3]};
            orientations[i] = new double[]{v[4], v[5], v[6], v[7]};
            i++;
        }
        return new PoseTrack(timestamps, positions, orientations);
    }

    /** Reads the frame times of a times file: second space separated token of every non-comment line. */
    public static double[] readFrameTimes(Path file) throws IOException {
        DoubleArrayList times = new DoubleArrayList();
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.startsWith("#") || line.isBlank()) continue;
                String[] tokens = line.strip().split(" ");
                if (tokens.length < 2) {
                    throw new IOException("Times file " + file + " has a line without frame time: " + line);
                }
                try {
                    times.add(Double.parseDouble(tokens[1]));
                } catch (NumberFormatException ex) {
                    throw new IOException("Times file " + file + " has an unparsable frame time: " + line, ex);
                }
            }
        }
        return times.toDoubleArray();
    }
}
