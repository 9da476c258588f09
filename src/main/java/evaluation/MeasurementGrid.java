package evaluation;

import java.util.Arrays;
import java.util.Objects;

/**
 * Iterations x sequences table of one measured quantity. A cell is either a finite value or
 * {@link #UNMEASURED} (positive infinity), which stands for "not measured or invalidated". NaN is
 * never stored.
 */
public final class MeasurementGrid {
    public static final double UNMEASURED = Double.POSITIVE_INFINITY;

    private final double[][] cells;

    private MeasurementGrid(double[][] cells) {
        this.cells = cells;
    }

    public static MeasurementGrid unmeasured(int iterations, int sequences) {
        return filled(iterations, sequences, UNMEASURED);
    }

    public static MeasurementGrid filled(int iterations, int sequences, double value) {
        if (iterations < 1 || sequences < 1) {
            throw new IllegalArgumentException("grid needs at least one iteration and one sequence, got "
                    + iterations + "x" + sequences);
        }
        checkValue(value);
        double[][] cells = new double[iterations][sequences];
        for (double[] row : cells) Arrays.fill(row, value);
        return new MeasurementGrid(cells);
    }

    /** Copies {@code values}; rows must be non-empty, equally long and free of NaN. */
    public static MeasurementGrid of(double[][] values) {
        Objects.requireNonNull(values, "values");
        if (values.length == 0 || values[0] == null || values[0].length == 0) {
            throw new IllegalArgumentException("grid must not be empty");
        }
        double[][] cells = new double[values.length][];
        for (int k = 0; k < values.length; k++) {
            if (values[k] == null || values[k].length != values[0].length) {
                throw new IllegalArgumentException("grid row " + k + " differs in length");
            }
            for (double v : values[k]) checkValue(v);
            cells[k] = values[k].clone();
        }
        return new MeasurementGrid(cells);
    }

    public int iterations() { return cells.length; }
    public int sequences() { return cells[0].length; }

    public double get(int iteration, int sequence) {
        return cells[iteration][sequence];
    }

    public void set(int iteration, int sequence, double value) {
        checkValue(value);
        cells[iteration][sequence] = value;
    }

    public boolean isMeasured(int iteration, int sequence) {
        return Double.isFinite(cells[iteration][sequence]);
    }

    public double[] column(int sequence) {
        double[] column = new double[cells.length];
        for (int k = 0; k < cells.length; k++) column[k] = cells[k][sequence];
        return column;
    }

    public int countMeasured(int sequence) {
        int count = 0;
        for (double[] row : cells) if (Double.isFinite(row[sequence])) count++;
        return count;
    }

    public boolean sameShape(MeasurementGrid other) {
        return iterations() == other.iterations() && sequences() == other.sequences();
    }

    public double[][] toArray() {
        double[][] copy = new double[cells.length][];
        for (int k = 0; k < cells.length; k++) copy[k] = cells[k].clone();
        return copy;
    }

    public MeasurementGrid copy() {
        return new MeasurementGrid(toArray());
    }

    private static void checkValue(double value) {
        if (Double.isNaN(value)) {
            throw new IllegalArgumentException("NaN is not a valid measurement, use UNMEASURED");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MeasurementGrid other)) return false;
        return Arrays.deepEquals(cells, other.cells);
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(cells);
    }

    @Override
    public String toString() {
        return Arrays.deepToString(cells);
    }
}
