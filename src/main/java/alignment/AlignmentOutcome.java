package alignment;

/**
 * Result of one alignment.
 *
 * @param rmse  root mean squared position error after alignment
 * @param scale scale of the estimate this outcome stands for
 */
public record AlignmentOutcome(double rmse, double scale) {

    public AlignmentOutcome withRmse(double newRmse) {
        return new AlignmentOutcome(newRmse, scale);
    }

    public AlignmentOutcome invalidated() {
        return withRmse(Double.POSITIVE_INFINITY);
    }
}
