package groundtruth;

/**
 * Static description of one benchmark sequence.
 *
 * @param name             result folder name, including the dataset prefix
 * @param startFrame       first evaluated frame (index into the times file)
 * @param endFrame         last evaluated frame, or {@link #LAST_FRAME} for the end of the times file
 * @param trajectoryLength length of the groundtruth trajectory in metres, NaN when unknown
 */
public record SequenceSpec(String name, int startFrame, int endFrame, double trajectoryLength) {
    public static final int LAST_FRAME = -1;

    public boolean hasTrajectoryLength() {
        return !Double.isNaN(trajectoryLength);
    }
}
