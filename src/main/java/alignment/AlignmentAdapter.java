package alignment;

import groundtruth.PoseTrack;

import java.nio.file.Path;

public interface AlignmentAdapter {

    // Association tolerance used by the evaluation, in seconds.
    double DEFAULT_MAX_TIME_DIFFERENCE = 0.05;

    /**
     * Aligns the trajectory in {@code estimateFile}, multiplied by {@code scale}, to {@code groundtruth}.
     *
     * @param maxTimeDifference  largest timestamp difference for two poses to be associated
     * @param allowUnassociated  whether estimate poses without a groundtruth partner are tolerated
     * @return the estimated-scale and groundtruth-scale outcomes and the associated time interval
     */
    AlignmentResult align(PoseTrack groundtruth,
                          Path estimateFile,
                          double scale,
                          double maxTimeDifference,
                          boolean allowUnassociated) throws AlignmentException;
}
