package evaluation;

import java.util.Objects;

/**
 * The two evaluations of a run: aligned with the scale the run estimated, and re-aligned with the
 * groundtruth scale.
 */
public record RunEvaluation(EvaluationResult estimatedScale, EvaluationResult groundtruthScale) {
    public static final String GT_SCALE_PREFIX = "gt_scale_";

    public RunEvaluation {
        Objects.requireNonNull(estimatedScale, "estimatedScale");
        Objects.requireNonNull(groundtruthScale, "groundtruthScale");
    }

    // Labels both results for plot legends.
    public RunEvaluation rename(String name) {
        estimatedScale.setDisplayName(name);
        groundtruthScale.setDisplayName(name == null ? null : GT_SCALE_PREFIX + name);
        return this;
    }
}
