package alignment;

import java.util.Objects;
import java.util.Optional;

/**
 * Both alignments of one estimate. The estimated-scale outcome may be absent when only the
 * groundtruth-scale alignment succeeded.
 */
public record AlignmentResult(Optional<AlignmentOutcome> estimatedScale,
                              AlignmentOutcome groundtruthScale,
                              double minAssociatedTime,
                              double maxAssociatedTime) {

    public AlignmentResult {
        Objects.requireNonNull(estimatedScale, "estimatedScale");
        Objects.requireNonNull(groundtruthScale, "groundtruthScale");
        if (maxAssociatedTime < minAssociatedTime) {
            throw new IllegalArgumentException("associated interval is reversed");
        }
    }

    public double associatedSpan() {
        return maxAssociatedTime - minAssociatedTime;
    }
}
