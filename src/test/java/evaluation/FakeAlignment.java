package evaluation;

import alignment.AlignmentAdapter;
import alignment.AlignmentException;
import alignment.AlignmentOutcome;
import alignment.AlignmentResult;
import groundtruth.PoseTrack;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Returns canned alignments keyed by estimate file name and records every call. */
final class FakeAlignment implements AlignmentAdapter {

    record Call(Path estimateFile, double scale, double maxTimeDifference, boolean allowUnassociated) {}

    private final Map<String, AlignmentResult> results = new HashMap<>();
    private final List<Call> calls = new ArrayList<>();

    FakeAlignment put(String estimateFileName, double rmse, double scale, double gtRmse, double gtScale,
                      double minTime, double maxTime) {
        results.put(estimateFileName, new AlignmentResult(Optional.of(new AlignmentOutcome(rmse, scale)),
                new AlignmentOutcome(gtRmse, gtScale), minTime, maxTime));
        return this;
    }

    FakeAlignment putGroundtruthScaleOnly(String estimateFileName, double gtRmse, double gtScale,
                                          double minTime, double maxTime) {
        results.put(estimateFileName, new AlignmentResult(Optional.empty(),
                new AlignmentOutcome(gtRmse, gtScale), minTime, maxTime));
        return this;
    }

    List<Call> calls() {
        return calls;
    }

    @Override
    public AlignmentResult align(PoseTrack groundtruth, Path estimateFile, double scale,
                                 double maxTimeDifference, boolean allowUnassociated) throws AlignmentException {
        calls.add(new Call(estimateFile, scale, maxTimeDifference, allowUnassociated));
        AlignmentResult result = results.get(estimateFile.getFileName().toString());
        if (result == null) {
            throw new AlignmentException("no canned alignment for " + estimateFile);
        }
        return result;
    }
}
