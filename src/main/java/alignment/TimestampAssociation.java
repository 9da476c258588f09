package alignment;

import groundtruth.PoseTrack;
import it.unimi.dsi.fastutil.ints.IntArrayList;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Greedy timestamp association: all pairs closer than the tolerance are candidates, accepted by
 * increasing time difference, each pose used at most once. Matches are returned in estimate order.
 */
public final class TimestampAssociation {

    private final int[] estimateIndices;
    private final int[] groundtruthIndices;

    private TimestampAssociation(int[] estimateIndices, int[] groundtruthIndices) {
        this.estimateIndices = estimateIndices;
        this.groundtruthIndices = groundtruthIndices;
    }

    public static TimestampAssociation associate(PoseTrack estimate, PoseTrack groundtruth, double maxDifference) {
        record Candidate(int est, int gt, double diff) {}

        List<Candidate> candidates = new ArrayList<>();
        for (int e = 0; e < estimate.size(); e++) {
            double t = estimate.timestamp(e);
            int g = groundtruth.lowerBound(t - maxDifference);
            for (; g < groundtruth.size(); g++) {
                double diff = Math.abs(groundtruth.timestamp(g) - t);
                if (groundtruth.timestamp(g) - t >= maxDifference) break;
                if (diff < maxDifference) candidates.add(new Candidate(e, g, diff));
            }
        }
        candidates.sort(Comparator.comparingDouble(Candidate::diff)
                .thenComparingInt(Candidate::est)
                .thenComparingInt(Candidate::gt));

        boolean[] estUsed = new boolean[estimate.size()];
        boolean[] gtUsed = new boolean[groundtruth.size()];
        int[] partner = new int[estimate.size()];
        for (Candidate c : candidates) {
            if (estUsed[c.est()] || gtUsed[c.gt()]) continue;
            estUsed[c.est()] = true;
            gtUsed[c.gt()] = true;
            partner[c.est()] = c.gt();
        }

        IntArrayList est = new IntArrayList();
        IntArrayList gt = new IntArrayList();
        for (int e = 0; e < estimate.size(); e++) {
            if (estUsed[e]) {
                est.add(e);
                gt.add(partner[e]);
            }
        }
        return new TimestampAssociation(est.toIntArray(), gt.toIntArray());
    }

    public int size() { return estimateIndices.length; }

    public int estimateIndex(int match) { return estimateIndices[match]; }

    public int groundtruthIndex(int match) { return groundtruthIndices[match]; }
}
