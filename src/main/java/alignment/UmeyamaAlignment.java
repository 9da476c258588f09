package alignment;

import groundtruth.PoseTrack;
import groundtruth.TrajectoryFileReader;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularValueDecomposition;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

/**
 * Default {@link AlignmentAdapter}: associates estimate and groundtruth by timestamp and aligns the
 * associated positions in closed form (Umeyama 1991). The estimated-scale outcome uses a rigid
 * alignment of the scaled estimate; the groundtruth-scale outcome additionally fits the scale.
 */
public final class UmeyamaAlignment implements AlignmentAdapter {
    static final int MIN_ASSOCIATED_POSES = 3;

    @Override
    public AlignmentResult align(PoseTrack groundtruth,
                                 Path estimateFile,
                                 double scale,
                                 double maxTimeDifference,
                                 boolean allowUnassociated) throws AlignmentException {
        PoseTrack estimate;
        try {
            estimate = TrajectoryFileReader.readTrajectory(estimateFile);
        } catch (IOException e) {
            throw new AlignmentException("Cannot read estimate " + estimateFile, e);
        }
        return align(groundtruth, estimate, scale, maxTimeDifference, allowUnassociated);
    }

    public AlignmentResult align(PoseTrack groundtruth,
                                 PoseTrack estimate,
                                 double scale,
                                 double maxTimeDifference,
                                 boolean allowUnassociated) throws AlignmentException {
        if (!(scale > 0.0) || Double.isInfinite(scale)) {
            throw new AlignmentException("Scale must be positive and finite, got " + scale);
        }
        TimestampAssociation matches = TimestampAssociation.associate(estimate, groundtruth, maxTimeDifference);
        if (!allowUnassociated && matches.size() < estimate.size()) {
            throw new AlignmentException(String.format(Locale.ROOT,
                    "%d of %d estimate poses have no groundtruth within %.3fs",
                    estimate.size() - matches.size(), estimate.size(), maxTimeDifference));
        }
        if (matches.size() < MIN_ASSOCIATED_POSES) {
            throw new AlignmentException(String.format(Locale.ROOT,
                    "Only %d associated poses, at least %d needed", matches.size(), MIN_ASSOCIATED_POSES));
        }

        int n = matches.size();
        double[][] est = new double[n][];
        double[][] gt = new double[n][];
        double minTime = Double.POSITIVE_INFINITY;
        double maxTime = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < n; i++) {
            int e = matches.estimateIndex(i);
            double[] p = estimate.position(e);
            est[i] = new double[]{p[0] * scale, p[1] * scale, p[2] * scale};
            gt[i] = groundtruth.position(matches.groundtruthIndex(i));
            minTime = Math.min(minTime, estimate.timestamp(e));
            maxTime = Math.max(maxTime, estimate.timestamp(e));
        }

        Similarity rigid = fit(est, gt, false);
        Similarity similarity = fit(est, gt, true);
        AlignmentOutcome withEstimatedScale = new AlignmentOutcome(rmse(rigid, est, gt), scale);
        AlignmentOutcome withGroundtruthScale = new AlignmentOutcome(rmse(similarity, est, gt), scale * similarity.scale());
        requireFinite(withEstimatedScale, "estimated-scale");
        requireFinite(withGroundtruthScale, "groundtruth-scale");
        return new AlignmentResult(Optional.of(withEstimatedScale), withGroundtruthScale, minTime, maxTime);
    }

    static void requireFinite(AlignmentOutcome outcome, String which) throws AlignmentException {
        if (!Double.isFinite(outcome.rmse()) || !Double.isFinite(outcome.scale())) {
            throw new AlignmentException(String.format(Locale.ROOT, "Non-finite %s alignment: rmse %s, scale %s",
                    which, outcome.rmse(), outcome.scale()));
        }
    }

    /** Transform {@code y = scale * rotation * x + translation} mapping the source onto the target. */
    record Similarity(RealMatrix rotation, RealVector translation, double scale) {
        double[] apply(double[] x) {
            return rotation.operate(new ArrayRealVector(x, false)).mapMultiply(scale).add(translation).toArray();
        }
    }

    static Similarity fit(double[][] source, double[][] target, boolean withScale) throws AlignmentException {
        int n = source.length;
        RealVector meanSource = mean(source);
        RealVector meanTarget = mean(target);

        RealMatrix covariance = new Array2DRowRealMatrix(3, 3);
        double sourceVariance = 0.0;
        for (int i = 0; i < n; i++) {
            RealVector s = new ArrayRealVector(source[i], false).subtract(meanSource);
            RealVector t = new ArrayRealVector(target[i], false).subtract(meanTarget);
            covariance = covariance.add(t.outerProduct(s));
            sourceVariance += s.dotProduct(s);
        }
        covariance = covariance.scalarMultiply(1.0 / n);
        sourceVariance /= n;
        if (sourceVariance <= 0.0) {
            throw new AlignmentException("Estimate positions are degenerate (zero spread)");
        }

        SingularValueDecomposition svd = new SingularValueDecomposition(covariance);
        RealMatrix u = svd.getU();
        RealMatrix v = svd.getV();
        double[] singular = svd.getSingularValues();

        RealMatrix signs = MatrixUtils.createRealIdentityMatrix(3);
        if (new LUDecomposition(u.multiply(v.transpose())).getDeterminant() < 0) {
            signs.setEntry(2, 2, -1.0);
        }
        RealMatrix rotation = u.multiply(signs).multiply(v.transpose());

        double scale = 1.0;
        if (withScale) {
            double trace = 0.0;
            for (int i = 0; i < 3; i++) trace += singular[i] * signs.getEntry(i, i);
            scale = trace / sourceVariance;
        }
        RealVector translation = meanTarget.subtract(rotation.operate(meanSource).mapMultiply(scale));
        return new Similarity(rotation, translation, scale);
    }

    static double rmse(Similarity transform, double[][] source, double[][] target) {
        double sum = 0.0;
        for (int i = 0; i < source.length; i++) {
            double[] aligned = transform.apply(source[i]);
            for (int d = 0; d < 3; d++) {
                double diff = aligned[d] - target[i][d];
                sum += diff * diff;
            }
        }
        return Math.sqrt(sum / source.length);
    }

    private static RealVector mean(double[][] points) {
        RealVector sum = new ArrayRealVector(3);
        for (double[] p : points) sum = sum.add(new ArrayRealVector(p, false));
        return sum.mapDivide(points.length);
    }
}
