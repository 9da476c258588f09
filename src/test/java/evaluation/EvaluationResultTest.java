package evaluation;

import static org.junit.Assert.*;

import groundtruth.Dataset;

import java.nio.file.Path;
import java.util.List;

import org.junit.Test;

public class EvaluationResultTest {

    private static final double INF = Double.POSITIVE_INFINITY;

    private static EvaluationResult result(double[][] errors, double[][] scaleErrors) {
        int seq = errors[0].length;
        List<String> names = seq == 1 ? List.of("a") : List.of("a", "b");
        MeasurementGrid e = MeasurementGrid.of(errors);
        return new EvaluationResult(Path.of("run"), Dataset.EUROC, names, e,
                MeasurementGrid.filled(errors.length, seq, 1.0),
                MeasurementGrid.of(scaleErrors),
                MeasurementGrid.filled(errors.length, seq, 1.0));
    }

    @Test
    public void evenIterationCount_picksWorseMiddleRun() {
        EvaluationResult r = result(new double[][]{{4}, {1}, {3}, {2}}, new double[][]{{40}, {10}, {30}, {20}});

        assertEquals(2, r.medianIndex()[0]);
        assertEquals(2.5, r.medianErrors()[0], 1e-12);
        // scale error of the representative run, not the median of scale errors
        assertEquals(30.0, r.medianScaleErrors()[0], 0.0);
    }

    @Test
    public void oddIterationCount_usesMiddleRun() {
        EvaluationResult r = result(new double[][]{{0.5, 7}, {0.1, 9}, {0.3, 8}}, new double[][]{{5, 70}, {1, 90}, {3, 80}});

        assertArrayEquals(new int[]{2, 2}, r.medianIndex());
        assertArrayEquals(new double[]{0.3, 8}, r.medianErrors(), 0.0);
        assertArrayEquals(new double[]{3, 80}, r.medianScaleErrors(), 0.0);
    }

    @Test
    public void unmeasuredRunsSortLast() {
        EvaluationResult r = result(new double[][]{{INF}, {1.0}, {INF}, {2.0}}, new double[][]{{INF}, {1}, {INF}, {2}});

        assertEquals(INF, r.medianErrors()[0], 0.0);
        assertEquals(INF, r.errors().get(r.medianIndex()[0], 0), 0.0);
        assertEquals(0, r.medianIndex()[0]);
    }

    @Test
    public void allUnmeasured_medianIsInfiniteNotNaN() {
        EvaluationResult r = result(new double[][]{{INF}, {INF}}, new double[][]{{INF}, {INF}});

        assertEquals(INF, r.medianErrors()[0], 0.0);
        assertEquals(1, r.medianIndex()[0]);
    }

    @Test
    public void singleIteration() {
        EvaluationResult r = result(new double[][]{{0.4, 0.6}}, new double[][]{{1, 2}});

        assertArrayEquals(new int[]{0, 0}, r.medianIndex());
        assertArrayEquals(new double[]{0.4, 0.6}, r.medianErrors(), 0.0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsGridsOfDifferentShape() {
        new EvaluationResult(Path.of("run"), Dataset.EUROC, List.of("a"),
                MeasurementGrid.unmeasured(2, 1), MeasurementGrid.unmeasured(3, 1),
                MeasurementGrid.unmeasured(2, 1), MeasurementGrid.unmeasured(2, 1));
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsNameCountMismatch() {
        new EvaluationResult(Path.of("run"), Dataset.EUROC, List.of("a", "b"),
                MeasurementGrid.unmeasured(2, 1), MeasurementGrid.unmeasured(2, 1),
                MeasurementGrid.unmeasured(2, 1), MeasurementGrid.unmeasured(2, 1));
    }

    @Test
    public void renameLabelsBothResults() {
        EvaluationResult a = result(new double[][]{{1}}, new double[][]{{1}});
        EvaluationResult b = result(new double[][]{{1}}, new double[][]{{0}});

        new RunEvaluation(a, b).rename("dmvio");

        assertEquals("dmvio", a.displayName());
        assertEquals("gt_scale_dmvio", b.displayName());
    }
}
