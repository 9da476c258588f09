package evaluation;

import static org.junit.Assert.*;

import groundtruth.Dataset;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class ResultCacheTest {

    private static final double INF = Double.POSITIVE_INFINITY;

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private Path run;
    private final ResultCache cache = new ResultCache();

    @Before
    public void setUp() throws Exception {
        run = tmp.newFolder("run").toPath();
    }

    private RunEvaluation evaluation() {
        List<String> names = List.of("seq_a", "seq_b");
        EvaluationResult result = new EvaluationResult(run, Dataset.TUMVI, names,
                MeasurementGrid.of(new double[][]{{0.1, INF}, {0.3, 0.2}}),
                MeasurementGrid.of(new double[][]{{1.5, INF}, {1.6, 0.9}}),
                MeasurementGrid.of(new double[][]{{3.0, INF}, {1.0, 12.5}}),
                MeasurementGrid.of(new double[][]{{0.95, INF}, {0.99, 0.93}}));
        EvaluationResult gtScale = new EvaluationResult(run, Dataset.TUMVI, names,
                MeasurementGrid.of(new double[][]{{0.05, INF}, {0.2, 0.1}}),
                MeasurementGrid.of(new double[][]{{1.55, INF}, {1.62, 1.01}}),
                MeasurementGrid.of(new double[][]{{0.0, INF}, {0.0, 0.0}}),
                MeasurementGrid.of(new double[][]{{0.95, INF}, {0.99, 0.93}}));
        return new RunEvaluation(result, gtScale);
    }

    @Test
    public void savedSnapshotLoadsWithIdenticalGrids() throws Exception {
        RunEvaluation saved = evaluation();
        cache.save(run, saved);

        RunEvaluation loaded = cache.tryLoad(run, Dataset.TUMVI, 2).orElseThrow();

        assertEquals(saved.estimatedScale().sequenceNames(), loaded.estimatedScale().sequenceNames());
        assertEquals(saved.estimatedScale().errors(), loaded.estimatedScale().errors());
        assertEquals(saved.estimatedScale().scales(), loaded.estimatedScale().scales());
        assertEquals(saved.groundtruthScale().scales(), loaded.groundtruthScale().scales());
        assertEquals(saved.groundtruthScale().percentageDone(), loaded.groundtruthScale().percentageDone());
        assertArrayEquals(saved.estimatedScale().medianIndex(), loaded.estimatedScale().medianIndex());
        assertEquals(Dataset.TUMVI, loaded.estimatedScale().dataset());
    }

    @Test
    public void snapshotStoresScaleGridUnderScale() throws Exception {
        cache.save(run, evaluation());

        String json = Files.readString(ResultCache.snapshotFile(run));

        assertTrue(json.contains("\"formatVersion\": 2"));
        assertTrue(json.contains("1.62"));
        assertTrue(json.contains("Infinity"));
    }

    @Test
    public void saveOverwritesPreviousSnapshot() throws Exception {
        cache.save(run, evaluation());
        RunEvaluation second = evaluation();
        EvaluationResult other = new EvaluationResult(run, Dataset.TUMVI, List.of("only"),
                MeasurementGrid.filled(2, 1, 0.5), MeasurementGrid.filled(2, 1, 1.0),
                MeasurementGrid.filled(2, 1, 0.0), MeasurementGrid.filled(2, 1, 1.0));
        cache.save(run, new RunEvaluation(other, other));

        RunEvaluation loaded = cache.tryLoad(run, Dataset.TUMVI, 2).orElseThrow();

        assertEquals(List.of("only"), loaded.estimatedScale().sequenceNames());
        assertNotEquals(second.estimatedScale().errors(), loaded.estimatedScale().errors());
    }

    @Test
    public void missingSnapshotIsMiss() {
        assertEquals(Optional.empty(), cache.tryLoad(run, Dataset.TUMVI, 2));
    }

    @Test
    public void differentIterationCountIsMiss() throws Exception {
        cache.save(run, evaluation());

        assertFalse(cache.tryLoad(run, Dataset.TUMVI, 5).isPresent());
    }

    @Test
    public void unversionedLegacySnapshotIsMiss() throws Exception {
        Path file = ResultCache.snapshotFile(run);
        Files.createDirectories(file.getParent());
        Files.writeString(file, "{\"sequenceNames\": [\"a\"],"
                + " \"results\": {\"error\": [[1.0]], \"scale\": [[1.0]], \"scaleError\": [[0.0]], \"percentageDone\": [[1.0]]},"
                + " \"resultsGtScale\": {\"error\": [[1.0]], \"scale\": [[1.0]], \"scaleError\": [[0.0]], \"percentageDone\": [[1.0]]}}");

        assertFalse(cache.tryLoad(run, Dataset.EUROC, 1).isPresent());
    }

    @Test
    public void missingKeyIsMiss() throws Exception {
        Path file = ResultCache.snapshotFile(run);
        Files.createDirectories(file.getParent());
        Files.writeString(file, "{\"formatVersion\": 2, \"sequenceNames\": [\"a\"],"
                + " \"results\": {\"error\": [[1.0]], \"scaleError\": [[0.0]], \"percentageDone\": [[1.0]]},"
                + " \"resultsGtScale\": {\"error\": [[1.0]], \"scale\": [[1.0]], \"scaleError\": [[0.0]], \"percentageDone\": [[1.0]]}}");

        assertFalse(cache.tryLoad(run, Dataset.EUROC, 1).isPresent());
    }

    @Test
    public void corruptSnapshotIsMiss() throws Exception {
        Path file = ResultCache.snapshotFile(run);
        Files.createDirectories(file.getParent());
        Files.writeString(file, "folder_names:\n- mav_MH_01_easy\nresults:\n  errors: [[");

        assertFalse(cache.tryLoad(run, Dataset.EUROC, 1).isPresent());
    }

    @Test
    public void nullCellInSnapshotIsMiss() throws Exception {
        Path file = ResultCache.snapshotFile(run);
        Files.createDirectories(file.getParent());
        Files.writeString(file, "{\"formatVersion\": 2, \"sequenceNames\": [\"a\"],"
                + " \"results\": {\"error\": [[null]], \"scale\": [[1.0]], \"scaleError\": [[0.0]], \"percentageDone\": [[1.0]]},"
                + " \"resultsGtScale\": {\"error\": [[1.0]], \"scale\": [[1.0]], \"scaleError\": [[0.0]], \"percentageDone\": [[1.0]]}}");

        assertFalse(cache.tryLoad(run, Dataset.EUROC, 1).isPresent());
    }

    @Test
    public void raggedGridIsMiss() throws Exception {
        Path file = ResultCache.snapshotFile(run);
        Files.createDirectories(file.getParent());
        Files.writeString(file, "{\"formatVersion\": 2, \"sequenceNames\": [\"a\", \"b\"],"
                + " \"results\": {\"error\": [[1.0, 2.0], [1.0]], \"scale\": [[1.0, 1.0], [1.0, 1.0]], \"scaleError\": [[0.0, 0.0], [0.0, 0.0]], \"percentageDone\": [[1.0, 1.0], [1.0, 1.0]]},"
                + " \"resultsGtScale\": {\"error\": [[1.0, 2.0], [1.0, 1.0]], \"scale\": [[1.0, 1.0], [1.0, 1.0]], \"scaleError\": [[0.0, 0.0], [0.0, 0.0]], \"percentageDone\": [[1.0, 1.0], [1.0, 1.0]]}}");

        assertFalse(cache.tryLoad(run, Dataset.EUROC, 2).isPresent());
    }
}
