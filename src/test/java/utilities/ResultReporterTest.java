package utilities;

import static org.junit.Assert.*;

import evaluation.EvaluationResult;
import evaluation.MeasurementGrid;
import evaluation.RunEvaluation;
import groundtruth.Dataset;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class ResultReporterTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private static EvaluationResult result(Path run, List<String> names, double scaleError) {
        return new EvaluationResult(run, Dataset.EUROC, names,
                MeasurementGrid.of(new double[][]{{0.1, Double.POSITIVE_INFINITY}}),
                MeasurementGrid.filled(1, 2, 1.0), MeasurementGrid.filled(1, 2, scaleError),
                MeasurementGrid.filled(1, 2, 1.0));
    }

    @Test
    public void writeCsv_oneRowPerSequence() throws Exception {
        Path run = tmp.newFolder("dmvioresult-euroc").toPath();
        List<String> names = List.of("mav_MH_01_easy", "mav_MH_02_easy");
        RunEvaluation evaluation = new RunEvaluation(result(run, names, 2.0), result(run, names, 0.0)).rename("dmvio");
        ResultReporter.printConsoleSummary(evaluation);

        Path csv = ResultReporter.writeCsv(tmp.getRoot().toPath().resolve("out").resolve("summary.csv"), List.of(evaluation));

        List<String> lines = Files.readAllLines(csv);
        assertEquals(3, lines.size());
        assertTrue(lines.get(0).startsWith("run,dataset,sequence,median_error"));
        assertEquals("dmvio,euroc,mav_MH_01_easy,0.100000,2.000000,0,0.100000,1,1", lines.get(1));
        assertTrue(lines.get(2).contains(",inf,"));
    }
}
