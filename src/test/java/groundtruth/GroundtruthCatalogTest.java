package groundtruth;

import static org.junit.Assert.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class GroundtruthCatalogTest {

    private static final int EUROC_FRAMES = 3601;

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private Path root;
    private GroundtruthCatalog catalog;

    @Before
    public void setUp() throws IOException {
        root = tmp.newFolder("groundtruth_files").toPath();
        catalog = new GroundtruthCatalog(root);
    }

    private void writeEuroc() throws IOException {
        StringBuilder times = new StringBuilder("# frame time\n");
        for (int f = 0; f < EUROC_FRAMES; f++) {
            times.append(String.format(Locale.ROOT, "%05d %.2f%n", f, f * 0.05));
        }
        String gt = "0.0 0 0 0 0 0 0 1\n1.0 1 0 0 0 0 0 1\n2.0 2 1 0 0 0 0 1\n";
        for (SequenceSpec spec : Dataset.EUROC.sequences()) {
            Path timesFile = catalog.timesFile(Dataset.EUROC, spec.name());
            Path gtFile = catalog.groundtruthFile(Dataset.EUROC, spec.name());
            Files.createDirectories(timesFile.getParent());
            Files.createDirectories(gtFile.getParent());
            Files.writeString(timesFile, times.toString());
            Files.writeString(gtFile, gt);
        }
    }

    @Test
    public void sequences_loadsAllSequencesInCatalogOrder() throws Exception {
        writeEuroc();

        SequenceSet set = catalog.sequences(Dataset.EUROC);

        assertEquals(11, set.size());
        assertEquals(0.8, set.completionThreshold(), 0.0);
        Sequence first = set.sequences().get(0);
        assertEquals("mav_MH_01_easy", first.name());
        assertEquals((3600 - 950) * 0.05, first.duration(), 1e-9);
        assertEquals(3, first.groundtruth().size());
        assertEquals(root.resolve("euroc").resolve("gtFiles").resolve("mav_MH_01_easy.txt"), first.groundtruthFile());
        assertEquals("mav_V2_03_difficult", set.sequences().get(10).name());
    }

    @Test
    public void sequences_failsWhenAnyFileIsMissing() throws Exception {
        writeEuroc();
        Files.delete(catalog.timesFile(Dataset.EUROC, "mav_V1_02_medium"));

        try {
            catalog.sequences(Dataset.EUROC);
            fail("expected CatalogLoadException");
        } catch (CatalogLoadException e) {
            assertTrue(e.getMessage().contains("mav_V1_02_medium"));
        }
    }

    @Test(expected = CatalogLoadException.class)
    public void sequences_failsForEmptyStore() throws Exception {
        catalog.sequences(Dataset.TUMVI);
    }

    @Test
    public void load_defaultsEndFrameToLastFrame() throws Exception {
        Path times = tmp.newFile("times.txt").toPath();
        Path gt = tmp.newFile("gt.txt").toPath();
        Files.writeString(times, "0 100.0\n1 100.5\n2 101.0\n3 104.0\n");
        Files.writeString(gt, "100.0 0 0 0\n104.0 1 1 1\n");

        Sequence sequence = Sequence.load(new SequenceSpec("seq", 2, SequenceSpec.LAST_FRAME, Double.NaN), times, gt);

        assertEquals(3, sequence.endFrame());
        assertEquals(3.0, sequence.duration(), 1e-12);
    }

    @Test(expected = CatalogLoadException.class)
    public void load_rejectsFramesOutsideTimesFile() throws Exception {
        Path times = tmp.newFile("times.txt").toPath();
        Path gt = tmp.newFile("gt.txt").toPath();
        Files.writeString(times, "0 100.0\n1 100.5\n");
        Files.writeString(gt, "100.0 0 0 0\n");

        Sequence.load(new SequenceSpec("seq", 0, 5, Double.NaN), times, gt);
    }
}
