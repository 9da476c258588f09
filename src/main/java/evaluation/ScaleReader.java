package evaluation;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads the monocular scale logged by a run. The log is append-only; the last non-empty line holds
 * the latest estimate as its second whitespace separated token.
 */
public class ScaleReader {

    public double readScale(Path scaleFile) throws IOException {
        List<String> lines = Files.readAllLines(scaleFile, StandardCharsets.UTF_8);
        for (int i = lines.size() - 1; i >= 0; i--) {
            String line = lines.get(i).strip();
            if (line.isEmpty()) continue;
            String[] tokens = line.split("\\s+");
            if (tokens.length < 2) {
                throw new ScaleParseException("Last line of " + scaleFile + " has no scale column: " + line);
            }
            try {
                return Double.parseDouble(tokens[1]);
            } catch (NumberFormatException ex) {
                throw new ScaleParseException("Unparsable scale in " + scaleFile + ": " + tokens[1], ex);
            }
        }
        throw new ScaleParseException("Scale file " + scaleFile + " is empty");
    }
}
