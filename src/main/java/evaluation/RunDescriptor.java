package evaluation;

import utilities.EvalLogger;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * A run folder together with the settings recorded in its {@code setup/setup.yaml}. Only top-level
 * scalar entries are kept; nested blocks are skipped.
 */
public record RunDescriptor(Path folder, Map<String, String> settings, boolean finished) {
    static final String SETUP_FILE = "setup.yaml";
    static final String FINISHED_FILE = "Finished.txt";
    private static final Pattern TOP_LEVEL_ENTRY = Pattern.compile("^([A-Za-z0-9_.\\-]+):(?:\\s+(.*))?$");

    public RunDescriptor {
        Objects.requireNonNull(folder, "folder");
        settings = Collections.unmodifiableMap(new LinkedHashMap<>(settings));
    }

    public Optional<String> setting(String key) {
        return Optional.ofNullable(settings.get(key));
    }

    public static Path setupFile(Path runFolder) {
        return runFolder.resolve(ResultCache.SETUP_DIR).resolve(SETUP_FILE);
    }

    public static RunDescriptor load(Path runFolder) throws IOException {
        Map<String, String> settings = new LinkedHashMap<>();
        try (BufferedReader reader = Files.newBufferedReader(setupFile(runFolder), StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank() || line.startsWith("#")) continue;
                Matcher m = TOP_LEVEL_ENTRY.matcher(line.stripTrailing());
                if (!m.matches()) continue;
                String value = m.group(2);
                if (value == null || value.isEmpty()) continue; // block follows
                settings.put(m.group(1), unquote(value.strip()));
            }
        }
        boolean finished = Files.exists(runFolder.resolve(ResultCache.SETUP_DIR).resolve(FINISHED_FILE));
        return new RunDescriptor(runFolder, settings, finished);
    }

    /** Descriptors of all children of {@code resultsRoot} that have a setup file, sorted by folder name. */
    public static List<RunDescriptor> loadAll(Path resultsRoot) throws IOException {
        List<Path> children;
        try (Stream<Path> stream = Files.list(resultsRoot)) {
            children = stream.filter(Files::isDirectory)
                    .sorted(Comparator.comparing(path -> path.getFileName().toString()))
                    .toList();
        }
        List<RunDescriptor> runs = new ArrayList<>();
        for (Path child : children) {
            if (!Files.isRegularFile(setupFile(child))) {
                EvalLogger.warning("Skipping " + child + ", because the setup file does not exist");
                continue;
            }
            runs.add(load(child));
        }
        return runs;
    }

    private static String unquote(String value) {
        if (value.length() >= 2) {
            char first = value.charAt(0);
            char last = value.charAt(value.length() - 1);
            if ((first == '\'' || first == '"') && first == last) {
                return value.substring(1, value.length() - 1);
            }
        }
        return value;
    }
}
