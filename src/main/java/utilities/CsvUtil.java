package utilities;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

public final class CsvUtil {
    private CsvUtil() {}

    // Configuration for CSV formatting.
    public static final class Config {
        private final char delimiter;
        private final char quote;
        private final String lineSeparator;
        private final Charset charset;

        private Config(char delimiter, char quote, String lineSeparator, Charset charset) {
            this.delimiter = delimiter;
            this.quote = quote;
            this.lineSeparator = Objects.requireNonNull(lineSeparator, "lineSeparator");
            this.charset = Objects.requireNonNull(charset, "charset");
        }

        // Comma, double quote, '\n', UTF-8.
        public static Config defaults() {
            return new Config(',', '"', "\n", StandardCharsets.UTF_8);
        }
    }

    // Write multiple rows (list of lists) to a file.
    public static void writeRows(Path file, List<? extends List<?>> rows) throws IOException {
        writeRows(file, rows, Config.defaults());
    }

    public static void writeRows(Path file, List<? extends List<?>> rows, Config config) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        try (BufferedWriter bw = Files.newBufferedWriter(file, config.charset)) {
            writeRows(bw, rows, config);
        }
    }

    // Write multiple rows to an existing Writer (caller closes).
    public static void writeRows(Writer writer, List<? extends List<?>> rows, Config config) throws IOException {
        Objects.requireNonNull(writer, "writer");
        Objects.requireNonNull(rows, "rows");
        Objects.requireNonNull(config, "config");

        for (List<?> row : rows) {
            writer.write(toCsvLine(row, config));
            writer.write(config.lineSeparator);
        }
        writer.flush();
    }

    public static String toCsvLine(List<?> row) {
        return toCsvLine(row, Config.defaults());
    }

    public static String toCsvLine(List<?> row, Config config) {
        Objects.requireNonNull(row, "row");
        StringBuilder sb = new StringBuilder();
        for (Iterator<?> it = row.iterator(); it.hasNext(); ) {
            sb.append(quoteIfNeeded(stringify(it.next()), config));
            if (it.hasNext()) sb.append(config.delimiter);
        }
        return sb.toString();
    }

    // null becomes empty, non-finite doubles are written the way numpy prints them.
    private static String stringify(Object value) {
        if (value == null) return "";
        if (value instanceof Double d) {
            if (d.isNaN()) return "nan";
            if (d.isInfinite()) return d > 0 ? "inf" : "-inf";
            return String.format(Locale.ROOT, "%.6f", d);
        }
        return String.valueOf(value);
    }

    // Apply CSV quoting rules and double inner quote characters when quoting.
    private static String quoteIfNeeded(String field, Config config) {
        boolean containsDelimiter = field.indexOf(config.delimiter) >= 0;
        boolean containsQuote = field.indexOf(config.quote) >= 0;
        boolean containsNewline = field.indexOf('\n') >= 0 || field.indexOf('\r') >= 0;

        if (containsDelimiter || containsQuote || containsNewline) {
            String doubled = field.replace(String.valueOf(config.quote), String.valueOf(config.quote) + config.quote);
            return config.quote + doubled + config.quote;
        }
        return field;
    }
}
