package com.klinevault.fetcher.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Utility class for CSV file operations.
 */
public final class CsvUtils {

    private static final Logger log = LoggerFactory.getLogger(CsvUtils.class);

    private CsvUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Read a CSV file and parse each line using the provided parser function.
     * A line that fails to parse fails the whole read.
     *
     * @param file          The CSV file to read
     * @param headerPrefix  The prefix that identifies a header line (e.g., "timestamp")
     * @param parser        Function to parse each CSV line into an object
     * @throws IOException  if the file cannot be read or a line does not parse
     */
    public static <T> List<T> readCsv(Path file, String headerPrefix, Function<String, T> parser)
            throws IOException {
        List<T> items = new ArrayList<>();

        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            boolean firstLine = true;
            int lineNumber = 0;

            while ((line = reader.readLine()) != null) {
                lineNumber++;
                line = stripBom(line).trim();
                if (line.isEmpty()) continue;

                // Skip header line
                if (firstLine) {
                    firstLine = false;
                    if (line.startsWith(headerPrefix)) {
                        continue;
                    }
                }

                try {
                    T item = parser.apply(line);
                    if (item != null) {
                        items.add(item);
                    }
                } catch (RuntimeException e) {
                    throw new IOException("Unparseable line " + lineNumber + " in " + file + ": " + e.getMessage(), e);
                }
            }
        }

        return items;
    }

    /**
     * Write items to a CSV file with a header, replacing any existing file.
     */
    public static <T> void writeCsv(Path file, String header, List<T> items,
                                    Function<T, String> formatter) throws IOException {
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            writer.write(header);
            writer.newLine();
            for (T item : items) {
                writer.write(formatter.apply(item));
                writer.newLine();
            }
        }
        log.debug("Saved {} items to {}", items.size(), file);
    }

    /**
     * Split a CSV line on commas, honouring double quotes.
     */
    public static List<String> splitLine(String line) {
        List<String> fields = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '"') {
                if (quoted && i + 1 < line.length() && line.charAt(i + 1) == '"') {
                    current.append('"');
                    i++;
                } else {
                    quoted = !quoted;
                }
            } else if (c == ',' && !quoted) {
                fields.add(current.toString().trim());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        fields.add(current.toString().trim());
        return fields;
    }

    static String stripBom(String line) {
        return !line.isEmpty() && line.charAt(0) == '\uFEFF' ? line.substring(1) : line;
    }
}
