package org.Arcane.otf.rename;

import org.Arcane.otf.OtfPipelineException;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Plain-text list of pointing ids and their generated names.
 *
 * <p>Format: one {@code #} header line, then {@code <id> <name>} per line in ascending id order.</p>
 */
public final class PointingNameList {
    static final String HEADER_PREFIX = "#List of OTF IDs and field names generated at ";

    private final SortedMap<Integer, String> names;

    public PointingNameList(Map<Integer, String> names) {
        TreeMap<Integer, String> sorted = new TreeMap<>();
        for (Map.Entry<Integer, String> entry : Objects.requireNonNull(names, "names").entrySet()) {
            String name = Objects.requireNonNull(entry.getValue(), "name of pointing " + entry.getKey());
            if (name.isBlank() || name.chars().anyMatch(Character::isWhitespace)) {
                throw new IllegalArgumentException("Name of pointing " + entry.getKey() + " must be one token: '" + name + "'");
            }
            sorted.put(Objects.requireNonNull(entry.getKey(), "pointing id"), name);
        }
        this.names = Collections.unmodifiableSortedMap(sorted);
    }

    public SortedMap<Integer, String> names() {
        return names;
    }

    public int size() {
        return names.size();
    }

    public String nameOf(int id) {
        String name = names.get(id);
        if (name == null) {
            throw new OtfPipelineException(OtfPipelineException.UNKNOWN_POINTING_ID,
                    "Pointing id " + id + " is not in the name list");
        }
        return name;
    }

    /**
     * Writes the list to {@code path}, replacing an existing file.
     */
    public void write(Path path, Clock clock) throws IOException {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(clock, "clock");
        try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            writer.write(HEADER_PREFIX + LocalDateTime.now(clock));
            writer.newLine();
            for (Map.Entry<Integer, String> entry : names.entrySet()) {
                writer.write(entry.getKey() + " " + entry.getValue());
                writer.newLine();
            }
        }
    }

    /**
     * Reads a name list, skipping comment and blank lines.
     *
     * @throws OtfPipelineException {@code MISSING_FILE} when absent, {@code FORMAT} for a malformed line.
     */
    public static PointingNameList read(Path path) {
        List<String> lines;
        try {
            lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        } catch (NoSuchFileException ex) {
            throw new OtfPipelineException(OtfPipelineException.MISSING_FILE, "Name list not found: " + path, ex);
        } catch (IOException ex) {
            throw new OtfPipelineException(OtfPipelineException.MISSING_FILE, "Name list cannot be read: " + path, ex);
        }

        TreeMap<Integer, String> names = new TreeMap<>();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).strip();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            String[] tokens = line.split("\\s+");
            if (tokens.length != 2) {
                throw new OtfPipelineException(OtfPipelineException.FORMAT,
                        "Name list " + path + " line " + (i + 1) + " is not '<id> <name>': " + line);
            }
            int id;
            try {
                id = Integer.parseInt(tokens[0]);
            } catch (NumberFormatException ex) {
                throw new OtfPipelineException(OtfPipelineException.FORMAT,
                        "Name list " + path + " line " + (i + 1) + " has a non-integer id: " + tokens[0], ex);
            }
            if (id < 0 || names.put(id, tokens[1]) != null) {
                throw new OtfPipelineException(OtfPipelineException.FORMAT,
                        "Name list " + path + " line " + (i + 1) + " has an invalid or repeated id: " + id);
            }
        }
        return new PointingNameList(names);
    }
}
