package io.schemafm.core.mapping;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import io.schemafm.core.error.AmbiguousKeyPathException;
import io.schemafm.core.error.KeyMappingLoadException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Reads and writes the key mapping table as CSV with header {@code key-path,feature-id,value-kind}. */
public final class KeyMappingLoader {

    private static final Logger LOG = LoggerFactory.getLogger(KeyMappingLoader.class);

    private static final CsvMapper MAPPER = new CsvMapper();
    private static final CsvSchema WRITE_SCHEMA = MAPPER.schemaFor(Row.class).withHeader();
    private static final CsvSchema READ_SCHEMA = CsvSchema.emptySchema().withHeader();

    @JsonPropertyOrder({"key-path", "feature-id", "value-kind"})
    record Row(
            @JsonProperty("key-path") String keyPath,
            @JsonProperty("feature-id") String featureId,
            @JsonProperty("value-kind") String valueKind) {}

    private KeyMappingLoader() {}

    public static KeyMappingTable load(Path path) {
        String text;
        try {
            text = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new KeyMappingLoadException("Cannot read key mapping table", e, path.toString());
        }
        KeyMappingTable table = parse(text, path.toString());
        LOG.info("Loaded {} key mapping entries from {}", table.size(), path);
        return table;
    }

    /**
     * @throws KeyMappingLoadException if a row is malformed
     * @throws AmbiguousKeyPathException if two rows overlap; every overlap is logged first
     */
    public static KeyMappingTable parse(String csv, String source) {
        List<KeyMappingEntry> entries = new ArrayList<>();
        int row = 1;
        try (MappingIterator<Row> rows = MAPPER.readerFor(Row.class).with(READ_SCHEMA).readValues(csv)) {
            while (rows.hasNextValue()) {
                row++;
                Row r = rows.nextValue();
                if (r.keyPath() == null || r.featureId() == null || r.valueKind() == null) {
                    throw new KeyMappingLoadException("Row " + row + " is missing a column", source);
                }
                entries.add(new KeyMappingEntry(
                        KeyPath.parse(r.keyPath().strip()), r.featureId().strip(), ValueKind.fromKeyword(r.valueKind().strip())));
            }
        } catch (IOException e) {
            throw new KeyMappingLoadException("Malformed CSV near row " + row, e, source);
        } catch (IllegalArgumentException e) {
            throw new KeyMappingLoadException("Row " + row + ": " + e.getMessage(), e, source);
        }
        List<AmbiguousKeyPathException> ambiguities = KeyMappingTable.ambiguities(entries);
        if (!ambiguities.isEmpty()) {
            for (AmbiguousKeyPathException a : ambiguities) {
                LOG.error("Ambiguous key path in {}: {} overlaps {}", source, a.keyPath(), a.conflictingPath());
            }
            throw ambiguities.get(0);
        }
        return KeyMappingTable.of(entries);
    }

    public static String toCsv(KeyMappingTable table) {
        List<Row> rows = new ArrayList<>(table.size());
        for (KeyMappingEntry e : table.entries()) {
            rows.add(new Row(e.keyPath().toString(), e.featureId(), e.valueKind().keyword()));
        }
        try {
            return MAPPER.writer(WRITE_SCHEMA).writeValueAsString(rows);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static void write(KeyMappingTable table, Path target) {
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, toCsv(table), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write key mapping table to " + target, e);
        }
    }
}
