package io.schemafm.batch.runner;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.schemafm.core.error.DocumentReadException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads a corpus file and sorts its documents into translatable units and skips.
 *
 * <p>
 * Multi-document YAML files are split on {@code ---}. A file containing template markers
 * ({@code {{}, {@code }}} or {@code #@}) is skipped as a whole when {@code skipTemplated} is on,
 * since its documents are not concrete configurations. Thread-safe.
 */
public final class DocumentClassifier {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

    private final boolean skipTemplated;
    private final boolean skipCustomResources;
    private final boolean requireKind;

    public DocumentClassifier(boolean skipTemplated, boolean skipCustomResources, boolean requireKind) {
        this.skipTemplated = skipTemplated;
        this.skipCustomResources = skipCustomResources;
        this.requireKind = requireKind;
    }

    /**
     * @param file     file to read
     * @param relative id prefix for the file's documents, normally its corpus-relative path
     * @throws DocumentReadException if the file cannot be read or parsed
     */
    public Triage classify(Path file, String relative) {
        String text;
        long size;
        try {
            size = Files.size(file);
            text = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new DocumentReadException("Cannot read document file", e, relative);
        }
        SizeBucket bucket = SizeBucket.of(size);

        if (skipTemplated && isTemplated(text)) {
            return new Triage(relative, bucket, List.of(), Map.of(relative, SkipReason.TEMPLATED));
        }

        List<JsonNode> documents = parse(text, relative, file);
        List<DocumentUnit> units = new ArrayList<>();
        Map<String, SkipReason> skipped = new LinkedHashMap<>();
        for (int i = 0; i < documents.size(); i++) {
            String id = documents.size() == 1 ? relative : relative + "#" + i;
            JsonNode doc = documents.get(i);
            SkipReason reason = skipReason(doc);
            if (reason != null) {
                skipped.put(id, reason);
            } else {
                units.add(new DocumentUnit(id, doc));
            }
        }
        return new Triage(relative, bucket, units, skipped);
    }

    static boolean isTemplated(String text) {
        return text.contains("{{") || text.contains("}}") || text.contains("#@");
    }

    private SkipReason skipReason(JsonNode doc) {
        if (doc == null || doc.isNull() || doc.isMissingNode() || (doc.isContainerNode() && doc.isEmpty())) {
            return SkipReason.EMPTY;
        }
        if (!doc.isObject()) {
            // non-object roots are reported by the translator as read failures
            return null;
        }
        if (requireKind && (!doc.hasNonNull("apiVersion") || !doc.hasNonNull("kind"))) {
            return SkipReason.MISSING_KIND;
        }
        if (skipCustomResources && "CustomResourceDefinition".equals(doc.path("kind").asText())) {
            return SkipReason.CUSTOM_RESOURCE;
        }
        return null;
    }

    private static List<JsonNode> parse(String text, String relative, Path file) {
        boolean json = file.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".json");
        ObjectMapper mapper = json ? JSON_MAPPER : YAML_MAPPER;
        try (MappingIterator<JsonNode> it = mapper.readerFor(JsonNode.class).readValues(text)) {
            List<JsonNode> out = new ArrayList<>();
            while (it.hasNextValue()) {
                out.add(it.nextValue());
            }
            return out;
        } catch (IOException | RuntimeException e) {
            throw new DocumentReadException("Malformed document: " + e.getMessage(), e, relative);
        }
    }
}
