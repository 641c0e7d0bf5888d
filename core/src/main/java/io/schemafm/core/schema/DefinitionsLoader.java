package io.schemafm.core.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.schemafm.core.error.SchemaLoadException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads raw schema definitions from a JSON or YAML file into a flat, order-preserving map from
 * definition name to raw node.
 *
 * <p>
 * Accepted layouts: the map itself, a swagger-style document with a top-level {@code definitions}
 * member, or an OpenAPI 3 document with {@code components.schemas}.
 */
public final class DefinitionsLoader {

    private static final Logger LOG = LoggerFactory.getLogger(DefinitionsLoader.class);

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private DefinitionsLoader() {
        // utility class
    }

    /**
     * Loads definitions from a file; {@code .yaml}/{@code .yml} files are parsed as YAML, anything
     * else as JSON.
     *
     * @throws SchemaLoadException if the file cannot be read or has no definitions map
     */
    public static Map<String, JsonNode> load(Path path) {
        String source = path.toString();
        String fileName = path.getFileName().toString().toLowerCase();
        ObjectMapper mapper = fileName.endsWith(".yaml") || fileName.endsWith(".yml") ? YAML_MAPPER : JSON_MAPPER;
        try (InputStream in = Files.newInputStream(path)) {
            Map<String, JsonNode> definitions = extract(mapper.readTree(in), source);
            LOG.info("Loaded {} raw definitions from {}", definitions.size(), source);
            return definitions;
        } catch (IOException e) {
            throw new SchemaLoadException("Failed to read schema definitions: " + e.getMessage(), e, source);
        }
    }

    /** Parses definitions from in-memory JSON or YAML text. */
    public static Map<String, JsonNode> parse(String content, String source) {
        try {
            return extract(YAML_MAPPER.readTree(content), source);
        } catch (IOException e) {
            throw new SchemaLoadException("Failed to parse schema definitions: " + e.getMessage(), e, source);
        }
    }

    /** Picks the definitions map out of a parsed schema document. */
    public static Map<String, JsonNode> extract(JsonNode root, String source) {
        if (root == null || !root.isObject()) {
            throw new SchemaLoadException("Schema document must be a mapping of definition name to schema", source);
        }
        JsonNode container = root;
        if (root.path("definitions").isObject()) {
            container = root.get("definitions");
        } else if (root.path("components").path("schemas").isObject()) {
            container = root.get("components").get("schemas");
        }
        Map<String, JsonNode> definitions = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = container.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            definitions.put(field.getKey(), field.getValue());
        }
        if (definitions.isEmpty()) {
            throw new SchemaLoadException("Schema document contains no definitions", source);
        }
        return definitions;
    }
}
