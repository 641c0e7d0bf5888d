package io.schemafm.core.testkit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.schemafm.core.engine.GeneratedModel;
import io.schemafm.core.engine.ModelPipeline;
import io.schemafm.core.engine.PipelineOptions;
import io.schemafm.core.schema.DefinitionsLoader;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/** Classpath fixtures shared by the core tests. */
public final class Fixtures {

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    private Fixtures() {}

    public static String text(String resource) {
        try (InputStream in = Fixtures.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalArgumentException("No test resource " + resource);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static Map<String, JsonNode> definitions(String resource) {
        return DefinitionsLoader.parse(text(resource), resource);
    }

    public static JsonNode document(String resource) {
        return yaml(text(resource));
    }

    public static JsonNode yaml(String text) {
        try {
            return YAML.readTree(text);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /** Model generated from {@code schemas/pod.json} with default roots. */
    public static GeneratedModel podModel() {
        return generate("schemas/pod.json");
    }

    public static GeneratedModel generate(String resource) {
        return new ModelPipeline(PipelineOptions.DEFAULT).generate(definitions(resource));
    }

    public static GeneratedModel generate(String resource, List<String> roots) {
        return new ModelPipeline(new PipelineOptions("model", roots, 1)).generate(definitions(resource));
    }
}
