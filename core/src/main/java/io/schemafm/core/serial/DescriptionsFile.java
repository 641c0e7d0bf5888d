package io.schemafm.core.serial;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.schemafm.core.error.ModelParseException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/** The JSON object of feature id to description written next to a model file. */
public final class DescriptionsFile {

    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private DescriptionsFile() {}

    public static void write(Map<String, String> descriptions, Path target) {
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            MAPPER.writeValue(target.toFile(), new LinkedHashMap<>(descriptions));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write descriptions to " + target, e);
        }
    }

    public static Map<String, String> read(Path source) {
        try {
            return MAPPER.readValue(source.toFile(), new TypeReference<LinkedHashMap<String, String>>() {});
        } catch (IOException e) {
            throw new ModelParseException("Malformed descriptions file", e, source.toString());
        }
    }
}
