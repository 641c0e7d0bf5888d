package io.schemafm.batch.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import io.schemafm.core.translate.TranslationBudget;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads {@link BatchConfig} from a YAML file with an optional environment variable overlay.
 *
 * <p>
 * Supports two invocation patterns:
 * <ul>
 * <li>Default: loads {@code schema-fm.yaml} from the current directory</li>
 * <li>{@code --config /path/to/config.yaml}: loads from the specified path</li>
 * </ul>
 * Without {@code --config} and without a {@code schema-fm.yaml} in the current directory, the
 * settings come from the environment alone.
 *
 * <p>
 * The YAML document is first checked against the bundled {@code batch-config.schema.json}, so
 * unknown keys and wrongly typed values fail at startup with every violation listed. Missing keys
 * receive the defaults from {@link BatchConfig.Builder}.
 *
 * <p>
 * Every setting can be overridden by a {@code SCHEMAFM_*} environment variable, which takes
 * precedence over YAML. A variable counts as set only when its trimmed value is non-empty.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final String DEFAULT_CONFIG_FILE = "schema-fm.yaml";
    private static final String CONFIG_SCHEMA_RESOURCE = "/batch-config.schema.json";

    private static final JsonSchema CONFIG_SCHEMA = loadConfigSchema();

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads the configuration named by the command-line arguments. An explicit {@code --config}
     * file must exist; the default file is optional and its absence falls back to
     * {@link #fromEnvironment}.
     *
     * @throws ConfigLoadException if a config file is invalid or an environment value is malformed
     */
    public static BatchConfig load(String[] args, Function<String, String> envLookup) {
        Path path = resolveConfigPath(args);
        if (!Arrays.asList(args).contains("--config") && !Files.exists(path)) {
            LOG.info("No {} in the working directory; using environment settings only", DEFAULT_CONFIG_FILE);
            return fromEnvironment(envLookup);
        }
        return load(path, envLookup);
    }

    /**
     * Loads a {@link BatchConfig} from the given YAML file, applying overrides from
     * {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing, unparseable or invalid
     */
    public static BatchConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads a {@link BatchConfig} from the given YAML file, applying overrides from the supplied
     * lookup. A lookup returning {@code null} means the variable is not defined.
     *
     * @throws ConfigLoadException if the file is missing, unparseable or invalid
     */
    public static BatchConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException(
                    "Configuration file not found: " + configPath + ". Use --config <path> to specify a config file.");
        }

        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            if (root == null || root.isMissingNode() || root.isNull()) {
                root = YAML_MAPPER.createObjectNode();
            }
            validate(root, configPath);
            return mapToConfig(root, envLookup);
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        } catch (Exception e) {
            throw new ConfigLoadException("Failed to load configuration from: " + configPath, e);
        }
    }

    /** Builds a configuration from defaults and environment overrides alone. */
    public static BatchConfig fromEnvironment(Function<String, String> envLookup) {
        try {
            return mapToConfig(YAML_MAPPER.createObjectNode(), envLookup);
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException("Invalid environment configuration: " + e.getMessage(), e);
        }
    }

    /**
     * Resolves the config file path from CLI arguments.
     *
     * @param args command-line arguments
     * @return the resolved config file path
     */
    public static Path resolveConfigPath(String[] args) {
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i])) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("--config requires a file path argument");
                }
                return Path.of(args[i + 1]);
            }
        }
        return Path.of(DEFAULT_CONFIG_FILE);
    }

    private static void validate(JsonNode root, Path configPath) {
        Set<ValidationMessage> errors = CONFIG_SCHEMA.validate(root);
        if (!errors.isEmpty()) {
            String detail = errors.stream()
                    .map(ValidationMessage::getMessage)
                    .sorted()
                    .collect(Collectors.joining("; "));
            throw new ConfigLoadException("Invalid configuration in " + configPath + ": " + detail);
        }
    }

    /**
     * Maps a parsed YAML tree to a {@link BatchConfig} via the builder, then overlays environment
     * variable overrides.
     */
    private static BatchConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        BatchConfig.Builder builder = BatchConfig.builder();

        // --- YAML mapping ---

        JsonNode schema = root.path("schema");
        if (schema.has("definitions")) builder.schemaFile(schema.get("definitions").asText());
        if (schema.has("roots")) builder.roots(textList(schema.get("roots")));
        if (schema.has("namespace")) builder.namespace(schema.get("namespace").asText());

        JsonNode model = root.path("model");
        if (model.has("output-dir")) builder.modelDir(model.get("output-dir").asText());
        if (model.has("parallelism")) builder.parallelism(model.get("parallelism").asInt());
        if (model.has("include-descriptions"))
            builder.inlineDescriptions(model.get("include-descriptions").asBoolean());

        JsonNode mapping = root.path("mapping");
        if (mapping.has("table")) builder.mappingTable(mapping.get("table").asText());

        JsonNode corpus = root.path("corpus");
        if (corpus.has("input-dir")) builder.corpusDir(corpus.get("input-dir").asText());
        if (corpus.has("extensions")) builder.extensions(textList(corpus.get("extensions")));
        if (corpus.has("batch-size")) builder.batchSize(corpus.get("batch-size").asInt());
        if (corpus.has("skip-templated"))
            builder.skipTemplated(corpus.get("skip-templated").asBoolean());
        if (corpus.has("skip-custom-resources"))
            builder.skipCustomResources(corpus.get("skip-custom-resources").asBoolean());
        if (corpus.has("require-kind")) builder.requireKind(corpus.get("require-kind").asBoolean());
        if (corpus.has("default-kind")) builder.defaultKind(corpus.get("default-kind").asText());

        // Pool and budget are records; collect YAML values first, env overlay below
        JsonNode pool = root.path("pool");
        int yamlWorkers = intOrDefault(pool, "workers", WorkerPoolConfig.DEFAULT.workers());
        int yamlQueueCapacity = intOrDefault(pool, "queue-capacity", WorkerPoolConfig.DEFAULT.queueCapacity());

        JsonNode budget = root.path("budget");
        long yamlMaxMs = budget.has("max-ms") ? budget.get("max-ms").asLong() : TranslationBudget.DEFAULT.maxMillis();
        int yamlMaxDepth = intOrDefault(budget, "max-depth", TranslationBudget.DEFAULT.maxDepth());

        JsonNode output = root.path("output");
        if (output.has("report")) builder.reportFile(output.get("report").asText());
        if (output.has("summary")) builder.summaryFile(output.get("summary").asText());
        if (output.has("checkpoint")) builder.checkpointFile(output.get("checkpoint").asText());

        JsonNode logging = root.path("logging");
        builder.loggingFormat(textOrDefault(logging, "format", "text"));
        builder.loggingLevel(textOrDefault(logging, "level", "INFO"));

        // --- Environment variable overlay ---

        envString(envLookup, "SCHEMAFM_SCHEMA_DEFINITIONS", builder::schemaFile);
        if (isSet(envLookup, "SCHEMAFM_SCHEMA_ROOTS")) {
            builder.roots(splitList(envLookup.apply("SCHEMAFM_SCHEMA_ROOTS")));
        }
        envString(envLookup, "SCHEMAFM_SCHEMA_NAMESPACE", builder::namespace);

        envString(envLookup, "SCHEMAFM_MODEL_OUTPUT_DIR", builder::modelDir);
        envInt(envLookup, "SCHEMAFM_MODEL_PARALLELISM", builder::parallelism);
        envBool(envLookup, "SCHEMAFM_MODEL_INCLUDE_DESCRIPTIONS", builder::inlineDescriptions);

        envString(envLookup, "SCHEMAFM_MAPPING_TABLE", builder::mappingTable);

        envString(envLookup, "SCHEMAFM_CORPUS_INPUT_DIR", builder::corpusDir);
        if (isSet(envLookup, "SCHEMAFM_CORPUS_EXTENSIONS")) {
            builder.extensions(splitList(envLookup.apply("SCHEMAFM_CORPUS_EXTENSIONS")));
        }
        envInt(envLookup, "SCHEMAFM_CORPUS_BATCH_SIZE", builder::batchSize);
        envBool(envLookup, "SCHEMAFM_CORPUS_SKIP_TEMPLATED", builder::skipTemplated);
        envBool(envLookup, "SCHEMAFM_CORPUS_SKIP_CUSTOM_RESOURCES", builder::skipCustomResources);
        envBool(envLookup, "SCHEMAFM_CORPUS_REQUIRE_KIND", builder::requireKind);
        envString(envLookup, "SCHEMAFM_CORPUS_DEFAULT_KIND", builder::defaultKind);

        builder.pool(new WorkerPoolConfig(
                envIntOrDefault(envLookup, "SCHEMAFM_POOL_WORKERS", yamlWorkers),
                envIntOrDefault(envLookup, "SCHEMAFM_POOL_QUEUE_CAPACITY", yamlQueueCapacity)));

        builder.budget(new TranslationBudget(
                isSet(envLookup, "SCHEMAFM_BUDGET_MAX_MS")
                        ? Long.parseLong(envLookup.apply("SCHEMAFM_BUDGET_MAX_MS").trim())
                        : yamlMaxMs,
                envIntOrDefault(envLookup, "SCHEMAFM_BUDGET_MAX_DEPTH", yamlMaxDepth)));

        envString(envLookup, "SCHEMAFM_OUTPUT_REPORT", builder::reportFile);
        envString(envLookup, "SCHEMAFM_OUTPUT_SUMMARY", builder::summaryFile);
        envString(envLookup, "SCHEMAFM_OUTPUT_CHECKPOINT", builder::checkpointFile);

        envString(envLookup, "SCHEMAFM_LOGGING_FORMAT", builder::loggingFormat);
        envString(envLookup, "SCHEMAFM_LOGGING_LEVEL", builder::loggingLevel);

        return builder.build();
    }

    private static JsonSchema loadConfigSchema() {
        try (InputStream in = ConfigLoader.class.getResourceAsStream(CONFIG_SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + CONFIG_SCHEMA_RESOURCE);
            }
            JsonNode schemaNode = new ObjectMapper().readTree(in);
            return JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012).getSchema(schemaNode);
        } catch (IOException e) {
            throw new IllegalStateException("Unreadable classpath resource " + CONFIG_SCHEMA_RESOURCE, e);
        }
    }

    // --- Env helpers ---

    /** An env var is "set" iff it is defined and its trimmed value is non-empty. */
    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    /** Applies a string env var override if set. */
    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    /** Applies an integer env var override if set. */
    private static void envInt(Function<String, String> envLookup, String envVar, IntConsumer setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(parseInt(envVar, envLookup.apply(envVar)));
        }
    }

    /** Applies a boolean env var override if set. */
    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Boolean.parseBoolean(envLookup.apply(envVar).trim()));
        }
    }

    /** Returns the env var integer if set, otherwise the YAML default. */
    private static int envIntOrDefault(Function<String, String> envLookup, String envVar, int yamlDefault) {
        return isSet(envLookup, envVar) ? parseInt(envVar, envLookup.apply(envVar)) : yamlDefault;
    }

    private static int parseInt(String envVar, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigLoadException(envVar + " must be an integer, got: " + value.trim(), e);
        }
    }

    private static List<String> splitList(String value) {
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    // --- YAML helpers ---

    private static List<String> textList(JsonNode node) {
        List<String> out = new ArrayList<>();
        node.forEach(n -> out.add(n.asText()));
        return out;
    }

    private static String textOrDefault(JsonNode node, String field, String defaultValue) {
        return node.has(field) ? node.get(field).asText() : defaultValue;
    }

    private static int intOrDefault(JsonNode node, String field, int defaultValue) {
        return node.has(field) ? node.get(field).asInt() : defaultValue;
    }
}
