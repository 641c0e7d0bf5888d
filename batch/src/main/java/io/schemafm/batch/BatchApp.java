package io.schemafm.batch;

import io.schemafm.batch.config.BatchConfig;
import io.schemafm.batch.config.ConfigLoadException;
import io.schemafm.batch.config.ConfigLoader;
import io.schemafm.batch.runner.BatchRunner;
import io.schemafm.batch.runner.CheckpointStore;
import io.schemafm.batch.runner.CorpusScanner;
import io.schemafm.batch.runner.DocumentClassifier;
import io.schemafm.batch.runner.ReportWriter;
import io.schemafm.batch.runner.RunSummary;
import io.schemafm.core.engine.DocumentChecker;
import io.schemafm.core.engine.GeneratedModel;
import io.schemafm.core.engine.ModelPipeline;
import io.schemafm.core.engine.PipelineOptions;
import io.schemafm.core.error.Diagnostic;
import io.schemafm.core.mapping.KeyMappingDeriver;
import io.schemafm.core.mapping.KeyMappingEntry;
import io.schemafm.core.mapping.KeyMappingLoader;
import io.schemafm.core.mapping.KeyMappingTable;
import io.schemafm.core.model.FeatureModel;
import io.schemafm.core.model.ModelDiff;
import io.schemafm.core.schema.DefinitionsLoader;
import io.schemafm.core.serial.DescriptionsFile;
import io.schemafm.core.serial.ModelParser;
import io.schemafm.core.serial.ModelSerializer;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Batch tool commands.
 *
 * <ul>
 * <li>{@code generate}: schema definitions to model, descriptions and key mapping files; writes
 * a changelog when a previous model is replaced</li>
 * <li>{@code validate}: checks the corpus against the model in the output directory</li>
 * <li>{@code run} (default): {@code generate} followed by {@code validate}</li>
 * <li>{@code diff <old> <new> [--out <file>]}: markdown changelog between two model files</li>
 * </ul>
 *
 * Every command except {@code diff} reads its settings through {@link ConfigLoader}.
 */
public final class BatchApp {

    private static final Logger LOG = LoggerFactory.getLogger(BatchApp.class);

    static final String MODEL_FILE = "model.fm";
    static final String DESCRIPTIONS_FILE = "descriptions.json";
    static final String MAPPING_FILE = "key-mapping.csv";
    static final String CHANGELOG_FILE = "CHANGELOG.md";

    private static final long PROGRESS_EVERY = 1000;

    private final Function<String, String> envLookup;
    private final PrintStream out;
    private final ProgressListener listener = new ProgressListener(PROGRESS_EVERY);
    private volatile BatchRunner activeRunner;

    public BatchApp(Function<String, String> envLookup, PrintStream out) {
        this.envLookup = envLookup;
        this.out = out;
    }

    /** Runs the command named by {@code args[0]}, or {@code run} when the first argument is an option. */
    public void execute(String[] args) {
        String command = args.length > 0 && !args[0].startsWith("--") ? args[0] : "run";
        if ("diff".equals(command)) {
            diff(args);
            return;
        }
        BatchConfig config = ConfigLoader.load(args, envLookup);
        LogbackConfigurator.configure(config.loggingFormat(), config.loggingLevel());
        switch (command) {
            case "generate" -> generate(config);
            case "validate" -> validate(config, null);
            case "run" -> validate(config, generate(config));
            default -> throw new IllegalArgumentException(
                    "Unknown command '" + command + "'. Expected one of: generate, validate, run, diff");
        }
    }

    /** Stops the batch run in progress, if any. */
    public void cancel() {
        BatchRunner runner = activeRunner;
        if (runner != null) {
            runner.cancel();
        }
    }

    GeneratedModel generate(BatchConfig config) {
        if (config.schemaFile() == null) {
            throw new ConfigLoadException("schema.definitions is required to generate a model");
        }
        GeneratedModel generated = new ModelPipeline(
                        new PipelineOptions(config.namespace(), config.roots(), config.parallelism()), listener)
                .generate(DefinitionsLoader.load(Path.of(config.schemaFile())));

        Path dir = Path.of(config.modelDir());
        Path modelFile = dir.resolve(MODEL_FILE);
        FeatureModel previous = Files.exists(modelFile) ? ModelParser.read(modelFile) : null;

        new ModelSerializer(config.inlineDescriptions()).write(generated.model(), modelFile);
        DescriptionsFile.write(generated.model().descriptions(), dir.resolve(DESCRIPTIONS_FILE));
        KeyMappingLoader.write(generated.mapping(), dir.resolve(MAPPING_FILE));
        LOG.info("Wrote {}, {} and {} to {}", MODEL_FILE, DESCRIPTIONS_FILE, MAPPING_FILE, dir);

        if (previous != null) {
            ModelDiff diff = ModelDiff.between(previous, generated.model());
            if (!diff.isEmpty()) {
                writeText(dir.resolve(CHANGELOG_FILE), diff.toMarkdown());
                LOG.info("Model changed since the previous run; changelog written to {}", dir.resolve(CHANGELOG_FILE));
            }
        }

        for (Diagnostic d : generated.diagnostics().all()) {
            LOG.debug("{}", d);
        }
        LOG.info("Diagnostics by code: {}", generated.diagnostics().countsByCode());
        if (generated.unconvertedDescriptions() > 0) {
            LOG.info("{} description sentences read like constraints but were not converted",
                    generated.unconvertedDescriptions());
        }
        return generated;
    }

    RunSummary validate(BatchConfig config, GeneratedModel generated) {
        Path dir = Path.of(config.modelDir());
        FeatureModel model = generated != null ? generated.model() : ModelParser.read(dir.resolve(MODEL_FILE));
        KeyMappingTable mapping = loadMapping(config, model, generated);
        for (KeyMappingEntry stale : mapping.checkAgainst(model)) {
            LOG.warn("Mapping entry {} names unknown feature {}", stale.keyPath(), stale.featureId());
        }

        DocumentChecker checker =
                new DocumentChecker(model, mapping, config.defaultKind(), config.budget(), listener);
        DocumentClassifier classifier =
                new DocumentClassifier(config.skipTemplated(), config.skipCustomResources(), config.requireKind());
        BatchRunner runner = new BatchRunner(
                checker,
                classifier,
                config.pool(),
                config.batchSize(),
                new CheckpointStore(Path.of(config.checkpointFile())),
                new ReportWriter(Path.of(config.reportFile()), Path.of(config.summaryFile())));
        activeRunner = runner;
        RunSummary summary;
        try {
            summary = runner.run(new CorpusScanner(Path.of(config.corpusDir()), config.extensions()));
        } finally {
            activeRunner = null;
        }
        if (generated != null) {
            summary = summary.withDiagnostics(generated.diagnostics().countsByCode());
        }
        logSummary(summary);
        return summary;
    }

    private static KeyMappingTable loadMapping(BatchConfig config, FeatureModel model, GeneratedModel generated) {
        if (config.mappingTable() != null) {
            return KeyMappingLoader.load(Path.of(config.mappingTable()));
        }
        if (generated != null) {
            return generated.mapping();
        }
        Path derived = Path.of(config.modelDir()).resolve(MAPPING_FILE);
        return Files.exists(derived) ? KeyMappingLoader.load(derived) : KeyMappingDeriver.derive(model);
    }

    private void diff(String[] args) {
        if (args.length < 3) {
            throw new IllegalArgumentException("diff requires two model files: diff <old> <new> [--out <file>]");
        }
        FeatureModel older = ModelParser.read(Path.of(args[1]));
        FeatureModel newer = ModelParser.read(Path.of(args[2]));
        String markdown = ModelDiff.between(older, newer).toMarkdown();
        if (args.length >= 5 && "--out".equals(args[3])) {
            writeText(Path.of(args[4]), markdown);
            LOG.info("Changelog written to {}", args[4]);
        } else {
            out.print(markdown);
        }
    }

    private static void logSummary(RunSummary s) {
        LOG.info("Documents: processed={}, valid={}, invalid={}, failed={}",
                s.processed(), s.valid(), s.invalid(), s.failed());
        LOG.info("Skipped by reason: {}", s.skipped());
        LOG.info("Files by size: {}", s.buckets());
        LOG.info("Unmapped keys: {}", s.unmappedKeys());
        if (!s.diagnostics().isEmpty()) {
            LOG.info("Model diagnostics: {}", s.diagnostics());
        }
        LOG.info("Batches: run={}, resumed={}, cancelled={}, elapsedMs={}",
                s.batchesRun(), s.batchesResumed(), s.cancelled(), s.elapsedMillis());
    }

    private static void writeText(Path target, String text) {
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, text, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + target, e);
        }
    }
}
