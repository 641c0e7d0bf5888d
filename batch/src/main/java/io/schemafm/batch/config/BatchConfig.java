package io.schemafm.batch.config;

import io.schemafm.core.translate.TranslationBudget;
import java.util.List;

/**
 * Root configuration of the batch tool.
 *
 * <p>
 * Every field has a default except {@code schemaFile}, which {@code generate} requires. Use
 * {@link #builder()} to construct instances.
 *
 * @param schemaFile             JSON or YAML file holding the schema definitions
 * @param roots                  definitions to treat as kinds, empty for the default root set
 * @param namespace              name of the model's synthetic root
 * @param modelDir               directory receiving the model, descriptions and mapping files
 * @param parallelism            threads synthesizing kinds concurrently
 * @param inlineDescriptions     also write descriptions as {@code doc} attributes in the model
 * @param mappingTable           key mapping CSV to use instead of the one derived from the model
 * @param corpusDir              directory scanned for documents
 * @param extensions             file extensions of corpus documents
 * @param batchSize              files per checkpointed batch
 * @param skipTemplated          skip files containing template markers
 * @param skipCustomResources    skip CustomResourceDefinition documents
 * @param requireKind            skip documents without {@code apiVersion} and {@code kind}
 * @param defaultKind            kind assumed for documents without a {@code kind} field
 * @param pool                   batch worker pool settings
 * @param budget                 per-document translation budget
 * @param reportFile             per-document validation report CSV
 * @param summaryFile            per-document summary CSV
 * @param checkpointFile         completed batch ids, one per line
 * @param loggingFormat          json or text
 * @param loggingLevel           root log level
 */
public record BatchConfig(
        String schemaFile,
        List<String> roots,
        String namespace,
        String modelDir,
        int parallelism,
        boolean inlineDescriptions,
        String mappingTable,
        String corpusDir,
        List<String> extensions,
        int batchSize,
        boolean skipTemplated,
        boolean skipCustomResources,
        boolean requireKind,
        String defaultKind,
        WorkerPoolConfig pool,
        TranslationBudget budget,
        String reportFile,
        String summaryFile,
        String checkpointFile,
        String loggingFormat,
        String loggingLevel) {

    public BatchConfig {
        roots = List.copyOf(roots);
        extensions = List.copyOf(extensions);
    }

    /** Creates a new builder with the documented defaults. */
    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link BatchConfig}. */
    public static final class Builder {
        private String schemaFile;
        private List<String> roots = List.of();
        private String namespace = "model";
        private String modelDir = "./out/model";
        private int parallelism = 1;
        private boolean inlineDescriptions = false;
        private String mappingTable;
        private String corpusDir = "./corpus";
        private List<String> extensions = List.of("yaml", "yml", "json");
        private int batchSize = 100;
        private boolean skipTemplated = true;
        private boolean skipCustomResources = true;
        private boolean requireKind = true;
        private String defaultKind;
        private WorkerPoolConfig pool = WorkerPoolConfig.DEFAULT;
        private TranslationBudget budget = TranslationBudget.DEFAULT;
        private String reportFile = "./out/report.csv";
        private String summaryFile = "./out/summary.csv";
        private String checkpointFile = "./out/checkpoint.txt";
        private String loggingFormat = "text";
        private String loggingLevel = "INFO";

        Builder() {}

        public Builder schemaFile(String schemaFile) {
            this.schemaFile = schemaFile;
            return this;
        }

        public Builder roots(List<String> roots) {
            this.roots = roots;
            return this;
        }

        public Builder namespace(String namespace) {
            this.namespace = namespace;
            return this;
        }

        public Builder modelDir(String modelDir) {
            this.modelDir = modelDir;
            return this;
        }

        public Builder parallelism(int parallelism) {
            this.parallelism = parallelism;
            return this;
        }

        public Builder inlineDescriptions(boolean inlineDescriptions) {
            this.inlineDescriptions = inlineDescriptions;
            return this;
        }

        public Builder mappingTable(String mappingTable) {
            this.mappingTable = mappingTable;
            return this;
        }

        public Builder corpusDir(String corpusDir) {
            this.corpusDir = corpusDir;
            return this;
        }

        public Builder extensions(List<String> extensions) {
            this.extensions = extensions;
            return this;
        }

        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        public Builder skipTemplated(boolean skipTemplated) {
            this.skipTemplated = skipTemplated;
            return this;
        }

        public Builder skipCustomResources(boolean skipCustomResources) {
            this.skipCustomResources = skipCustomResources;
            return this;
        }

        public Builder requireKind(boolean requireKind) {
            this.requireKind = requireKind;
            return this;
        }

        public Builder defaultKind(String defaultKind) {
            this.defaultKind = defaultKind;
            return this;
        }

        public Builder pool(WorkerPoolConfig pool) {
            this.pool = pool;
            return this;
        }

        public Builder budget(TranslationBudget budget) {
            this.budget = budget;
            return this;
        }

        public Builder reportFile(String reportFile) {
            this.reportFile = reportFile;
            return this;
        }

        public Builder summaryFile(String summaryFile) {
            this.summaryFile = summaryFile;
            return this;
        }

        public Builder checkpointFile(String checkpointFile) {
            this.checkpointFile = checkpointFile;
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        public BatchConfig build() {
            if (batchSize <= 0) {
                throw new IllegalArgumentException("batchSize must be positive, got: " + batchSize);
            }
            return new BatchConfig(
                    schemaFile,
                    roots,
                    namespace,
                    modelDir,
                    parallelism,
                    inlineDescriptions,
                    mappingTable,
                    corpusDir,
                    extensions,
                    batchSize,
                    skipTemplated,
                    skipCustomResources,
                    requireKind,
                    defaultKind,
                    pool,
                    budget,
                    reportFile,
                    summaryFile,
                    checkpointFile,
                    loggingFormat,
                    loggingLevel);
        }
    }
}
