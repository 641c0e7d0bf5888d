package io.schemafm.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.schemafm.core.assemble.KindModel;
import io.schemafm.core.assemble.ModelAssembler;
import io.schemafm.core.constraint.ConstraintDeriver;
import io.schemafm.core.constraint.DerivationResult;
import io.schemafm.core.error.Diagnostics;
import io.schemafm.core.mapping.KeyMappingDeriver;
import io.schemafm.core.mapping.KeyMappingTable;
import io.schemafm.core.model.FeatureModel;
import io.schemafm.core.schema.SchemaGraph;
import io.schemafm.core.schema.SchemaGraphResolver;
import io.schemafm.core.spi.PipelineListener;
import io.schemafm.core.synth.FeatureSynthesizer;
import io.schemafm.core.synth.KindTree;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Generates a feature model from raw schema definitions: resolve the graph, synthesize and derive
 * constraints per kind, assemble, then derive the key mapping.
 *
 * <p>
 * Resolution is sequential. Kinds are independent once the graph is resolved and, with
 * {@code parallelism > 1}, are synthesized on a fixed pool; results are joined in root order so the
 * output does not depend on scheduling.
 */
public final class ModelPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(ModelPipeline.class);

    private final PipelineOptions options;
    private final PipelineListener listener;

    public ModelPipeline(PipelineOptions options) {
        this(options, null);
    }

    /**
     * @param listener optional listener for generation events, may be {@code null}
     */
    public ModelPipeline(PipelineOptions options, PipelineListener listener) {
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.listener = listener;
    }

    public GeneratedModel generate(Map<String, JsonNode> rawDefinitions) {
        long started = System.currentTimeMillis();
        Diagnostics diagnostics = new Diagnostics();
        SchemaGraph graph = new SchemaGraphResolver(rawDefinitions, diagnostics).resolve(options.roots());
        FeatureSynthesizer synthesizer = new FeatureSynthesizer(graph, diagnostics);
        ConstraintDeriver deriver = new ConstraintDeriver(graph, diagnostics);
        AtomicInteger unconverted = new AtomicInteger();

        List<KindModel> kinds = synthesizeAll(graph.roots(), root -> {
            KindTree tree = synthesizer.synthesize(root);
            DerivationResult derived = deriver.derive(tree);
            unconverted.addAndGet(derived.unconverted());
            notifyKind(tree, derived);
            return new KindModel(tree, derived.constraints());
        });

        FeatureModel model = new ModelAssembler(options.namespace(), diagnostics).assemble(kinds);
        KeyMappingTable mapping = KeyMappingDeriver.derive(model);
        long durationMs = System.currentTimeMillis() - started;
        LOG.info("Generated model {} in {}ms: {} kinds, {} features, {} constraints, {} mapping entries, {} diagnostics",
                model.namespace(), durationMs, model.kinds().size(), model.size(), model.constraints().size(),
                mapping.size(), diagnostics.size());
        notifyModel(model, durationMs);
        return new GeneratedModel(model, mapping, diagnostics, unconverted.get());
    }

    @FunctionalInterface
    private interface KindStep {
        KindModel apply(String root);
    }

    private List<KindModel> synthesizeAll(List<String> roots, KindStep step) {
        List<KindModel> out = new ArrayList<>(roots.size());
        if (options.parallelism() == 1 || roots.size() < 2) {
            roots.forEach(r -> out.add(step.apply(r)));
            return out;
        }
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(options.parallelism(), roots.size()));
        try {
            List<Future<KindModel>> futures = new ArrayList<>(roots.size());
            for (String root : roots) {
                futures.add(pool.submit(() -> step.apply(root)));
            }
            for (Future<KindModel> f : futures) {
                out.add(f.get());
            }
            return out;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while synthesizing kinds", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException re) {
                throw re;
            }
            throw new IllegalStateException("Kind synthesis failed", e.getCause());
        } finally {
            pool.shutdownNow();
        }
    }

    private void notifyKind(KindTree tree, DerivationResult derived) {
        if (listener == null) return;
        try {
            listener.onKindSynthesized(new PipelineListener.KindSynthesizedEvent(
                    tree.root().id(), tree.definition(), tree.root().preOrder().size(), derived.constraints().size()));
        } catch (Exception e) {
            LOG.warn("PipelineListener.onKindSynthesized failed", e);
        }
    }

    private void notifyModel(FeatureModel model, long durationMs) {
        if (listener == null) return;
        try {
            listener.onModelGenerated(new PipelineListener.ModelGeneratedEvent(
                    model.namespace(), model.kinds().size(), model.size(), model.constraints().size(), durationMs));
        } catch (Exception e) {
            LOG.warn("PipelineListener.onModelGenerated failed", e);
        }
    }
}
