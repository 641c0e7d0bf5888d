package io.schemafm.core.engine;

import java.util.List;
import java.util.Objects;

/**
 * Model generation settings.
 *
 * @param namespace   name of the synthetic root (default: {@code model})
 * @param roots       definitions to treat as kinds; empty means every definition carrying a kind
 *                    extension, or every definition if none does
 * @param parallelism threads synthesizing kinds concurrently; 1 synthesizes on the caller thread
 */
public record PipelineOptions(String namespace, List<String> roots, int parallelism) {

    public static final PipelineOptions DEFAULT = new PipelineOptions("model", List.of(), 1);

    public PipelineOptions {
        Objects.requireNonNull(namespace, "namespace must not be null");
        if (namespace.isBlank()) {
            throw new IllegalArgumentException("namespace must not be blank");
        }
        roots = List.copyOf(roots);
        if (parallelism <= 0) {
            throw new IllegalArgumentException("parallelism must be positive, got: " + parallelism);
        }
    }
}
