package io.schemafm.core.spi;

/**
 * Observability hooks for model generation and document checking.
 *
 * <p>
 * All methods receive immutable event objects. Implementations must be thread-safe and
 * non-blocking: document events arrive from every batch worker. Exceptions thrown by listeners
 * are caught and logged by the caller and never affect the outcome.
 */
public interface PipelineListener {

    /** Called after one kind tree has been synthesized and its constraints derived. */
    void onKindSynthesized(KindSynthesizedEvent event);

    /** Called once the model is assembled and its key mapping derived. */
    void onModelGenerated(ModelGeneratedEvent event);

    /** Called when a document was translated and validated, valid or not. */
    void onDocumentChecked(DocumentCheckedEvent event);

    /** Called when a document could not be translated (unreadable, budget exceeded). */
    void onDocumentFailed(DocumentFailedEvent event);

    record KindSynthesizedEvent(String kindId, String definition, int features, int constraints) {}

    record ModelGeneratedEvent(String namespace, int kinds, int features, int constraints, long durationMs) {}

    record DocumentCheckedEvent(String documentId, boolean valid, int violations, int unmapped, long durationMs) {}

    record DocumentFailedEvent(String documentId, long durationMs, String errorDetail) {}
}
