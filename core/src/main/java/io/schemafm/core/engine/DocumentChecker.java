package io.schemafm.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.schemafm.core.error.InputException;
import io.schemafm.core.mapping.KeyMappingTable;
import io.schemafm.core.model.FeatureModel;
import io.schemafm.core.spi.PipelineListener;
import io.schemafm.core.translate.ConfigurationSelection;
import io.schemafm.core.translate.ConfigurationTranslator;
import io.schemafm.core.translate.TranslationBudget;
import io.schemafm.core.validate.ModelValidator;
import io.schemafm.core.validate.ValidationReport;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Translates and validates single documents against a shared model and mapping table.
 *
 * <p>
 * A document that cannot be translated (unreadable root, budget exceeded) becomes a failed
 * {@link DocumentResult}; the failure never escapes to the caller, so one bad document cannot
 * stop a batch. Thread-safe.
 */
public final class DocumentChecker {

    private static final Logger LOG = LoggerFactory.getLogger(DocumentChecker.class);

    private final ConfigurationTranslator translator;
    private final ModelValidator validator;
    private final PipelineListener listener;

    public DocumentChecker(FeatureModel model, KeyMappingTable mapping) {
        this(model, mapping, null, TranslationBudget.DEFAULT, null);
    }

    /**
     * @param defaultKind kind for documents without a {@code kind} field, may be {@code null}
     * @param listener    optional listener for document events, may be {@code null}
     */
    public DocumentChecker(
            FeatureModel model,
            KeyMappingTable mapping,
            String defaultKind,
            TranslationBudget budget,
            PipelineListener listener) {
        Objects.requireNonNull(model, "model must not be null");
        this.translator = new ConfigurationTranslator(model, mapping, defaultKind, budget);
        this.validator = new ModelValidator(model);
        this.listener = listener;
    }

    public DocumentResult check(JsonNode document, String documentId) {
        long started = System.currentTimeMillis();
        MDC.put("document", documentId);
        try {
            ConfigurationSelection selection = translator.translate(document, documentId);
            ValidationReport report = validator.validate(selection);
            long elapsed = System.currentTimeMillis() - started;
            LOG.debug("Checked {}: valid={}, violations={}, unmapped={}",
                    documentId, report.valid(), report.violations().size(), selection.unmapped().size());
            notifyChecked(report, selection, elapsed);
            return DocumentResult.checked(selection, report, elapsed);
        } catch (InputException e) {
            long elapsed = System.currentTimeMillis() - started;
            LOG.warn("Document {} failed: {}", documentId, e.getMessage());
            notifyFailed(documentId, elapsed, e.getMessage());
            return DocumentResult.failed(documentId, e.getMessage(), elapsed);
        } finally {
            MDC.remove("document");
        }
    }

    private void notifyChecked(ValidationReport report, ConfigurationSelection selection, long elapsed) {
        if (listener == null) return;
        try {
            listener.onDocumentChecked(new PipelineListener.DocumentCheckedEvent(
                    report.documentId(), report.valid(), report.violations().size(), selection.unmapped().size(), elapsed));
        } catch (Exception e) {
            LOG.warn("PipelineListener.onDocumentChecked failed", e);
        }
    }

    private void notifyFailed(String documentId, long elapsed, String detail) {
        if (listener == null) return;
        try {
            listener.onDocumentFailed(new PipelineListener.DocumentFailedEvent(documentId, elapsed, detail));
        } catch (Exception e) {
            LOG.warn("PipelineListener.onDocumentFailed failed", e);
        }
    }
}
