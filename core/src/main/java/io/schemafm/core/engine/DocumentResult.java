package io.schemafm.core.engine;

import io.schemafm.core.translate.ConfigurationSelection;
import io.schemafm.core.validate.ValidationReport;

/**
 * Outcome of checking one document. Exactly one of {@code report} and {@code error} is set.
 *
 * @param documentId    identifier of the document
 * @param selection     translation output, {@code null} when translation failed
 * @param report        validation report, {@code null} when translation failed
 * @param error         failure detail, {@code null} when the document was checked
 * @param elapsedMillis wall-clock time for translation and validation together
 */
public record DocumentResult(
        String documentId, ConfigurationSelection selection, ValidationReport report, String error, long elapsedMillis) {

    public static DocumentResult checked(ConfigurationSelection selection, ValidationReport report, long elapsedMillis) {
        return new DocumentResult(report.documentId(), selection, report, null, elapsedMillis);
    }

    public static DocumentResult failed(String documentId, String error, long elapsedMillis) {
        return new DocumentResult(documentId, null, null, error, elapsedMillis);
    }

    public boolean failed() {
        return error != null;
    }

    /** Checked and free of violations. */
    public boolean valid() {
        return report != null && report.valid();
    }
}
