package io.schemafm.core.validate;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;
import java.util.Objects;

/**
 * @param documentId    identifier of the validated document
 * @param valid         whether no rule was violated
 * @param violations    violated rule ids in check order, e.g. {@code parent:Pod.metadata.labels}
 * @param elapsedMillis time spent validating
 */
@JsonPropertyOrder({"document-id", "valid", "violated-constraints", "elapsed-time"})
public record ValidationReport(
        @JsonProperty("document-id") String documentId,
        @JsonProperty("valid") boolean valid,
        @JsonProperty("violated-constraints") List<String> violations,
        @JsonProperty("elapsed-time") long elapsedMillis) {

    public ValidationReport {
        Objects.requireNonNull(documentId, "documentId must not be null");
        violations = List.copyOf(violations);
        if (valid != violations.isEmpty()) {
            throw new IllegalArgumentException("valid must be true exactly when there are no violations");
        }
    }
}
