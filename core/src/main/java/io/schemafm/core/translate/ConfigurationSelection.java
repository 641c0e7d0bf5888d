package io.schemafm.core.translate;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;
import io.schemafm.core.model.Assignment;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Outcome of translating one document: the features it selects, the literal values it carries,
 * and the keys no mapping entry covered.
 *
 * @param documentId identifier of the translated document
 * @param selected   selected feature ids, in activation order
 * @param values     feature id to the literal values recorded for it
 * @param unmapped   key paths (without the kind) that matched no entry
 */
@JsonPropertyOrder({"document-id", "selected-feature-ids", "attribute-values", "unmapped-keys"})
public record ConfigurationSelection(
        @JsonProperty("document-id") String documentId,
        @JsonProperty("selected-feature-ids") Set<String> selected,
        @JsonProperty("attribute-values") Map<String, List<JsonNode>> values,
        @JsonProperty("unmapped-keys") List<String> unmapped)
        implements Assignment {

    public ConfigurationSelection {
        Objects.requireNonNull(documentId, "documentId must not be null");
        selected = Collections.unmodifiableSet(new LinkedHashSet<>(selected));
        Map<String, List<JsonNode>> copy = new LinkedHashMap<>();
        values.forEach((k, v) -> copy.put(k, List.copyOf(v)));
        values = Collections.unmodifiableMap(copy);
        unmapped = List.copyOf(unmapped);
    }

    @Override
    public boolean isSelected(String featureId) {
        return selected.contains(featureId);
    }

    @Override
    public boolean hasValue(String featureId, String literal) {
        List<JsonNode> recorded = values.get(featureId);
        if (recorded == null) {
            return false;
        }
        for (JsonNode v : recorded) {
            if (v.asText().equals(literal)) {
                return true;
            }
        }
        return false;
    }

    @JsonIgnore
    public boolean fullyMapped() {
        return unmapped.isEmpty();
    }
}
