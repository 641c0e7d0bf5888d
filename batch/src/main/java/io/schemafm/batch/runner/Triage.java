package io.schemafm.batch.runner;

import java.util.List;
import java.util.Map;

/**
 * Classification of one corpus file.
 *
 * @param file    file path relative to the corpus directory
 * @param bucket  size class of the file
 * @param units   documents to translate
 * @param skipped document ids left out, with the reason
 */
public record Triage(String file, SizeBucket bucket, List<DocumentUnit> units, Map<String, SkipReason> skipped) {

    public Triage {
        units = List.copyOf(units);
        skipped = Map.copyOf(skipped);
    }
}
