package io.schemafm.batch.runner;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One document ready for translation. Files holding several documents yield one unit each, with
 * ids of the form {@code path#index}.
 */
public record DocumentUnit(String id, JsonNode document) {}
