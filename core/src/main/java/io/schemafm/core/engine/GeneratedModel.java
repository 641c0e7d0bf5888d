package io.schemafm.core.engine;

import io.schemafm.core.error.Diagnostics;
import io.schemafm.core.mapping.KeyMappingTable;
import io.schemafm.core.model.FeatureModel;

/**
 * Everything model generation produces.
 *
 * @param model                   the assembled feature model
 * @param mapping                 key mapping table derived from the model
 * @param diagnostics             warnings and notes collected along the way
 * @param unconvertedDescriptions description sentences that read like constraints but matched no
 *                                rule
 */
public record GeneratedModel(
        FeatureModel model, KeyMappingTable mapping, Diagnostics diagnostics, int unconvertedDescriptions) {}
