package com.chicu.anomalyguard.ml.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * Что живёт на диске после успешного fit: scorer и normalizer, обученные на одном окне.
 */
public record ModelBundle(
        TrainableScorer scorer,
        StandardNormalizer normalizer,
        String schemaHash,
        Instant trainedAt,
        int trainingSize
) implements Serializable {
}
