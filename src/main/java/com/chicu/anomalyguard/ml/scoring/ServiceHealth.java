package com.chicu.anomalyguard.ml.scoring;

public record ServiceHealth(
        int activeModels,
        int persistedModels
) {
}
