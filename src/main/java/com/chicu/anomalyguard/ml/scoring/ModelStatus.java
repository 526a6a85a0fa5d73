package com.chicu.anomalyguard.ml.scoring;

import java.time.Instant;

public record ModelStatus(
        String deviceId,
        boolean inMemory,
        boolean persisted,
        boolean trained,
        int pointsSinceTrain,
        int windowSize,
        Instant trainedAt
) {
}
