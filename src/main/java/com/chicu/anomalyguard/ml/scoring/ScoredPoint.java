package com.chicu.anomalyguard.ml.scoring;

/**
 * @param index позиция в присланном батче (не в окне)
 * @param score 0..1, больше = аномальнее
 */
public record ScoredPoint(
        int index,
        double score,
        boolean anomaly
) {
}
