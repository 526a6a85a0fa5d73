package com.chicu.anomalyguard.web.dto;

import com.chicu.anomalyguard.ml.scoring.ScoredPoint;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ScoredPointDto {

    private int index;

    /** 0..1, больше = аномальнее */
    private double score;

    @JsonProperty("isAnomaly")
    private boolean anomaly;

    public static ScoredPointDto of(ScoredPoint p) {
        return new ScoredPointDto(p.index(), p.score(), p.anomaly());
    }
}
