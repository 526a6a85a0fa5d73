package com.chicu.anomalyguard.web.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ScoreBatchResponse {
    private List<ScoredPointDto> scores;
}
