package com.chicu.anomalyguard.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HealthResponse {
    private boolean ok;
    private String service;
    private int activeModels;
    private int persistedModels;
}
