package com.chicu.anomalyguard.web.controller.api;

import com.chicu.anomalyguard.ml.scoring.AnomalyScoringService;
import com.chicu.anomalyguard.ml.scoring.ServiceHealth;
import com.chicu.anomalyguard.web.dto.HealthResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class HealthApiController {

    static final String SERVICE_NAME = "ml-anomaly-detection";

    private final AnomalyScoringService scoringService;

    @GetMapping("/health")
    public HealthResponse health() {
        ServiceHealth h = scoringService.health();
        return HealthResponse.builder()
                .ok(true)
                .service(SERVICE_NAME)
                .activeModels(h.activeModels())
                .persistedModels(h.persistedModels())
                .build();
    }
}
