package com.chicu.anomalyguard.web.controller.api;

import com.chicu.anomalyguard.ml.features.TelemetryPoint;
import com.chicu.anomalyguard.ml.scoring.AnomalyScoringService;
import com.chicu.anomalyguard.ml.scoring.ScoredPoint;
import com.chicu.anomalyguard.web.dto.MetricPointDto;
import com.chicu.anomalyguard.web.dto.ScoreBatchRequest;
import com.chicu.anomalyguard.web.dto.ScoreBatchResponse;
import com.chicu.anomalyguard.web.dto.ScoredPointDto;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@Slf4j
@RestController
@RequiredArgsConstructor
public class ScoringApiController {

    private final AnomalyScoringService scoringService;

    /**
     * POST /score-batch
     * {"deviceId":"d1","points":[{"ts":"...","temperature_c":21.5,"vibration_g":0.02,"humidity_pct":40,"voltage_v":3.3}]}
     */
    @PostMapping("/score-batch")
    public ResponseEntity<ScoreBatchResponse> scoreBatch(@Valid @RequestBody ScoreBatchRequest request) {

        List<TelemetryPoint> points = request.getPoints().stream()
                .map(p -> p == null ? null : p.toPoint())
                .toList();

        List<ScoredPoint> scored = scoringService.scoreBatch(request.getDeviceId(), points);

        List<ScoredPointDto> out = scored.stream().map(ScoredPointDto::of).toList();

        long anomalies = out.stream().filter(ScoredPointDto::isAnomaly).count();
        log.info("🌐 [API] scored {} points for device {}: {} anomalies",
                out.size(), request.getDeviceId(), anomalies);

        return ResponseEntity.ok(new ScoreBatchResponse(out));
    }
}
