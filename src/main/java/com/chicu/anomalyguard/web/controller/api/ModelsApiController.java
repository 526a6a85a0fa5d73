package com.chicu.anomalyguard.web.controller.api;

import com.chicu.anomalyguard.ml.error.PersistenceDeleteException;
import com.chicu.anomalyguard.ml.registry.ModelRegistry;
import com.chicu.anomalyguard.ml.scoring.AnomalyScoringService;
import com.chicu.anomalyguard.ml.scoring.ModelStatus;
import com.chicu.anomalyguard.web.dto.DeleteModelResponse;
import com.chicu.anomalyguard.web.dto.ModelStatusDto;
import com.chicu.anomalyguard.web.dto.ModelsResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/models")
public class ModelsApiController {

    private final AnomalyScoringService scoringService;

    @GetMapping
    public ModelsResponse list() {
        Map<String, ModelStatusDto> models = new LinkedHashMap<>();
        for (Map.Entry<String, ModelStatus> e : scoringService.statuses().entrySet()) {
            models.put(e.getKey(), ModelStatusDto.of(e.getValue()));
        }
        return new ModelsResponse(models.size(), models);
    }

    @GetMapping("/{deviceId}")
    public ModelStatusDto get(@PathVariable String deviceId) {
        return scoringService.status(deviceId)
                .map(ModelStatusDto::of)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND,
                        "No model for device " + deviceId));
    }

    /**
     * DELETE /models/{deviceId}
     * Удаляет окно, in-memory модель и бандл на диске. Для неизвестного устройства тоже success.
     */
    @DeleteMapping("/{deviceId}")
    public ResponseEntity<DeleteModelResponse> delete(@PathVariable String deviceId) {
        try {
            ModelRegistry.PurgeResult res = scoringService.purge(deviceId);

            log.info("🌐 [API] model purged: deviceId={}, persisted={}, inMemory={}",
                    deviceId, res.persistedRemoved(), res.inMemoryRemoved());

            return ResponseEntity.ok(DeleteModelResponse.success(deviceId, "Model deleted"));

        } catch (PersistenceDeleteException ex) {
            log.error("❌ failed to delete model bundle deviceId={}", deviceId, ex);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(DeleteModelResponse.error(deviceId, ex.getMessage()));
        }
    }
}
