package com.chicu.anomalyguard.web.dto;

import com.chicu.anomalyguard.ml.scoring.ModelStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelStatusDto {

    private String deviceId;
    private boolean inMemory;
    private boolean persisted;
    private boolean trained;
    private int pointsSinceTrain;
    private int windowSize;

    /** null пока модель не обучалась в этом процессе и не поднята с диска */
    private Instant trainedAt;

    public static ModelStatusDto of(ModelStatus s) {
        return ModelStatusDto.builder()
                .deviceId(s.deviceId())
                .inMemory(s.inMemory())
                .persisted(s.persisted())
                .trained(s.trained())
                .pointsSinceTrain(s.pointsSinceTrain())
                .windowSize(s.windowSize())
                .trainedAt(s.trainedAt())
                .build();
    }
}
