package com.chicu.anomalyguard.ml.error;

import lombok.Getter;

/**
 * Неожиданный сбой fit/score. Батч отбрасывается, состояние устройства откатывается (HTTP 500).
 */
@Getter
public class InternalScoringException extends AnomalyServiceException {

    private final String deviceId;

    public InternalScoringException(String deviceId, String message, Throwable cause) {
        super(message, cause);
        this.deviceId = deviceId;
    }
}
