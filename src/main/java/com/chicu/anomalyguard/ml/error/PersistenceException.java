package com.chicu.anomalyguard.ml.error;

import lombok.Getter;

@Getter
public abstract class PersistenceException extends AnomalyServiceException {

    private final String deviceId;

    protected PersistenceException(String deviceId, String message, Throwable cause) {
        super(message, cause);
        this.deviceId = deviceId;
    }
}
