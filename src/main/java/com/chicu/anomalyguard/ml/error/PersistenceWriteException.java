package com.chicu.anomalyguard.ml.error;

public class PersistenceWriteException extends PersistenceException {

    public PersistenceWriteException(String deviceId, String message, Throwable cause) {
        super(deviceId, message, cause);
    }
}
