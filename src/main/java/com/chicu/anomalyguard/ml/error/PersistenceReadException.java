package com.chicu.anomalyguard.ml.error;

public class PersistenceReadException extends PersistenceException {

    public PersistenceReadException(String deviceId, String message, Throwable cause) {
        super(deviceId, message, cause);
    }
}
