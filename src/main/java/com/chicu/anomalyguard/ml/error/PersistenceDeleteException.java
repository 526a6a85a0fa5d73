package com.chicu.anomalyguard.ml.error;

/**
 * Единственный случай, когда ошибка хранилища видна клиенту: purge обещает,
 * что после него на диске не останется следов устройства.
 */
public class PersistenceDeleteException extends PersistenceException {

    public PersistenceDeleteException(String deviceId, String message, Throwable cause) {
        super(deviceId, message, cause);
    }
}
