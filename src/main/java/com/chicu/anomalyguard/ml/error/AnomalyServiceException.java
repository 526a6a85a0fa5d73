package com.chicu.anomalyguard.ml.error;

/**
 * Корень всех доменных ошибок сервиса скоринга.
 */
public class AnomalyServiceException extends RuntimeException {

    public AnomalyServiceException(String message) {
        super(message);
    }

    public AnomalyServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
