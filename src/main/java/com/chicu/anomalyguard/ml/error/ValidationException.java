package com.chicu.anomalyguard.ml.error;

/**
 * Битый/пустой батч. Бросается ДО любой мутации состояния устройства (HTTP 400).
 */
public class ValidationException extends AnomalyServiceException {

    public ValidationException(String message) {
        super(message);
    }
}
