package com.chicu.anomalyguard.ml.error;

/**
 * Мало данных для fit. Наружу не уходит: lifecycle проверяет размер окна заранее,
 * холодное устройство получает нейтральный скор.
 */
public class InsufficientDataException extends AnomalyServiceException {

    private final int available;
    private final int required;

    public InsufficientDataException(int available, int required) {
        super("insufficient training data: " + available + " < " + required);
        this.available = available;
        this.required = required;
    }

    public int getAvailable() {
        return available;
    }

    public int getRequired() {
        return required;
    }
}
