package com.chicu.anomalyguard.ml.lifecycle;

public enum LifecycleDecision {

    /** UNTRAINED, окно ещё меньше порога обучения */
    COLD,

    /** UNTRAINED -> TRAINED */
    TRAINED,

    /** TRAINED -> TRAINED, полный refit на окне */
    RETRAINED,

    /** TRAINED, до retrain-интервала ещё не дошли */
    UP_TO_DATE;

    public boolean fitted() {
        return this == TRAINED || this == RETRAINED;
    }
}
