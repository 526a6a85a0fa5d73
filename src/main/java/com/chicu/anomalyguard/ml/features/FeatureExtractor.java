package com.chicu.anomalyguard.ml.features;

import java.util.List;

public interface FeatureExtractor {

    FeatureSchema schema();

    /**
     * Одна строка X на точку, в порядке входа. Без состояния.
     *
     * @throws com.chicu.anomalyguard.ml.error.ValidationException пустой батч или пропущенный канал
     */
    List<double[]> extract(List<TelemetryPoint> points);
}
