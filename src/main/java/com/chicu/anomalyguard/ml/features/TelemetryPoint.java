package com.chicu.anomalyguard.ml.features;

/**
 * Одна точка телеметрии устройства. Каналы nullable на входе,
 * проверка в {@link FeatureExtractor}.
 */
public record TelemetryPoint(
        String ts,
        Double temperatureC,
        Double vibrationG,
        Double humidityPct,
        Double voltageV
) {
}
