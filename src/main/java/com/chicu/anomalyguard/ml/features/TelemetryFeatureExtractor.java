package com.chicu.anomalyguard.ml.features;

import com.chicu.anomalyguard.ml.error.ValidationException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Линейная проекция точки в вектор:
 * - temperature_c
 * - vibration_g
 * - humidity_pct
 * - voltage_v
 */
@Component
public class TelemetryFeatureExtractor implements FeatureExtractor {

    private final FeatureSchema schema = FeatureSchema.TELEMETRY;

    @Override
    public FeatureSchema schema() {
        return schema;
    }

    @Override
    public List<double[]> extract(List<TelemetryPoint> points) {
        if (points == null || points.isEmpty()) {
            throw new ValidationException("No points provided");
        }

        List<double[]> rows = new ArrayList<>(points.size());
        for (int i = 0; i < points.size(); i++) {
            TelemetryPoint p = points.get(i);
            if (p == null) {
                throw new ValidationException("points[" + i + "] is null");
            }
            rows.add(new double[]{
                    channel(i, "temperature_c", p.temperatureC()),
                    channel(i, "vibration_g", p.vibrationG()),
                    channel(i, "humidity_pct", p.humidityPct()),
                    channel(i, "voltage_v", p.voltageV())
            });
        }
        return rows;
    }

    private static double channel(int index, String name, Double v) {
        if (v == null) {
            throw new ValidationException("points[" + index + "]." + name + " is missing");
        }
        if (!Double.isFinite(v)) {
            throw new ValidationException("points[" + index + "]." + name + " is not finite: " + v);
        }
        return v;
    }
}
