package com.chicu.anomalyguard.web.dto;

import com.chicu.anomalyguard.ml.features.TelemetryPoint;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MetricPointDto {

    private String ts;

    @NotNull
    @JsonProperty("temperature_c")
    private Double temperatureC;

    @NotNull
    @JsonProperty("vibration_g")
    private Double vibrationG;

    @NotNull
    @JsonProperty("humidity_pct")
    private Double humidityPct;

    @NotNull
    @JsonProperty("voltage_v")
    private Double voltageV;

    public TelemetryPoint toPoint() {
        return new TelemetryPoint(ts, temperatureC, vibrationG, humidityPct, voltageV);
    }
}
