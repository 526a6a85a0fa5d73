package com.chicu.anomalyguard.web.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScoreBatchRequest {

    @NotBlank
    @Size(max = 128)
    private String deviceId;

    @NotEmpty
    private List<@Valid MetricPointDto> points;
}
