package com.chicu.anomalyguard.web.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ModelsResponse {
    private int count;
    private Map<String, ModelStatusDto> models;
}
