package com.chicu.anomalyguard.ml.storage;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "ml.storage")
public class MlStorageProperties {
    private String modelsDir = "./ml-models";
}
