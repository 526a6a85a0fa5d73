package com.chicu.anomalyguard.ml;

import com.chicu.anomalyguard.ml.storage.MlStorageProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({
        IsoForestProperties.class,
        MlStorageProperties.class
})
public class MlConfig {
}
