package com.chicu.anomalyguard.ml;

import com.chicu.anomalyguard.ml.storage.FileModelBundleStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Files;

@Slf4j
@Component
@RequiredArgsConstructor
public class MlStorageProbe implements ApplicationRunner {

    private final FileModelBundleStore store;
    private final IsoForestProperties props;

    @Override
    public void run(ApplicationArguments args) {
        try {
            Files.createDirectories(store.directory());
            int persisted = store.listDeviceIds().size();
            log.info("✅ model store OK: dir={} persisted={} window={} contamination={} threshold={} retrainInterval={}",
                    store.directory().toAbsolutePath(), persisted,
                    props.getWindow(), props.getContamination(), props.getThreshold(), props.getRetrainInterval());
        } catch (Exception e) {
            // сервис поднимаем: модели просто будут жить только в памяти
            log.warn("⚠️ model store NOT available: {}", e.getMessage());
        }
    }
}
