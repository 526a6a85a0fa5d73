package com.chicu.anomalyguard.ml.registry;

import com.chicu.anomalyguard.ml.error.PersistenceException;
import com.chicu.anomalyguard.ml.features.FeatureSchema;
import com.chicu.anomalyguard.ml.model.ModelBundle;
import com.chicu.anomalyguard.ml.storage.ModelBundleStore;
import com.chicu.anomalyguard.ml.window.SlidingWindowStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * deviceId -> {@link ModelState}. Лениво поднимается с диска или создаётся пустым.
 * <p>
 * getOrCreate / save / purge вызываются под локом устройства.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ModelRegistry {

    private final ModelBundleStore store;
    private final SlidingWindowStore windows;

    private final Map<String, ModelState> states = new ConcurrentHashMap<>();

    public ModelState getOrCreate(String deviceId) {
        ModelState cached = states.get(deviceId);
        if (cached != null) {
            return cached;
        }
        ModelState state = loadOrFresh(deviceId);
        states.put(deviceId, state);
        return state;
    }

    public Optional<ModelState> find(String deviceId) {
        return Optional.ofNullable(states.get(deviceId));
    }

    /**
     * Best-effort: при ошибке записи модель остаётся рабочей в памяти до рестарта.
     *
     * @return true если бандл записан
     */
    public boolean save(String deviceId, ModelState state) {
        try {
            store.save(deviceId, state.toBundle(FeatureSchema.TELEMETRY.schemaHash()));
            return true;
        } catch (PersistenceException e) {
            log.warn("⚠️ bundle NOT saved deviceId={} (model stays in memory): {}", deviceId, e.getMessage());
            return false;
        }
    }

    /**
     * Сначала диск, потом память: если бандл не удалился, in-memory состояние не трогаем
     * и ошибка уходит клиенту.
     *
     * @throws com.chicu.anomalyguard.ml.error.PersistenceDeleteException бандл не удалось удалить
     */
    public PurgeResult purge(String deviceId) {
        boolean persisted = store.delete(deviceId);
        boolean inMemory = states.remove(deviceId) != null;
        boolean window = windows.remove(deviceId);

        log.info("🗑️ purge deviceId={} persisted={} inMemory={} window={}", deviceId, persisted, inMemory, window);
        return new PurgeResult(deviceId, inMemory || window, persisted);
    }

    public boolean isPersisted(String deviceId) {
        try {
            return store.exists(deviceId);
        } catch (RuntimeException e) {
            log.warn("⚠️ exists() failed deviceId={}: {}", deviceId, e.getMessage());
            return false;
        }
    }

    public Set<String> persistedDeviceIds() {
        try {
            return store.listDeviceIds();
        } catch (PersistenceException e) {
            log.warn("⚠️ cannot list persisted bundles: {}", e.getMessage());
            return Set.of();
        }
    }

    public Set<String> deviceIds() {
        return Set.copyOf(states.keySet());
    }

    public int activeCount() {
        return states.size();
    }

    private ModelState loadOrFresh(String deviceId) {
        try {
            Optional<ModelBundle> bundle = store.load(deviceId);
            if (bundle.isPresent()) {
                ModelBundle b = bundle.get();
                log.info("♻️ model restored deviceId={} trainedAt={} trainingSize={}",
                        deviceId, b.trainedAt(), b.trainingSize());
                return ModelState.restored(deviceId, b);
            }
        } catch (PersistenceException e) {
            log.warn("⚠️ bundle unreadable deviceId={}, starting fresh: {}", deviceId, e.getMessage());
        }

        log.info("🆕 new model deviceId={}", deviceId);
        return ModelState.fresh(deviceId);
    }

    public record PurgeResult(
            String deviceId,
            boolean inMemoryRemoved,
            boolean persistedRemoved
    ) {
    }
}
