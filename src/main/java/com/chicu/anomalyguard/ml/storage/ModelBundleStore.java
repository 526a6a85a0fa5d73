package com.chicu.anomalyguard.ml.storage;

import com.chicu.anomalyguard.ml.model.ModelBundle;

import java.util.Optional;
import java.util.Set;

/**
 * Долговременное хранилище deviceId -> бандл модели. Единственный источник
 * истины между рестартами, in-memory состояние лишь кэш над ним.
 */
public interface ModelBundleStore {

    void save(String deviceId, ModelBundle bundle);

    Optional<ModelBundle> load(String deviceId);

    /**
     * @return true если бандл был и удалён, false если удалять было нечего
     */
    boolean delete(String deviceId);

    boolean exists(String deviceId);

    Set<String> listDeviceIds();
}
