package com.chicu.anomalyguard.ml.registry;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Эксклюзивный лок на deviceId: окно, состояние модели и запись бандла
 * меняются только под ним.
 * <p>
 * Фиксированный набор локов (stripes), deviceId хэшируется на один из них.
 * Память не растёт с числом устройств; один и тот же id всегда попадает на один лок.
 * Разные устройства могут делить stripe и тогда ждут друг друга.
 */
@Component
public class DeviceLocks {

    static final int DEFAULT_STRIPES = 256;

    private final ReentrantLock[] stripes;

    @Autowired
    public DeviceLocks() {
        this(DEFAULT_STRIPES);
    }

    public DeviceLocks(int stripes) {
        if (stripes <= 0) {
            throw new IllegalArgumentException("stripes must be > 0: " + stripes);
        }
        this.stripes = new ReentrantLock[stripes];
        for (int i = 0; i < stripes; i++) {
            this.stripes[i] = new ReentrantLock();
        }
    }

    public <T> T withLock(String deviceId, Supplier<T> action) {
        ReentrantLock lock = lockFor(deviceId);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    ReentrantLock lockFor(String deviceId) {
        return stripes[Math.floorMod(deviceId.hashCode(), stripes.length)];
    }
}
