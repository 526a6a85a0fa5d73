package com.chicu.anomalyguard.ml.window;

import com.chicu.anomalyguard.ml.IsoForestProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Окно последних W фич-векторов на устройство, FIFO.
 * <p>
 * Сам Deque не потокобезопасен: все мутации идут под локом устройства
 * ({@link com.chicu.anomalyguard.ml.registry.DeviceLocks}).
 */
@Component
public class SlidingWindowStore {

    private final int capacity;
    private final Map<String, Deque<double[]>> windows = new ConcurrentHashMap<>();

    @Autowired
    public SlidingWindowStore(IsoForestProperties props) {
        this(props.getWindow());
    }

    public SlidingWindowStore(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("window capacity must be > 0: " + capacity);
        }
        this.capacity = capacity;
    }

    /**
     * @return размер окна после append + truncate
     */
    public int append(String deviceId, List<double[]> vectors) {
        Deque<double[]> w = windows.computeIfAbsent(deviceId, k -> new ArrayDeque<>());
        for (double[] v : vectors) {
            w.addLast(v.clone());
        }
        while (w.size() > capacity) {
            w.removeFirst();
        }
        return w.size();
    }

    /**
     * Содержимое окна, старые первыми. Векторы не копируются, не мутировать.
     */
    public List<double[]> snapshot(String deviceId) {
        Deque<double[]> w = windows.get(deviceId);
        return w == null ? List.of() : new ArrayList<>(w);
    }

    public int size(String deviceId) {
        Deque<double[]> w = windows.get(deviceId);
        return w == null ? 0 : w.size();
    }

    /**
     * Откат окна к снимку, взятому до неудачного батча.
     */
    public void restore(String deviceId, List<double[]> snapshot) {
        if (snapshot == null || snapshot.isEmpty()) {
            windows.remove(deviceId);
        } else {
            windows.put(deviceId, new ArrayDeque<>(snapshot));
        }
    }

    public boolean remove(String deviceId) {
        return windows.remove(deviceId) != null;
    }

    public Set<String> deviceIds() {
        return Set.copyOf(windows.keySet());
    }
}
