package com.chicu.anomalyguard.ml.scoring;

import com.chicu.anomalyguard.ml.error.InternalScoringException;
import com.chicu.anomalyguard.ml.error.ValidationException;
import com.chicu.anomalyguard.ml.features.FeatureExtractor;
import com.chicu.anomalyguard.ml.features.TelemetryPoint;
import com.chicu.anomalyguard.ml.lifecycle.LifecycleDecision;
import com.chicu.anomalyguard.ml.lifecycle.ModelLifecycleManager;
import com.chicu.anomalyguard.ml.model.PointLabel;
import com.chicu.anomalyguard.ml.registry.DeviceLocks;
import com.chicu.anomalyguard.ml.registry.ModelRegistry;
import com.chicu.anomalyguard.ml.registry.ModelState;
import com.chicu.anomalyguard.ml.window.SlidingWindowStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Скоринг батча устройства:
 * extract -> (lock) window.append -> maybeTrain -> score -> persist.
 * <p>
 * Батч атомарен для устройства: при любом сбое после валидации окно, счётчик и
 * модель откатываются к состоянию до батча.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnomalyScoringService {

    static final int MAX_DEVICE_ID_LENGTH = 128;

    private final FeatureExtractor extractor;
    private final SlidingWindowStore windows;
    private final ModelRegistry registry;
    private final ModelLifecycleManager lifecycle;
    private final DeviceLocks locks;
    private final LogisticScoreMapper scoreMapper;
    private final AnomalyDecisionPolicy decisionPolicy;

    public List<ScoredPoint> scoreBatch(String deviceId, List<TelemetryPoint> points) {
        String id = requireDeviceId(deviceId);
        List<double[]> vectors = extractor.extract(points);
        return locks.withLock(id, () -> scoreLocked(id, vectors));
    }

    public ModelRegistry.PurgeResult purge(String deviceId) {
        String id = requireDeviceId(deviceId);
        return locks.withLock(id, () -> registry.purge(id));
    }

    public Optional<ModelStatus> status(String deviceId) {
        String id = requireDeviceId(deviceId);
        return locks.withLock(id, () -> statusLocked(id));
    }

    /**
     * Все известные устройства: в памяти и на диске.
     * Каждый статус читается под локом своего устройства; между устройствами снимок не атомарен.
     */
    public Map<String, ModelStatus> statuses() {
        Set<String> persisted = registry.persistedDeviceIds();
        Set<String> ids = new TreeSet<>(registry.deviceIds());
        ids.addAll(persisted);

        Map<String, ModelStatus> out = new TreeMap<>();
        for (String id : ids) {
            ModelStatus st = locks.withLock(id, () ->
                    toStatus(id, registry.find(id).orElse(null), persisted.contains(id), windows.size(id)));
            out.put(id, st);
        }
        return out;
    }

    public ServiceHealth health() {
        return new ServiceHealth(registry.activeCount(), registry.persistedDeviceIds().size());
    }

    private Optional<ModelStatus> statusLocked(String id) {
        Optional<ModelState> state = registry.find(id);
        boolean persisted = registry.isPersisted(id);
        int windowSize = windows.size(id);
        if (state.isEmpty() && !persisted && windowSize == 0) {
            return Optional.empty();
        }
        return Optional.of(toStatus(id, state.orElse(null), persisted, windowSize));
    }

    private List<ScoredPoint> scoreLocked(String deviceId, List<double[]> vectors) {
        ModelState state = registry.getOrCreate(deviceId);
        ModelState.Snapshot before = state.snapshot();
        List<double[]> windowBefore = windows.snapshot(deviceId);

        try {
            int windowSize = lifecycle.ingest(deviceId, vectors);
            LifecycleDecision decision = lifecycle.maybeTrain(deviceId);

            List<ScoredPoint> out = state.isTrained()
                    ? scoreTrained(state, vectors)
                    : neutral(vectors.size());

            lifecycle.persist(deviceId, decision);

            if (log.isDebugEnabled()) {
                long anomalies = out.stream().filter(ScoredPoint::anomaly).count();
                log.debug("📈 scored deviceId={} points={} anomalies={} window={} decision={}",
                        deviceId, out.size(), anomalies, windowSize, decision);
            }
            return out;

        } catch (RuntimeException e) {
            windows.restore(deviceId, windowBefore);
            state.restore(before);
            log.error("❌ scoring FAILED deviceId={} points={} (state rolled back): {}",
                    deviceId, vectors.size(), e.toString(), e);
            throw new InternalScoringException(deviceId,
                    "Scoring failed for device " + deviceId + ": " + safeMsg(e), e);
        }
    }

    private List<ScoredPoint> scoreTrained(ModelState state, List<double[]> vectors) {
        List<double[]> z = state.getNormalizer().transform(vectors);
        double[] raw = state.getScorer().score(z);
        List<PointLabel> labels = state.getScorer().classify(z);

        if (raw.length != vectors.size() || labels.size() != vectors.size()) {
            throw new IllegalStateException("scorer returned " + raw.length + " scores / "
                    + labels.size() + " labels for " + vectors.size() + " points");
        }

        List<ScoredPoint> out = new ArrayList<>(vectors.size());
        for (int i = 0; i < vectors.size(); i++) {
            double score = scoreMapper.toScore(raw[i]);
            out.add(new ScoredPoint(i, score, decisionPolicy.isAnomaly(labels.get(i), score)));
        }
        return out;
    }

    private static List<ScoredPoint> neutral(int n) {
        List<ScoredPoint> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            out.add(new ScoredPoint(i, LogisticScoreMapper.NEUTRAL_SCORE, false));
        }
        return out;
    }

    private ModelStatus toStatus(String id, ModelState state, boolean persisted, int windowSize) {
        return new ModelStatus(
                id,
                state != null,
                persisted,
                state != null && state.isTrained(),
                state != null ? state.getPointsSinceTrain() : 0,
                windowSize,
                state != null ? state.getTrainedAt() : null
        );
    }

    private static String requireDeviceId(String deviceId) {
        if (deviceId == null || deviceId.isBlank()) {
            throw new ValidationException("deviceId is required");
        }
        if (deviceId.length() > MAX_DEVICE_ID_LENGTH) {
            throw new ValidationException("deviceId is longer than " + MAX_DEVICE_ID_LENGTH + " characters");
        }
        return deviceId;
    }

    private static String safeMsg(Throwable e) {
        String m = e.getMessage();
        return (m != null && !m.isBlank()) ? m : e.getClass().getSimpleName();
    }
}
