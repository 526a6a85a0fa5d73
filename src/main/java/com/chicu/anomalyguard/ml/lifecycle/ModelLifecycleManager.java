package com.chicu.anomalyguard.ml.lifecycle;

import com.chicu.anomalyguard.ml.IsoForestProperties;
import com.chicu.anomalyguard.ml.error.InsufficientDataException;
import com.chicu.anomalyguard.ml.model.ScorerFactory;
import com.chicu.anomalyguard.ml.model.StandardNormalizer;
import com.chicu.anomalyguard.ml.model.TrainableScorer;
import com.chicu.anomalyguard.ml.registry.ModelRegistry;
import com.chicu.anomalyguard.ml.registry.ModelState;
import com.chicu.anomalyguard.ml.window.SlidingWindowStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * Жизненный цикл модели устройства: UNTRAINED -> TRAINED -> TRAINED (retrain).
 * <p>
 * Обучение всегда полное, на всём текущем окне, свежими экземплярами scorer + normalizer.
 * Состояние меняется только после того, как оба fit прошли. Обратного перехода в
 * UNTRAINED нет, кроме purge.
 * <p>
 * Все методы вызываются под локом устройства.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ModelLifecycleManager {

    private final SlidingWindowStore windows;
    private final ModelRegistry registry;
    private final ScorerFactory scorerFactory;
    private final IsoForestProperties props;

    /**
     * Кладёт батч в окно и двигает счётчик точек с последнего fit.
     *
     * @return размер окна после append
     */
    public int ingest(String deviceId, List<double[]> vectors) {
        ModelState state = registry.getOrCreate(deviceId);
        int size = windows.append(deviceId, vectors);
        state.recordPoints(vectors.size());
        return size;
    }

    public LifecycleDecision maybeTrain(String deviceId) {
        ModelState state = registry.getOrCreate(deviceId);
        int windowSize = windows.size(deviceId);
        int minPoints = Math.max(1, props.getMinTrainingPoints());

        if (!state.isTrained()) {
            if (windowSize < minPoints) {
                return LifecycleDecision.COLD;
            }
            return fit(deviceId, state, LifecycleDecision.TRAINED) ? LifecycleDecision.TRAINED : LifecycleDecision.COLD;
        }

        if (state.getPointsSinceTrain() >= props.getRetrainInterval() && windowSize >= minPoints) {
            return fit(deviceId, state, LifecycleDecision.RETRAINED) ? LifecycleDecision.RETRAINED : LifecycleDecision.UP_TO_DATE;
        }

        return LifecycleDecision.UP_TO_DATE;
    }

    /**
     * Запись бандла строго после fit, который её породил.
     */
    public void persist(String deviceId, LifecycleDecision decision) {
        if (!decision.fitted()) return;
        ModelState state = registry.getOrCreate(deviceId);
        registry.save(deviceId, state);
    }

    private boolean fit(String deviceId, ModelState state, LifecycleDecision kind) {
        List<double[]> window = windows.snapshot(deviceId);
        long t0 = System.currentTimeMillis();

        TrainableScorer scorer = scorerFactory.create();
        StandardNormalizer normalizer = new StandardNormalizer();
        try {
            if (window.size() < scorer.minSamples()) {
                throw new InsufficientDataException(window.size(), scorer.minSamples());
            }
            normalizer.fit(window);
            scorer.fit(normalizer.transform(window));
        } catch (InsufficientDataException e) {
            log.debug("🧠 FIT skipped deviceId={}: {}", deviceId, e.getMessage());
            return false;
        }

        int pointsBefore = state.getPointsSinceTrain();
        state.commitFit(scorer, normalizer, Instant.now(), window.size());

        log.info("🧠 {} deviceId={} window={} pointsSinceTrain={} ({} ms)",
                kind, deviceId, window.size(), pointsBefore, System.currentTimeMillis() - t0);
        return true;
    }
}
