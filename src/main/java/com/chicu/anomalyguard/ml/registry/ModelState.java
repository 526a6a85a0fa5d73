package com.chicu.anomalyguard.ml.registry;

import com.chicu.anomalyguard.ml.model.ModelBundle;
import com.chicu.anomalyguard.ml.model.StandardNormalizer;
import com.chicu.anomalyguard.ml.model.TrainableScorer;
import lombok.Getter;

import java.time.Instant;

/**
 * In-memory состояние модели устройства. Кэш над {@link ModelBundle} на диске.
 * <p>
 * trained и pointsSinceTrain меняет только lifecycle, под локом устройства.
 * scorer и normalizer всегда заменяются парой в {@link #commitFit}.
 */
@Getter
public class ModelState {

    private final String deviceId;

    private TrainableScorer scorer;
    private StandardNormalizer normalizer;
    private boolean trained;
    private int pointsSinceTrain;
    private Instant trainedAt;
    private int trainingSize;

    private ModelState(String deviceId,
                       TrainableScorer scorer,
                       StandardNormalizer normalizer,
                       boolean trained,
                       Instant trainedAt,
                       int trainingSize) {
        this.deviceId = deviceId;
        this.scorer = scorer;
        this.normalizer = normalizer;
        this.trained = trained;
        this.pointsSinceTrain = 0;
        this.trainedAt = trainedAt;
        this.trainingSize = trainingSize;
    }

    /**
     * Необученное состояние: scorer и normalizer появятся только в {@link #commitFit}.
     */
    public static ModelState fresh(String deviceId) {
        return new ModelState(deviceId, null, null, false, null, 0);
    }

    /**
     * Бандл на диске есть результат завершённого fit, поэтому trained=true и счётчик с нуля.
     */
    public static ModelState restored(String deviceId, ModelBundle bundle) {
        return new ModelState(deviceId, bundle.scorer(), bundle.normalizer(), true,
                bundle.trainedAt(), bundle.trainingSize());
    }

    public void recordPoints(int n) {
        if (n < 0) {
            throw new IllegalArgumentException("points count must be >= 0: " + n);
        }
        long next = (long) pointsSinceTrain + n;
        pointsSinceTrain = (int) Math.min(Integer.MAX_VALUE, next);
    }

    public void commitFit(TrainableScorer fittedScorer, StandardNormalizer fittedNormalizer,
                          Instant at, int size) {
        this.scorer = fittedScorer;
        this.normalizer = fittedNormalizer;
        this.trained = true;
        this.pointsSinceTrain = 0;
        this.trainedAt = at;
        this.trainingSize = size;
    }

    public ModelBundle toBundle(String schemaHash) {
        if (!trained) {
            throw new IllegalStateException("model for " + deviceId + " is not trained");
        }
        return new ModelBundle(scorer, normalizer, schemaHash, trainedAt, trainingSize);
    }

    public Snapshot snapshot() {
        return new Snapshot(scorer, normalizer, trained, pointsSinceTrain, trainedAt, trainingSize);
    }

    public void restore(Snapshot s) {
        this.scorer = s.scorer();
        this.normalizer = s.normalizer();
        this.trained = s.trained();
        this.pointsSinceTrain = s.pointsSinceTrain();
        this.trainedAt = s.trainedAt();
        this.trainingSize = s.trainingSize();
    }

    public record Snapshot(
            TrainableScorer scorer,
            StandardNormalizer normalizer,
            boolean trained,
            int pointsSinceTrain,
            Instant trainedAt,
            int trainingSize
    ) {
    }
}
