package com.chicu.anomalyguard.ml.model;

import com.chicu.anomalyguard.ml.error.InsufficientDataException;
import smile.anomaly.IsolationForest;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Isolation Forest поверх Smile.
 * <p>
 * Smile отдаёт anomaly score в (0..1], больше = аномальнее; здесь он инвертируется,
 * чтобы соблюсти конвенцию raw (меньше = аномальнее). Порог classify() считается как квантиль
 * contamination по raw-скорам обучающего окна.
 */
public class IsolationForestScorer implements TrainableScorer {

    private static final long serialVersionUID = 1L;

    public static final int MIN_SAMPLES = 10;

    private final int trees;
    private final double subsample;
    private final double contamination;

    private IsolationForest forest;
    private double offset;

    public IsolationForestScorer(int trees, double subsample, double contamination) {
        if (trees <= 0) throw new IllegalArgumentException("trees must be > 0: " + trees);
        if (subsample <= 0 || subsample > 1) throw new IllegalArgumentException("subsample must be in (0, 1]: " + subsample);
        if (contamination < 0 || contamination > 0.5) {
            throw new IllegalArgumentException("contamination must be in [0, 0.5]: " + contamination);
        }
        this.trees = trees;
        this.subsample = subsample;
        this.contamination = contamination;
    }

    @Override
    public void fit(List<double[]> vectors) {
        int n = vectors != null ? vectors.size() : 0;
        if (n < MIN_SAMPLES) {
            throw new InsufficientDataException(n, MIN_SAMPLES);
        }

        double[][] x = vectors.toArray(new double[0][]);
        int sampleSize = Math.max(2, (int) Math.round(n * subsample));
        int maxDepth = (int) Math.ceil(Math.log(sampleSize) / Math.log(2));

        IsolationForest model = IsolationForest.fit(x, trees, maxDepth, subsample, 0);
        double[] raw = rawScores(model, x);

        this.offset = quantile(raw, contamination);
        this.forest = model;
    }

    @Override
    public double[] score(List<double[]> vectors) {
        return rawScores(requireFitted(), vectors.toArray(new double[0][]));
    }

    @Override
    public List<PointLabel> classify(List<double[]> vectors) {
        double[] raw = score(vectors);
        List<PointLabel> labels = new ArrayList<>(raw.length);
        for (double r : raw) {
            labels.add(r < offset ? PointLabel.OUTLIER : PointLabel.INLIER);
        }
        return labels;
    }

    @Override
    public int minSamples() {
        return MIN_SAMPLES;
    }

    private IsolationForest requireFitted() {
        if (forest == null) {
            throw new IllegalStateException("isolation forest is not fitted");
        }
        return forest;
    }

    private static double[] rawScores(IsolationForest model, double[][] x) {
        double[] raw = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            raw[i] = -model.score(x[i]);
        }
        return raw;
    }

    /**
     * Линейная интерполяция между соседними порядковыми статистиками (как numpy.percentile).
     */
    static double quantile(double[] values, double q) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        double pos = q * (sorted.length - 1);
        int lo = (int) Math.floor(pos);
        int hi = (int) Math.ceil(pos);
        return sorted[lo] + (sorted[hi] - sorted[lo]) * (pos - lo);
    }
}
