package com.chicu.anomalyguard.ml.model;

import com.chicu.anomalyguard.ml.error.InsufficientDataException;

import java.util.ArrayList;
import java.util.List;

/**
 * Управляемый scorer для тестов lifecycle/скоринга: отдаёт заранее заданные raw и метки.
 */
public class StubScorer implements TrainableScorer {

    private static final long serialVersionUID = 1L;

    public int fitCalls;
    public int lastFitSize;
    public int minSamples = 10;

    /** по кругу; null => -0.3 для всех точек */
    public double[] raw;
    /** по кругу; null => INLIER для всех точек */
    public List<PointLabel> labels;

    public transient RuntimeException failOnFit;
    public transient RuntimeException failOnScore;

    @Override
    public void fit(List<double[]> vectors) {
        if (failOnFit != null) throw failOnFit;
        if (vectors.size() < minSamples) throw new InsufficientDataException(vectors.size(), minSamples);
        fitCalls++;
        lastFitSize = vectors.size();
    }

    @Override
    public double[] score(List<double[]> vectors) {
        if (failOnScore != null) throw failOnScore;
        double[] out = new double[vectors.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = raw == null ? -0.3 : raw[i % raw.length];
        }
        return out;
    }

    @Override
    public List<PointLabel> classify(List<double[]> vectors) {
        List<PointLabel> out = new ArrayList<>(vectors.size());
        for (int i = 0; i < vectors.size(); i++) {
            out.add(labels == null ? PointLabel.INLIER : labels.get(i % labels.size()));
        }
        return out;
    }

    @Override
    public int minSamples() {
        return minSamples;
    }
}
