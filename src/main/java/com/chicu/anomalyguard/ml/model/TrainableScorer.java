package com.chicu.anomalyguard.ml.model;

import java.io.Serializable;
import java.util.List;

/**
 * Обучаемый детектор выбросов. Lifecycle не знает, какой алгоритм под капотом,
 * ему важен только этот контракт.
 * <p>
 * Конвенция raw-скора: непрерывный, неограниченный, чем МЕНЬШЕ, тем аномальнее.
 */
public interface TrainableScorer extends Serializable {

    /**
     * Полный fit с нуля.
     *
     * @throws com.chicu.anomalyguard.ml.error.InsufficientDataException если векторов меньше {@link #minSamples()}
     */
    void fit(List<double[]> vectors);

    double[] score(List<double[]> vectors);

    List<PointLabel> classify(List<double[]> vectors);

    int minSamples();
}
