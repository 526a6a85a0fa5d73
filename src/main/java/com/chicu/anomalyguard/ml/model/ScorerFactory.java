package com.chicu.anomalyguard.ml.model;

/**
 * Свежий необученный scorer с зафиксированными гиперпараметрами.
 */
@FunctionalInterface
public interface ScorerFactory {

    TrainableScorer create();
}
