package com.chicu.anomalyguard.ml.model;

public enum PointLabel {
    INLIER,
    OUTLIER
}
