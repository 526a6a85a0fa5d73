package com.chicu.anomalyguard.ml.scoring;

import com.chicu.anomalyguard.ml.IsoForestProperties;
import com.chicu.anomalyguard.ml.model.PointLabel;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Метка классификатора OR порог по скору: любого сигнала достаточно.
 */
@Component
public class AnomalyDecisionPolicy {

    private final double threshold;

    @Autowired
    public AnomalyDecisionPolicy(IsoForestProperties props) {
        this(props.getThreshold());
    }

    public AnomalyDecisionPolicy(double threshold) {
        this.threshold = threshold;
    }

    public boolean isAnomaly(PointLabel label, double score) {
        return label == PointLabel.OUTLIER || score > threshold;
    }
}
