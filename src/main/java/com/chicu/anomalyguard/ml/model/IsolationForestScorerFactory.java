package com.chicu.anomalyguard.ml.model;

import com.chicu.anomalyguard.ml.IsoForestProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class IsolationForestScorerFactory implements ScorerFactory {

    private final IsoForestProperties props;

    @Override
    public TrainableScorer create() {
        return new IsolationForestScorer(props.getTrees(), props.getSubsample(), props.getContamination());
    }
}
