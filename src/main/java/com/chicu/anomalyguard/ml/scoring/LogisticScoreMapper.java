package com.chicu.anomalyguard.ml.scoring;

import com.chicu.anomalyguard.ml.IsoForestProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * raw -> [0..1]: score = 1 / (1 + exp(k * (raw - c))).
 * <p>
 * c = -0.5: нейтральная точка isolation forest (средняя длина пути = c(n)),
 * k: крутизна. Монотонно убывает по raw: чем отрицательнее raw, тем ближе к 1.
 */
@Component
public class LogisticScoreMapper {

    public static final double CENTER = -0.5;

    /**
     * Скор холодного устройства и NaN raw: точка неопределённости, не аномалия.
     */
    public static final double NEUTRAL_SCORE = 0.5;

    private final double sharpness;

    @Autowired
    public LogisticScoreMapper(IsoForestProperties props) {
        this(props.getSharpness());
    }

    public LogisticScoreMapper(double sharpness) {
        if (!(sharpness > 0) || !Double.isFinite(sharpness)) {
            throw new IllegalArgumentException("sharpness must be finite and > 0: " + sharpness);
        }
        this.sharpness = sharpness;
    }

    public double toScore(double raw) {
        if (Double.isNaN(raw)) return NEUTRAL_SCORE;
        double s = 1.0 / (1.0 + Math.exp(sharpness * (raw - CENTER)));
        return Math.max(0.0, Math.min(1.0, s));
    }
}
