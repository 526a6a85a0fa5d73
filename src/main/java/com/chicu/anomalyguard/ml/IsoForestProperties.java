package com.chicu.anomalyguard.ml;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "ml.isoforest")
public class IsoForestProperties {

    /**
     * Ёмкость скользящего окна на устройство (W).
     */
    private int window = 512;

    /**
     * Доля выбросов в обучающем окне, задаёт порог classify().
     */
    private double contamination = 0.03;

    /**
     * Порог нормированного скора: score > threshold => аномалия.
     */
    private double threshold = 0.65;

    /**
     * Сколько новых точек после последнего fit запускают полный переобучение.
     */
    private int retrainInterval = 100;

    /**
     * Минимальный размер окна для первого обучения.
     */
    private int minTrainingPoints = 100;

    /**
     * Размер ансамбля деревьев.
     */
    private int trees = 100;

    /**
     * Доля окна, которую видит каждое дерево.
     */
    private double subsample = 0.7;

    /**
     * Крутизна логистики raw -> [0..1].
     */
    private double sharpness = 10.0;
}
