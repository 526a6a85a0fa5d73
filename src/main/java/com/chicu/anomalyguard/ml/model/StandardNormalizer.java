package com.chicu.anomalyguard.ml.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * z-score по колонкам: (x - mean) / std. Колонка с нулевой дисперсией делится на 1.
 */
public class StandardNormalizer implements Serializable {

    private static final long serialVersionUID = 1L;

    private double[] mean;
    private double[] scale;

    public void fit(List<double[]> vectors) {
        if (vectors == null || vectors.isEmpty()) {
            throw new IllegalArgumentException("cannot fit normalizer on empty data");
        }
        int d = vectors.get(0).length;
        double[] m = new double[d];
        for (double[] row : vectors) {
            checkWidth(row, d);
            for (int j = 0; j < d; j++) m[j] += row[j];
        }
        for (int j = 0; j < d; j++) m[j] /= vectors.size();

        double[] var = new double[d];
        for (double[] row : vectors) {
            for (int j = 0; j < d; j++) {
                double diff = row[j] - m[j];
                var[j] += diff * diff;
            }
        }
        double[] s = new double[d];
        for (int j = 0; j < d; j++) {
            double std = Math.sqrt(var[j] / vectors.size());
            s[j] = std > 0 ? std : 1.0;
        }

        this.mean = m;
        this.scale = s;
    }

    public List<double[]> transform(List<double[]> vectors) {
        if (mean == null) {
            throw new IllegalStateException("normalizer is not fitted");
        }
        List<double[]> out = new ArrayList<>(vectors.size());
        for (double[] row : vectors) {
            checkWidth(row, mean.length);
            double[] z = new double[row.length];
            for (int j = 0; j < row.length; j++) {
                z[j] = (row[j] - mean[j]) / scale[j];
            }
            out.add(z);
        }
        return out;
    }

    public boolean isFitted() {
        return mean != null;
    }

    private static void checkWidth(double[] row, int d) {
        if (row == null || row.length != d) {
            throw new IllegalArgumentException("vector width mismatch: expected " + d
                    + ", got " + (row == null ? "null" : row.length));
        }
    }
}
