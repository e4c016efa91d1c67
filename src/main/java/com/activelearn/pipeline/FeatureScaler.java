package com.activelearn.pipeline;

import java.util.Arrays;

public final class FeatureScaler {
    private final double[] means;
    private final double[] scales;

    private FeatureScaler(double[] means, double[] scales) {
        this.means = means;
        this.scales = scales;
    }

    public static FeatureScaler fit(double[][] rows) {
        if (rows.length == 0) {
            throw new IllegalArgumentException("Cannot fit a scaler on zero rows");
        }
        int width = rows[0].length;
        double[] means = new double[width];
        double[] scales = new double[width];
        for (double[] row : rows) {
            for (int j = 0; j < width; j++) {
                means[j] += row[j];
            }
        }
        for (int j = 0; j < width; j++) {
            means[j] /= rows.length;
        }
        for (double[] row : rows) {
            for (int j = 0; j < width; j++) {
                double centered = row[j] - means[j];
                scales[j] += centered * centered;
            }
        }
        for (int j = 0; j < width; j++) {
            double std = Math.sqrt(scales[j] / rows.length);
            // constant columns pass through centered
            scales[j] = std < 1e-12 ? 1.0 : std;
        }
        return new FeatureScaler(means, scales);
    }

    public double[][] transform(double[][] rows) {
        double[][] out = new double[rows.length][];
        for (int i = 0; i < rows.length; i++) {
            out[i] = transform(rows[i]);
        }
        return out;
    }

    public double[] transform(double[] row) {
        double[] out = new double[row.length];
        for (int j = 0; j < row.length; j++) {
            out[j] = (row[j] - means[j]) / scales[j];
        }
        return out;
    }

    public double inverse(int featureIndex, double scaledValue) {
        return means[featureIndex] + scaledValue * scales[featureIndex];
    }

    public double[] means() {
        return Arrays.copyOf(means, means.length);
    }

    public double[] scales() {
        return Arrays.copyOf(scales, scales.length);
    }
}
