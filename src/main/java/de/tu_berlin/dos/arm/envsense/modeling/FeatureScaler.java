package de.tu_berlin.dos.arm.envsense.modeling;

import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

import java.io.Serializable;

/**
 * Zero-mean, unit-variance scaling fit on a training set. Persisted next to the forecast model it was
 * trained with and never refit at inference time. A column without variance is only centred.
 */
public class FeatureScaler implements Serializable {

    private static final long serialVersionUID = 2L;

    public final String version;
    private final double[] mu;
    private final double[] sd;

    private FeatureScaler(String version, double[] mu, double[] sd) {

        this.version = version;
        this.mu = mu;
        this.sd = sd;
    }

    public static FeatureScaler fit(String version, double[][] data) {

        if (data.length == 0) throw new IllegalArgumentException("Cannot fit scaler on empty data");
        int p = data[0].length;
        double[] mu = new double[p];
        double[] sd = new double[p];
        // population deviation, as the original scaler computed it
        StandardDeviation deviation = new StandardDeviation(false);
        Mean mean = new Mean();
        for (int j = 0; j < p; j++) {

            double[] column = new double[data.length];
            for (int i = 0; i < data.length; i++) column[i] = data[i][j];
            mu[j] = mean.evaluate(column);
            double s = deviation.evaluate(column);
            sd[j] = s == 0 || Double.isNaN(s) ? 1 : s;
        }
        return new FeatureScaler(version, mu, sd);
    }

    public double[] transform(double[] vector) {

        if (vector.length != mu.length) {

            throw new IllegalArgumentException("Expected " + mu.length + " features, got " + vector.length);
        }
        double[] scaled = new double[vector.length];
        for (int j = 0; j < vector.length; j++) {

            scaled[j] = (vector[j] - mu[j]) / sd[j];
        }
        return scaled;
    }

    public double[][] transform(double[][] data) {

        double[][] result = new double[data.length][];
        for (int i = 0; i < data.length; i++) {

            result[i] = transform(data[i]);
        }
        return result;
    }
}
