package de.tu_berlin.dos.arm.envsense.modeling;

import de.tu_berlin.dos.arm.envsense.io.Reading;
import org.apache.commons.math3.util.Precision;
import smile.data.DataFrame;
import smile.regression.RandomForest;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.OptionalDouble;

/**
 * One-step-ahead temperature regressor. Inputs are scaled by the {@link FeatureScaler} of the same
 * training run, identified by a shared version id.
 */
public class ForecastModel implements Serializable {

    private static final long serialVersionUID = 1L;

    public final String version;
    public final long trainedAt;
    public final int trainingRows;

    private final RandomForest forest;

    public ForecastModel(String version, long trainedAt, int trainingRows, RandomForest forest) {

        this.version = version;
        this.trainedAt = trainedAt;
        this.trainingRows = trainingRows;
        this.forest = forest;
    }

    /**
     * Feature vector for the step after the given reading. The current temperature fills all three
     * temperature lag slots: the true lags of the unseen point are not available, so this is a known
     * approximation. Returns null when the reading lacks temperature, motion or battery.
     */
    public static double[] vectorFor(Reading latest) {

        if (latest.temperature == null || latest.motion == null || latest.battery == null) return null;
        return new double[]{latest.temperature, latest.temperature, latest.temperature, latest.motion, latest.battery};
    }

    public OptionalDouble predict(FeatureScaler scaler, Reading latest) {

        if (!this.version.equals(scaler.version)) {

            throw new IllegalStateException("Scaler " + scaler.version + " does not belong to model " + this.version);
        }
        double[] vector = vectorFor(latest);
        if (vector == null) return OptionalDouble.empty();
        return OptionalDouble.of(Precision.round(predictScaled(scaler.transform(vector)), 2));
    }

    double predictScaled(double[] scaled) {

        // the frame must carry the label column the forest was bound to, its value is never read
        double[] row = Arrays.copyOf(scaled, scaled.length + 1);
        List<String> header = new ArrayList<>(FeatureTable.FORECAST_FEATURES);
        header.add(FeatureRow.TEMPERATURE_NEXT);
        DataFrame df = DataFrame.of(new double[][]{row}, header.toArray(new String[0]));
        return this.forest.predict(df)[0];
    }

    @Override
    public String toString() {
        return "ForecastModel{" +
                "version='" + version + '\'' +
                ", trainingRows=" + trainingRows +
                '}';
    }
}
