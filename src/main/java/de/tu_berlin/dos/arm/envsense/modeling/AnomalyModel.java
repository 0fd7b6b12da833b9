package de.tu_berlin.dos.arm.envsense.modeling;

import smile.anomaly.IsolationForest;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A trained isolation forest together with the feature columns it was fit on. Scores follow the
 * decision-function convention: below zero means anomalous.
 */
public class AnomalyModel implements Serializable {

    private static final long serialVersionUID = 1L;

    public final String version;
    public final long trainedAt;
    public final int trainingRows;

    private final ArrayList<String> columns;
    private final IsolationForest forest;
    private final double offset;

    public AnomalyModel(String version, long trainedAt, int trainingRows, List<String> columns, IsolationForest forest, double offset) {

        this.version = version;
        this.trainedAt = trainedAt;
        this.trainingRows = trainingRows;
        this.columns = new ArrayList<>(columns);
        this.forest = forest;
        this.offset = offset;
    }

    public List<String> columns() {

        return Collections.unmodifiableList(columns);
    }

    public double score(double[] vector) {

        return offset - forest.score(vector);
    }

    /**
     * Scores every row of the table, which must expose exactly the columns seen during training.
     */
    public double[] score(FeatureTable table) {

        List<String> available = table.anomalyColumns();
        if (!available.equals(columns)) {

            throw new IllegalStateException("Feature schema mismatch: trained on " + columns + ", got " + available);
        }
        double[][] matrix = table.anomalyMatrix(columns);
        double[] scores = new double[matrix.length];
        for (int i = 0; i < matrix.length; i++) {

            scores[i] = score(matrix[i]);
        }
        return scores;
    }

    @Override
    public String toString() {
        return "AnomalyModel{" +
                "version='" + version + '\'' +
                ", trainingRows=" + trainingRows +
                ", columns=" + columns +
                ", offset=" + offset +
                '}';
    }
}
