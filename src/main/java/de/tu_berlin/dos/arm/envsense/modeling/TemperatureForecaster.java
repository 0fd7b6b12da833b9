package de.tu_berlin.dos.arm.envsense.modeling;

import org.apache.commons.lang3.RandomStringUtils;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.log4j.Logger;
import smile.data.DataFrame;
import smile.data.formula.Formula;
import smile.regression.RandomForest;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Trains the temperature forecaster: standardize the lag features, then fit a bagged regression-tree
 * ensemble on the next-step temperature.
 */
public class TemperatureForecaster {

    private static final Logger LOG = Logger.getLogger(TemperatureForecaster.class);
    private static final int MAX_DEPTH = 20;
    private static final int NODE_SIZE = 2;

    private final int trees;
    private final long seed;
    private final int minRows;

    public TemperatureForecaster(int trees, long seed, int minRows) {

        this.trees = trees;
        this.seed = seed;
        this.minRows = minRows;
    }

    public Pair<ForecastModel, FeatureScaler> fit(FeatureTable table) throws InsufficientDataException {

        List<FeatureRow> rows = table.forecastRows();
        if (rows.size() < minRows) throw new InsufficientDataException("forecast", rows.size(), minRows);

        LOG.info("Training Started: " + rows.size() + " labeled rows");
        List<String> features = FeatureTable.FORECAST_FEATURES;
        double[][] x = new double[rows.size()][features.size()];
        double[] y = new double[rows.size()];
        for (int i = 0; i < rows.size(); i++) {

            FeatureRow row = rows.get(i);
            for (int j = 0; j < features.size(); j++) {

                x[i][j] = row.value(features.get(j));
            }
            y[i] = row.temperatureNext;
        }

        String version = RandomStringUtils.random(10, true, true);
        FeatureScaler scaler = FeatureScaler.fit(version, x);
        double[][] scaled = scaler.transform(x);

        // scaled features followed by the label
        List<String> header = new ArrayList<>(features);
        header.add(FeatureRow.TEMPERATURE_NEXT);
        double[][] dataArr = new double[rows.size()][];
        for (int i = 0; i < rows.size(); i++) {

            dataArr[i] = new double[features.size() + 1];
            System.arraycopy(scaled[i], 0, dataArr[i], 0, features.size());
            dataArr[i][features.size()] = y[i];
        }
        DataFrame df = DataFrame.of(dataArr, header.toArray(new String[0]));

        RandomForest forest = RandomForest.fit(
            Formula.lhs(FeatureRow.TEMPERATURE_NEXT), df,
            trees, features.size(), MAX_DEPTH, Math.max(2, rows.size()), NODE_SIZE, 1.0,
            new Random(seed).longs(trees));

        ForecastModel model = new ForecastModel(version, System.currentTimeMillis(), rows.size(), forest);
        LOG.info("Training finished: " + model);
        return Pair.of(model, scaler);
    }
}
