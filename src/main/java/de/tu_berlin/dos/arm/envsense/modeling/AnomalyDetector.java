package de.tu_berlin.dos.arm.envsense.modeling;

import org.apache.commons.lang3.RandomStringUtils;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;
import org.apache.log4j.Logger;
import smile.anomaly.IsolationForest;
import smile.math.MathEx;

import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;

/**
 * Fits an isolation forest over the anomaly feature columns. The decision offset is placed at the
 * (1 - contamination) quantile of the training scores, so roughly that fraction of the training rows
 * scores below zero.
 */
public class AnomalyDetector {

    private static final Logger LOG = Logger.getLogger(AnomalyDetector.class);
    private static final int MAX_SAMPLES = 256;
    private static final double MAX_SAMPLING_RATE = 0.9;

    private final int trees;
    private final double contamination;
    private final long seed;
    private final int minRows;

    public AnomalyDetector(int trees, double contamination, long seed, int minRows) {

        if (contamination <= 0 || contamination >= 0.5) throw new IllegalArgumentException("Invalid contamination " + contamination);
        this.trees = trees;
        this.contamination = contamination;
        this.seed = seed;
        this.minRows = minRows;
    }

    public AnomalyModel fit(FeatureTable table) throws InsufficientDataException {

        List<String> columns = table.anomalyColumns();
        int rows = columns.isEmpty() ? 0 : table.size();
        if (rows < minRows) throw new InsufficientDataException("anomaly", rows, minRows);

        LOG.info("Training Started: " + rows + " rows over " + columns);
        double[][] data = table.anomalyMatrix(columns);

        double subsample = Math.min(MAX_SAMPLING_RATE, (double) MAX_SAMPLES / rows);
        int sampleSize = Math.max(2, (int) Math.round(rows * subsample));
        int maxDepth = (int) Math.ceil(Math.log(sampleSize) / Math.log(2));

        IsolationForest forest = fitSeeded(data, maxDepth, subsample);

        double[] scores = new double[data.length];
        for (int i = 0; i < data.length; i++) {

            scores[i] = forest.score(data[i]);
        }
        double offset = new Percentile()
            .withEstimationType(EstimationType.R_7)
            .evaluate(scores, 100 * (1 - contamination));

        AnomalyModel model = new AnomalyModel(
            RandomStringUtils.random(10, true, true), System.currentTimeMillis(), rows, columns, forest, offset);
        LOG.info("Training finished: " + model);
        return model;
    }

    /**
     * Smile draws tree samples from the random generator of the running thread and builds trees on a
     * parallel stream. Confining the fit to a one-thread pool whose worker is seeded first makes every
     * draw come from the same seeded sequence, in the same order.
     */
    private IsolationForest fitSeeded(double[][] data, int maxDepth, double subsample) {

        ForkJoinPool pool = new ForkJoinPool(1);
        try {
            return pool.submit(() -> {

                MathEx.setSeed(seed);
                return IsolationForest.fit(data, trees, maxDepth, subsample, 0);
            }).get();
        }
        catch (InterruptedException e) {

            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while training isolation forest", e);
        }
        catch (ExecutionException e) {

            throw new IllegalStateException("Isolation forest training failed: " + e.getCause().getMessage(), e.getCause());
        }
        finally {
            pool.shutdown();
        }
    }
}
