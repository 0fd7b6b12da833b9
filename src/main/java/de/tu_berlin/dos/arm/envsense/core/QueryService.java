package de.tu_berlin.dos.arm.envsense.core;

import de.tu_berlin.dos.arm.envsense.core.responses.AnalyticsSummary;
import de.tu_berlin.dos.arm.envsense.core.responses.AnomalyRecord;
import de.tu_berlin.dos.arm.envsense.core.responses.PipelineStatus;
import de.tu_berlin.dos.arm.envsense.core.responses.Prediction;
import de.tu_berlin.dos.arm.envsense.core.responses.ReadingView;
import de.tu_berlin.dos.arm.envsense.io.ArtifactNotFoundException;
import de.tu_berlin.dos.arm.envsense.io.ArtifactStore;
import de.tu_berlin.dos.arm.envsense.io.CanonicalSeries;
import de.tu_berlin.dos.arm.envsense.io.FileHistoryStore;
import de.tu_berlin.dos.arm.envsense.io.Reading;
import de.tu_berlin.dos.arm.envsense.io.Sensor;
import de.tu_berlin.dos.arm.envsense.modeling.AnomalyModel;
import de.tu_berlin.dos.arm.envsense.modeling.FeatureScaler;
import de.tu_berlin.dos.arm.envsense.modeling.FeatureTable;
import de.tu_berlin.dos.arm.envsense.modeling.ForecastModel;
import org.apache.commons.lang3.SerializationException;
import org.apache.commons.lang3.SerializationUtils;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.commons.math3.util.Precision;
import org.apache.log4j.Logger;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Read-only views over the persisted series and model artifacts. Every call reads the latest committed
 * state, so a query running next to a cycle sees either the previous or the new snapshot, never a mix.
 */
public class QueryService {

    private static final Logger LOG = Logger.getLogger(QueryService.class);

    private final Context context;

    public QueryService(Context context) {

        this.context = context;
    }

    public AnalyticsSummary getAnalyticsSummary(int limit) {

        CanonicalSeries series = loadHistory();
        List<ReadingView> recent = new ArrayList<>();
        for (Reading reading : series.tail(limit)) {

            recent.add(new ReadingView(reading));
        }
        return new AnalyticsSummary(
            mean(series, Sensor.TEMPERATURE), mean(series, Sensor.HUMIDITY), mean(series, Sensor.BATTERY), recent);
    }

    public Prediction predictNextTemperature() {

        CanonicalSeries series = loadHistory();
        if (series.isEmpty()) return Prediction.unavailable();

        Pair<ForecastModel, FeatureScaler> pair = loadForecast();
        if (pair == null) return Prediction.unavailable();

        OptionalDouble value = pair.getLeft().predict(pair.getRight(), series.getLast());
        if (value.isEmpty()) {

            LOG.warn("Latest reading " + series.getLast().time + " lacks a forecast input");
            return Prediction.unavailable();
        }
        return Prediction.of(value.getAsDouble());
    }

    /**
     * The most recent {@code limit} readings the stored anomaly model scores below zero, in time order.
     */
    public List<AnomalyRecord> getAnomalies(int limit) {

        List<AnomalyRecord> anomalies = new ArrayList<>();
        CanonicalSeries series = loadHistory();
        if (series.isEmpty()) return anomalies;

        AnomalyModel model;
        try {
            model = SerializationUtils.deserialize(context.artifactStore.read(ArtifactStore.ANOMALY_MODEL));
        }
        catch (ArtifactNotFoundException e) {

            LOG.info("No anomaly model trained yet");
            return anomalies;
        }
        catch (IOException | SerializationException | ClassCastException e) {

            LOG.error("Anomaly model unreadable: " + e.getMessage(), e);
            return anomalies;
        }

        FeatureTable table = context.synthesizer.synthesize(series);
        double[] scores;
        try {
            scores = model.score(table);
        }
        catch (IllegalStateException e) {

            LOG.warn("Skipping anomaly scoring: " + e.getMessage());
            return anomalies;
        }
        List<Reading> readings = series.readings();
        for (int i = 0; i < scores.length; i++) {

            if (scores[i] < 0) anomalies.add(new AnomalyRecord(readings.get(i), scores[i]));
        }
        int from = Math.max(0, anomalies.size() - Math.max(0, limit));
        return new ArrayList<>(anomalies.subList(from, anomalies.size()));
    }

    public PipelineStatus getStatus() {

        CanonicalSeries series = loadHistory();
        List<String> columns = new ArrayList<>();
        if (!series.isEmpty()) {

            columns.add(FileHistoryStore.TIME);
            for (Sensor sensor : series.sensors()) columns.add(sensor.column);
        }
        return new PipelineStatus(
            !series.isEmpty(), series.size(), columns,
            context.artifactStore.exists(ArtifactStore.FORECAST_MODEL),
            context.artifactStore.exists(ArtifactStore.ANOMALY_MODEL));
    }

    private CanonicalSeries loadHistory() {

        try {
            return context.historyStore.load();
        }
        catch (IOException e) {

            LOG.error("History unreadable, answering from empty series: " + e.getMessage(), e);
            return CanonicalSeries.empty();
        }
    }

    /**
     * Model and scaler of the same training run, or null. A version mismatch means a retrain is writing
     * the pair right now; one re-read normally resolves it.
     */
    private Pair<ForecastModel, FeatureScaler> loadForecast() {

        for (int attempt = 0; attempt < 2; attempt++) {

            try {
                FeatureScaler scaler = SerializationUtils.deserialize(context.artifactStore.read(ArtifactStore.FORECAST_SCALER));
                ForecastModel model = SerializationUtils.deserialize(context.artifactStore.read(ArtifactStore.FORECAST_MODEL));
                if (model.version.equals(scaler.version)) return Pair.of(model, scaler);
                LOG.warn("Forecast model " + model.version + " and scaler " + scaler.version + " disagree");
            }
            catch (ArtifactNotFoundException e) {

                LOG.info("Forecast unavailable: " + e.getMessage());
                return null;
            }
            catch (IOException | SerializationException | ClassCastException e) {

                LOG.error("Forecast artifacts unreadable: " + e.getMessage(), e);
                return null;
            }
        }
        return null;
    }

    private static Double mean(CanonicalSeries series, Sensor sensor) {

        return series.average(sensor).map(value -> Precision.round(value, 2)).orElse(null);
    }
}
