package de.tu_berlin.dos.arm.envsense.core;

import de.tu_berlin.dos.arm.envsense.clients.LocalFileSource;
import de.tu_berlin.dos.arm.envsense.core.responses.AnalyticsSummary;
import de.tu_berlin.dos.arm.envsense.core.responses.AnomalyRecord;
import de.tu_berlin.dos.arm.envsense.core.responses.PipelineStatus;
import de.tu_berlin.dos.arm.envsense.core.responses.Prediction;
import de.tu_berlin.dos.arm.envsense.io.ArtifactStore;
import de.tu_berlin.dos.arm.envsense.modeling.FeatureScaler;
import de.tu_berlin.dos.arm.envsense.utils.FileReader;
import org.apache.commons.lang3.SerializationUtils;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class QueryServiceTest {

    @TempDir
    Path dir;

    private Context context;
    private QueryService queries;

    @BeforeEach
    void setUp() throws Exception {

        Properties props = new Properties();
        props.setProperty("store.seriesFile", dir.resolve("local.csv").toString());
        props.setProperty("store.modelDir", dir.resolve("models").toString());
        File file = FileReader.GET.read("sensor_batch.csv", File.class);
        context = new Context(props, new LocalFileSource(file.toPath()));
        queries = new QueryService(context);
    }

    @AfterEach
    void tearDown() {

        context.close();
    }

    @Test
    void emptyStateAnswersWithNulls() {

        AnalyticsSummary summary = queries.getAnalyticsSummary(50);
        assertNull(summary.avgTemperature);
        assertTrue(summary.recentReadings.isEmpty());
        assertEquals(
            "{\"avg_temperature\":null,\"avg_humidity\":null,\"avg_battery\":null,\"recent_readings\":[]}",
            summary.toJson());

        Prediction prediction = queries.predictNextTemperature();
        assertFalse(prediction.isAvailable());
        assertEquals("{\"predicted_next_temperature\":null}", prediction.toJson());

        assertTrue(queries.getAnomalies(50).isEmpty());

        PipelineStatus status = queries.getStatus();
        assertFalse(status.dataLoaded);
        assertEquals(0, status.rowCount);
        assertFalse(status.modelExists);
        assertFalse(status.anomalyModelExists);
    }

    @Test
    void summaryAveragesWholeSeriesAndListsTail() {

        new SensorPipeline(context).runCycle();

        AnalyticsSummary summary = queries.getAnalyticsSummary(5);
        assertEquals(22.1, summary.avgTemperature, 1e-9);
        assertEquals(60.47, summary.avgHumidity, 1e-9);
        assertEquals(4.05, summary.avgBattery, 1e-9);
        assertEquals(5, summary.recentReadings.size());
        assertEquals(LocalDateTime.of(2024, 5, 1, 10, 0), summary.recentReadings.get(4).time);
        assertEquals(21.58, summary.recentReadings.get(4).temperature, 1e-9);
        assertTrue(summary.toJson().contains("\"time\":\"2024-05-01T10:00:00\""));
        assertTrue(summary.toJson().contains("\"Temperature\":21.58"));
    }

    @Test
    void statusReflectsStoredState() {

        new SensorPipeline(context).runCycle();

        PipelineStatus status = queries.getStatus();
        assertTrue(status.dataLoaded);
        assertEquals(25, status.rowCount);
        assertEquals(List.of("time", "Battery", "Humidity", "Motion", "Temperature"), status.columns);
        assertTrue(status.modelExists);
        assertTrue(status.anomalyModelExists);
        assertTrue(status.toJson().contains("\"anomaly_model_exists\":true"));
    }

    @Test
    void mismatchedScalerMakesPredictionUnavailable() throws Exception {

        new SensorPipeline(context).runCycle();
        assertTrue(queries.predictNextTemperature().isAvailable());

        FeatureScaler foreign = FeatureScaler.fit("foreign", new double[][]{{1, 2, 3, 4, 5}, {2, 3, 4, 5, 6}});
        context.artifactStore.write(ArtifactStore.FORECAST_SCALER, SerializationUtils.serialize(foreign));

        assertFalse(queries.predictNextTemperature().isAvailable());
    }

    @Test
    void unreadableAnomalyModelYieldsNoAnomalies() throws Exception {

        new SensorPipeline(context).runCycle();
        context.artifactStore.write(ArtifactStore.ANOMALY_MODEL, new byte[]{1, 2, 3});

        assertTrue(queries.getAnomalies(50).isEmpty());
    }

    @Test
    void anomalyLimitKeepsMostRecent() {

        new SensorPipeline(context).runCycle();

        List<AnomalyRecord> all = queries.getAnomalies(50);
        assertTrue(queries.getAnomalies(0).isEmpty());
        for (int i = 1; i < all.size(); i++) assertTrue(all.get(i - 1).time.isBefore(all.get(i).time));
        if (!all.isEmpty()) assertEquals(all.get(all.size() - 1).time, queries.getAnomalies(1).get(0).time);
    }
}
