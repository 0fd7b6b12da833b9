package de.tu_berlin.dos.arm.envsense.core;

import de.tu_berlin.dos.arm.envsense.clients.BatchSource;
import de.tu_berlin.dos.arm.envsense.clients.LocalFileSource;
import de.tu_berlin.dos.arm.envsense.clients.storage.ObjectStorageClient;
import de.tu_berlin.dos.arm.envsense.io.ArtifactStore;
import de.tu_berlin.dos.arm.envsense.io.FileArtifactStore;
import de.tu_berlin.dos.arm.envsense.io.FileHistoryStore;
import de.tu_berlin.dos.arm.envsense.io.HistoryStore;
import de.tu_berlin.dos.arm.envsense.io.MergeEngine;
import de.tu_berlin.dos.arm.envsense.io.ReadingNormalizer;
import de.tu_berlin.dos.arm.envsense.modeling.AnomalyDetector;
import de.tu_berlin.dos.arm.envsense.modeling.FeatureSynthesizer;
import de.tu_berlin.dos.arm.envsense.modeling.TemperatureForecaster;
import de.tu_berlin.dos.arm.envsense.utils.FileReader;
import org.apache.log4j.Logger;

import java.io.IOException;
import java.nio.file.Paths;
import java.time.ZoneId;
import java.util.Properties;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Collaborator handles shared by the write cycle and the read paths. Built once at process start and
 * passed to whoever needs it.
 */
public class Context implements AutoCloseable {

    /******************************************************************************
     * CLASS VARIABLES
     ******************************************************************************/

    private static final Logger LOG = Logger.getLogger(Context.class);
    public static final String PROPERTIES_FILE = "envsense.properties";

    /******************************************************************************
     * CLASS BEHAVIOURS
     ******************************************************************************/

    public static Context load() throws IOException {

        return new Context(FileReader.GET.read(PROPERTIES_FILE, Properties.class));
    }

    private static BatchSource createSource(Properties props) {

        String type = props.getProperty("source.type", "file");
        switch (type) {
            case "file":
                return new LocalFileSource(Paths.get(props.getProperty("source.file", "data/sensor_data.csv")));
            case "http":
                return new ObjectStorageClient(
                    props.getProperty("source.baseUrl"),
                    props.getProperty("source.bucket"),
                    props.getProperty("source.objectKey"),
                    Integer.parseInt(props.getProperty("source.connectTimeoutSeconds", "60")),
                    Integer.parseInt(props.getProperty("source.readTimeoutSeconds", "30")));
            default:
                throw new IllegalArgumentException("Unknown source.type " + type);
        }
    }

    /******************************************************************************
     * INSTANCE STATE
     ******************************************************************************/

    public final int pollMinutes;
    public final ZoneId zone;

    public final BatchSource source;
    public final ReadingNormalizer normalizer;
    public final HistoryStore historyStore;
    public final MergeEngine mergeEngine;
    public final FeatureSynthesizer synthesizer;
    public final AnomalyDetector anomalyDetector;
    public final TemperatureForecaster forecaster;
    public final ArtifactStore artifactStore;

    public final ScheduledExecutorService executor;

    /******************************************************************************
     * CONSTRUCTOR(S)
     ******************************************************************************/

    public Context(Properties props) {

        this(props, createSource(props));
    }

    public Context(Properties props, BatchSource source) {

        this.pollMinutes = Integer.parseInt(props.getProperty("pipeline.pollMinutes", "5"));
        this.zone = ZoneId.of(props.getProperty("pipeline.timezone", "Africa/Kampala"));

        this.source = source;
        this.normalizer = new ReadingNormalizer(this.zone);
        this.historyStore = new FileHistoryStore(Paths.get(props.getProperty("store.seriesFile", "data/local.csv")));
        this.mergeEngine = new MergeEngine();
        this.synthesizer = new FeatureSynthesizer();
        this.anomalyDetector = new AnomalyDetector(
            Integer.parseInt(props.getProperty("anomaly.trees", "200")),
            Double.parseDouble(props.getProperty("anomaly.contamination", "0.02")),
            Long.parseLong(props.getProperty("anomaly.seed", "42")),
            Integer.parseInt(props.getProperty("anomaly.minRows", "10")));
        this.forecaster = new TemperatureForecaster(
            Integer.parseInt(props.getProperty("forecast.trees", "200")),
            Long.parseLong(props.getProperty("forecast.seed", "42")),
            Integer.parseInt(props.getProperty("forecast.minRows", "20")));
        this.artifactStore = new FileArtifactStore(Paths.get(props.getProperty("store.modelDir", "models")));

        this.executor = Executors.newSingleThreadScheduledExecutor();
        LOG.info("Context created: source=" + source.getClass().getSimpleName() + ", zone=" + zone + ", pollMinutes=" + pollMinutes);
    }

    @Override
    public void close() {

        this.executor.shutdown();
    }
}
