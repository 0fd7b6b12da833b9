package de.tu_berlin.dos.arm.envsense.core;

import de.tu_berlin.dos.arm.envsense.clients.TransportException;
import de.tu_berlin.dos.arm.envsense.io.ArtifactStore;
import de.tu_berlin.dos.arm.envsense.io.CanonicalSeries;
import de.tu_berlin.dos.arm.envsense.io.RawBatch;
import de.tu_berlin.dos.arm.envsense.io.SchemaException;
import de.tu_berlin.dos.arm.envsense.modeling.AnomalyModel;
import de.tu_berlin.dos.arm.envsense.modeling.FeatureScaler;
import de.tu_berlin.dos.arm.envsense.modeling.FeatureTable;
import de.tu_berlin.dos.arm.envsense.modeling.ForecastModel;
import de.tu_berlin.dos.arm.envsense.modeling.InsufficientDataException;
import de.tu_berlin.dos.arm.envsense.utils.SequenceFSM;
import org.apache.commons.lang3.SerializationUtils;
import org.apache.commons.lang3.tuple.Pair;

import java.io.IOException;

/**
 * The poll cycle. Each constant is the state being entered; its stage does the work that leads out of
 * it. START is the idle state a trigger leaves, IDLE the state every cycle ends in.
 */
public enum CycleManager implements SequenceFSM<Cycle, CycleManager> {

    START {

        public CycleManager runStage(Cycle cycle) {

            try {
                cycle.raw = cycle.context.source.fetch();
            }
            catch (TransportException e) {

                LOG.error("Fetching batch failed, abandoning cycle: " + e.getMessage(), e);
                return cycle.abandon("fetch failed: " + e.getMessage());
            }
            return FETCHED;
        }
    },
    FETCHED {

        public CycleManager runStage(Cycle cycle) {

            try {
                cycle.batch = cycle.context.normalizer.normalize(RawBatch.fromCSV(cycle.raw));
            }
            catch (SchemaException e) {

                LOG.warn("Batch rejected: " + e.getMessage());
                return cycle.abandon("schema: " + e.getMessage());
            }
            catch (IOException e) {

                LOG.error("Batch could not be read: " + e.getMessage(), e);
                return cycle.abandon("unreadable batch: " + e.getMessage());
            }
            if (cycle.batch.isEmpty()) {

                LOG.warn("Batch holds no usable readings");
                return cycle.abandon("empty batch");
            }
            return NORMALIZED;
        }
    },
    NORMALIZED {

        public CycleManager runStage(Cycle cycle) {

            if (cycle.isCancelled()) return cycle.abandon("cancelled");
            CanonicalSeries existing;
            try {
                existing = cycle.context.historyStore.load();
            }
            catch (IOException e) {

                LOG.error("Loading history failed, abandoning cycle: " + e.getMessage(), e);
                return cycle.abandon("history unreadable: " + e.getMessage());
            }
            cycle.merge = cycle.context.mergeEngine.merge(existing, cycle.batch);
            return MERGED;
        }
    },
    MERGED {

        public CycleManager runStage(Cycle cycle) {

            if (cycle.merge.newCount == 0) return SKIPPED;
            if (cycle.isCancelled()) return cycle.abandon("cancelled");

            LOG.info("Found " + cycle.merge.newCount + " new rows. Saving and retraining.");
            try {
                cycle.context.historyStore.replace(cycle.merge.merged);
            }
            catch (IOException e) {

                LOG.error("Persisting merged series failed, abandoning cycle: " + e.getMessage(), e);
                return cycle.abandon("history not written: " + e.getMessage());
            }
            return RETRAINING;
        }
    },
    RETRAINING {

        public CycleManager runStage(Cycle cycle) {

            if (cycle.isCancelled()) return cycle.abandon("cancelled");
            FeatureTable table = cycle.context.synthesizer.synthesize(cycle.merge.merged);
            // the trainers are independent, a failure in one never stops the other
            cycle.setAnomalyTrained(trainAnomaly(cycle.context, table));
            cycle.setForecastTrained(trainForecast(cycle.context, table));
            return IDLE;
        }
    },
    SKIPPED {

        public CycleManager runStage(Cycle cycle) {

            LOG.info("No new rows found in batch.");
            return IDLE;
        }
    },
    IDLE {

        public CycleManager runStage(Cycle cycle) {

            throw new IllegalStateException("IDLE is terminal");
        }
    };

    static boolean trainAnomaly(Context context, FeatureTable table) {

        try {
            AnomalyModel model = context.anomalyDetector.fit(table);
            context.artifactStore.write(ArtifactStore.ANOMALY_MODEL, SerializationUtils.serialize(model));
            LOG.info("Saved anomaly model " + model.version);
            return true;
        }
        catch (InsufficientDataException e) {

            LOG.info(e.getMessage() + ", keeping previous anomaly model");
        }
        catch (Exception e) {

            LOG.error("Anomaly training failed, keeping previous model: " + e.getMessage(), e);
        }
        return false;
    }

    static boolean trainForecast(Context context, FeatureTable table) {

        try {
            Pair<ForecastModel, FeatureScaler> fitted = context.forecaster.fit(table);
            // scaler first; readers match the pair by version
            context.artifactStore.write(ArtifactStore.FORECAST_SCALER, SerializationUtils.serialize(fitted.getRight()));
            context.artifactStore.write(ArtifactStore.FORECAST_MODEL, SerializationUtils.serialize(fitted.getLeft()));
            LOG.info("Saved temperature model and scaler " + fitted.getLeft().version);
            return true;
        }
        catch (InsufficientDataException e) {

            LOG.info(e.getMessage() + ", keeping previous temperature model");
        }
        catch (Exception e) {

            LOG.error("Temperature training failed, keeping previous model: " + e.getMessage(), e);
        }
        return false;
    }
}
