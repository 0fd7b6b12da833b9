package de.tu_berlin.dos.arm.envsense.io;

import java.io.IOException;

/**
 * Opaque trained-model blobs keyed by logical name. Writes replace the previous blob atomically.
 */
public interface ArtifactStore {

    String ANOMALY_MODEL = "anomaly-model";
    String FORECAST_MODEL = "forecast-model";
    String FORECAST_SCALER = "forecast-scaler";

    byte[] read(String name) throws ArtifactNotFoundException, IOException;

    void write(String name, byte[] blob) throws IOException;

    boolean exists(String name);
}
