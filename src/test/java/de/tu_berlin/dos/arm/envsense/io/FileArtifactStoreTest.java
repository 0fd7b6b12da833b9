package de.tu_berlin.dos.arm.envsense.io;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class FileArtifactStoreTest {

    @TempDir
    Path dir;

    @Test
    void absentArtifactIsNotFound() {

        FileArtifactStore store = new FileArtifactStore(dir.resolve("models"));

        assertFalse(store.exists(ArtifactStore.ANOMALY_MODEL));
        ArtifactNotFoundException e =
            assertThrows(ArtifactNotFoundException.class, () -> store.read(ArtifactStore.ANOMALY_MODEL));
        assertEquals(ArtifactStore.ANOMALY_MODEL, e.name);
    }

    @Test
    void writeReplacesBlob() throws Exception {

        FileArtifactStore store = new FileArtifactStore(dir.resolve("models"));
        store.write(ArtifactStore.FORECAST_MODEL, new byte[]{1, 2, 3});
        store.write(ArtifactStore.FORECAST_MODEL, new byte[]{4, 5});

        assertTrue(store.exists(ArtifactStore.FORECAST_MODEL));
        assertArrayEquals(new byte[]{4, 5}, store.read(ArtifactStore.FORECAST_MODEL));
        assertFalse(store.exists(ArtifactStore.FORECAST_SCALER));
    }
}
