package de.tu_berlin.dos.arm.envsense.clients;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class LocalFileSourceTest {

    @TempDir
    Path dir;

    @Test
    void returnsFileBytes() throws Exception {

        Path file = dir.resolve("sensor_data.csv");
        Files.write(file, "Time,Battery\n".getBytes(StandardCharsets.UTF_8));

        assertArrayEquals("Time,Battery\n".getBytes(StandardCharsets.UTF_8), new LocalFileSource(file).fetch());
    }

    @Test
    void missingFileIsTransportFailure() {

        assertThrows(TransportException.class, () -> new LocalFileSource(dir.resolve("absent.csv")).fetch());
    }
}
