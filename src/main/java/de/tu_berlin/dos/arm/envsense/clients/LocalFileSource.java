package de.tu_berlin.dos.arm.envsense.clients;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads the batch from a file that some other process keeps up to date.
 */
public class LocalFileSource implements BatchSource {

    private final Path file;

    public LocalFileSource(Path file) {

        this.file = file;
    }

    @Override
    public byte[] fetch() throws TransportException {

        try {
            return Files.readAllBytes(this.file);
        }
        catch (IOException e) {

            throw new TransportException("Unable to read batch file " + this.file, e);
        }
    }
}
