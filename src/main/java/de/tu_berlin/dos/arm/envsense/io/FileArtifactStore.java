package de.tu_berlin.dos.arm.envsense.io;

import de.tu_berlin.dos.arm.envsense.utils.AtomicFiles;
import org.apache.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

public class FileArtifactStore implements ArtifactStore {

    private static final Logger LOG = Logger.getLogger(FileArtifactStore.class);
    private static final String SUFFIX = ".bin";

    private final Path dir;

    public FileArtifactStore(Path dir) {

        this.dir = dir;
    }

    @Override
    public byte[] read(String name) throws ArtifactNotFoundException, IOException {

        try {
            return Files.readAllBytes(resolve(name));
        }
        catch (NoSuchFileException e) {

            throw new ArtifactNotFoundException(name);
        }
    }

    @Override
    public void write(String name, byte[] blob) throws IOException {

        AtomicFiles.write(resolve(name), out -> out.write(blob));
        LOG.info("Stored artifact " + name + " (" + blob.length + " bytes)");
    }

    @Override
    public boolean exists(String name) {

        return Files.isRegularFile(resolve(name));
    }

    private Path resolve(String name) {

        return this.dir.resolve(name + SUFFIX);
    }
}
