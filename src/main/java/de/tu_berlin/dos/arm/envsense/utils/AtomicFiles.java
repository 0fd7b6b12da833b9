package de.tu_berlin.dos.arm.envsense.utils;

import org.apache.log4j.Logger;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

public final class AtomicFiles {

    @FunctionalInterface
    public interface CheckedConsumer<T> {

        void accept(T t) throws IOException;
    }

    private static final Logger LOG = Logger.getLogger(AtomicFiles.class);

    private AtomicFiles() {}

    /**
     * Writes to a temporary sibling of the target, then renames it over the target so that readers never
     * open a partially written file.
     */
    public static void write(Path target, CheckedConsumer<OutputStream> writer) throws IOException {

        Path dir = target.toAbsolutePath().getParent();
        Files.createDirectories(dir);
        Path tmp = Files.createTempFile(dir, target.getFileName().toString(), ".tmp");
        try {
            try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(tmp))) {

                writer.accept(out);
            }
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            }
            catch (AtomicMoveNotSupportedException e) {

                LOG.warn("Atomic move not supported for " + target + ", falling back to plain replace");
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        }
        finally {
            Files.deleteIfExists(tmp);
        }
    }
}
