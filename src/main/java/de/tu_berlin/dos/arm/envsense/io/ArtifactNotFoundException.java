package de.tu_berlin.dos.arm.envsense.io;

/**
 * A model artifact was requested that has never been written.
 */
public class ArtifactNotFoundException extends Exception {

    public final String name;

    public ArtifactNotFoundException(String name) {

        super("No artifact stored under " + name);
        this.name = name;
    }
}
