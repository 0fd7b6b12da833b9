package de.tu_berlin.dos.arm.envsense.io;

/**
 * A whole batch was rejected because its shape is unusable, e.g. no recognisable time column.
 */
public class SchemaException extends Exception {

    public SchemaException(String message) {

        super(message);
    }
}
