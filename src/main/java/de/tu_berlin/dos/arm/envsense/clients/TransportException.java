package de.tu_berlin.dos.arm.envsense.clients;

/**
 * Fetching a raw batch failed. The cycle that asked for it is abandoned.
 */
public class TransportException extends Exception {

    public TransportException(String message) {

        super(message);
    }

    public TransportException(String message, Throwable cause) {

        super(message, cause);
    }
}
