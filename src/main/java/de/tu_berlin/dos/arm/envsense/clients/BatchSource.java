package de.tu_berlin.dos.arm.envsense.clients;

/**
 * Upstream provider of raw sensor batches, delivered as CSV bytes. Delivery is at-least-once: the same
 * rows may show up in several batches.
 */
public interface BatchSource {

    byte[] fetch() throws TransportException;
}
