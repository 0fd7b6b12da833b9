package de.tu_berlin.dos.arm.envsense.modeling;

/**
 * Not enough usable rows to train a model. Callers keep the previously trained artifact.
 */
public class InsufficientDataException extends Exception {

    public final int available;
    public final int required;

    public InsufficientDataException(String model, int available, int required) {

        super("Not enough data to train " + model + " model: " + available + " rows, need " + required);
        this.available = available;
        this.required = required;
    }
}
