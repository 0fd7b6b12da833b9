package de.tu_berlin.dos.arm.envsense.io;

import java.io.IOException;

/**
 * The persisted canonical series. {@link #replace} swaps the whole snapshot atomically: concurrent
 * readers observe either the complete old or the complete new series.
 */
public interface HistoryStore {

    /**
     * Returns the current snapshot, or an empty series when nothing has been persisted yet.
     */
    CanonicalSeries load() throws IOException;

    void replace(CanonicalSeries series) throws IOException;
}
