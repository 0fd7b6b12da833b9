package de.tu_berlin.dos.arm.envsense.core;

import de.tu_berlin.dos.arm.envsense.io.CanonicalSeries;
import de.tu_berlin.dos.arm.envsense.io.MergeEngine.MergeResult;
import org.apache.commons.lang3.time.StopWatch;

import java.util.List;
import java.util.function.BooleanSupplier;

/**
 * State of one poll cycle. Everything here is local to the cycle and discarded once it ends.
 */
public class Cycle {

    public final Context context;
    private final BooleanSupplier cancelled;
    private final StopWatch stopWatch = StopWatch.createStarted();

    byte[] raw;
    CanonicalSeries batch;
    MergeResult merge;

    private String abandonReason;
    private boolean anomalyTrained;
    private boolean forecastTrained;

    public Cycle(Context context, BooleanSupplier cancelled) {

        this.context = context;
        this.cancelled = cancelled;
    }

    boolean isCancelled() {

        return cancelled.getAsBoolean();
    }

    CycleManager abandon(String reason) {

        this.abandonReason = reason;
        return CycleManager.IDLE;
    }

    void setAnomalyTrained(boolean anomalyTrained) {

        this.anomalyTrained = anomalyTrained;
    }

    void setForecastTrained(boolean forecastTrained) {

        this.forecastTrained = forecastTrained;
    }

    public CycleReport report(List<CycleManager> path) {

        CycleReport.Outcome outcome;
        if (abandonReason != null) outcome = CycleReport.Outcome.ABANDONED;
        else if (path.contains(CycleManager.RETRAINING)) outcome = CycleReport.Outcome.RETRAINED;
        else outcome = CycleReport.Outcome.SKIPPED;

        int newCount = merge == null ? 0 : merge.newCount;
        return new CycleReport(outcome, newCount, anomalyTrained, forecastTrained, abandonReason, path, stopWatch.getTime());
    }
}
