package de.tu_berlin.dos.arm.envsense.core;

import java.util.Collections;
import java.util.List;

/**
 * What a single poll cycle did.
 */
public class CycleReport {

    public enum Outcome {

        RETRAINED,
        SKIPPED,
        ABANDONED,
        DROPPED
    }

    public final Outcome outcome;
    public final int newCount;
    public final boolean anomalyTrained;
    public final boolean forecastTrained;
    public final String reason;
    public final List<CycleManager> path;
    public final long durationMillis;

    public CycleReport(
            Outcome outcome, int newCount, boolean anomalyTrained, boolean forecastTrained,
            String reason, List<CycleManager> path, long durationMillis) {

        this.outcome = outcome;
        this.newCount = newCount;
        this.anomalyTrained = anomalyTrained;
        this.forecastTrained = forecastTrained;
        this.reason = reason;
        this.path = Collections.unmodifiableList(path);
        this.durationMillis = durationMillis;
    }

    public static CycleReport dropped() {

        return new CycleReport(Outcome.DROPPED, 0, false, false, "previous cycle still running", Collections.emptyList(), 0);
    }

    @Override
    public String toString() {
        return "CycleReport{" +
                "outcome=" + outcome +
                ", newCount=" + newCount +
                ", anomalyTrained=" + anomalyTrained +
                ", forecastTrained=" + forecastTrained +
                ", reason='" + reason + '\'' +
                ", path=" + path +
                ", durationMillis=" + durationMillis +
                '}';
    }
}
