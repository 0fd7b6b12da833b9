package de.tu_berlin.dos.arm.envsense.io;

import org.apache.log4j.Logger;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Appends the part of an incoming batch that lies strictly after the watermark of the existing series.
 * Anything at or before the watermark counts as already seen and is dropped, even when its values differ.
 */
public class MergeEngine {

    public static class MergeResult {

        public final CanonicalSeries merged;
        public final int newCount;

        public MergeResult(CanonicalSeries merged, int newCount) {

            this.merged = merged;
            this.newCount = newCount;
        }

        @Override
        public String toString() {

            return "MergeResult{" +
                    "merged=" + merged +
                    ", newCount=" + newCount +
                    '}';
        }
    }

    private static final Logger LOG = Logger.getLogger(MergeEngine.class);

    public MergeResult merge(CanonicalSeries existing, CanonicalSeries incoming) {

        Optional<LocalDateTime> watermark = existing.watermark();

        List<Reading> fresh = new ArrayList<>();
        Set<LocalDateTime> seen = new HashSet<>();
        int stale = 0;
        for (Reading reading : incoming.readings()) {

            if (watermark.isPresent() && !reading.time.isAfter(watermark.get())) {

                stale++;
                continue;
            }
            // first reading per timestamp wins within a batch
            if (!seen.add(reading.time)) {

                stale++;
                continue;
            }
            fresh.add(reading);
        }
        if (stale > 0) LOG.info("Discarded " + stale + " already seen readings, watermark " + watermark.orElse(null));

        if (fresh.isEmpty()) return new MergeResult(existing, 0);

        List<Reading> readings = new ArrayList<>(existing.size() + fresh.size());
        readings.addAll(existing.readings());
        readings.addAll(fresh);

        Set<Sensor> sensors = EnumSet.noneOf(Sensor.class);
        sensors.addAll(existing.sensors());
        sensors.addAll(incoming.sensors());
        return new MergeResult(CanonicalSeries.of(sensors, readings), fresh.size());
    }
}
