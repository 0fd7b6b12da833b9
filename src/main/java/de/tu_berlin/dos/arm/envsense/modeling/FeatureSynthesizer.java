package de.tu_berlin.dos.arm.envsense.modeling;

import de.tu_berlin.dos.arm.envsense.io.CanonicalSeries;
import de.tu_berlin.dos.arm.envsense.io.Reading;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

public class FeatureSynthesizer {

    static final int MAX_LAG = 3;

    public FeatureTable synthesize(CanonicalSeries series) {

        List<Reading> readings = series.readings();
        List<FeatureRow> rows = new ArrayList<>(readings.size());
        for (int i = 0; i < readings.size(); i++) {

            Reading curr = readings.get(i);
            double batteryDrop = 0;
            double elapsedMinutes = 0;
            if (i > 0) {

                Reading prev = readings.get(i - 1);
                if (curr.battery != null && prev.battery != null) batteryDrop = curr.battery - prev.battery;
                elapsedMinutes = Duration.between(prev.time, curr.time).toMillis() / 60000.0;
            }
            double batteryDropRate = elapsedMinutes != 0 ? batteryDrop / elapsedMinutes : 0;
            if (Double.isNaN(batteryDropRate) || Double.isInfinite(batteryDropRate)) batteryDropRate = 0;

            Double[] tempLags = new Double[MAX_LAG];
            Double[] motionLags = new Double[MAX_LAG];
            Double[] batteryLags = new Double[MAX_LAG];
            for (int lag = 1; lag <= MAX_LAG; lag++) {

                if (i - lag < 0) break;
                Reading lagged = readings.get(i - lag);
                tempLags[lag - 1] = lagged.temperature;
                motionLags[lag - 1] = lagged.motion;
                batteryLags[lag - 1] = lagged.battery;
            }
            Double temperatureNext = i + 1 < readings.size() ? readings.get(i + 1).temperature : null;

            rows.add(new FeatureRow(
                curr.time, curr.battery, curr.humidity, curr.motion, curr.temperature,
                batteryDrop, elapsedMinutes, batteryDropRate,
                tempLags, motionLags, batteryLags, temperatureNext));
        }
        return new FeatureTable(series.sensors(), rows);
    }
}
