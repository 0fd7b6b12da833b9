package de.tu_berlin.dos.arm.envsense.modeling;

import de.tu_berlin.dos.arm.envsense.io.CanonicalSeries;
import de.tu_berlin.dos.arm.envsense.io.Reading;
import de.tu_berlin.dos.arm.envsense.io.Sensor;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FeatureSynthesizerTest {

    private static final LocalDateTime T0 = LocalDateTime.of(2024, 5, 1, 8, 0);

    private final FeatureSynthesizer synthesizer = new FeatureSynthesizer();

    @Test
    void lagsAndTargetLineUpWithNeighbours() {

        CanonicalSeries series = CanonicalSeries.of(EnumSet.allOf(Sensor.class), List.of(
            new Reading(T0, 4.10, 60.0, 0.0, 20.0),
            new Reading(T0.plusMinutes(5), 4.09, 61.0, 1.0, 21.0),
            new Reading(T0.plusMinutes(10), 4.08, 62.0, 2.0, 22.0),
            new Reading(T0.plusMinutes(15), 4.07, 63.0, 3.0, 23.0),
            new Reading(T0.plusMinutes(20), 4.06, 64.0, 4.0, 24.0)));

        FeatureTable table = synthesizer.synthesize(series);
        List<FeatureRow> rows = table.rows();
        assertEquals(5, table.size());

        FeatureRow first = rows.get(0);
        assertNull(first.value(FeatureRow.TEMP_LAG_1));
        assertEquals(21.0, first.temperatureNext, 1e-9);

        FeatureRow fourth = rows.get(3);
        assertEquals(22.0, fourth.value(FeatureRow.TEMP_LAG_1), 1e-9);
        assertEquals(21.0, fourth.value(FeatureRow.TEMP_LAG_2), 1e-9);
        assertEquals(20.0, fourth.value(FeatureRow.TEMP_LAG_3), 1e-9);
        assertEquals(2.0, fourth.value(FeatureRow.MOTION_LAG_1), 1e-9);
        assertEquals(0.0, fourth.value(FeatureRow.MOTION_LAG_3), 1e-9);
        assertEquals(4.08, fourth.value(FeatureRow.BATTERY_LAG_1), 1e-9);
        assertEquals(4.10, fourth.value(FeatureRow.BATTERY_LAG_3), 1e-9);
        assertEquals(24.0, fourth.value(FeatureRow.TEMPERATURE_NEXT), 1e-9);

        assertNull(rows.get(4).temperatureNext);
    }

    @Test
    void batteryDropRateIsPerMinute() {

        CanonicalSeries series = CanonicalSeries.of(EnumSet.of(Sensor.BATTERY), List.of(
            new Reading(T0, 4.10, null, null, null),
            new Reading(T0.plusMinutes(5), 4.00, null, null, null),
            new Reading(T0.plusMinutes(5), 3.90, null, null, null)));

        List<FeatureRow> rows = synthesizer.synthesize(series).rows();

        assertEquals(0.0, rows.get(0).batteryDropRate, 1e-12);
        assertEquals(5.0, rows.get(1).elapsedMinutes, 1e-12);
        assertEquals(-0.02, rows.get(1).value(FeatureRow.BATTERY_DROP_RATE), 1e-9);
        // no time elapsed
        assertEquals(0.0, rows.get(2).batteryDropRate, 1e-12);
    }

    @Test
    void onlyCompleteLabelledRowsFeedTheForecaster() {

        CanonicalSeries series = CanonicalSeries.of(EnumSet.allOf(Sensor.class), List.of(
            new Reading(T0, 4.10, 60.0, 0.0, 20.0),
            new Reading(T0.plusMinutes(5), 4.09, 61.0, 1.0, 21.0),
            new Reading(T0.plusMinutes(10), 4.08, 62.0, 2.0, 22.0),
            new Reading(T0.plusMinutes(15), 4.07, 63.0, 3.0, 23.0),
            new Reading(T0.plusMinutes(20), 4.06, 64.0, 4.0, 24.0),
            new Reading(T0.plusMinutes(25), 4.05, 65.0, 5.0, 25.0)));

        List<FeatureRow> rows = synthesizer.synthesize(series).forecastRows();

        assertEquals(2, rows.size());
        assertEquals(T0.plusMinutes(15), rows.get(0).time);
        assertEquals(T0.plusMinutes(20), rows.get(1).time);
    }

    @Test
    void anomalyColumnsFollowPresentSensors() {

        CanonicalSeries withBattery = CanonicalSeries.of(EnumSet.of(Sensor.BATTERY, Sensor.TEMPERATURE),
            List.of(new Reading(T0, 4.1, null, null, 20.0)));
        CanonicalSeries withoutBattery = CanonicalSeries.of(EnumSet.of(Sensor.TEMPERATURE),
            List.of(new Reading(T0, null, null, null, 20.0)));

        assertEquals(List.of(FeatureRow.BATTERY, FeatureRow.TEMPERATURE, FeatureRow.BATTERY_DROP_RATE),
            synthesizer.synthesize(withBattery).anomalyColumns());
        assertEquals(List.of(FeatureRow.TEMPERATURE),
            synthesizer.synthesize(withoutBattery).anomalyColumns());
    }
}
