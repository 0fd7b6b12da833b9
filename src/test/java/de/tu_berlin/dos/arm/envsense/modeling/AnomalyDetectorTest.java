package de.tu_berlin.dos.arm.envsense.modeling;

import de.tu_berlin.dos.arm.envsense.io.CanonicalSeries;
import de.tu_berlin.dos.arm.envsense.io.Reading;
import de.tu_berlin.dos.arm.envsense.io.Sensor;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class AnomalyDetectorTest {

    private static final LocalDateTime T0 = LocalDateTime.of(2024, 5, 1, 8, 0);

    private final FeatureSynthesizer synthesizer = new FeatureSynthesizer();
    private final AnomalyDetector detector = new AnomalyDetector(200, 0.02, 42, 10);

    private static List<Reading> normalReadings(int count) {

        Random random = new Random(7);
        List<Reading> readings = new ArrayList<>();
        for (int i = 0; i < count; i++) {

            readings.add(new Reading(
                T0.plusMinutes(5L * i),
                4.10 - 0.001 * i + random.nextGaussian() * 0.002,
                60 + random.nextGaussian(),
                (double) random.nextInt(3),
                22 + random.nextGaussian() * 0.5));
        }
        return readings;
    }

    private FeatureTable table(List<Reading> readings) {

        return synthesizer.synthesize(CanonicalSeries.of(EnumSet.allOf(Sensor.class), readings));
    }

    @Test
    void fewerThanTenRowsIsRejected() {

        InsufficientDataException e =
            assertThrows(InsufficientDataException.class, () -> detector.fit(table(normalReadings(9))));
        assertEquals(9, e.available);
        assertEquals(10, e.required);
    }

    @Test
    void tenRowsAreEnough() throws Exception {

        AnomalyModel model = detector.fit(table(normalReadings(10)));

        assertEquals(10, model.trainingRows);
        assertEquals(5, model.columns().size());
    }

    @Test
    void depletedBatteryScoresBelowZero() throws Exception {

        List<Reading> readings = normalReadings(60);
        Reading last = readings.get(readings.size() - 1);
        readings.add(new Reading(last.time.plusMinutes(5), 0.01, 60.0, 1.0, 22.0));

        FeatureTable table = table(readings);
        AnomalyModel model = detector.fit(table);
        double[] scores = model.score(table);

        assertEquals(readings.size(), scores.length);
        assertTrue(scores[scores.length - 1] < 0, "score " + scores[scores.length - 1]);

        int flagged = 0;
        for (double score : scores) if (score < 0) flagged++;
        assertTrue(flagged <= 3, flagged + " rows flagged");
    }

    @Test
    void sameSeedGivesSameScores() throws Exception {

        FeatureTable table = table(normalReadings(80));

        double[] first = detector.fit(table).score(table);
        double[] second = detector.fit(table).score(table);

        assertArrayEquals(first, second);
    }

    @Test
    void scoringWithDifferentColumnsFails() throws Exception {

        AnomalyModel model = detector.fit(table(normalReadings(20)));

        List<Reading> temperatureOnly = new ArrayList<>();
        for (int i = 0; i < 20; i++) temperatureOnly.add(new Reading(T0.plusMinutes(i), null, null, null, 22.0));
        FeatureTable other = synthesizer.synthesize(CanonicalSeries.of(EnumSet.of(Sensor.TEMPERATURE), temperatureOnly));

        assertThrows(IllegalStateException.class, () -> model.score(other));
    }

    @Test
    void contaminationMustBeAFraction() {

        assertThrows(IllegalArgumentException.class, () -> new AnomalyDetector(200, 0, 42, 10));
        assertThrows(IllegalArgumentException.class, () -> new AnomalyDetector(200, 0.5, 42, 10));
    }
}
