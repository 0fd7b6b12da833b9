package de.tu_berlin.dos.arm.envsense.io;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * An immutable, time-ordered sequence of readings together with the set of sensor columns the data
 * actually carries. Instances are snapshots: changing the series means building a new one.
 */
public class CanonicalSeries {

    /******************************************************************************
     * CLASS BEHAVIOURS
     ******************************************************************************/

    private static final CanonicalSeries EMPTY = new CanonicalSeries(EnumSet.noneOf(Sensor.class), new ArrayList<>());

    public static CanonicalSeries empty() {

        return EMPTY;
    }

    public static CanonicalSeries of(Set<Sensor> sensors, List<Reading> readings) {

        EnumSet<Sensor> copy = sensors.isEmpty() ? EnumSet.noneOf(Sensor.class) : EnumSet.copyOf(sensors);
        return new CanonicalSeries(copy, new ArrayList<>(readings));
    }

    /******************************************************************************
     * INSTANCE STATE
     ******************************************************************************/

    private final Set<Sensor> sensors;
    private final List<Reading> readings;

    /******************************************************************************
     * CONSTRUCTOR(S)
     ******************************************************************************/

    private CanonicalSeries(EnumSet<Sensor> sensors, List<Reading> readings) {

        // stable sort, equal timestamps keep their arrival order
        Collections.sort(readings);
        this.sensors = Collections.unmodifiableSet(sensors);
        this.readings = Collections.unmodifiableList(readings);
    }

    /******************************************************************************
     * INSTANCE BEHAVIOUR
     ******************************************************************************/

    public int size() {

        return this.readings.size();
    }

    public boolean isEmpty() {

        return this.readings.isEmpty();
    }

    public List<Reading> readings() {

        return this.readings;
    }

    public Set<Sensor> sensors() {

        return this.sensors;
    }

    public boolean has(Sensor sensor) {

        return this.sensors.contains(sensor);
    }

    /**
     * The latest timestamp in the series, i.e. the merge watermark.
     */
    public Optional<LocalDateTime> watermark() {

        return this.readings.isEmpty() ? Optional.empty() : Optional.of(getLast().time);
    }

    public Reading getLast() {

        return this.readings.get(this.readings.size() - 1);
    }

    public List<Reading> tail(int limit) {

        int from = Math.max(0, this.readings.size() - Math.max(0, limit));
        return this.readings.subList(from, this.readings.size());
    }

    /**
     * Mean over the non-missing values of a sensor, empty when the sensor is absent or has no values.
     */
    public Optional<Double> average(Sensor sensor) {

        if (!has(sensor)) return Optional.empty();
        double sum = 0;
        int count = 0;
        for (Reading reading : this.readings) {

            Double value = reading.get(sensor);
            if (value != null && !Double.isNaN(value)) {

                sum += value;
                count++;
            }
        }
        return count == 0 ? Optional.empty() : Optional.of(sum / count);
    }

    @Override
    public String toString() {

        return "CanonicalSeries{" +
                "sensors=" + sensors +
                ", count=" + readings.size() +
                '}';
    }
}
