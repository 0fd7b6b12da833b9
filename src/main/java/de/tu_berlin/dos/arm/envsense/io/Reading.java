package de.tu_berlin.dos.arm.envsense.io;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.Objects;

/**
 * One timestamped sample. Sensor values are nullable, a null means the value is missing.
 */
public class Reading implements Comparable<Reading> {

    public final LocalDateTime time;
    public final Double battery;
    public final Double humidity;
    public final Double motion;
    public final Double temperature;

    public Reading(LocalDateTime time, Double battery, Double humidity, Double motion, Double temperature) {

        this.time = Objects.requireNonNull(time, "time");
        this.battery = battery;
        this.humidity = humidity;
        this.motion = motion;
        this.temperature = temperature;
    }

    public static Reading of(LocalDateTime time, Map<Sensor, Double> values) {

        return new Reading(
            time,
            values.get(Sensor.BATTERY),
            values.get(Sensor.HUMIDITY),
            values.get(Sensor.MOTION),
            values.get(Sensor.TEMPERATURE));
    }

    public Double get(Sensor sensor) {

        switch (sensor) {
            case BATTERY: return battery;
            case HUMIDITY: return humidity;
            case MOTION: return motion;
            case TEMPERATURE: return temperature;
            default: throw new IllegalArgumentException("Unknown sensor " + sensor);
        }
    }

    @Override
    public int compareTo(Reading that) {

        return this.time.compareTo(that.time);
    }

    @Override
    public boolean equals(Object o) {

        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Reading that = (Reading) o;
        return time.equals(that.time) &&
                Objects.equals(battery, that.battery) &&
                Objects.equals(humidity, that.humidity) &&
                Objects.equals(motion, that.motion) &&
                Objects.equals(temperature, that.temperature);
    }

    @Override
    public int hashCode() {

        return Objects.hash(time, battery, humidity, motion, temperature);
    }

    @Override
    public String toString() {
        return "Reading{" +
                "time=" + time +
                ", battery=" + battery +
                ", humidity=" + humidity +
                ", motion=" + motion +
                ", temperature=" + temperature +
                '}';
    }
}
