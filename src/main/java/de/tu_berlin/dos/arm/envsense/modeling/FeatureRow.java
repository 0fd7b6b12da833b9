package de.tu_berlin.dos.arm.envsense.modeling;

import java.time.LocalDateTime;

/**
 * Model-ready view of one reading: the raw values, the battery depletion features and the lag / target
 * columns for the forecaster. Lag and target cells are null where the window runs off the series.
 */
public class FeatureRow {

    public static final String BATTERY = "battery";
    public static final String HUMIDITY = "humidity";
    public static final String MOTION = "motion";
    public static final String TEMPERATURE = "temperature";
    public static final String BATTERY_DROP_RATE = "battery_drop_rate";
    public static final String TEMP_LAG_1 = "temp_lag_1";
    public static final String TEMP_LAG_2 = "temp_lag_2";
    public static final String TEMP_LAG_3 = "temp_lag_3";
    public static final String MOTION_LAG_1 = "motion_lag_1";
    public static final String MOTION_LAG_2 = "motion_lag_2";
    public static final String MOTION_LAG_3 = "motion_lag_3";
    public static final String BATTERY_LAG_1 = "battery_lag_1";
    public static final String BATTERY_LAG_2 = "battery_lag_2";
    public static final String BATTERY_LAG_3 = "battery_lag_3";
    public static final String TEMPERATURE_NEXT = "temperature_next";

    public final LocalDateTime time;
    public final Double battery;
    public final Double humidity;
    public final Double motion;
    public final Double temperature;

    public final double batteryDrop;
    public final double elapsedMinutes;
    public final double batteryDropRate;

    public final Double[] tempLags;
    public final Double[] motionLags;
    public final Double[] batteryLags;
    public final Double temperatureNext;

    public FeatureRow(
            LocalDateTime time, Double battery, Double humidity, Double motion, Double temperature,
            double batteryDrop, double elapsedMinutes, double batteryDropRate,
            Double[] tempLags, Double[] motionLags, Double[] batteryLags, Double temperatureNext) {

        this.time = time;
        this.battery = battery;
        this.humidity = humidity;
        this.motion = motion;
        this.temperature = temperature;
        this.batteryDrop = batteryDrop;
        this.elapsedMinutes = elapsedMinutes;
        this.batteryDropRate = batteryDropRate;
        this.tempLags = tempLags;
        this.motionLags = motionLags;
        this.batteryLags = batteryLags;
        this.temperatureNext = temperatureNext;
    }

    /**
     * Value of a named feature column, null when missing.
     */
    public Double value(String column) {

        switch (column) {
            case BATTERY: return battery;
            case HUMIDITY: return humidity;
            case MOTION: return motion;
            case TEMPERATURE: return temperature;
            case BATTERY_DROP_RATE: return batteryDropRate;
            case TEMP_LAG_1: return tempLags[0];
            case TEMP_LAG_2: return tempLags[1];
            case TEMP_LAG_3: return tempLags[2];
            case MOTION_LAG_1: return motionLags[0];
            case MOTION_LAG_2: return motionLags[1];
            case MOTION_LAG_3: return motionLags[2];
            case BATTERY_LAG_1: return batteryLags[0];
            case BATTERY_LAG_2: return batteryLags[1];
            case BATTERY_LAG_3: return batteryLags[2];
            case TEMPERATURE_NEXT: return temperatureNext;
            default: throw new IllegalArgumentException("Unknown feature column " + column);
        }
    }

    @Override
    public String toString() {
        return "FeatureRow{" +
                "time=" + time +
                ", temperature=" + temperature +
                ", batteryDropRate=" + batteryDropRate +
                ", temperatureNext=" + temperatureNext +
                '}';
    }
}
