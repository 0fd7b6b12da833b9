package de.tu_berlin.dos.arm.envsense.io;

import java.util.List;
import java.util.Optional;

/**
 * The numeric channels of a reading. Each sensor knows its canonical column name and the header aliases
 * exporters are known to use for it.
 */
public enum Sensor {

    BATTERY("Battery", "battery_V"),
    HUMIDITY("Humidity", "humidity_%"),
    MOTION("Motion", "motion_count"),
    TEMPERATURE("Temperature", "temperature_C");

    public final String column;
    private final List<String> aliases;

    Sensor(String column, String... aliases) {

        this.column = column;
        this.aliases = List.of(aliases);
    }

    public boolean matches(String header) {

        if (column.equalsIgnoreCase(header)) return true;
        return aliases.stream().anyMatch(alias -> alias.equalsIgnoreCase(header));
    }

    public static Optional<Sensor> fromColumn(String header) {

        for (Sensor sensor : values()) {

            if (sensor.column.equalsIgnoreCase(header)) return Optional.of(sensor);
        }
        return Optional.empty();
    }
}
