package de.tu_berlin.dos.arm.envsense.modeling;

import de.tu_berlin.dos.arm.envsense.io.Sensor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Feature rows derived from one canonical series, in time order. Cycle-local, never persisted.
 */
public class FeatureTable {

    public static final List<String> FORECAST_FEATURES = List.of(
        FeatureRow.TEMP_LAG_1, FeatureRow.TEMP_LAG_2, FeatureRow.TEMP_LAG_3,
        FeatureRow.MOTION_LAG_1, FeatureRow.BATTERY_LAG_1);

    private final Set<Sensor> sensors;
    private final List<FeatureRow> rows;

    public FeatureTable(Set<Sensor> sensors, List<FeatureRow> rows) {

        this.sensors = Collections.unmodifiableSet(sensors.isEmpty() ? EnumSet.noneOf(Sensor.class) : EnumSet.copyOf(sensors));
        this.rows = Collections.unmodifiableList(new ArrayList<>(rows));
    }

    public int size() {

        return rows.size();
    }

    public List<FeatureRow> rows() {

        return rows;
    }

    /**
     * The anomaly feature columns this table can supply: every present sensor, plus the battery depletion
     * rate when a battery sensor is present.
     */
    public List<String> anomalyColumns() {

        List<String> columns = new ArrayList<>();
        if (sensors.contains(Sensor.BATTERY)) columns.add(FeatureRow.BATTERY);
        if (sensors.contains(Sensor.HUMIDITY)) columns.add(FeatureRow.HUMIDITY);
        if (sensors.contains(Sensor.MOTION)) columns.add(FeatureRow.MOTION);
        if (sensors.contains(Sensor.TEMPERATURE)) columns.add(FeatureRow.TEMPERATURE);
        if (sensors.contains(Sensor.BATTERY)) columns.add(FeatureRow.BATTERY_DROP_RATE);
        return columns;
    }

    /**
     * One vector per row over the given columns, missing cells filled with 0.
     */
    public double[][] anomalyMatrix(List<String> columns) {

        double[][] matrix = new double[rows.size()][];
        for (int i = 0; i < rows.size(); i++) {

            matrix[i] = zeroFilled(rows.get(i), columns);
        }
        return matrix;
    }

    static double[] zeroFilled(FeatureRow row, List<String> columns) {

        double[] vector = new double[columns.size()];
        for (int j = 0; j < columns.size(); j++) {

            Double value = row.value(columns.get(j));
            vector[j] = value == null || Double.isNaN(value) ? 0 : value;
        }
        return vector;
    }

    /**
     * Rows carrying every forecast feature and a next-step label.
     */
    public List<FeatureRow> forecastRows() {

        List<FeatureRow> complete = new ArrayList<>();
        for (FeatureRow row : rows) {

            if (row.temperatureNext == null) continue;
            boolean proceed = true;
            for (String column : FORECAST_FEATURES) {

                if (row.value(column) == null) {

                    proceed = false;
                    break;
                }
            }
            if (proceed) complete.add(row);
        }
        return complete;
    }
}
