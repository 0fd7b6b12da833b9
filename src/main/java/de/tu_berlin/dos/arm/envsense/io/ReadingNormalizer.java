package de.tu_berlin.dos.arm.envsense.io;

import de.tu_berlin.dos.arm.envsense.utils.DateUtil;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;
import org.apache.log4j.Logger;

import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Turns a raw batch into typed, time-sorted, gap-filled readings. No deduplication happens here.
 */
public class ReadingNormalizer {

    /******************************************************************************
     * STATIC INNER CLASSES
     ******************************************************************************/

    private static class Row {

        final LocalDateTime time;
        final long millis;
        final double[] values;

        Row(LocalDateTime time, double[] values) {

            this.time = time;
            this.millis = time.toInstant(ZoneOffset.UTC).toEpochMilli();
            this.values = values;
        }
    }

    /******************************************************************************
     * CLASS VARIABLES
     ******************************************************************************/

    private static final Logger LOG = Logger.getLogger(ReadingNormalizer.class);

    // priority order, the first one present wins
    public static final List<String> TIME_ALIASES = List.of("Time (Uganda)", "Time", "timestamp", "Datetime", "time");

    /******************************************************************************
     * INSTANCE STATE
     ******************************************************************************/

    private final ZoneId zone;

    /******************************************************************************
     * CONSTRUCTOR(S)
     ******************************************************************************/

    public ReadingNormalizer(ZoneId zone) {

        this.zone = zone;
    }

    /******************************************************************************
     * INSTANCE BEHAVIOUR
     ******************************************************************************/

    public CanonicalSeries normalize(RawBatch batch) throws SchemaException {

        List<String> columns = new ArrayList<>();
        for (String column : batch.columns()) {

            columns.add(StringUtils.trimToEmpty(column));
        }
        int timeIndex = locateTimeColumn(columns);
        Map<Sensor, Integer> sensorIndex = locateSensorColumns(columns, timeIndex);

        Sensor[] sensors = Sensor.values();
        List<Row> rows = new ArrayList<>(batch.size());
        int dropped = 0;
        for (int i = 0; i < batch.size(); i++) {

            Optional<LocalDateTime> time = DateUtil.parse(batch.cell(i, timeIndex), zone);
            if (time.isEmpty()) {

                dropped++;
                continue;
            }
            double[] values = new double[sensors.length];
            Arrays.fill(values, Double.NaN);
            for (Map.Entry<Sensor, Integer> entry : sensorIndex.entrySet()) {

                values[entry.getKey().ordinal()] = toNumber(batch.cell(i, entry.getValue()));
            }
            rows.add(new Row(time.get(), values));
        }
        if (dropped > 0) LOG.warn("Dropped " + dropped + " of " + batch.size() + " rows with unparseable time");

        // List.sort is stable, rows sharing a timestamp keep their order
        rows.sort(Comparator.comparingLong(r -> r.millis));

        Set<Sensor> present = EnumSet.noneOf(Sensor.class);
        for (Sensor sensor : sensorIndex.keySet()) {

            if (fill(rows, sensor.ordinal())) present.add(sensor);
            else LOG.info("Column " + sensor.column + " has no numeric values, leaving it absent");
        }

        List<Reading> readings = new ArrayList<>(rows.size());
        for (Row row : rows) {

            Map<Sensor, Double> values = new EnumMap<>(Sensor.class);
            for (Sensor sensor : present) {

                values.put(sensor, row.values[sensor.ordinal()]);
            }
            readings.add(Reading.of(row.time, values));
        }
        return CanonicalSeries.of(present, readings);
    }

    int locateTimeColumn(List<String> columns) throws SchemaException {

        for (String alias : TIME_ALIASES) {

            int index = columns.indexOf(alias);
            if (index >= 0) return index;
        }
        throw new SchemaException("No time column found among " + columns + ", expected one of " + TIME_ALIASES);
    }

    private static Map<Sensor, Integer> locateSensorColumns(List<String> columns, int timeIndex) {

        Map<Sensor, Integer> result = new EnumMap<>(Sensor.class);
        for (Sensor sensor : Sensor.values()) {

            for (int i = 0; i < columns.size(); i++) {

                if (i != timeIndex && sensor.matches(columns.get(i))) {

                    result.put(sensor, i);
                    break;
                }
            }
        }
        return result;
    }

    private static double toNumber(String cell) {

        double value = NumberUtils.toDouble(StringUtils.trimToEmpty(cell), Double.NaN);
        return Double.isInfinite(value) ? Double.NaN : value;
    }

    /**
     * Fills the missing values of one column in place: linear in elapsed time between two known values,
     * boundary values carried outward at both ends. Returns false when the column holds no value at all.
     */
    private static boolean fill(List<Row> rows, int column) {

        int prev = -1;
        for (int i = 0; i < rows.size(); i++) {

            if (Double.isNaN(rows.get(i).values[column])) continue;

            if (prev < 0) {
                // leading gap takes the first known value
                for (int j = 0; j < i; j++) rows.get(j).values[column] = rows.get(i).values[column];
            }
            else {
                Row before = rows.get(prev);
                Row after = rows.get(i);
                long span = after.millis - before.millis;
                for (int j = prev + 1; j < i; j++) {

                    double v0 = before.values[column];
                    double v1 = after.values[column];
                    if (span == 0) rows.get(j).values[column] = v0;
                    else {
                        double ratio = (double) (rows.get(j).millis - before.millis) / span;
                        rows.get(j).values[column] = v0 + ratio * (v1 - v0);
                    }
                }
            }
            prev = i;
        }
        if (prev < 0) return false;
        // trailing gap takes the last known value
        for (int j = prev + 1; j < rows.size(); j++) rows.get(j).values[column] = rows.get(prev).values[column];
        return true;
    }
}
