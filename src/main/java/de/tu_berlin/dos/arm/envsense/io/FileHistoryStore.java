package de.tu_berlin.dos.arm.envsense.io;

import de.tu_berlin.dos.arm.envsense.utils.AtomicFiles;
import de.tu_berlin.dos.arm.envsense.utils.DateUtil;
import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Keeps the canonical series as a CSV snapshot on local disk. The header lists the time column followed
 * by the sensor columns present in the series; missing values are empty cells.
 */
public class FileHistoryStore implements HistoryStore {

    private static final Logger LOG = Logger.getLogger(FileHistoryStore.class);
    private static final String SEP = ",";
    public static final String TIME = "time";

    private final Path file;

    public FileHistoryStore(Path file) {

        this.file = file;
    }

    @Override
    public CanonicalSeries load() throws IOException {

        List<String> lines;
        try {
            lines = Files.readAllLines(this.file, StandardCharsets.UTF_8);
        }
        catch (NoSuchFileException e) {

            return CanonicalSeries.empty();
        }
        if (lines.isEmpty()) return CanonicalSeries.empty();

        String[] header = StringUtils.splitPreserveAllTokens(lines.get(0), SEP);
        if (header.length == 0 || !TIME.equals(header[0])) {

            throw new IOException("Corrupt history snapshot " + this.file + ": unexpected header " + lines.get(0));
        }
        Sensor[] columns = new Sensor[header.length];
        Set<Sensor> sensors = EnumSet.noneOf(Sensor.class);
        for (int i = 1; i < header.length; i++) {

            final String name = header[i];
            columns[i] = Sensor.fromColumn(name)
                .orElseThrow(() -> new IOException("Corrupt history snapshot " + this.file + ": unknown column " + name));
            sensors.add(columns[i]);
        }

        List<Reading> readings = new ArrayList<>(lines.size() - 1);
        for (String line : lines.subList(1, lines.size())) {

            if (line.isEmpty()) continue;
            String[] cells = StringUtils.splitPreserveAllTokens(line, SEP);
            try {
                LocalDateTime time = LocalDateTime.parse(cells[0]);
                Map<Sensor, Double> values = new EnumMap<>(Sensor.class);
                for (int i = 1; i < columns.length && i < cells.length; i++) {

                    if (!cells[i].isEmpty()) values.put(columns[i], Double.parseDouble(cells[i]));
                }
                readings.add(Reading.of(time, values));
            }
            catch (DateTimeParseException | NumberFormatException e) {

                throw new IOException("Corrupt history snapshot " + this.file + ": bad line " + line, e);
            }
        }
        return CanonicalSeries.of(sensors, readings);
    }

    @Override
    public void replace(CanonicalSeries series) throws IOException {

        List<Sensor> sensors = new ArrayList<>(series.sensors());
        AtomicFiles.write(this.file, out -> {

            BufferedWriter writer = new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8));
            StringBuilder header = new StringBuilder(TIME);
            for (Sensor sensor : sensors) header.append(SEP).append(sensor.column);
            writer.write(header.toString());
            writer.newLine();
            for (Reading reading : series.readings()) {

                StringBuilder line = new StringBuilder(DateUtil.format(reading.time));
                for (Sensor sensor : sensors) {

                    Double value = reading.get(sensor);
                    line.append(SEP);
                    if (value != null) line.append(value);
                }
                writer.write(line.toString());
                writer.newLine();
            }
            writer.flush();
        });
        LOG.info("Persisted " + series.size() + " readings to " + this.file);
    }
}
