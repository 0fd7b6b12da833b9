package de.tu_berlin.dos.arm.envsense.utils;

import org.apache.commons.lang3.StringUtils;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.util.List;
import java.util.Optional;

public interface DateUtil {

    String ISO_DATE_FORMAT_ZERO_OFFSET = "yyyy-MM-dd HH:mm:ss";

    DateTimeFormatter LOCAL_FORMAT =
        new DateTimeFormatterBuilder()
            .appendPattern(ISO_DATE_FORMAT_ZERO_OFFSET)
            .optionalStart()
            .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
            .optionalEnd()
            .toFormatter();

    DateTimeFormatter SLASH_FORMAT =
        new DateTimeFormatterBuilder()
            .appendPattern("yyyy/MM/dd HH:mm")
            .optionalStart()
            .appendPattern(":ss")
            .optionalEnd()
            .toFormatter();

    // naive shapes, tried in order
    List<DateTimeFormatter> LOCAL_FORMATS =
        List.of(LOCAL_FORMAT, DateTimeFormatter.ISO_LOCAL_DATE_TIME, SLASH_FORMAT);

    // shapes carrying an offset, converted to the target zone
    List<DateTimeFormatter> OFFSET_FORMATS =
        List.of(
            DateTimeFormatter.ISO_OFFSET_DATE_TIME,
            new DateTimeFormatterBuilder().append(LOCAL_FORMAT).appendOffset("+HH:MM", "Z").toFormatter(),
            new DateTimeFormatterBuilder().append(LOCAL_FORMAT).appendOffset("+HHMM", "Z").toFormatter());

    /**
     * Parses a raw timestamp cell into local wall-clock time in the given zone. Returns empty when the value
     * matches none of the accepted shapes.
     */
    static Optional<LocalDateTime> parse(String raw, ZoneId zone) {

        String value = StringUtils.trimToNull(raw);
        if (value == null) return Optional.empty();

        for (DateTimeFormatter formatter : OFFSET_FORMATS) {

            Optional<LocalDateTime> parsed = parseOffset(value, formatter, zone);
            if (parsed.isPresent()) return parsed;
        }
        for (DateTimeFormatter formatter : LOCAL_FORMATS) {

            Optional<LocalDateTime> parsed = parseLocal(value, formatter);
            if (parsed.isPresent()) return parsed;
        }
        try {
            return Optional.of(LocalDate.parse(value).atStartOfDay());
        }
        catch (DateTimeParseException e) {

            return Optional.empty();
        }
    }

    static Optional<LocalDateTime> parseOffset(String value, DateTimeFormatter formatter, ZoneId zone) {

        try {
            OffsetDateTime odt = OffsetDateTime.parse(value, formatter);
            return Optional.of(odt.atZoneSameInstant(zone).toLocalDateTime());
        }
        catch (DateTimeParseException e) {

            return Optional.empty();
        }
    }

    static Optional<LocalDateTime> parseLocal(String value, DateTimeFormatter formatter) {

        try {
            return Optional.of(LocalDateTime.parse(value, formatter));
        }
        catch (DateTimeParseException e) {

            return Optional.empty();
        }
    }

    static String format(LocalDateTime time) {

        return time.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME);
    }
}
