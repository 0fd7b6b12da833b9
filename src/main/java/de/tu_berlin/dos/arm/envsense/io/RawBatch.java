package de.tu_berlin.dos.arm.envsense.io;

import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A rectangular table of raw cells as delivered by an upstream source: named columns, string cells, no
 * typing applied yet.
 */
public class RawBatch {

    private static final Logger LOG = Logger.getLogger(RawBatch.class);
    private static final char SEP = ',';
    private static final char QUOTE = '"';
    private static final byte[] UTF8_BOM = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};

    /**
     * Decodes CSV bytes. UTF-8 is expected, a leading BOM is dropped, and bytes that are not valid UTF-8
     * are read as ISO-8859-1.
     */
    public static RawBatch fromCSV(byte[] bytes) throws IOException {

        return fromCSV(decode(bytes));
    }

    public static RawBatch fromCSV(String content) throws IOException {

        List<String> columns = null;
        List<List<String>> rows = new ArrayList<>();
        try (BufferedReader br = new BufferedReader(new StringReader(content))) {
            String line;
            while ((line = br.readLine()) != null) {

                if (StringUtils.isBlank(line)) continue;
                List<String> cells = split(line);
                if (columns == null) columns = cells;
                else rows.add(cells);
            }
        }
        if (columns == null) columns = Collections.emptyList();
        return new RawBatch(columns, rows);
    }

    static String decode(byte[] bytes) {

        int offset = 0;
        if (bytes.length >= UTF8_BOM.length && Arrays.equals(Arrays.copyOf(bytes, UTF8_BOM.length), UTF8_BOM)) {

            offset = UTF8_BOM.length;
        }
        ByteBuffer buffer = ByteBuffer.wrap(bytes, offset, bytes.length - offset);
        try {
            return StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(buffer)
                .toString();
        }
        catch (CharacterCodingException e) {

            LOG.warn("Batch is not valid UTF-8, decoding as ISO-8859-1");
            return new String(bytes, offset, bytes.length - offset, StandardCharsets.ISO_8859_1);
        }
    }

    /**
     * Splits one CSV line. Separators inside double quotes belong to the cell, a doubled quote inside a
     * quoted cell is a literal quote.
     */
    static List<String> split(String line) {

        List<String> cells = new ArrayList<>();
        StringBuilder cell = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {

            char c = line.charAt(i);
            if (c == QUOTE) {

                if (quoted && i + 1 < line.length() && line.charAt(i + 1) == QUOTE) {

                    cell.append(QUOTE);
                    i++;
                }
                else quoted = !quoted;
            }
            else if (c == SEP && !quoted) {

                cells.add(cell.toString().trim());
                cell.setLength(0);
            }
            else cell.append(c);
        }
        cells.add(cell.toString().trim());
        return cells;
    }

    private final List<String> columns;
    private final List<List<String>> rows;

    public RawBatch(List<String> columns, List<List<String>> rows) {

        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
        this.rows = Collections.unmodifiableList(new ArrayList<>(rows));
    }

    public List<String> columns() {

        return columns;
    }

    public int size() {

        return rows.size();
    }

    public boolean isEmpty() {

        return rows.isEmpty();
    }

    /**
     * Cell at the given row and column index, null when the row is shorter than the header.
     */
    public String cell(int row, int column) {

        List<String> cells = rows.get(row);
        return column < cells.size() ? cells.get(column) : null;
    }
}
