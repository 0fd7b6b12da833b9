package de.tu_berlin.dos.arm.envsense.io;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RawBatchTest {

    @Test
    void headerAndCellsAreSplit() throws IOException {

        RawBatch batch = RawBatch.fromCSV("Time,Battery, Temperature\n2024-05-01 08:00:00,4.1,\"22.5\"\n\n2024-05-01 08:05:00,,23\n");

        assertEquals(List.of("Time", "Battery", "Temperature"), batch.columns());
        assertEquals(2, batch.size());
        assertEquals("22.5", batch.cell(0, 2));
        assertEquals("", batch.cell(1, 1));
    }

    @Test
    void quotedSeparatorStaysInCell() throws IOException {

        RawBatch batch = RawBatch.fromCSV(
            "Note,Time,Temperature\n\"hot, \"\"humid\"\"\",2024-05-01 08:00:00,22.5\n");

        assertEquals(3, batch.columns().size());
        assertEquals("hot, \"humid\"", batch.cell(0, 0));
        assertEquals("2024-05-01 08:00:00", batch.cell(0, 1));
        assertEquals("22.5", batch.cell(0, 2));
    }

    @Test
    void shortRowYieldsNullCell() throws IOException {

        RawBatch batch = RawBatch.fromCSV("Time,Battery,Temperature\n2024-05-01 08:00:00,4.1\n");

        assertNull(batch.cell(0, 2));
    }

    @Test
    void leadingBomIsDropped() throws IOException {

        byte[] body = "Time,Battery\n2024-05-01 08:00:00,4.1\n".getBytes(StandardCharsets.UTF_8);
        byte[] bytes = new byte[body.length + 3];
        bytes[0] = (byte) 0xEF;
        bytes[1] = (byte) 0xBB;
        bytes[2] = (byte) 0xBF;
        System.arraycopy(body, 0, bytes, 3, body.length);

        assertEquals("Time", RawBatch.fromCSV(bytes).columns().get(0));
    }

    @Test
    void invalidUtf8FallsBackToLatin1() throws IOException {

        byte[] bytes = "Time,humidity_%°\n2024-05-01 08:00:00,60\n".getBytes(StandardCharsets.ISO_8859_1);

        RawBatch batch = RawBatch.fromCSV(bytes);
        assertEquals("humidity_%°", batch.columns().get(1));
        assertEquals("60", batch.cell(0, 1));
    }

    @Test
    void emptyInputHasNoColumns() throws IOException {

        RawBatch batch = RawBatch.fromCSV(new byte[0]);

        assertTrue(batch.columns().isEmpty());
        assertTrue(batch.isEmpty());
    }
}
