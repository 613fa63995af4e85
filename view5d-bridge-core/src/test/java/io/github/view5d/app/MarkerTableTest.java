package io.github.view5d.app;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for MarkerRecord and MarkerTable.
 */
class MarkerTableTest {

    private static double[] sampleValues(double listNr, double markerNr) {
        double[] values = new double[MarkerRecord.FIELD_COUNT];
        values[0] = listNr;
        values[1] = markerNr;
        for (int i = 2; i < values.length; i++) {
            values[i] = i;
        }
        values[2] = 12.5;
        values[21] = 16711680;
        return values;
    }

    // ========== Record Tests ==========

    @Test
    void testRecord_namedFields() {
        MarkerRecord record = new MarkerRecord(sampleValues(3, 7));

        assertEquals(3, record.getListNumber());
        assertEquals(7, record.getMarkerNumber());
        assertEquals(12.5, record.getPosition(0));
        assertEquals(3.0, record.getPosition(1));
        assertEquals(7.0, record.getIntegral());
        assertEquals(8.0, record.getMax());
        assertEquals(9.0, record.getRealPosition(0));
        assertEquals(16, record.getTag());
        assertEquals(16711680, record.getListColor());
    }

    @Test
    void testRecord_wrongFieldCountRejected() {
        assertThrows(IllegalArgumentException.class, () -> new MarkerRecord(new double[21]));
        assertThrows(IllegalArgumentException.class, () -> new MarkerRecord(null));
    }

    @Test
    void testRecord_axisOutOfRange() {
        MarkerRecord record = new MarkerRecord(sampleValues(0, 0));
        assertThrows(IndexOutOfBoundsException.class, () -> record.getPosition(5));
    }

    @Test
    void testRecord_defensiveCopies() {
        double[] values = sampleValues(0, 0);
        MarkerRecord record = new MarkerRecord(values);
        values[0] = 42;
        record.toArray()[1] = 42;

        assertEquals(0, record.getListNumber());
        assertEquals(0, record.getMarkerNumber());
    }

    @Test
    void testRecord_fieldNamesMatchCount() {
        assertEquals(MarkerRecord.FIELD_COUNT, MarkerRecord.FIELD_NAMES.size());
        assertEquals("ListColor", MarkerRecord.FIELD_NAMES.get(21));
    }

    // ========== Table Tests ==========

    @Test
    void testParse_emptyText() {
        assertTrue(MarkerTable.parse("").isEmpty());
        assertTrue(MarkerTable.parse(null).isEmpty());
    }

    @Test
    void testParse_headerOnly() {
        assertTrue(MarkerTable.parse(String.join("\t", MarkerRecord.FIELD_NAMES) + "\n").isEmpty());
    }

    @Test
    void testFormatThenParse_keepsRecords() {
        List<MarkerRecord> records = Arrays.asList(
                new MarkerRecord(sampleValues(0, 0)),
                new MarkerRecord(sampleValues(0, 1)));

        String text = MarkerTable.format(records);

        assertTrue(text.startsWith("ListNr\tMarkerNr\tPosX"));
        assertEquals(records, MarkerTable.parse(text));
    }

    @Test
    void testFormat_integralValuesWithoutDecimals() {
        String text = MarkerTable.format(Collections.singletonList(new MarkerRecord(sampleValues(1, 2))));
        String row = text.split("\n")[1];

        assertTrue(row.startsWith("1\t2\t12.5\t3\t"));
        assertTrue(row.endsWith("\t16711680"));
    }

    @Test
    void testParse_windowsLineEndingsAndBlankLines() {
        String row = MarkerTable.format(Collections.singletonList(new MarkerRecord(sampleValues(0, 4))))
                .split("\n")[1];
        String text = "\r\n" + String.join("\t", MarkerRecord.FIELD_NAMES) + "\r\n" + row + "\r\n\r\n";

        List<MarkerRecord> records = MarkerTable.parse(text);

        assertEquals(1, records.size());
        assertEquals(4, records.get(0).getMarkerNumber());
    }

    @Test
    void testParse_wrongColumnCount() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> MarkerTable.parse("header\n1\t2\t3\n"));
        assertTrue(e.getMessage().contains("Line 2"));
    }

    @Test
    void testParse_notANumber() {
        String[] cells = new String[MarkerRecord.FIELD_COUNT];
        Arrays.fill(cells, "0");
        cells[4] = "abc";
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> MarkerTable.parse("header\n" + String.join("\t", cells)));
        assertTrue(e.getMessage().contains("PosZ"));
    }
}
