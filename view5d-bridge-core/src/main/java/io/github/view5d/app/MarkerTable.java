package io.github.view5d.app;

import java.util.ArrayList;
import java.util.List;

/**
 * Tab-separated text form of marker lists.
 *
 * <p>The first non-blank line is a header of column labels; each following
 * line holds one marker with {@link MarkerRecord#FIELD_COUNT} values in the
 * field order of {@link MarkerRecord}:</p>
 * <pre>
 * ListNr	MarkerNr	PosX	...	ListColor
 * 0	0	12.5	...	16711680
 * </pre>
 */
public final class MarkerTable {

    private MarkerTable() {
        // Static utility class
    }

    /**
     * Parses marker text as exported by the viewer.
     *
     * @param text header row followed by one row per marker
     * @return the markers, in row order
     * @throws IllegalArgumentException if a row does not hold 22 numbers
     */
    public static List<MarkerRecord> parse(String text) {
        List<MarkerRecord> records = new ArrayList<>();
        if (text == null || text.trim().isEmpty()) {
            return records;
        }

        String[] lines = text.split("\r?\n");
        boolean headerSeen = false;
        for (int lineNo = 0; lineNo < lines.length; lineNo++) {
            String line = lines[lineNo];
            if (line.trim().isEmpty()) {
                continue;
            }
            if (!headerSeen) {
                headerSeen = true;
                continue;
            }

            String[] cells = line.trim().split("\t");
            if (cells.length != MarkerRecord.FIELD_COUNT) {
                throw new IllegalArgumentException("Line " + (lineNo + 1) + ": expected "
                        + MarkerRecord.FIELD_COUNT + " columns, found " + cells.length);
            }
            double[] values = new double[MarkerRecord.FIELD_COUNT];
            for (int i = 0; i < cells.length; i++) {
                try {
                    values[i] = Double.parseDouble(cells[i].trim());
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("Line " + (lineNo + 1) + ", column "
                            + MarkerRecord.FIELD_NAMES.get(i) + ": not a number: " + cells[i], e);
                }
            }
            records.add(new MarkerRecord(values));
        }
        return records;
    }

    /**
     * Formats markers with a header row.
     *
     * @param records the markers
     * @return tab-separated text, one line per marker, newline terminated
     */
    public static String format(List<MarkerRecord> records) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.join("\t", MarkerRecord.FIELD_NAMES)).append('\n');
        for (MarkerRecord record : records) {
            for (int i = 0; i < MarkerRecord.FIELD_COUNT; i++) {
                if (i > 0) {
                    sb.append('\t');
                }
                sb.append(formatValue(record.get(i)));
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    private static String formatValue(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }
}
