package io.github.view5d.app;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * One marker as exchanged with the viewer: a fixed row of 22 numbers.
 *
 * <table>
 *   <caption>Field layout</caption>
 *   <tr><th>Index</th><th>Content</th></tr>
 *   <tr><td>0-1</td><td>list number, marker number</td></tr>
 *   <tr><td>2-6</td><td>raw sub-pixel position X, Y, Z, E, T</td></tr>
 *   <tr><td>7-8</td><td>integral and maximum, no background subtraction</td></tr>
 *   <tr><td>9-15</td><td>the same position, integral and maximum in scaled axis units</td></tr>
 *   <tr><td>16-20</td><td>tag, parent 1, parent 2, child 1, child 2</td></tr>
 *   <tr><td>21</td><td>list color (coded)</td></tr>
 * </table>
 */
public final class MarkerRecord {

    public static final int FIELD_COUNT = 22;

    /**
     * Column labels, in field order.
     */
    public static final List<String> FIELD_NAMES = Collections.unmodifiableList(Arrays.asList(
            "ListNr", "MarkerNr",
            "PosX", "PosY", "PosZ", "PosE", "PosT",
            "Integral", "Max",
            "RealPosX", "RealPosY", "RealPosZ", "RealPosE", "RealPosT",
            "RealIntegral", "RealMax",
            "TagInteger", "Parent1", "Parent2", "Child1", "Child2",
            "ListColor"));

    private static final int POSITION = 2;
    private static final int REAL_POSITION = 9;

    private final double[] values;

    /**
     * @param values exactly {@link #FIELD_COUNT} values, copied
     */
    public MarkerRecord(double[] values) {
        if (values == null || values.length != FIELD_COUNT) {
            throw new IllegalArgumentException("A marker has " + FIELD_COUNT + " fields, got "
                    + (values == null ? "null" : String.valueOf(values.length)));
        }
        this.values = values.clone();
    }

    public double get(int field) {
        return values[field];
    }

    public int getListNumber() {
        return (int) values[0];
    }

    public int getMarkerNumber() {
        return (int) values[1];
    }

    /**
     * @param axis 0..4 for X, Y, Z, E, T
     * @return raw position in pixel coordinates
     */
    public double getPosition(int axis) {
        return values[POSITION + checkAxis(axis)];
    }

    public double getIntegral() {
        return values[7];
    }

    public double getMax() {
        return values[8];
    }

    /**
     * @param axis 0..4 for X, Y, Z, E, T
     * @return position in scaled axis units
     */
    public double getRealPosition(int axis) {
        return values[REAL_POSITION + checkAxis(axis)];
    }

    public double getRealIntegral() {
        return values[14];
    }

    public double getRealMax() {
        return values[15];
    }

    public int getTag() {
        return (int) values[16];
    }

    public int getParent1() {
        return (int) values[17];
    }

    public int getParent2() {
        return (int) values[18];
    }

    public int getChild1() {
        return (int) values[19];
    }

    public int getChild2() {
        return (int) values[20];
    }

    public int getListColor() {
        return (int) values[21];
    }

    /**
     * @return a copy of all 22 values
     */
    public double[] toArray() {
        return values.clone();
    }

    float[] toFloatArray() {
        float[] narrowed = new float[FIELD_COUNT];
        for (int i = 0; i < FIELD_COUNT; i++) {
            narrowed[i] = (float) values[i];
        }
        return narrowed;
    }

    private static int checkAxis(int axis) {
        if (axis < 0 || axis >= AxisCalibration.AXES) {
            throw new IndexOutOfBoundsException("axis " + axis + " outside 0..4");
        }
        return axis;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MarkerRecord)) {
            return false;
        }
        return Arrays.equals(values, ((MarkerRecord) o).values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "MarkerRecord[list=" + getListNumber() + ", marker=" + getMarkerNumber()
                + ", pos=" + Arrays.toString(Arrays.copyOfRange(values, POSITION, POSITION + 5)) + "]";
    }
}
