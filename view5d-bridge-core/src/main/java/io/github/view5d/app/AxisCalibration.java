package io.github.view5d.app;

import java.util.Arrays;
import java.util.Objects;

/**
 * Physical scaling and labelling of the five axes and of the displayed value.
 *
 * <p>Axis arrays shorter than five entries are padded with defaults and a
 * warning is logged; longer ones are rejected.</p>
 *
 * <pre>{@code
 * AxisCalibration calibration = AxisCalibration.defaults()
 *         .withPixelSizes(0.1, 0.1, 0.5)
 *         .withAxisUnits("um", "um", "um")
 *         .withValue(1.0, "intensity", "photons");
 * session.setAxisScalesAndUnits(calibration);
 * }</pre>
 */
public final class AxisCalibration {

    public static final int AXES = 5;

    private static final double[] DEFAULT_PIXEL_SIZES = {1.0, 1.0, 1.0, 1.0, 1.0};
    private static final String[] DEFAULT_AXIS_NAMES = {"X", "Y", "Z", "E", "T"};
    private static final String[] DEFAULT_AXIS_UNITS = {"a.u.", "a.u.", "a.u.", "a.u.", "a.u."};

    private final double[] pixelSizes;
    private final double[] axisOffsets;
    private final double valueScale;
    private final double valueOffset;
    private final String valueName;
    private final String valueUnit;
    private final String[] axisNames;
    private final String[] axisUnits;

    private AxisCalibration(double[] pixelSizes, double[] axisOffsets, double valueScale,
                            double valueOffset, String valueName, String valueUnit,
                            String[] axisNames, String[] axisUnits) {
        this.pixelSizes = pixelSizes;
        this.axisOffsets = axisOffsets;
        this.valueScale = valueScale;
        this.valueOffset = valueOffset;
        this.valueName = valueName;
        this.valueUnit = valueUnit;
        this.axisNames = axisNames;
        this.axisUnits = axisUnits;
    }

    /**
     * Unit pixel sizes, zero offsets, axes named X/Y/Z/E/T in {@code a.u.},
     * value "intensity" in "photons".
     *
     * @return the default calibration
     */
    public static AxisCalibration defaults() {
        return new AxisCalibration(DEFAULT_PIXEL_SIZES.clone(), new double[AXES], 1.0, 0.0,
                "intensity", "photons", DEFAULT_AXIS_NAMES.clone(), DEFAULT_AXIS_UNITS.clone());
    }

    public AxisCalibration withPixelSizes(double... sizes) {
        double[] padded = DEFAULT_PIXEL_SIZES.clone();
        checkAxisCount(sizes.length, "pixel sizes", "1.0");
        System.arraycopy(sizes, 0, padded, 0, sizes.length);
        return new AxisCalibration(padded, axisOffsets, valueScale, valueOffset, valueName,
                valueUnit, axisNames, axisUnits);
    }

    public AxisCalibration withAxisOffsets(double... offsets) {
        double[] padded = new double[AXES];
        checkAxisCount(offsets.length, "axis offsets", "0.0");
        System.arraycopy(offsets, 0, padded, 0, offsets.length);
        return new AxisCalibration(pixelSizes, padded, valueScale, valueOffset, valueName,
                valueUnit, axisNames, axisUnits);
    }

    public AxisCalibration withAxisNames(String... names) {
        String[] padded = DEFAULT_AXIS_NAMES.clone();
        checkAxisCount(names.length, "axis names", "standard names");
        System.arraycopy(names, 0, padded, 0, names.length);
        return new AxisCalibration(pixelSizes, axisOffsets, valueScale, valueOffset, valueName,
                valueUnit, padded, axisUnits);
    }

    public AxisCalibration withAxisUnits(String... units) {
        String[] padded = DEFAULT_AXIS_UNITS.clone();
        checkAxisCount(units.length, "axis units", "\"a.u.\"");
        System.arraycopy(units, 0, padded, 0, units.length);
        return new AxisCalibration(pixelSizes, axisOffsets, valueScale, valueOffset, valueName,
                valueUnit, axisNames, padded);
    }

    /**
     * Sets how raw values map to physical values.
     *
     * @param scale multiplier applied to raw values
     * @param name  value name, e.g. "intensity"
     * @param unit  value unit, e.g. "photons"
     * @return a new calibration
     */
    public AxisCalibration withValue(double scale, String name, String unit) {
        return new AxisCalibration(pixelSizes, axisOffsets, scale, valueOffset,
                Objects.requireNonNull(name, "name must not be null"),
                Objects.requireNonNull(unit, "unit must not be null"), axisNames, axisUnits);
    }

    public AxisCalibration withValueOffset(double offset) {
        return new AxisCalibration(pixelSizes, axisOffsets, valueScale, offset, valueName,
                valueUnit, axisNames, axisUnits);
    }

    private static void checkAxisCount(int length, String what, String replacement) {
        if (length > AXES) {
            throw new IllegalArgumentException(what + " must have at most 5 entries, got " + length);
        }
        if (length < AXES) {
            log(what + " should be 5D but has only " + length
                    + " entries. Replacing trailing dimensions by " + replacement + ".");
        }
    }

    public double[] getPixelSizes() {
        return pixelSizes.clone();
    }

    public double[] getAxisOffsets() {
        return axisOffsets.clone();
    }

    public double getValueScale() {
        return valueScale;
    }

    public double getValueOffset() {
        return valueOffset;
    }

    public String getValueName() {
        return valueName;
    }

    public String getValueUnit() {
        return valueUnit;
    }

    public String[] getAxisNames() {
        return axisNames.clone();
    }

    public String[] getAxisUnits() {
        return axisUnits.clone();
    }

    @Override
    public String toString() {
        return "AxisCalibration[sizes=" + Arrays.toString(pixelSizes)
                + ", names=" + Arrays.toString(axisNames)
                + ", units=" + Arrays.toString(axisUnits)
                + ", value=" + valueScale + " " + valueName + " [" + valueUnit + "]]";
    }

    private static void log(String message) {
        System.err.println("View5D: " + message);
    }
}
