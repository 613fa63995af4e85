package io.github.view5d.app;

import java.util.Arrays;
import java.util.Objects;

/**
 * Caller-owned N-dimensional array handed to the viewer.
 *
 * <p>Values are stored column-major: the first axis (X) varies fastest. The
 * axes are interpreted as X, Y, Z, Element and Time; arrays of lower rank are
 * padded with unit axes when they are adapted for the viewer. Packed color
 * arrays ({@link ElementKind#RGB}, {@link ElementKind#GRAY}) carry spatial
 * axes X, Y, Z and Time only, because their channels become the Element
 * axis.</p>
 *
 * <p>The backing arrays are not copied. This class never writes to them.</p>
 *
 * <pre>{@code
 * float[] voxels = new float[64 * 64 * 16];
 * NDArray stack = NDArray.ofFloats(voxels, 64, 64, 16);
 *
 * NDArray field = NDArray.ofComplex(re, im, 128, 128);
 * }</pre>
 */
public final class NDArray {

    /**
     * Highest rank the viewer can display.
     */
    public static final int MAX_RANK = 5;

    private static final int MAX_COLOR_RANK = 4;

    private final ElementKind kind;
    private final int[] shape;
    private final Object data;
    private final Object imaginary;

    private NDArray(ElementKind kind, int[] shape, Object data, Object imaginary) {
        this.kind = kind;
        this.shape = shape;
        this.data = data;
        this.imaginary = imaginary;
    }

    // =========================================================================
    // FACTORIES
    // =========================================================================

    public static NDArray ofBytes(byte[] data, int... shape) {
        return create(ElementKind.INT8, data, data == null ? 0 : data.length, shape);
    }

    /**
     * Wraps bytes that hold unsigned 8-bit values (0..255).
     *
     * @param data  the values, bit pattern interpreted as unsigned
     * @param shape the array extents, X first
     * @return the array
     */
    public static NDArray ofUnsignedBytes(byte[] data, int... shape) {
        return create(ElementKind.UINT8, data, data == null ? 0 : data.length, shape);
    }

    public static NDArray ofShorts(short[] data, int... shape) {
        return create(ElementKind.INT16, data, data == null ? 0 : data.length, shape);
    }

    public static NDArray ofUnsignedShorts(short[] data, int... shape) {
        return create(ElementKind.UINT16, data, data == null ? 0 : data.length, shape);
    }

    public static NDArray ofInts(int[] data, int... shape) {
        return create(ElementKind.INT32, data, data == null ? 0 : data.length, shape);
    }

    public static NDArray ofUnsignedInts(int[] data, int... shape) {
        return create(ElementKind.UINT32, data, data == null ? 0 : data.length, shape);
    }

    public static NDArray ofLongs(long[] data, int... shape) {
        return create(ElementKind.INT64, data, data == null ? 0 : data.length, shape);
    }

    /**
     * Wraps unsigned 64-bit values. Such arrays can be built but the viewer
     * has no primitive wide enough for them, so adapting one fails.
     *
     * @param data  the values
     * @param shape the array extents
     * @return the array
     */
    public static NDArray ofUnsignedLongs(long[] data, int... shape) {
        return create(ElementKind.UINT64, data, data == null ? 0 : data.length, shape);
    }

    public static NDArray ofFloats(float[] data, int... shape) {
        return create(ElementKind.FLOAT32, data, data == null ? 0 : data.length, shape);
    }

    public static NDArray ofDoubles(double[] data, int... shape) {
        return create(ElementKind.FLOAT64, data, data == null ? 0 : data.length, shape);
    }

    /**
     * Wraps single precision complex values given as separate real and
     * imaginary parts.
     *
     * @param real      real parts
     * @param imaginary imaginary parts, same length as {@code real}
     * @param shape     the array extents
     * @return the array
     */
    public static NDArray ofComplex(float[] real, float[] imaginary, int... shape) {
        Objects.requireNonNull(imaginary, "imaginary must not be null");
        requireSameLength(real == null ? 0 : real.length, imaginary.length);
        NDArray array = create(ElementKind.COMPLEX_FLOAT32, real, real == null ? 0 : real.length, shape);
        return new NDArray(array.kind, array.shape, real, imaginary);
    }

    /**
     * Wraps double precision complex values given as separate real and
     * imaginary parts.
     *
     * @param real      real parts
     * @param imaginary imaginary parts, same length as {@code real}
     * @param shape     the array extents
     * @return the array
     */
    public static NDArray ofComplex(double[] real, double[] imaginary, int... shape) {
        Objects.requireNonNull(imaginary, "imaginary must not be null");
        requireSameLength(real == null ? 0 : real.length, imaginary.length);
        NDArray array = create(ElementKind.COMPLEX_FLOAT64, real, real == null ? 0 : real.length, shape);
        return new NDArray(array.kind, array.shape, real, imaginary);
    }

    /**
     * Wraps packed RGB pixels. Each pixel occupies three consecutive bytes
     * (red, green, blue), pixels follow in X-fastest order.
     *
     * @param rgb   channel-interleaved bytes, length {@code 3 * product(shape)}
     * @param shape spatial extents X, Y, Z and optionally Time
     * @return the array
     */
    public static NDArray ofRgb(byte[] rgb, int... shape) {
        return create(ElementKind.RGB, rgb, rgb == null ? 0 : rgb.length, shape);
    }

    /**
     * Wraps packed 8-bit grayscale pixels.
     *
     * @param gray  pixel bytes, X fastest
     * @param shape spatial extents X, Y, Z and optionally Time
     * @return the array
     */
    public static NDArray ofGray(byte[] gray, int... shape) {
        return create(ElementKind.GRAY, gray, gray == null ? 0 : gray.length, shape);
    }

    private static NDArray create(ElementKind kind, Object data, int length, int[] shape) {
        Objects.requireNonNull(data, "data must not be null");
        Objects.requireNonNull(shape, "shape must not be null");
        int maxRank = kind.isColor() ? MAX_COLOR_RANK : MAX_RANK;
        if (shape.length > maxRank) {
            throw new IllegalArgumentException("Rank " + shape.length + " exceeds maximum of "
                    + maxRank + " for " + kind);
        }
        int expected = countValues(shape, kind.valuesPerElement());
        if (expected != length) {
            throw new IllegalArgumentException("Data length " + length + " does not match shape "
                    + Arrays.toString(shape) + " (expected " + expected + ")");
        }
        return new NDArray(kind, shape.clone(), data, null);
    }

    /**
     * Number of values a shape holds, {@code valuesPerElement * product(shape)}.
     *
     * @throws IllegalArgumentException for a negative extent or a count above
     *                                  {@link Integer#MAX_VALUE}
     */
    static int countValues(int[] shape, int valuesPerElement) {
        boolean empty = false;
        for (int extent : shape) {
            if (extent < 0) {
                throw new IllegalArgumentException("Negative extent in shape " + Arrays.toString(shape));
            }
            empty |= extent == 0;
        }
        if (empty) {
            return 0;
        }
        int count = valuesPerElement;
        try {
            for (int extent : shape) {
                count = Math.multiplyExact(count, extent);
            }
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Shape " + Arrays.toString(shape)
                    + " holds more than " + Integer.MAX_VALUE + " values", e);
        }
        return count;
    }

    private static void requireSameLength(int realLength, int imaginaryLength) {
        if (realLength != imaginaryLength) {
            throw new IllegalArgumentException("Real and imaginary parts differ in length: "
                    + realLength + " vs " + imaginaryLength);
        }
    }

    // =========================================================================
    // ACCESSORS
    // =========================================================================

    public ElementKind getKind() {
        return kind;
    }

    public boolean isComplex() {
        return kind.isComplex();
    }

    /**
     * @return a copy of the array extents
     */
    public int[] getShape() {
        return shape.clone();
    }

    public int getRank() {
        return shape.length;
    }

    /**
     * Extent along an axis, treating axes beyond the rank as unit length.
     *
     * @param axis zero-based axis index
     * @return the extent
     */
    public int size(int axis) {
        if (axis < 0) {
            throw new IllegalArgumentException("Negative axis " + axis);
        }
        return axis < shape.length ? shape[axis] : 1;
    }

    /**
     * @return the number of array elements (pixels for color kinds)
     */
    public int getElementCount() {
        return countValues(shape, 1);
    }

    /**
     * Largest absolute value in the array. Complex values contribute their
     * magnitude; packed color values their raw channel value.
     *
     * @return the maximum, or 0 for an empty array
     */
    public double maxAbs() {
        int n = countValues(shape, kind.valuesPerElement());
        double max = 0;
        for (int i = 0; i < n; i++) {
            double value = isComplex() ? Math.hypot(real(i), imag(i)) : Math.abs(real(i));
            if (value > max) {
                max = value;
            }
        }
        return max;
    }

    /**
     * Real part (or plain value) at a flat storage index, honouring the
     * signedness of the element kind.
     */
    double real(int index) {
        switch (kind) {
            case INT8:
                return ((byte[]) data)[index];
            case UINT8:
            case RGB:
            case GRAY:
                return Byte.toUnsignedInt(((byte[]) data)[index]);
            case INT16:
                return ((short[]) data)[index];
            case UINT16:
                return Short.toUnsignedInt(((short[]) data)[index]);
            case INT32:
                return ((int[]) data)[index];
            case UINT32:
                return Integer.toUnsignedLong(((int[]) data)[index]);
            case INT64:
                return ((long[]) data)[index];
            case UINT64:
                long raw = ((long[]) data)[index];
                double value = (double) (raw >>> 1) * 2.0;
                return value + (raw & 1L);
            case FLOAT32:
            case COMPLEX_FLOAT32:
                return ((float[]) data)[index];
            case FLOAT64:
            case COMPLEX_FLOAT64:
                return ((double[]) data)[index];
            default:
                throw new IllegalStateException("Unhandled element kind " + kind);
        }
    }

    /**
     * Imaginary part at a flat index; 0 for real kinds.
     */
    double imag(int index) {
        if (kind == ElementKind.COMPLEX_FLOAT32) {
            return ((float[]) imaginary)[index];
        }
        if (kind == ElementKind.COMPLEX_FLOAT64) {
            return ((double[]) imaginary)[index];
        }
        return 0;
    }

    /**
     * The backing array (real parts for complex kinds).
     */
    Object data() {
        return data;
    }

    @Override
    public String toString() {
        return "NDArray[" + kind + " " + Arrays.toString(shape) + "]";
    }
}
