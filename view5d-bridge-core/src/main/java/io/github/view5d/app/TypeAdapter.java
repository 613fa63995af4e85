package io.github.view5d.app;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Converts {@link NDArray}s into {@link AdaptedBuffer}s.
 *
 * <p>The bridge knows only signed Java primitives, so unsigned kinds are
 * either reinterpreted or widened:</p>
 * <ul>
 *   <li>{@code UINT8} keeps its bit pattern as a signed byte</li>
 *   <li>{@code UINT16} is widened to {@code int}</li>
 *   <li>{@code INT32} and {@code UINT32} are widened to {@code long}</li>
 *   <li>complex values become interleaved {@code float} pairs</li>
 *   <li>{@code UINT64} has no mapping</li>
 * </ul>
 *
 * <p>All conversions copy; the source array is never modified.</p>
 */
public final class TypeAdapter {

    private static final Map<ElementKind, PrimitiveKind> PRIMITIVES;

    static {
        Map<ElementKind, PrimitiveKind> table = new EnumMap<>(ElementKind.class);
        table.put(ElementKind.INT8, PrimitiveKind.BYTE);
        table.put(ElementKind.UINT8, PrimitiveKind.BYTE);
        table.put(ElementKind.INT16, PrimitiveKind.SHORT);
        table.put(ElementKind.UINT16, PrimitiveKind.INT);
        table.put(ElementKind.INT32, PrimitiveKind.LONG);
        table.put(ElementKind.UINT32, PrimitiveKind.LONG);
        table.put(ElementKind.INT64, PrimitiveKind.LONG);
        table.put(ElementKind.FLOAT32, PrimitiveKind.FLOAT);
        table.put(ElementKind.FLOAT64, PrimitiveKind.DOUBLE);
        table.put(ElementKind.COMPLEX_FLOAT32, PrimitiveKind.FLOAT);
        table.put(ElementKind.COMPLEX_FLOAT64, PrimitiveKind.FLOAT);
        table.put(ElementKind.RGB, PrimitiveKind.BYTE);
        table.put(ElementKind.GRAY, PrimitiveKind.BYTE);
        PRIMITIVES = Collections.unmodifiableMap(table);
    }

    private TypeAdapter() {
        // Static utility class
    }

    /**
     * Returns the bridge primitive an element kind is converted to.
     *
     * @param kind the element kind
     * @return the primitive kind
     * @throws UnsupportedElementKindException if the kind has no mapping
     */
    public static PrimitiveKind primitiveKindFor(ElementKind kind) {
        PrimitiveKind primitive = PRIMITIVES.get(kind);
        if (primitive == null) {
            throw new UnsupportedElementKindException(kind);
        }
        return primitive;
    }

    /**
     * Adapts an array for the viewer.
     *
     * @param array the source array
     * @return a new buffer with a 5D shape
     * @throws UnsupportedElementKindException if the element kind has no mapping
     */
    public static AdaptedBuffer adapt(NDArray array) {
        ElementKind kind = array.getKind();
        PrimitiveKind primitive = primitiveKindFor(kind);
        int[] shape = array.getShape();

        switch (kind) {
            case COMPLEX_FLOAT32:
            case COMPLEX_FLOAT64:
                return new AdaptedBuffer(primitive, true, padShape(shape), interleave(array));
            case RGB:
                return adaptRgb(array, shape);
            case GRAY:
                return new AdaptedBuffer(primitive, false, colorShape(shape, 1),
                        ((byte[]) array.data()).clone());
            default:
                return new AdaptedBuffer(primitive, false, padShape(shape), convert(array));
        }
    }

    /**
     * Right-pads a shape with unit axes up to rank 5. A 5D shape is returned
     * unchanged (as a copy).
     *
     * @param shape extents of rank 0..5
     * @return the padded extents
     */
    public static int[] padShape(int[] shape) {
        if (shape.length > NDArray.MAX_RANK) {
            throw new IllegalArgumentException("Rank " + shape.length + " exceeds 5: " + Arrays.toString(shape));
        }
        int[] padded = new int[NDArray.MAX_RANK];
        Arrays.fill(padded, 1);
        System.arraycopy(shape, 0, padded, 0, shape.length);
        return padded;
    }

    // Spatial (X, Y, Z[, T]) extents with the channel count inserted as the Element axis
    private static int[] colorShape(int[] shape, int channels) {
        int[] padded = padShape(shape);
        int time = shape.length == 4 ? shape[3] : 1;
        padded[AdaptedBuffer.ELEMENT] = channels;
        padded[AdaptedBuffer.TIME] = time;
        return padded;
    }

    private static AdaptedBuffer adaptRgb(NDArray array, int[] shape) {
        int[] target = colorShape(shape, 3);
        int volume = target[AdaptedBuffer.X] * target[AdaptedBuffer.Y] * target[AdaptedBuffer.Z];
        int times = target[AdaptedBuffer.TIME];
        byte[] source = (byte[]) array.data();
        byte[] out = new byte[source.length];
        // source (c, x, y, z, t) -> target (x, y, z, c, t)
        for (int t = 0; t < times; t++) {
            for (int v = 0; v < volume; v++) {
                int pixel = t * volume + v;
                for (int c = 0; c < 3; c++) {
                    out[(t * 3 + c) * volume + v] = source[pixel * 3 + c];
                }
            }
        }
        return new AdaptedBuffer(PrimitiveKind.BYTE, false, target, out);
    }

    private static float[] interleave(NDArray array) {
        int n = array.getElementCount();
        float[] out = new float[NDArray.countValues(array.getShape(), 2)];
        for (int i = 0; i < n; i++) {
            out[2 * i] = (float) array.real(i);
            out[2 * i + 1] = (float) array.imag(i);
        }
        return out;
    }

    private static Object convert(NDArray array) {
        Object source = array.data();
        int n = array.getElementCount();
        switch (array.getKind()) {
            case INT8:
            case UINT8:
                return ((byte[]) source).clone();
            case INT16:
                return ((short[]) source).clone();
            case UINT16: {
                short[] in = (short[]) source;
                int[] out = new int[n];
                for (int i = 0; i < n; i++) {
                    out[i] = Short.toUnsignedInt(in[i]);
                }
                return out;
            }
            case INT32: {
                int[] in = (int[]) source;
                long[] out = new long[n];
                for (int i = 0; i < n; i++) {
                    out[i] = in[i];
                }
                return out;
            }
            case UINT32: {
                int[] in = (int[]) source;
                long[] out = new long[n];
                for (int i = 0; i < n; i++) {
                    out[i] = Integer.toUnsignedLong(in[i]);
                }
                return out;
            }
            case INT64:
                return ((long[]) source).clone();
            case FLOAT32:
                return ((float[]) source).clone();
            case FLOAT64:
                return ((double[]) source).clone();
            default:
                throw new UnsupportedElementKindException(array.getKind());
        }
    }
}
