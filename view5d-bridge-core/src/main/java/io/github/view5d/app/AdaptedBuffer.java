package io.github.view5d.app;

import java.lang.reflect.Array;
import java.util.Arrays;
import java.util.Objects;

/**
 * A flat primitive array in the layout the viewer consumes.
 *
 * <p>The logical shape always has five axes, X, Y, Z, Element and Time, with
 * X varying fastest. Complex buffers store real and imaginary parts in
 * alternating slots, so their backing array is twice as long as the logical
 * shape suggests:</p>
 * <pre>
 * length == sizeX * sizeY * sizeZ * sizeE * sizeT * (complex ? 2 : 1)
 * </pre>
 *
 * <p>Instances are produced by {@link TypeAdapter} and are treated as
 * immutable: {@link #getData()} exposes the backing array so it can be handed
 * across the bridge without copying, and callers must not modify it.</p>
 */
public final class AdaptedBuffer {

    public static final int X = 0;
    public static final int Y = 1;
    public static final int Z = 2;
    public static final int ELEMENT = 3;
    public static final int TIME = 4;

    private final PrimitiveKind primitiveKind;
    private final boolean complex;
    private final int[] shape;
    private final Object data;

    AdaptedBuffer(PrimitiveKind primitiveKind, boolean complex, int[] shape, Object data) {
        this.primitiveKind = Objects.requireNonNull(primitiveKind, "primitiveKind must not be null");
        Objects.requireNonNull(shape, "shape must not be null");
        Objects.requireNonNull(data, "data must not be null");
        if (shape.length != NDArray.MAX_RANK) {
            throw new IllegalArgumentException("Adapted shape must have 5 axes: " + Arrays.toString(shape));
        }
        if (data.getClass() != primitiveKind.getArrayType()) {
            throw new IllegalArgumentException("Backing array " + data.getClass().getSimpleName()
                    + " does not hold " + primitiveKind);
        }
        if (complex && primitiveKind != PrimitiveKind.FLOAT) {
            throw new IllegalArgumentException("Complex buffers must be FLOAT, not " + primitiveKind);
        }
        int expected = NDArray.countValues(shape, complex ? 2 : 1);
        if (Array.getLength(data) != expected) {
            throw new IllegalArgumentException("Buffer length " + Array.getLength(data)
                    + " does not match shape " + Arrays.toString(shape)
                    + (complex ? " (complex)" : ""));
        }
        this.complex = complex;
        this.shape = shape.clone();
        this.data = data;
    }

    public PrimitiveKind getPrimitiveKind() {
        return primitiveKind;
    }

    public boolean isComplex() {
        return complex;
    }

    /**
     * @return a copy of the logical 5D shape
     */
    public int[] getShape() {
        return shape.clone();
    }

    /**
     * @param axis one of {@link #X}, {@link #Y}, {@link #Z}, {@link #ELEMENT}, {@link #TIME}
     * @return the logical extent of that axis
     */
    public int size(int axis) {
        return shape[axis];
    }

    /**
     * @return the number of primitive values in the backing array
     */
    public int length() {
        return Array.getLength(data);
    }

    /**
     * Returns the backing primitive array, e.g. a {@code float[]} for
     * {@link PrimitiveKind#FLOAT}. Not a copy.
     *
     * @return the backing array
     */
    public Object getData() {
        return data;
    }

    /**
     * Copies one Element index across all time points.
     *
     * @param element the element index
     * @return a buffer of shape (X, Y, Z, 1, T)
     */
    public AdaptedBuffer elementSlice(int element) {
        checkIndex(element, shape[ELEMENT], "element");
        int block = volumeLength();
        int sizeE = shape[ELEMENT];
        int sizeT = shape[TIME];
        Object slice = primitiveKind.newArray(block * sizeT);
        for (int t = 0; t < sizeT; t++) {
            System.arraycopy(data, (t * sizeE + element) * block, slice, t * block, block);
        }
        int[] sliceShape = shape.clone();
        sliceShape[ELEMENT] = 1;
        return new AdaptedBuffer(primitiveKind, complex, sliceShape, slice);
    }

    /**
     * Copies one time point with all of its elements.
     *
     * @param time the time index
     * @return a buffer of shape (X, Y, Z, E, 1)
     */
    public AdaptedBuffer timeSlice(int time) {
        checkIndex(time, shape[TIME], "time");
        int block = volumeLength() * shape[ELEMENT];
        Object slice = primitiveKind.newArray(block);
        System.arraycopy(data, time * block, slice, 0, block);
        int[] sliceShape = shape.clone();
        sliceShape[TIME] = 1;
        return new AdaptedBuffer(primitiveKind, complex, sliceShape, slice);
    }

    /**
     * Largest absolute value; the magnitude for complex buffers.
     *
     * @return the maximum, or 0 for an empty buffer
     */
    public double maxAbs() {
        double max = 0;
        int n = length();
        if (complex) {
            float[] values = (float[]) data;
            for (int i = 0; i + 1 < n; i += 2) {
                max = Math.max(max, Math.hypot(values[i], values[i + 1]));
            }
            return max;
        }
        for (int i = 0; i < n; i++) {
            max = Math.max(max, Math.abs(((Number) Array.get(data, i)).doubleValue()));
        }
        return max;
    }

    // Primitive values per X*Y*Z volume
    private int volumeLength() {
        return shape[X] * shape[Y] * shape[Z] * (complex ? 2 : 1);
    }

    private static void checkIndex(int index, int extent, String axis) {
        if (index < 0 || index >= extent) {
            throw new IndexOutOfBoundsException(axis + " index " + index + " outside 0.." + (extent - 1));
        }
    }

    @Override
    public String toString() {
        return "AdaptedBuffer[" + primitiveKind + (complex ? " complex " : " ")
                + Arrays.toString(shape) + "]";
    }
}
