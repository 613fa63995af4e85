package io.github.view5d.app;

/**
 * Element types an {@link NDArray} can carry.
 *
 * <p>Not every kind can cross the viewer bridge; {@link TypeAdapter} decides
 * which primitive each one is converted to and rejects the rest.</p>
 */
public enum ElementKind {
    INT8,
    UINT8,
    INT16,
    UINT16,
    INT32,
    UINT32,
    INT64,
    UINT64,
    FLOAT32,
    FLOAT64,
    COMPLEX_FLOAT32,
    COMPLEX_FLOAT64,

    /**
     * Packed 8-bit red/green/blue, channels interleaved fastest.
     */
    RGB,

    /**
     * Packed 8-bit grayscale.
     */
    GRAY;

    /**
     * @return true for the complex kinds
     */
    public boolean isComplex() {
        return this == COMPLEX_FLOAT32 || this == COMPLEX_FLOAT64;
    }

    /**
     * @return true for the packed color kinds ({@link #RGB} and {@link #GRAY})
     */
    public boolean isColor() {
        return this == RGB || this == GRAY;
    }

    /**
     * Number of values one array element occupies in its backing array.
     * Complex kinds keep real and imaginary parts in separate arrays, so
     * they count 1.
     *
     * @return 3 for RGB, otherwise 1
     */
    public int valuesPerElement() {
        return this == RGB ? 3 : 1;
    }
}
