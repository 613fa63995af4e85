package io.github.view5d.app;

/**
 * Primitive array types accepted by the viewer's data entry points.
 */
public enum PrimitiveKind {
    BYTE(byte[].class),
    SHORT(short[].class),
    INT(int[].class),
    LONG(long[].class),
    FLOAT(float[].class),
    DOUBLE(double[].class);

    private final Class<?> arrayType;

    PrimitiveKind(Class<?> arrayType) {
        this.arrayType = arrayType;
    }

    /**
     * Returns the Java array class holding values of this kind.
     *
     * @return e.g. {@code float[].class} for {@link #FLOAT}
     */
    public Class<?> getArrayType() {
        return arrayType;
    }

    /**
     * Allocates a zeroed array of this kind.
     *
     * @param length number of values
     * @return a new primitive array
     */
    Object newArray(int length) {
        switch (this) {
            case BYTE:
                return new byte[length];
            case SHORT:
                return new short[length];
            case INT:
                return new int[length];
            case LONG:
                return new long[length];
            case FLOAT:
                return new float[length];
            case DOUBLE:
                return new double[length];
            default:
                throw new IllegalStateException("Unhandled primitive kind " + this);
        }
    }
}
