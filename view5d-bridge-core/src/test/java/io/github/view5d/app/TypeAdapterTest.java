package io.github.view5d.app;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for TypeAdapter.
 */
class TypeAdapterTest {

    // ========== Kind Mapping Tests ==========

    @Test
    void testPrimitiveKindFor_table() {
        assertEquals(PrimitiveKind.BYTE, TypeAdapter.primitiveKindFor(ElementKind.INT8));
        assertEquals(PrimitiveKind.BYTE, TypeAdapter.primitiveKindFor(ElementKind.UINT8));
        assertEquals(PrimitiveKind.SHORT, TypeAdapter.primitiveKindFor(ElementKind.INT16));
        assertEquals(PrimitiveKind.INT, TypeAdapter.primitiveKindFor(ElementKind.UINT16));
        assertEquals(PrimitiveKind.LONG, TypeAdapter.primitiveKindFor(ElementKind.INT32));
        assertEquals(PrimitiveKind.LONG, TypeAdapter.primitiveKindFor(ElementKind.UINT32));
        assertEquals(PrimitiveKind.LONG, TypeAdapter.primitiveKindFor(ElementKind.INT64));
        assertEquals(PrimitiveKind.FLOAT, TypeAdapter.primitiveKindFor(ElementKind.FLOAT32));
        assertEquals(PrimitiveKind.DOUBLE, TypeAdapter.primitiveKindFor(ElementKind.FLOAT64));
        assertEquals(PrimitiveKind.FLOAT, TypeAdapter.primitiveKindFor(ElementKind.COMPLEX_FLOAT32));
        assertEquals(PrimitiveKind.FLOAT, TypeAdapter.primitiveKindFor(ElementKind.COMPLEX_FLOAT64));
        assertEquals(PrimitiveKind.BYTE, TypeAdapter.primitiveKindFor(ElementKind.RGB));
        assertEquals(PrimitiveKind.BYTE, TypeAdapter.primitiveKindFor(ElementKind.GRAY));
    }

    @Test
    void testPrimitiveKindFor_uint64Unsupported() {
        UnsupportedElementKindException e = assertThrows(UnsupportedElementKindException.class,
                () -> TypeAdapter.primitiveKindFor(ElementKind.UINT64));
        assertEquals(ElementKind.UINT64, e.getKind());
    }

    @Test
    void testAdapt_uint64Unsupported() {
        NDArray data = NDArray.ofUnsignedLongs(new long[]{1L, 2L}, 2);
        assertThrows(UnsupportedElementKindException.class, () -> TypeAdapter.adapt(data));
    }

    // ========== Real Data Tests ==========

    @Test
    void testAdapt_floatsKeepValuesAndPadShape() {
        float[] values = new float[24];
        for (int i = 0; i < values.length; i++) {
            values[i] = i * 0.5f;
        }
        AdaptedBuffer buffer = TypeAdapter.adapt(NDArray.ofFloats(values, 2, 3, 4));

        assertEquals(PrimitiveKind.FLOAT, buffer.getPrimitiveKind());
        assertFalse(buffer.isComplex());
        assertArrayEquals(new int[]{2, 3, 4, 1, 1}, buffer.getShape());
        assertEquals(24, buffer.length());
        assertArrayEquals(values, (float[]) buffer.getData());
    }

    @Test
    void testAdapt_copiesSource() {
        float[] values = {1f, 2f};
        AdaptedBuffer buffer = TypeAdapter.adapt(NDArray.ofFloats(values, 2));
        values[0] = 99f;
        assertEquals(1f, ((float[]) buffer.getData())[0]);
    }

    @Test
    void testAdapt_uint16WidenedToInt() {
        short[] values = {(short) 0xFFFF, 1, (short) 0x8000};
        AdaptedBuffer buffer = TypeAdapter.adapt(NDArray.ofUnsignedShorts(values, 3));

        assertEquals(PrimitiveKind.INT, buffer.getPrimitiveKind());
        assertArrayEquals(new int[]{65535, 1, 32768}, (int[]) buffer.getData());
    }

    @Test
    void testAdapt_int32WidenedToLong() {
        AdaptedBuffer buffer = TypeAdapter.adapt(NDArray.ofInts(new int[]{-5, Integer.MAX_VALUE}, 2));

        assertEquals(PrimitiveKind.LONG, buffer.getPrimitiveKind());
        assertArrayEquals(new long[]{-5L, Integer.MAX_VALUE}, (long[]) buffer.getData());
    }

    @Test
    void testAdapt_uint32WidenedWithoutSignExtension() {
        AdaptedBuffer buffer = TypeAdapter.adapt(NDArray.ofUnsignedInts(new int[]{-1}, 1));

        assertArrayEquals(new long[]{4294967295L}, (long[]) buffer.getData());
    }

    @Test
    void testAdapt_uint8KeepsBitPattern() {
        byte[] values = {(byte) 200, 7};
        AdaptedBuffer buffer = TypeAdapter.adapt(NDArray.ofUnsignedBytes(values, 2));

        assertEquals(PrimitiveKind.BYTE, buffer.getPrimitiveKind());
        assertArrayEquals(values, (byte[]) buffer.getData());
    }

    @Test
    void testAdapt_fiveDimensionalShapeUnchanged() {
        AdaptedBuffer buffer = TypeAdapter.adapt(NDArray.ofDoubles(new double[2 * 2 * 2 * 3 * 2], 2, 2, 2, 3, 2));

        assertArrayEquals(new int[]{2, 2, 2, 3, 2}, buffer.getShape());
        assertEquals(PrimitiveKind.DOUBLE, buffer.getPrimitiveKind());
    }

    // ========== Complex Data Tests ==========

    @Nested
    class ComplexData {

        @Test
        void testAdapt_interleavesRealAndImaginary() {
            NDArray data = NDArray.ofComplex(new float[]{1f, 2f, 3f}, new float[]{-1f, -2f, -3f}, 3);
            AdaptedBuffer buffer = TypeAdapter.adapt(data);

            assertTrue(buffer.isComplex());
            assertEquals(PrimitiveKind.FLOAT, buffer.getPrimitiveKind());
            assertArrayEquals(new int[]{3, 1, 1, 1, 1}, buffer.getShape());
            assertEquals(6, buffer.length());
            assertArrayEquals(new float[]{1f, -1f, 2f, -2f, 3f, -3f}, (float[]) buffer.getData());
        }

        @Test
        void testAdapt_doubleComplexNarrowedToFloat() {
            NDArray data = NDArray.ofComplex(new double[]{0.25, 4.0}, new double[]{0.5, -8.0}, 1, 2);
            AdaptedBuffer buffer = TypeAdapter.adapt(data);

            assertEquals(PrimitiveKind.FLOAT, buffer.getPrimitiveKind());
            assertArrayEquals(new float[]{0.25f, 0.5f, 4f, -8f}, (float[]) buffer.getData());
        }

        @Test
        void testAdapt_deinterleaveRestoresParts() {
            float[] re = {1.5f, -2f, 0f, 7f};
            float[] im = {0f, 3f, -4.25f, 1f};
            float[] interleaved = (float[]) TypeAdapter.adapt(NDArray.ofComplex(re, im, 2, 2)).getData();

            for (int i = 0; i < re.length; i++) {
                assertEquals(re[i], interleaved[2 * i]);
                assertEquals(im[i], interleaved[2 * i + 1]);
            }
        }

        @Test
        void testMaxAbs_usesMagnitude() {
            AdaptedBuffer buffer = TypeAdapter.adapt(
                    NDArray.ofComplex(new float[]{3f, 1f}, new float[]{4f, 1f}, 2));
            assertEquals(5.0, buffer.maxAbs(), 1e-6);
        }
    }

    // ========== Color Data Tests ==========

    @Nested
    class ColorData {

        @Test
        void testAdapt_rgbMovesChannelsToElementAxis() {
            // two pixels: (1,2,3) and (4,5,6)
            byte[] rgb = {1, 2, 3, 4, 5, 6};
            AdaptedBuffer buffer = TypeAdapter.adapt(NDArray.ofRgb(rgb, 2, 1));

            assertArrayEquals(new int[]{2, 1, 1, 3, 1}, buffer.getShape());
            assertArrayEquals(new byte[]{1, 4, 2, 5, 3, 6}, (byte[]) buffer.getData());
        }

        @Test
        void testAdapt_rgbFourthAxisIsTime() {
            byte[] rgb = new byte[3 * 2 * 2];
            AdaptedBuffer buffer = TypeAdapter.adapt(NDArray.ofRgb(rgb, 2, 1, 1, 2));

            assertArrayEquals(new int[]{2, 1, 1, 3, 2}, buffer.getShape());
        }

        @Test
        void testAdapt_grayIsSingleElement() {
            byte[] gray = {9, 8, 7, 6};
            AdaptedBuffer buffer = TypeAdapter.adapt(NDArray.ofGray(gray, 2, 2));

            assertArrayEquals(new int[]{2, 2, 1, 1, 1}, buffer.getShape());
            assertArrayEquals(gray, (byte[]) buffer.getData());
        }

        @Test
        void testOfRgb_rankFiveRejected() {
            assertThrows(IllegalArgumentException.class,
                    () -> NDArray.ofRgb(new byte[3], 1, 1, 1, 1, 1));
        }
    }

    // ========== Shape Padding Tests ==========

    @Test
    void testPadShape_padsWithOnes() {
        assertArrayEquals(new int[]{4, 1, 1, 1, 1}, TypeAdapter.padShape(new int[]{4}));
        assertArrayEquals(new int[]{1, 1, 1, 1, 1}, TypeAdapter.padShape(new int[0]));
    }

    @Test
    void testPadShape_idempotent() {
        int[] once = TypeAdapter.padShape(new int[]{3, 2});
        assertArrayEquals(once, TypeAdapter.padShape(once));
    }

    @Test
    void testPadShape_rankSixRejected() {
        assertThrows(IllegalArgumentException.class, () -> TypeAdapter.padShape(new int[6]));
    }
}
