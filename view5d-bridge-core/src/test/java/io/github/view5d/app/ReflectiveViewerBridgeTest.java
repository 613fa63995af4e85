package io.github.view5d.app;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ReflectiveViewerBridge against FakeView5D.
 */
class ReflectiveViewerBridgeTest {

    private ReflectiveViewerBridge bridge;

    @BeforeEach
    void setUp() {
        bridge = new ReflectiveViewerBridge(FakeView5D.class);
    }

    private static FakeView5D fake(ViewerHandle handle) {
        return (FakeView5D) handle.getViewer();
    }

    // ========== Data Entry Tests ==========

    @Test
    void testStartViewer_passesLogicalSizes() {
        AdaptedBuffer buffer = TypeAdapter.adapt(NDArray.ofFloats(new float[12], 3, 2, 1, 2));

        ViewerHandle viewer = bridge.startViewer(buffer);

        assertArrayEquals(new int[]{3, 2, 1, 2, 1}, fake(viewer).sizes);
        assertSame(buffer.getData(), fake(viewer).data);
    }

    @Test
    void testStartViewer_selectsOverloadByPrimitive() {
        AdaptedBuffer buffer = TypeAdapter.adapt(NDArray.ofInts(new int[]{1, 2}, 2));

        ViewerHandle viewer = bridge.startViewer(buffer);

        assertTrue(fake(viewer).data instanceof long[]);
    }

    @Test
    void testStartViewer_complexUsesSuffixedMethodWithLogicalX() {
        AdaptedBuffer buffer = TypeAdapter.adapt(NDArray.ofComplex(new float[4], new float[4], 4));

        ViewerHandle viewer = bridge.startViewer(buffer);

        assertEquals("Start5DViewerC", fake(viewer).calls.get(0));
        assertEquals(4, fake(viewer).sizes[0]);
    }

    @Test
    void testStartViewer_missingOverload() {
        AdaptedBuffer buffer = TypeAdapter.adapt(NDArray.ofShorts(new short[2], 2));

        ViewerBridgeException e = assertThrows(ViewerBridgeException.class, () -> bridge.startViewer(buffer));
        assertTrue(e.getMessage().contains("Start5DViewer"));
    }

    @Test
    void testReplaceData() {
        ViewerHandle viewer = bridge.startViewer(TypeAdapter.adapt(NDArray.ofFloats(new float[2], 2)));

        bridge.replaceData(viewer, 0, 0, TypeAdapter.adapt(NDArray.ofFloats(new float[2], 2)));

        assertEquals("ReplaceData 0 0", fake(viewer).calls.get(0));
    }

    @Test
    void testAddElement_sameViewerKeepsHandle() {
        ViewerHandle viewer = bridge.startViewer(TypeAdapter.adapt(NDArray.ofFloats(new float[2], 2)));

        ViewerHandle result = bridge.addElement(viewer, TypeAdapter.adapt(NDArray.ofFloats(new float[2], 2)));

        assertSame(viewer, result);
        assertEquals(2, bridge.getNumElements(viewer));
    }

    @Test
    void testAddTime_newViewerGetsNewHandle() {
        ViewerHandle viewer = bridge.startViewer(TypeAdapter.adapt(NDArray.ofFloats(new float[2], 2)));
        fake(viewer).splitOnAddTime = true;

        ViewerHandle result = bridge.addTime(viewer, TypeAdapter.adapt(NDArray.ofFloats(new float[2], 2)));

        assertNotSame(viewer, result);
        assertEquals(2, bridge.getNumTimes(result));
        assertEquals(1, bridge.getNumTimes(viewer));
    }

    // ========== Property Tests ==========

    @Test
    void testSetGammaAndKeys() {
        ViewerHandle viewer = bridge.startViewer(TypeAdapter.adapt(NDArray.ofFloats(new float[2], 2)));

        bridge.setGamma(viewer, 1, 0.3);
        bridge.processKeyMainWindow(viewer, 'e');
        bridge.updatePanels(viewer);

        assertEquals("SetGamma 1 0.3", fake(viewer).calls.get(0));
        assertEquals("key e", fake(viewer).calls.get(1));
        assertEquals("UpdatePanels", fake(viewer).calls.get(2));
    }

    @Test
    void testSetAxisScalesAndUnits_argumentOrder() {
        ViewerHandle viewer = bridge.startViewer(TypeAdapter.adapt(NDArray.ofFloats(new float[2], 2)));
        AxisCalibration calibration = AxisCalibration.defaults()
                .withPixelSizes(0.5)
                .withAxisOffsets(7.0)
                .withValue(2.0, "counts", "e-")
                .withValueOffset(-1.0)
                .withAxisUnits("nm");

        bridge.setAxisScalesAndUnits(viewer, 0, 0, calibration);

        assertEquals("SetAxisScalesAndUnits 2.0 0.5 -1.0 7.0 counts T e- nm", fake(viewer).calls.get(0));
    }

    @Test
    void testExportMarkerLists() {
        ViewerHandle viewer = bridge.startViewer(TypeAdapter.adapt(NDArray.ofFloats(new float[2], 2)));
        assertEquals(1, bridge.exportMarkerLists(viewer).length);
    }

    // ========== Error Tests ==========

    @Test
    void testViewerExceptionUnwrapped() {
        ViewerHandle viewer = bridge.startViewer(TypeAdapter.adapt(NDArray.ofFloats(new float[2], 2)));

        ViewerBridgeException e = assertThrows(ViewerBridgeException.class, () -> bridge.setFontSize(viewer, 12));

        assertTrue(e.getCause() instanceof IllegalStateException);
        assertTrue(e.getMessage().contains("font size 12 not available"));
    }

    @Test
    void testMissingMethod() {
        ViewerHandle viewer = bridge.startViewer(TypeAdapter.adapt(NDArray.ofFloats(new float[2], 2)));

        ViewerBridgeException e = assertThrows(ViewerBridgeException.class, () -> bridge.toFront(viewer));
        assertTrue(e.getMessage().contains("toFront"));
    }

    @Test
    void testName() {
        assertEquals("Reflective(" + FakeView5D.class.getName() + ")", bridge.getName());
    }
}
