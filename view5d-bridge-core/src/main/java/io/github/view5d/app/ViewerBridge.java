package io.github.view5d.app;

/**
 * SPI for reaching the external View5D viewer.
 *
 * <p>Each method corresponds to one entry point of the viewer. Everything
 * above this interface works with typed values and {@link ViewerHandle}s; how
 * the viewer object is actually invoked (reflection, a different class loader,
 * a dispatching decorator) is the implementation's concern.</p>
 *
 * <p>Calls are synchronous: an implementation returns only once the viewer has
 * processed the request, because forwarded key strokes depend on the order in
 * which they arrive.</p>
 *
 * <p>The default implementation is {@link ReflectiveViewerBridge}. A custom
 * bridge is passed to {@link ViewerSession#ViewerSession(ViewerBridge)}:</p>
 * <pre>
 * ViewerBridge bridge = ReflectiveViewerBridge.fromSystemProperties();
 * ViewerSession session = new ViewerSession(new EdtViewerBridge(bridge));
 * </pre>
 */
public interface ViewerBridge {

    // =========================================================================
    // DATA
    // =========================================================================

    /**
     * Opens a new viewer showing the buffer.
     *
     * @param buffer the data, with its 5D extents
     * @return a handle to the new viewer
     */
    ViewerHandle startViewer(AdaptedBuffer buffer);

    /**
     * Replaces the data shown at an element and time index.
     *
     * @param viewer  the target viewer
     * @param element element index
     * @param time    time index
     * @param buffer  replacement data
     */
    void replaceData(ViewerHandle viewer, int element, int time, AdaptedBuffer buffer);

    /**
     * Appends one element to a viewer.
     *
     * @param viewer the target viewer
     * @param buffer a single element, shape (X, Y, Z, 1, T)
     * @return the handle of the viewer now holding the element
     */
    ViewerHandle addElement(ViewerHandle viewer, AdaptedBuffer buffer);

    /**
     * Appends one time point to a viewer.
     *
     * @param viewer the target viewer
     * @param buffer a single time point, shape (X, Y, Z, E, 1)
     * @return the handle of the viewer now holding the time point
     */
    ViewerHandle addTime(ViewerHandle viewer, AdaptedBuffer buffer);

    // =========================================================================
    // DISPLAY PROPERTIES
    // =========================================================================

    void setGamma(ViewerHandle viewer, int element, double gamma);

    /**
     * @param time time index, or -1 for the last time point
     */
    void setTime(ViewerHandle viewer, int time);

    /**
     * @param element element index, or -1 for the last element
     */
    void setElement(ViewerHandle viewer, int element);

    void setElementName(ViewerHandle viewer, int element, String name);

    void setElementsLinked(ViewerHandle viewer, boolean linked);

    void setTimesLinked(ViewerHandle viewer, boolean linked);

    void setTitle(ViewerHandle viewer, String title);

    void setDisplaySize(ViewerHandle viewer, int width, int height);

    int getNumElements(ViewerHandle viewer);

    int getNumTimes(ViewerHandle viewer);

    void setAxisScalesAndUnits(ViewerHandle viewer, int element, int time, AxisCalibration calibration);

    void setValueUnit(ViewerHandle viewer, int element, String unit);

    void setValueName(ViewerHandle viewer, int element, String name);

    void setFontSize(ViewerHandle viewer, int fontSize);

    void setMinMaxThresh(ViewerHandle viewer, int element, double min, double max);

    // =========================================================================
    // MARKERS
    // =========================================================================

    /**
     * @return one row of {@link MarkerRecord#FIELD_COUNT} values per marker
     */
    double[][] exportMarkerLists(ViewerHandle viewer);

    /**
     * @return the markers as tab-separated text with a header row
     */
    String exportMarkers(ViewerHandle viewer);

    void importMarkerLists(ViewerHandle viewer, float[][] markers);

    void deleteAllMarkerLists(ViewerHandle viewer);

    // =========================================================================
    // WINDOW AND KEYS
    // =========================================================================

    void toFront(ViewerHandle viewer);

    void hide(ViewerHandle viewer);

    void updatePanels(ViewerHandle viewer);

    void repaint(ViewerHandle viewer);

    void processKeyMainWindow(ViewerHandle viewer, char key);

    void processKeyElementWindow(ViewerHandle viewer, char key);

    /**
     * Get a human-readable name for this bridge.
     *
     * @return the bridge name, e.g. "Reflective"
     */
    default String getName() {
        return getClass().getSimpleName();
    }
}
