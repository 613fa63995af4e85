package io.github.view5d.app;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Entry point for showing arrays in View5D viewers and controlling them.
 *
 * <p>A session owns the state that ties calls together: the active viewer
 * (the one most recently shown into) and the history of viewers it replaced.
 * Every method that takes a {@link ViewerHandle} accepts {@code null} to mean
 * the active viewer; the overloads without a handle do the same.</p>
 *
 * <h2>Example Usage</h2>
 * <pre>{@code
 * ViewerSession session = new ViewerSession(ReflectiveViewerBridge.fromSystemProperties());
 *
 * // open a viewer
 * ViewerHandle viewer = session.view(NDArray.ofFloats(voxels, 64, 64, 16));
 *
 * // append a second channel to the same viewer and adjust its display
 * session.addElement(NDArray.ofFloats(other, 64, 64, 16), null,
 *         new ViewOptions().withName("GFP"));
 * session.setGamma(0.7, 1, viewer);
 * session.sendKeys("c", viewer, Panel.MAIN);
 * }</pre>
 *
 * <p>Sessions are not meant to be shared between threads. Viewer windows
 * opened by a session are not closed when the session is discarded.</p>
 */
public class ViewerSession {

    static final double DEFAULT_COMPLEX_GAMMA = 0.3;

    private final ViewerBridge bridge;
    private final SessionRegistry registry = new SessionRegistry();
    private final CommandForwarder forwarder;
    private final ViewerLifecycle lifecycle;
    private final PhaseAugmenter phaseAugmenter;

    /**
     * Creates a session talking to viewers through the given bridge.
     *
     * @param bridge the viewer bridge
     */
    public ViewerSession(ViewerBridge bridge) {
        this.bridge = Objects.requireNonNull(bridge, "bridge must not be null");
        this.forwarder = new CommandForwarder(bridge);
        this.lifecycle = new ViewerLifecycle(bridge, forwarder);
        this.phaseAugmenter = new PhaseAugmenter(bridge, lifecycle, forwarder);
    }

    public ViewerBridge getBridge() {
        return bridge;
    }

    public SessionRegistry getRegistry() {
        return registry;
    }

    public CommandForwarder getCommandForwarder() {
        return forwarder;
    }

    /**
     * @return the active viewer, if any
     */
    public Optional<ViewerHandle> getActiveViewer() {
        return registry.getActive();
    }

    // =========================================================================
    // SHOWING DATA
    // =========================================================================

    /**
     * Shows an array in a new viewer with default options.
     *
     * @param data the array
     * @return the new viewer, now active
     */
    public ViewerHandle view(NDArray data) {
        return view(data, null, new ViewOptions());
    }

    /**
     * Shows an array in a viewer.
     *
     * <p>The data is adapted, then a viewer is opened or mutated according to
     * the options' mode. Complex data gets display thresholds [0, max
     * magnitude] and a default gamma of 0.3. The resulting viewer becomes the
     * active one, and its panels are normalized and brought to the front.</p>
     *
     * @param data    the array
     * @param viewer  viewer to mutate, or null for the active one; ignored in
     *                {@link DisplayMode#NEW} mode
     * @param options display options
     * @return the viewer now showing the data
     * @throws UnsupportedElementKindException if the element kind cannot be shown
     * @throws MissingViewerException          if a mutating mode finds no viewer
     */
    public ViewerHandle view(NDArray data, ViewerHandle viewer, ViewOptions options) {
        Objects.requireNonNull(data, "data must not be null");
        Objects.requireNonNull(options, "options must not be null");
        DisplayMode mode = options.getMode();
        AdaptedBuffer buffer = TypeAdapter.adapt(data);

        ViewerHandle existing = mode.requiresViewer() ? registry.getOr(viewer).orElse(null) : null;
        ViewerHandle handle = lifecycle.openOrMutate(existing, buffer, mode,
                options.getElement(), options.getTime(), options.getName());

        Double gamma = options.getGamma();
        if (buffer.isComplex()) {
            setMinMaxThresh(0.0, buffer.maxAbs(), lastElement(handle), handle);
            if (gamma == null) {
                gamma = DEFAULT_COMPLEX_GAMMA;
            }
        }
        registry.setActive(handle);

        if (gamma != null) {
            setGamma(gamma, lastElement(handle), handle);
        }
        if (options.isKeepZero()) {
            setMinMaxThresh(0.0, data.maxAbs(), lastElement(handle), handle);
        }
        if (options.getTitle() != null) {
            setTitle(options.getTitle(), handle);
        }
        if (options.isShowPhase() && data.isComplex()) {
            // phase elements go after everything the viewer holds now
            handle = phaseAugmenter.addPhase(data, bridge.getNumElements(handle), handle, options.getName());
        }

        bridge.updatePanels(handle);
        forwarder.sendKeys(ViewerKeys.NORMALIZE_AND_REFRESH, handle);
        bridge.toFront(handle);
        return handle;
    }

    /**
     * Like {@link #view(NDArray, ViewerHandle, ViewOptions)} with phase
     * channels switched on for complex data.
     */
    public ViewerHandle viewWithPhase(NDArray data, ViewerHandle viewer, ViewOptions options) {
        return view(data, viewer, options.copy().withShowPhase(true));
    }

    /**
     * Appends the array's elements to a viewer, or opens a new viewer if
     * there is none. Element linking from the options is applied first.
     *
     * @param data    the array
     * @param viewer  target viewer, or null for the active one
     * @param options display options; the mode is ignored
     * @return the viewer showing the data
     */
    public ViewerHandle addElement(NDArray data, ViewerHandle viewer, ViewOptions options) {
        Optional<ViewerHandle> target = registry.getOr(viewer);
        if (target.isPresent()) {
            setElementsLinked(options.isElementsLinked(), target.get());
            return view(data, target.get(), options.copy().withMode(DisplayMode.ADD_ELEMENT));
        }
        return view(data, null, options.copy().withMode(DisplayMode.NEW));
    }

    public ViewerHandle addElement(NDArray data) {
        return addElement(data, null, new ViewOptions());
    }

    /**
     * Like {@link #addElement(NDArray, ViewerHandle, ViewOptions)} with phase
     * channels switched on for complex data.
     */
    public ViewerHandle addElementWithPhase(NDArray data, ViewerHandle viewer, ViewOptions options) {
        return addElement(data, viewer, options.copy().withShowPhase(true));
    }

    /**
     * Appends the array's time points to a viewer, or opens a new viewer if
     * there is none. Time linking from the options is applied first.
     *
     * @param data    the array
     * @param viewer  target viewer, or null for the active one
     * @param options display options; the mode is ignored
     * @return the viewer showing the data
     */
    public ViewerHandle addTime(NDArray data, ViewerHandle viewer, ViewOptions options) {
        Optional<ViewerHandle> target = registry.getOr(viewer);
        if (target.isPresent()) {
            setTimesLinked(options.isTimesLinked(), target.get());
            return view(data, target.get(), options.copy().withMode(DisplayMode.ADD_TIME));
        }
        return view(data, null, options.copy().withMode(DisplayMode.NEW));
    }

    public ViewerHandle addTime(NDArray data) {
        return addTime(data, null, new ViewOptions());
    }

    // =========================================================================
    // DISPLAY PROPERTIES
    // =========================================================================

    public void setGamma(double gamma) {
        setGamma(gamma, 0, null);
    }

    public void setGamma(double gamma, int element, ViewerHandle viewer) {
        ViewerHandle v = requireViewer(viewer);
        bridge.setGamma(v, element, gamma);
        bridge.updatePanels(v);
    }

    /**
     * @param time time index, -1 for the last
     */
    public void setTime(int time) {
        setTime(time, null);
    }

    public void setTime(int time, ViewerHandle viewer) {
        ViewerHandle v = requireViewer(viewer);
        bridge.setTime(v, time);
        refresh(v);
    }

    /**
     * @param element element index, -1 for the last
     */
    public void setElement(int element) {
        setElement(element, null);
    }

    public void setElement(int element, ViewerHandle viewer) {
        ViewerHandle v = requireViewer(viewer);
        bridge.setElement(v, element);
        refresh(v);
    }

    public void setElementName(int element, String name) {
        setElementName(element, name, null);
    }

    public void setElementName(int element, String name, ViewerHandle viewer) {
        ViewerHandle v = requireViewer(viewer);
        bridge.setElementName(v, element, Objects.requireNonNull(name, "name must not be null"));
        bridge.updatePanels(v);
    }

    public void setElementsLinked(boolean linked) {
        setElementsLinked(linked, null);
    }

    public void setElementsLinked(boolean linked, ViewerHandle viewer) {
        ViewerHandle v = requireViewer(viewer);
        bridge.setElementsLinked(v, linked);
        bridge.updatePanels(v);
    }

    public void setTimesLinked(boolean linked) {
        setTimesLinked(linked, null);
    }

    public void setTimesLinked(boolean linked, ViewerHandle viewer) {
        ViewerHandle v = requireViewer(viewer);
        bridge.setTimesLinked(v, linked);
        bridge.updatePanels(v);
    }

    public void setTitle(String title) {
        setTitle(title, null);
    }

    public void setTitle(String title, ViewerHandle viewer) {
        ViewerHandle v = requireViewer(viewer);
        bridge.setTitle(v, Objects.requireNonNull(title, "title must not be null"));
        bridge.updatePanels(v);
    }

    public void setDisplaySize(int width, int height) {
        setDisplaySize(width, height, null);
    }

    public void setDisplaySize(int width, int height, ViewerHandle viewer) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Display size must be positive: " + width + "x" + height);
        }
        bridge.setDisplaySize(requireViewer(viewer), width, height);
    }

    public int getNumElements() {
        return getNumElements(null);
    }

    public int getNumElements(ViewerHandle viewer) {
        return bridge.getNumElements(requireViewer(viewer));
    }

    public int getNumTimes() {
        return getNumTimes(null);
    }

    public int getNumTimes(ViewerHandle viewer) {
        return bridge.getNumTimes(requireViewer(viewer));
    }

    /**
     * Applies axis scales, names and units, for all elements and times.
     *
     * @param calibration the calibration
     */
    public void setAxisScalesAndUnits(AxisCalibration calibration) {
        setAxisScalesAndUnits(calibration, 0, 0, null);
    }

    public void setAxisScalesAndUnits(AxisCalibration calibration, int element, int time, ViewerHandle viewer) {
        ViewerHandle v = requireViewer(viewer);
        bridge.setAxisScalesAndUnits(v, element, time,
                Objects.requireNonNull(calibration, "calibration must not be null"));
        refresh(v);
    }

    public void setValueUnit(String unit) {
        setValueUnit(unit, 0, null);
    }

    public void setValueUnit(String unit, int element, ViewerHandle viewer) {
        ViewerHandle v = requireViewer(viewer);
        bridge.setValueUnit(v, element, Objects.requireNonNull(unit, "unit must not be null"));
        bridge.repaint(v);
    }

    public void setValueName(String name) {
        setValueName(name, 0, null);
    }

    public void setValueName(String name, int element, ViewerHandle viewer) {
        ViewerHandle v = requireViewer(viewer);
        bridge.setValueName(v, element, Objects.requireNonNull(name, "name must not be null"));
        refresh(v);
    }

    public void setFontSize(int fontSize) {
        setFontSize(fontSize, null);
    }

    public void setFontSize(int fontSize, ViewerHandle viewer) {
        bridge.setFontSize(requireViewer(viewer), fontSize);
    }

    /**
     * Sets the display thresholds of an element of the active viewer.
     *
     * @param min lower threshold
     * @param max upper threshold
     */
    public void setMinMaxThresh(double min, double max) {
        setMinMaxThresh(min, max, 0, null);
    }

    public void setMinMaxThresh(double min, double max, int element, ViewerHandle viewer) {
        ViewerHandle v = requireViewer(viewer);
        bridge.setMinMaxThresh(v, element, min, max);
        refresh(v);
    }

    // =========================================================================
    // MARKERS
    // =========================================================================

    public List<MarkerRecord> exportMarkerLists() {
        return exportMarkerLists(null);
    }

    /**
     * Reads all markers of a viewer.
     *
     * @param viewer the viewer, or null for the active one
     * @return one record per marker
     */
    public List<MarkerRecord> exportMarkerLists(ViewerHandle viewer) {
        double[][] rows = bridge.exportMarkerLists(requireViewer(viewer));
        List<MarkerRecord> records = new ArrayList<>();
        if (rows != null) {
            for (double[] row : rows) {
                records.add(new MarkerRecord(row));
            }
        }
        return records;
    }

    public String exportMarkersText() {
        return exportMarkersText(null);
    }

    /**
     * Reads all markers of a viewer as tab-separated text, parseable with
     * {@link MarkerTable#parse(String)}.
     *
     * @param viewer the viewer, or null for the active one
     * @return header row followed by one row per marker
     */
    public String exportMarkersText(ViewerHandle viewer) {
        return bridge.exportMarkers(requireViewer(viewer));
    }

    public void importMarkerLists(List<MarkerRecord> markers) {
        importMarkerLists(markers, null);
    }

    /**
     * Adds markers to a viewer. Values are narrowed to single precision.
     *
     * @param markers the markers
     * @param viewer  the viewer, or null for the active one
     */
    public void importMarkerLists(List<MarkerRecord> markers, ViewerHandle viewer) {
        Objects.requireNonNull(markers, "markers must not be null");
        ViewerHandle v = requireViewer(viewer);
        float[][] rows = new float[markers.size()][];
        for (int i = 0; i < rows.length; i++) {
            rows[i] = markers.get(i).toFloatArray();
        }
        bridge.importMarkerLists(v, rows);
        bridge.updatePanels(v);
    }

    public void deleteAllMarkerLists() {
        deleteAllMarkerLists(null);
    }

    public void deleteAllMarkerLists(ViewerHandle viewer) {
        ViewerHandle v = requireViewer(viewer);
        bridge.deleteAllMarkerLists(v);
        bridge.updatePanels(v);
    }

    // =========================================================================
    // WINDOW AND KEYS
    // =========================================================================

    public void toFront(ViewerHandle viewer) {
        bridge.toFront(requireViewer(viewer));
    }

    public void hide(ViewerHandle viewer) {
        bridge.hide(requireViewer(viewer));
    }

    public void updatePanels(ViewerHandle viewer) {
        bridge.updatePanels(requireViewer(viewer));
    }

    public void repaint(ViewerHandle viewer) {
        bridge.repaint(requireViewer(viewer));
    }

    /**
     * Sends keys to the main panel of the active viewer.
     *
     * @param keys the keys, in order
     */
    public void sendKeys(CharSequence keys) {
        sendKeys(keys, null, Panel.MAIN);
    }

    public void sendKeys(CharSequence keys, ViewerHandle viewer, Panel panel) {
        forwarder.sendKeys(keys, requireViewer(viewer), panel);
    }

    // =========================================================================
    // INTERNALS
    // =========================================================================

    private ViewerHandle requireViewer(ViewerHandle viewer) {
        return registry.getOr(viewer).orElseThrow(() ->
                new MissingViewerException("No viewer given and no active viewer in this session"));
    }

    private int lastElement(ViewerHandle viewer) {
        return bridge.getNumElements(viewer) - 1;
    }

    private void refresh(ViewerHandle viewer) {
        bridge.updatePanels(viewer);
        bridge.repaint(viewer);
    }
}
