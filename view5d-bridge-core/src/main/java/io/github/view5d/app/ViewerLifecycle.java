package io.github.view5d.app;

import java.util.Objects;

/**
 * Opens viewers and feeds data into existing ones.
 *
 * <p>Appending is done one slice at a time. If the bridge fails part way
 * through a multi-element or multi-time append, the slices already appended
 * stay in the viewer.</p>
 *
 * <p>Shapes are not checked against the target viewer: replacing or
 * appending data whose extents differ from the viewer's is left to the
 * viewer.</p>
 */
public class ViewerLifecycle {

    private final ViewerBridge bridge;
    private final CommandForwarder forwarder;

    public ViewerLifecycle(ViewerBridge bridge, CommandForwarder forwarder) {
        this.bridge = Objects.requireNonNull(bridge, "bridge must not be null");
        this.forwarder = Objects.requireNonNull(forwarder, "forwarder must not be null");
    }

    /**
     * Opens a new viewer or mutates an existing one.
     *
     * @param existing the viewer to mutate; ignored for {@link DisplayMode#NEW}
     * @param buffer   the adapted data
     * @param mode     what to do with the data
     * @param element  target element for {@link DisplayMode#REPLACE}
     * @param time     target time for {@link DisplayMode#REPLACE}
     * @param name     element name to apply, or null to keep the viewer's names
     * @return the new viewer for {@code NEW}, otherwise the mutated viewer
     * @throws MissingViewerException if a mutating mode has no viewer to work on
     */
    public ViewerHandle openOrMutate(ViewerHandle existing, AdaptedBuffer buffer, DisplayMode mode,
                                     int element, int time, String name) {
        Objects.requireNonNull(buffer, "buffer must not be null");
        Objects.requireNonNull(mode, "mode must not be null");
        if (mode.requiresViewer() && existing == null) {
            throw new MissingViewerException("missing viewer for mode " + mode.getToken()
                    + "; open one with mode new first");
        }

        switch (mode) {
            case NEW:
                return open(buffer, name);
            case REPLACE:
                bridge.replaceData(existing, element, time, buffer);
                return existing;
            case ADD_ELEMENT:
                return appendElements(existing, buffer, name);
            case ADD_TIME:
                return appendTimes(existing, buffer, name);
            default:
                throw new IllegalArgumentException("unknown mode " + mode
                        + ", choose new, replace, add_element or add_time");
        }
    }

    /**
     * Variant taking the mode as a token, e.g. {@code "add_time"}.
     *
     * @throws IllegalArgumentException for an unknown mode token
     */
    public ViewerHandle openOrMutate(ViewerHandle existing, AdaptedBuffer buffer, String modeToken,
                                     int element, int time, String name) {
        return openOrMutate(existing, buffer, DisplayMode.fromToken(modeToken), element, time, name);
    }

    private ViewerHandle open(AdaptedBuffer buffer, String name) {
        ViewerHandle viewer = bridge.startViewer(buffer);
        if (name != null) {
            int elements = bridge.getNumElements(viewer);
            for (int e = 0; e < elements; e++) {
                bridge.setElementName(viewer, e, name);
                bridge.updatePanels(viewer);
            }
        }
        return viewer;
    }

    private ViewerHandle appendElements(ViewerHandle viewer, AdaptedBuffer buffer, String name) {
        int elements = buffer.size(AdaptedBuffer.ELEMENT);
        for (int e = 0; e < elements; e++) {
            viewer = bridge.addElement(viewer, buffer.elementSlice(e));
            moveToLastElement(viewer);
            forwarder.sendKeys(ViewerKeys.NORMALIZE_ELEMENT, viewer);
            if (name != null) {
                bridge.setElementName(viewer, bridge.getNumElements(viewer) - 1, name);
                bridge.updatePanels(viewer);
            }
        }
        return viewer;
    }

    private ViewerHandle appendTimes(ViewerHandle viewer, AdaptedBuffer buffer, String name) {
        int times = buffer.size(AdaptedBuffer.TIME);
        for (int t = 0; t < times; t++) {
            viewer = bridge.addTime(viewer, buffer.timeSlice(t));
            bridge.setTime(viewer, -1);
            bridge.updatePanels(viewer);
            bridge.repaint(viewer);
            // linked scaling may have changed, so every element is normalized again
            int elements = bridge.getNumElements(viewer);
            for (int e = 0; e < elements; e++) {
                bridge.setElement(viewer, e);
                bridge.updatePanels(viewer);
                bridge.repaint(viewer);
                forwarder.sendKeys(ViewerKeys.NORMALIZE_ELEMENT, viewer);
                if (name != null) {
                    bridge.setElementName(viewer, e, name);
                    bridge.updatePanels(viewer);
                }
            }
        }
        return viewer;
    }

    private void moveToLastElement(ViewerHandle viewer) {
        bridge.setElement(viewer, -1);
        bridge.updatePanels(viewer);
        bridge.repaint(viewer);
    }
}
