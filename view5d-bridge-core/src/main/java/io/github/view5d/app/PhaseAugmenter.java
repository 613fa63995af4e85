package io.github.view5d.app;

import java.util.Objects;

/**
 * Appends phase channels for complex data.
 *
 * <p>For every element of a complex array, the phase angle is appended to the
 * viewer as a new element, labelled in degrees, and shown with the viewer's
 * cyclic color map multiplied onto the magnitude display. The display setup
 * is driven entirely through key strokes ({@link ViewerKeys}) and depends on
 * the viewer's key bindings.</p>
 */
public class PhaseAugmenter {

    static final double PHASE_MIN = 0.0;
    static final double PHASE_MAX = 360.0;

    private final ViewerBridge bridge;
    private final ViewerLifecycle lifecycle;
    private final CommandForwarder forwarder;

    public PhaseAugmenter(ViewerBridge bridge, ViewerLifecycle lifecycle, CommandForwarder forwarder) {
        this.bridge = Objects.requireNonNull(bridge, "bridge must not be null");
        this.lifecycle = Objects.requireNonNull(lifecycle, "lifecycle must not be null");
        this.forwarder = Objects.requireNonNull(forwarder, "forwarder must not be null");
    }

    /**
     * Maps the angle of a complex number from (-&pi;, &pi;] to [0, 360) degrees.
     *
     * @param real      real part
     * @param imaginary imaginary part
     * @return {@code 180 * (angle + pi) / pi}
     */
    public static double phaseDegrees(double real, double imaginary) {
        return 180.0 * (Math.atan2(imaginary, real) + Math.PI) / Math.PI;
    }

    /**
     * Computes the phase, in degrees, of one element of a complex array.
     *
     * @param data    complex source
     * @param element element index
     * @return float phases of shape (X, Y, Z, 1, T)
     */
    static NDArray phaseOfElement(NDArray data, int element) {
        int[] shape = TypeAdapter.padShape(data.getShape());
        int volume = shape[AdaptedBuffer.X] * shape[AdaptedBuffer.Y] * shape[AdaptedBuffer.Z];
        int elements = shape[AdaptedBuffer.ELEMENT];
        int times = shape[AdaptedBuffer.TIME];
        float[] phases = new float[volume * times];
        for (int t = 0; t < times; t++) {
            int source = (t * elements + element) * volume;
            for (int v = 0; v < volume; v++) {
                phases[t * volume + v] = (float) phaseDegrees(data.real(source + v), data.imag(source + v));
            }
        }
        return NDArray.ofFloats(phases, shape[0], shape[1], shape[2], 1, times);
    }

    /**
     * Appends one phase element per element of {@code data}.
     *
     * @param data         complex source data
     * @param startElement index the first phase element will get in the viewer
     * @param viewer       the viewer to extend
     * @param name         base name; phase elements are called {@code <name>_phase}
     * @return the viewer holding the phase elements
     * @throws IllegalArgumentException if {@code data} is not complex
     */
    public ViewerHandle addPhase(NDArray data, int startElement, ViewerHandle viewer, String name) {
        Objects.requireNonNull(data, "data must not be null");
        Objects.requireNonNull(viewer, "viewer must not be null");
        if (!data.isComplex()) {
            throw new IllegalArgumentException("Phase channels need complex data, got " + data.getKind());
        }
        String valueName = name != null ? name + "_phase" : "phase";
        int elements = data.size(AdaptedBuffer.ELEMENT);

        bridge.setTime(viewer, -1);
        bridge.updatePanels(viewer);
        bridge.repaint(viewer);

        for (int e = 0; e < elements; e++) {
            int target = startElement + e;
            AdaptedBuffer phases = TypeAdapter.adapt(phaseOfElement(data, e));
            viewer = lifecycle.openOrMutate(viewer, phases, DisplayMode.ADD_ELEMENT, target, 0, name);
            bridge.setGamma(viewer, bridge.getNumElements(viewer) - 1, 1.0);
            bridge.updatePanels(viewer);

            bridge.setValueName(viewer, target, valueName);
            bridge.updatePanels(viewer);
            bridge.repaint(viewer);
            bridge.setValueUnit(viewer, target, "deg");
            bridge.repaint(viewer);
            bridge.setMinMaxThresh(viewer, target, PHASE_MIN, PHASE_MAX);
            bridge.updatePanels(viewer);
            bridge.repaint(viewer);

            bridge.setElement(viewer, -1);
            bridge.updatePanels(viewer);
            bridge.repaint(viewer);
            forwarder.sendKeys(ViewerKeys.CYCLIC_COLORMAP, viewer);
            forwarder.sendKeys(ViewerKeys.DISPLAY_CORRECTION, viewer);
            forwarder.sendKeys(ViewerKeys.MULTIPLICATIVE_OVERLAY, viewer);
        }
        if (elements == 1) {
            forwarder.sendKeys(ViewerKeys.MULTICOLOR, viewer);
        }
        return viewer;
    }
}
