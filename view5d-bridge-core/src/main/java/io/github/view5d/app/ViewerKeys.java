package io.github.view5d.app;

/**
 * Key sequences understood by the viewer's panels.
 *
 * <p>Several keys toggle or cycle viewer state, so a sequence only means what
 * it means when sent in full and in order. The sequences follow the viewer's
 * key bindings and are kept verbatim.</p>
 */
public final class ViewerKeys {

    /**
     * Rescale the current element to its data range.
     */
    public static final String NORMALIZE_ELEMENT = "t";

    /**
     * Normalize the current element and force a refresh of the gray value image.
     */
    public static final String NORMALIZE_AND_REFRESH = "eE";

    /**
     * Cycle the color map twelve times, which lands on the cyclic map.
     */
    public static final String CYCLIC_COLORMAP = "cccccccccccc";

    /**
     * Nudge two display corrections; avoids dark pixels in the cyclic display.
     */
    public static final String DISPLAY_CORRECTION = "56";

    /**
     * Switch color overlay from additive to multiplicative.
     */
    public static final String MULTIPLICATIVE_OVERLAY = "vVe";

    /**
     * Back to multi-color mode.
     */
    public static final String MULTICOLOR = "C";

    private ViewerKeys() {
        // Constants only
    }
}
