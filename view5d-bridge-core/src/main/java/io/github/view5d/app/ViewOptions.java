package io.github.view5d.app;

import java.util.Objects;

/**
 * Display options for {@link ViewerSession#view(NDArray, ViewerHandle, ViewOptions)}.
 *
 * <pre>{@code
 * session.view(data, null, new ViewOptions()
 *         .withGamma(0.5)
 *         .withName("psf")
 *         .withTitle("Point spread function"));
 * }</pre>
 */
public class ViewOptions {

    private Double gamma;
    private DisplayMode mode = DisplayMode.NEW;
    private int element;
    private int time;
    private boolean showPhase;
    private boolean keepZero;
    private String name;
    private String title;
    private boolean elementsLinked;
    private boolean timesLinked;

    /**
     * Gamma applied to the last element after display. Complex data defaults
     * to 0.3 when no gamma is set.
     *
     * @param gamma the gamma value
     * @return these options for chaining
     */
    public ViewOptions withGamma(double gamma) {
        this.gamma = gamma;
        return this;
    }

    public ViewOptions withMode(DisplayMode mode) {
        this.mode = Objects.requireNonNull(mode, "mode must not be null");
        return this;
    }

    /**
     * @param modeToken {@code new}, {@code replace}, {@code add_element} or {@code add_time}
     * @return these options for chaining
     * @throws IllegalArgumentException for an unknown token
     */
    public ViewOptions withMode(String modeToken) {
        this.mode = DisplayMode.fromToken(modeToken);
        return this;
    }

    /**
     * Element to replace in {@link DisplayMode#REPLACE} mode.
     */
    public ViewOptions withElement(int element) {
        this.element = element;
        return this;
    }

    /**
     * Time point to replace in {@link DisplayMode#REPLACE} mode.
     */
    public ViewOptions withTime(int time) {
        this.time = time;
        return this;
    }

    /**
     * For complex data, also append phase channels.
     */
    public ViewOptions withShowPhase(boolean showPhase) {
        this.showPhase = showPhase;
        return this;
    }

    /**
     * Pin the lower display threshold of the last element to zero.
     */
    public ViewOptions withKeepZero(boolean keepZero) {
        this.keepZero = keepZero;
        return this;
    }

    public ViewOptions withName(String name) {
        this.name = name;
        return this;
    }

    public ViewOptions withTitle(String title) {
        this.title = title;
        return this;
    }

    /**
     * Used by {@link ViewerSession#addElement}: share one intensity scaling
     * across elements.
     */
    public ViewOptions withElementsLinked(boolean elementsLinked) {
        this.elementsLinked = elementsLinked;
        return this;
    }

    /**
     * Used by {@link ViewerSession#addTime}: share one intensity scaling
     * across time points.
     */
    public ViewOptions withTimesLinked(boolean timesLinked) {
        this.timesLinked = timesLinked;
        return this;
    }

    /**
     * @return the gamma, or null if none was set
     */
    public Double getGamma() {
        return gamma;
    }

    public DisplayMode getMode() {
        return mode;
    }

    public int getElement() {
        return element;
    }

    public int getTime() {
        return time;
    }

    public boolean isShowPhase() {
        return showPhase;
    }

    public boolean isKeepZero() {
        return keepZero;
    }

    public String getName() {
        return name;
    }

    public String getTitle() {
        return title;
    }

    public boolean isElementsLinked() {
        return elementsLinked;
    }

    public boolean isTimesLinked() {
        return timesLinked;
    }

    ViewOptions copy() {
        ViewOptions copy = new ViewOptions();
        copy.gamma = gamma;
        copy.mode = mode;
        copy.element = element;
        copy.time = time;
        copy.showPhase = showPhase;
        copy.keepZero = keepZero;
        copy.name = name;
        copy.title = title;
        copy.elementsLinked = elementsLinked;
        copy.timesLinked = timesLinked;
        return copy;
    }
}
