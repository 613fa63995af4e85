package io.github.view5d.app;

/**
 * How data is handed to a viewer.
 */
public enum DisplayMode {

    /**
     * Open a fresh viewer window.
     */
    NEW("new"),

    /**
     * Overwrite the data of an existing viewer at a given element and time.
     */
    REPLACE("replace"),

    /**
     * Append each Element of the data as a new element of an existing viewer.
     */
    ADD_ELEMENT("add_element"),

    /**
     * Append each time point of the data to an existing viewer.
     */
    ADD_TIME("add_time");

    private final String token;

    DisplayMode(String token) {
        this.token = token;
    }

    /**
     * @return the textual token, e.g. {@code "add_element"}
     */
    public String getToken() {
        return token;
    }

    /**
     * @return true if this mode needs an existing viewer
     */
    public boolean requiresViewer() {
        return this != NEW;
    }

    /**
     * Parses a mode token.
     *
     * @param token one of {@code new}, {@code replace}, {@code add_element}, {@code add_time}
     * @return the mode
     * @throws IllegalArgumentException for any other token
     */
    public static DisplayMode fromToken(String token) {
        for (DisplayMode mode : values()) {
            if (mode.token.equals(token)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("unknown mode " + token
                + ", choose new, replace, add_element or add_time");
    }
}
