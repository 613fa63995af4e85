package io.github.view5d.app;

/**
 * Viewer panel that receives forwarded key strokes.
 */
public enum Panel {
    MAIN("main"),
    ELEMENT("element");

    private final String token;

    Panel(String token) {
        this.token = token;
    }

    public String getToken() {
        return token;
    }

    /**
     * Parses a panel token.
     *
     * @param token {@code main} or {@code element}
     * @return the panel
     * @throws IllegalArgumentException for any other token
     */
    public static Panel fromToken(String token) {
        for (Panel panel : values()) {
            if (panel.token.equals(token)) {
                return panel;
            }
        }
        throw new IllegalArgumentException("unsupported mode " + token + ". Use `main` or `element`");
    }
}
