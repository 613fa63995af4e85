package io.github.view5d.app;

import java.util.Objects;

/**
 * One key stroke forwarded to a viewer panel.
 */
public final class KeyCommand {

    private final ViewerHandle viewer;
    private final Panel panel;
    private final char key;

    public KeyCommand(ViewerHandle viewer, Panel panel, char key) {
        this.viewer = Objects.requireNonNull(viewer, "viewer must not be null");
        this.panel = Objects.requireNonNull(panel, "panel must not be null");
        this.key = key;
    }

    public ViewerHandle getViewer() {
        return viewer;
    }

    public Panel getPanel() {
        return panel;
    }

    public char getKey() {
        return key;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof KeyCommand)) {
            return false;
        }
        KeyCommand other = (KeyCommand) o;
        return viewer == other.viewer && panel == other.panel && key == other.key;
    }

    @Override
    public int hashCode() {
        return Objects.hash(System.identityHashCode(viewer), panel, key);
    }

    @Override
    public String toString() {
        return viewer + ":" + panel.getToken() + ":'" + key + "'";
    }
}
