package io.github.view5d.app;

import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Sends key strokes to a viewer panel, one at a time.
 *
 * <p>Each key is processed, then the viewer's panels are updated and
 * repainted before the next key is sent. Keys are never batched: some of them
 * are toggles and the viewer state after a sequence depends on its exact
 * order.</p>
 */
public class CommandForwarder {

    private final ViewerBridge bridge;
    private final CopyOnWriteArrayList<KeyCommandListener> listeners = new CopyOnWriteArrayList<>();

    public CommandForwarder(ViewerBridge bridge) {
        this.bridge = Objects.requireNonNull(bridge, "bridge must not be null");
    }

    /**
     * Forwards a key sequence to the main panel.
     *
     * @param keys   the keys, sent in order
     * @param viewer the target viewer
     */
    public void sendKeys(CharSequence keys, ViewerHandle viewer) {
        sendKeys(keys, viewer, Panel.MAIN);
    }

    /**
     * Forwards a key sequence to a panel.
     *
     * @param keys   the keys, sent in order
     * @param viewer the target viewer
     * @param panel  the receiving panel
     */
    public void sendKeys(CharSequence keys, ViewerHandle viewer, Panel panel) {
        Objects.requireNonNull(keys, "keys must not be null");
        Objects.requireNonNull(viewer, "viewer must not be null");
        Objects.requireNonNull(panel, "panel must not be null");
        for (int i = 0; i < keys.length(); i++) {
            char key = keys.charAt(i);
            switch (panel) {
                case MAIN:
                    bridge.processKeyMainWindow(viewer, key);
                    break;
                case ELEMENT:
                    bridge.processKeyElementWindow(viewer, key);
                    break;
                default:
                    throw new IllegalArgumentException("unsupported mode " + panel);
            }
            bridge.updatePanels(viewer);
            bridge.repaint(viewer);
            fireKeyCommand(new KeyCommand(viewer, panel, key));
        }
    }

    /**
     * Forwards a key sequence to the panel named by a token.
     *
     * @param keys       the keys, sent in order
     * @param viewer     the target viewer
     * @param panelToken {@code main} or {@code element}
     * @throws IllegalArgumentException for an unknown panel token
     */
    public void sendKeys(CharSequence keys, ViewerHandle viewer, String panelToken) {
        sendKeys(keys, viewer, Panel.fromToken(panelToken));
    }

    public void addKeyCommandListener(KeyCommandListener listener) {
        if (listener != null) {
            listeners.add(listener);
        }
    }

    public void removeKeyCommandListener(KeyCommandListener listener) {
        listeners.remove(listener);
    }

    private void fireKeyCommand(KeyCommand command) {
        for (KeyCommandListener listener : listeners) {
            try {
                listener.onKeyCommand(command);
            } catch (Exception e) {
                log("Error in key command listener: " + e.getMessage());
            }
        }
    }

    private static void log(String message) {
        System.err.println("View5D: " + message);
    }
}
