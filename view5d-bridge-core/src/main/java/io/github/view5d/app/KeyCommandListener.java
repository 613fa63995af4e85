package io.github.view5d.app;

/**
 * Listener notified after each key stroke a {@link CommandForwarder} has
 * delivered to a viewer.
 *
 * <p>Notifications arrive in delivery order on the thread that forwarded the
 * keys. They form the command log of a session.</p>
 */
@FunctionalInterface
public interface KeyCommandListener {

    /**
     * Called once the key has been processed and the panel refreshed.
     *
     * @param command the delivered key stroke, never null
     */
    void onKeyCommand(KeyCommand command);
}
