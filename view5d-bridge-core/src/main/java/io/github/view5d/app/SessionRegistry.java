package io.github.view5d.app;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Tracks the active viewer of a {@link ViewerSession} and the viewers it
 * replaced.
 *
 * <p>Setting a new active viewer pushes the previous one onto the history.
 * The history only grows; handles in it stay reachable for the lifetime of
 * the registry.</p>
 */
public final class SessionRegistry {

    private ViewerHandle active;
    private final List<ViewerHandle> history = new ArrayList<>();

    /**
     * @return the active viewer, if any
     */
    public synchronized Optional<ViewerHandle> getActive() {
        return Optional.ofNullable(active);
    }

    /**
     * Makes a viewer the active one.
     *
     * @param viewer the new active viewer
     */
    public synchronized void setActive(ViewerHandle viewer) {
        if (viewer == null) {
            throw new IllegalArgumentException("viewer must not be null");
        }
        if (active != null) {
            history.add(active);
        }
        active = viewer;
    }

    /**
     * Resolves an optional explicit handle against the active viewer.
     *
     * @param explicit a handle supplied by the caller, or null
     * @return {@code explicit} if given, otherwise the active viewer
     */
    public synchronized Optional<ViewerHandle> getOr(ViewerHandle explicit) {
        return explicit != null ? Optional.of(explicit) : Optional.ofNullable(active);
    }

    /**
     * @return previously active viewers, most recent last
     */
    public synchronized List<ViewerHandle> getHistory() {
        return Collections.unmodifiableList(new ArrayList<>(history));
    }
}
