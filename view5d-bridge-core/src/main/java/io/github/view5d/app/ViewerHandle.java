package io.github.view5d.app;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Opaque reference to one running viewer instance.
 *
 * <p>Handles are created by a {@link ViewerBridge} and compared by identity.
 * The wrapped viewer object belongs to the bridge that created the handle;
 * nothing in this library frees the viewer's windows or memory.</p>
 */
public final class ViewerHandle {

    private static final AtomicInteger NEXT_ID = new AtomicInteger(1);

    private final int id;
    private final Object viewer;

    /**
     * Wraps a viewer object. Called by bridge implementations.
     *
     * @param viewer the bridge-specific viewer object
     */
    public ViewerHandle(Object viewer) {
        this.viewer = Objects.requireNonNull(viewer, "viewer must not be null");
        this.id = NEXT_ID.getAndIncrement();
    }

    /**
     * Returns the bridge-specific viewer object.
     *
     * @return the wrapped viewer, never null
     */
    public Object getViewer() {
        return viewer;
    }

    /**
     * @return a process-unique number, used in log messages
     */
    public int getId() {
        return id;
    }

    @Override
    public String toString() {
        return "ViewerHandle#" + id;
    }
}
