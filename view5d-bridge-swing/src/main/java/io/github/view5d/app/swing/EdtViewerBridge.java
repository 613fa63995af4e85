package io.github.view5d.app.swing;

import io.github.view5d.app.AdaptedBuffer;
import io.github.view5d.app.AxisCalibration;
import io.github.view5d.app.ViewerBridge;
import io.github.view5d.app.ViewerBridgeException;
import io.github.view5d.app.ViewerHandle;

import javax.swing.SwingUtilities;
import java.lang.reflect.InvocationTargetException;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs every call of a {@link ViewerBridge} on the Swing Event Dispatch Thread.
 *
 * <p>The viewer is an AWT component, so its methods must not be called from
 * arbitrary threads. Calls from the EDT run immediately; calls from other
 * threads block until the EDT has run them, so call order and return values
 * are preserved.</p>
 *
 * <h2>Usage</h2>
 * <pre>
 * ViewerSession session = new ViewerSession(
 *         new EdtViewerBridge(ReflectiveViewerBridge.fromSystemProperties()));
 * </pre>
 */
public class EdtViewerBridge implements ViewerBridge {

    private final ViewerBridge delegate;

    /**
     * @param delegate the bridge doing the actual work
     */
    public EdtViewerBridge(ViewerBridge delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
    }

    public ViewerBridge getDelegate() {
        return delegate;
    }

    @Override
    public ViewerHandle startViewer(AdaptedBuffer buffer) {
        return onEdt(() -> delegate.startViewer(buffer));
    }

    @Override
    public void replaceData(ViewerHandle viewer, int element, int time, AdaptedBuffer buffer) {
        runOnEdt(() -> delegate.replaceData(viewer, element, time, buffer));
    }

    @Override
    public ViewerHandle addElement(ViewerHandle viewer, AdaptedBuffer buffer) {
        return onEdt(() -> delegate.addElement(viewer, buffer));
    }

    @Override
    public ViewerHandle addTime(ViewerHandle viewer, AdaptedBuffer buffer) {
        return onEdt(() -> delegate.addTime(viewer, buffer));
    }

    @Override
    public void setGamma(ViewerHandle viewer, int element, double gamma) {
        runOnEdt(() -> delegate.setGamma(viewer, element, gamma));
    }

    @Override
    public void setTime(ViewerHandle viewer, int time) {
        runOnEdt(() -> delegate.setTime(viewer, time));
    }

    @Override
    public void setElement(ViewerHandle viewer, int element) {
        runOnEdt(() -> delegate.setElement(viewer, element));
    }

    @Override
    public void setElementName(ViewerHandle viewer, int element, String name) {
        runOnEdt(() -> delegate.setElementName(viewer, element, name));
    }

    @Override
    public void setElementsLinked(ViewerHandle viewer, boolean linked) {
        runOnEdt(() -> delegate.setElementsLinked(viewer, linked));
    }

    @Override
    public void setTimesLinked(ViewerHandle viewer, boolean linked) {
        runOnEdt(() -> delegate.setTimesLinked(viewer, linked));
    }

    @Override
    public void setTitle(ViewerHandle viewer, String title) {
        runOnEdt(() -> delegate.setTitle(viewer, title));
    }

    @Override
    public void setDisplaySize(ViewerHandle viewer, int width, int height) {
        runOnEdt(() -> delegate.setDisplaySize(viewer, width, height));
    }

    @Override
    public int getNumElements(ViewerHandle viewer) {
        return onEdt(() -> delegate.getNumElements(viewer));
    }

    @Override
    public int getNumTimes(ViewerHandle viewer) {
        return onEdt(() -> delegate.getNumTimes(viewer));
    }

    @Override
    public void setAxisScalesAndUnits(ViewerHandle viewer, int element, int time, AxisCalibration calibration) {
        runOnEdt(() -> delegate.setAxisScalesAndUnits(viewer, element, time, calibration));
    }

    @Override
    public void setValueUnit(ViewerHandle viewer, int element, String unit) {
        runOnEdt(() -> delegate.setValueUnit(viewer, element, unit));
    }

    @Override
    public void setValueName(ViewerHandle viewer, int element, String name) {
        runOnEdt(() -> delegate.setValueName(viewer, element, name));
    }

    @Override
    public void setFontSize(ViewerHandle viewer, int fontSize) {
        runOnEdt(() -> delegate.setFontSize(viewer, fontSize));
    }

    @Override
    public void setMinMaxThresh(ViewerHandle viewer, int element, double min, double max) {
        runOnEdt(() -> delegate.setMinMaxThresh(viewer, element, min, max));
    }

    @Override
    public double[][] exportMarkerLists(ViewerHandle viewer) {
        return onEdt(() -> delegate.exportMarkerLists(viewer));
    }

    @Override
    public String exportMarkers(ViewerHandle viewer) {
        return onEdt(() -> delegate.exportMarkers(viewer));
    }

    @Override
    public void importMarkerLists(ViewerHandle viewer, float[][] markers) {
        runOnEdt(() -> delegate.importMarkerLists(viewer, markers));
    }

    @Override
    public void deleteAllMarkerLists(ViewerHandle viewer) {
        runOnEdt(() -> delegate.deleteAllMarkerLists(viewer));
    }

    @Override
    public void toFront(ViewerHandle viewer) {
        runOnEdt(() -> delegate.toFront(viewer));
    }

    @Override
    public void hide(ViewerHandle viewer) {
        runOnEdt(() -> delegate.hide(viewer));
    }

    @Override
    public void updatePanels(ViewerHandle viewer) {
        runOnEdt(() -> delegate.updatePanels(viewer));
    }

    @Override
    public void repaint(ViewerHandle viewer) {
        runOnEdt(() -> delegate.repaint(viewer));
    }

    @Override
    public void processKeyMainWindow(ViewerHandle viewer, char key) {
        runOnEdt(() -> delegate.processKeyMainWindow(viewer, key));
    }

    @Override
    public void processKeyElementWindow(ViewerHandle viewer, char key) {
        runOnEdt(() -> delegate.processKeyElementWindow(viewer, key));
    }

    @Override
    public String getName() {
        return "EDT(" + delegate.getName() + ")";
    }

    // =========================================================================
    // DISPATCH
    // =========================================================================

    private void runOnEdt(Runnable runnable) {
        onEdt(() -> {
            runnable.run();
            return null;
        });
    }

    /**
     * Runs a call on the EDT and waits for its result.
     * If already on the EDT, runs immediately.
     */
    private static <T> T onEdt(Callable<T> call) {
        if (SwingUtilities.isEventDispatchThread()) {
            return invoke(call);
        }
        AtomicReference<T> result = new AtomicReference<>();
        try {
            SwingUtilities.invokeAndWait(() -> result.set(invoke(call)));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ViewerBridgeException("Interrupted while waiting for the event dispatch thread", e);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new ViewerBridgeException("Viewer call failed on the event dispatch thread", cause);
        }
        return result.get();
    }

    private static <T> T invoke(Callable<T> call) {
        try {
            return call.call();
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new ViewerBridgeException("Viewer call failed", e);
        }
    }
}
