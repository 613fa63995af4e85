package io.github.view5d.app;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link ViewerBridge} that calls the View5D viewer class by reflection.
 *
 * <p>The viewer is never a compile-time dependency. Its class is supplied
 * directly or located through {@link ViewerLocator}, and each bridge method
 * looks up the matching public viewer method by name and parameter types.
 * Data entry points come in two flavours: the plain one, overloaded on the
 * primitive array type, and a {@code C}-suffixed one taking interleaved
 * complex floats.</p>
 *
 * <pre>
 * // -Dview5d.jar=/opt/view5d/View5D_v2.3.1.jar
 * ViewerBridge bridge = ReflectiveViewerBridge.fromSystemProperties();
 * </pre>
 */
public class ReflectiveViewerBridge implements ViewerBridge {

    private static final String COMPLEX_SUFFIX = "C";

    private final Class<?> viewerClass;
    private final ConcurrentHashMap<String, Method> methods = new ConcurrentHashMap<>();

    /**
     * @param viewerClass the viewer class, e.g. {@code view5d.View5D}
     */
    public ReflectiveViewerBridge(Class<?> viewerClass) {
        this.viewerClass = Objects.requireNonNull(viewerClass, "viewerClass must not be null");
    }

    /**
     * Creates a bridge for the viewer located by {@link ViewerLocator#fromSystemProperties()}.
     *
     * @return the bridge
     * @throws ViewerBridgeException if the viewer cannot be found
     */
    public static ReflectiveViewerBridge fromSystemProperties() {
        return new ReflectiveViewerBridge(ViewerLocator.fromSystemProperties().loadViewerClass());
    }

    public Class<?> getViewerClass() {
        return viewerClass;
    }

    // =========================================================================
    // DATA
    // =========================================================================

    @Override
    public ViewerHandle startViewer(AdaptedBuffer buffer) {
        Object viewer = invoke(null, dataMethod("Start5DViewer", buffer), sizedParameters(buffer),
                sizedArguments(buffer));
        if (viewer == null) {
            throw new ViewerBridgeException("Viewer returned no instance for " + buffer);
        }
        return new ViewerHandle(viewer);
    }

    @Override
    public void replaceData(ViewerHandle viewer, int element, int time, AdaptedBuffer buffer) {
        invoke(viewer.getViewer(), dataMethod("ReplaceData", buffer),
                new Class<?>[]{int.class, int.class, buffer.getPrimitiveKind().getArrayType()},
                element, time, buffer.getData());
    }

    @Override
    public ViewerHandle addElement(ViewerHandle viewer, AdaptedBuffer buffer) {
        Object result = invoke(viewer.getViewer(), dataMethod("AddElement", buffer),
                sizedParameters(buffer), sizedArguments(buffer));
        return sameOrNew(viewer, result);
    }

    @Override
    public ViewerHandle addTime(ViewerHandle viewer, AdaptedBuffer buffer) {
        Object result = invoke(viewer.getViewer(), dataMethod("AddTime", buffer),
                sizedParameters(buffer), sizedArguments(buffer));
        return sameOrNew(viewer, result);
    }

    private static String dataMethod(String base, AdaptedBuffer buffer) {
        return buffer.isComplex() ? base + COMPLEX_SUFFIX : base;
    }

    // (data, sizeX, sizeY, sizeZ, sizeE, sizeT)
    private static Class<?>[] sizedParameters(AdaptedBuffer buffer) {
        return new Class<?>[]{buffer.getPrimitiveKind().getArrayType(),
                int.class, int.class, int.class, int.class, int.class};
    }

    private static Object[] sizedArguments(AdaptedBuffer buffer) {
        return new Object[]{buffer.getData(),
                buffer.size(AdaptedBuffer.X), buffer.size(AdaptedBuffer.Y), buffer.size(AdaptedBuffer.Z),
                buffer.size(AdaptedBuffer.ELEMENT), buffer.size(AdaptedBuffer.TIME)};
    }

    private static ViewerHandle sameOrNew(ViewerHandle viewer, Object result) {
        if (result == null || result == viewer.getViewer()) {
            return viewer;
        }
        return new ViewerHandle(result);
    }

    // =========================================================================
    // DISPLAY PROPERTIES
    // =========================================================================

    @Override
    public void setGamma(ViewerHandle viewer, int element, double gamma) {
        call(viewer, "SetGamma", types(int.class, double.class), element, gamma);
    }

    @Override
    public void setTime(ViewerHandle viewer, int time) {
        call(viewer, "setTime", types(int.class), time);
    }

    @Override
    public void setElement(ViewerHandle viewer, int element) {
        call(viewer, "setElement", types(int.class), element);
    }

    @Override
    public void setElementName(ViewerHandle viewer, int element, String name) {
        call(viewer, "setName", types(int.class, String.class), element, name);
    }

    @Override
    public void setElementsLinked(ViewerHandle viewer, boolean linked) {
        call(viewer, "SetElementsLinked", types(boolean.class), linked);
    }

    @Override
    public void setTimesLinked(ViewerHandle viewer, boolean linked) {
        call(viewer, "setTimesLinked", types(boolean.class), linked);
    }

    @Override
    public void setTitle(ViewerHandle viewer, String title) {
        call(viewer, "NameWindow", types(String.class), title);
    }

    @Override
    public void setDisplaySize(ViewerHandle viewer, int width, int height) {
        call(viewer, "setSize", types(int.class, int.class), width, height);
    }

    @Override
    public int getNumElements(ViewerHandle viewer) {
        return ((Number) call(viewer, "getNumElements", types())).intValue();
    }

    @Override
    public int getNumTimes(ViewerHandle viewer) {
        return ((Number) call(viewer, "getNumTime", types())).intValue();
    }

    @Override
    public void setAxisScalesAndUnits(ViewerHandle viewer, int element, int time, AxisCalibration calibration) {
        double[] sizes = calibration.getPixelSizes();
        double[] offsets = calibration.getAxisOffsets();
        Class<?>[] parameters = new Class<?>[18];
        Object[] arguments = new Object[18];
        parameters[0] = int.class;
        parameters[1] = int.class;
        arguments[0] = element;
        arguments[1] = time;
        // value scale, 5 axis scales, value offset, 5 axis offsets
        for (int i = 2; i < 14; i++) {
            parameters[i] = double.class;
        }
        arguments[2] = calibration.getValueScale();
        for (int i = 0; i < AxisCalibration.AXES; i++) {
            arguments[3 + i] = sizes[i];
            arguments[9 + i] = offsets[i];
        }
        arguments[8] = calibration.getValueOffset();
        parameters[14] = String.class;
        parameters[15] = String[].class;
        parameters[16] = String.class;
        parameters[17] = String[].class;
        arguments[14] = calibration.getValueName();
        arguments[15] = calibration.getAxisNames();
        arguments[16] = calibration.getValueUnit();
        arguments[17] = calibration.getAxisUnits();
        invoke(viewer.getViewer(), "SetAxisScalesAndUnits", parameters, arguments);
    }

    @Override
    public void setValueUnit(ViewerHandle viewer, int element, String unit) {
        call(viewer, "setUnit", types(int.class, String.class), element, unit);
    }

    @Override
    public void setValueName(ViewerHandle viewer, int element, String name) {
        call(viewer, "NameElement", types(int.class, String.class), element, name);
    }

    @Override
    public void setFontSize(ViewerHandle viewer, int fontSize) {
        call(viewer, "setFontSize", types(int.class), fontSize);
    }

    @Override
    public void setMinMaxThresh(ViewerHandle viewer, int element, double min, double max) {
        call(viewer, "setMinMaxThresh", types(int.class, double.class, double.class), element, min, max);
    }

    // =========================================================================
    // MARKERS
    // =========================================================================

    @Override
    public double[][] exportMarkerLists(ViewerHandle viewer) {
        return (double[][]) call(viewer, "ExportMarkerLists", types());
    }

    @Override
    public String exportMarkers(ViewerHandle viewer) {
        return (String) call(viewer, "ExportMarkers", types());
    }

    @Override
    public void importMarkerLists(ViewerHandle viewer, float[][] markers) {
        call(viewer, "ImportMarkerLists", types(float[][].class), (Object) markers);
    }

    @Override
    public void deleteAllMarkerLists(ViewerHandle viewer) {
        call(viewer, "DeleteAllMarkerLists", types());
    }

    // =========================================================================
    // WINDOW AND KEYS
    // =========================================================================

    @Override
    public void toFront(ViewerHandle viewer) {
        call(viewer, "toFront", types());
    }

    @Override
    public void hide(ViewerHandle viewer) {
        call(viewer, "hide", types());
    }

    @Override
    public void updatePanels(ViewerHandle viewer) {
        call(viewer, "UpdatePanels", types());
    }

    @Override
    public void repaint(ViewerHandle viewer) {
        call(viewer, "repaint", types());
    }

    @Override
    public void processKeyMainWindow(ViewerHandle viewer, char key) {
        call(viewer, "ProcessKeyMainWindow", types(char.class), key);
    }

    @Override
    public void processKeyElementWindow(ViewerHandle viewer, char key) {
        call(viewer, "ProcessKeyElementWindow", types(char.class), key);
    }

    @Override
    public String getName() {
        return "Reflective(" + viewerClass.getName() + ")";
    }

    // =========================================================================
    // REFLECTION
    // =========================================================================

    private static Class<?>[] types(Class<?>... types) {
        return types;
    }

    private Object call(ViewerHandle viewer, String name, Class<?>[] parameterTypes, Object... arguments) {
        return invoke(viewer.getViewer(), name, parameterTypes, arguments);
    }

    private Object invoke(Object target, String name, Class<?>[] parameterTypes, Object... arguments) {
        Method method = lookup(name, parameterTypes);
        try {
            return method.invoke(target, arguments);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new ViewerBridgeException(viewerClass.getSimpleName() + "." + name + " failed: "
                    + cause.getMessage(), cause);
        } catch (IllegalAccessException | IllegalArgumentException e) {
            throw new ViewerBridgeException("Cannot call " + signature(name, parameterTypes), e);
        }
    }

    private Method lookup(String name, Class<?>[] parameterTypes) {
        String key = signature(name, parameterTypes);
        Method method = methods.get(key);
        if (method != null) {
            return method;
        }
        try {
            method = viewerClass.getMethod(name, parameterTypes);
        } catch (NoSuchMethodException e) {
            throw new ViewerBridgeException("Viewer has no method " + key, e);
        }
        methods.putIfAbsent(key, method);
        return method;
    }

    private String signature(String name, Class<?>[] parameterTypes) {
        String[] names = new String[parameterTypes.length];
        for (int i = 0; i < parameterTypes.length; i++) {
            names[i] = parameterTypes[i].getSimpleName();
        }
        return viewerClass.getName() + "." + name + Arrays.toString(names).replace('[', '(').replace(']', ')');
    }
}
