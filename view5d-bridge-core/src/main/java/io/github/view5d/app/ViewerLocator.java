package io.github.view5d.app;

import java.net.MalformedURLException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Finds the View5D viewer class before first use.
 *
 * <p>The viewer is shipped as a separate jar. Its location is read from, in
 * order:</p>
 * <ul>
 *   <li>the {@code view5d.jar} system property</li>
 *   <li>the {@code VIEW5D_JAR} environment variable</li>
 * </ul>
 * <p>If neither is set the viewer class must already be on the class path.
 * The class name defaults to {@code view5d.View5D} and can be overridden with
 * the {@code view5d.class} system property.</p>
 */
public class ViewerLocator {

    static final String PROP_JAR = "view5d.jar";
    static final String PROP_CLASS = "view5d.class";
    static final String ENV_JAR = "VIEW5D_JAR";
    static final String DEFAULT_CLASS = "view5d.View5D";

    private final Path jarPath;
    private final String className;

    /**
     * @param jarPath   the viewer jar, or null to use the class path
     * @param className fully qualified viewer class name
     */
    public ViewerLocator(Path jarPath, String className) {
        if (className == null || className.isEmpty()) {
            throw new IllegalArgumentException("className must not be empty");
        }
        this.jarPath = jarPath;
        this.className = className;
    }

    /**
     * Builds a locator from system properties and the environment.
     *
     * @return the locator
     */
    public static ViewerLocator fromSystemProperties() {
        String jar = System.getProperty(PROP_JAR);
        if (jar == null || jar.isEmpty()) {
            jar = System.getenv(ENV_JAR);
        }
        String className = System.getProperty(PROP_CLASS, DEFAULT_CLASS);
        Path jarPath = jar == null || jar.isEmpty() ? null : Paths.get(jar);
        return new ViewerLocator(jarPath, className);
    }

    /**
     * @return the configured jar, or null when the class path is used
     */
    public Path getJarPath() {
        return jarPath;
    }

    public String getClassName() {
        return className;
    }

    /**
     * Loads the viewer class.
     *
     * @return the viewer class
     * @throws ViewerBridgeException if the jar or the class cannot be found
     */
    public Class<?> loadViewerClass() {
        ClassLoader loader = createClassLoader();
        try {
            return Class.forName(className, true, loader);
        } catch (ClassNotFoundException | LinkageError e) {
            throw new ViewerBridgeException("Cannot load viewer class " + className
                    + (jarPath != null ? " from " + jarPath : " from the class path")
                    + ". Set -D" + PROP_JAR + " to the View5D jar.", e);
        }
    }

    private ClassLoader createClassLoader() {
        ClassLoader parent = Thread.currentThread().getContextClassLoader();
        if (parent == null) {
            parent = ViewerLocator.class.getClassLoader();
        }
        if (jarPath == null) {
            return parent;
        }
        if (!Files.isRegularFile(jarPath)) {
            throw new ViewerBridgeException("View5D jar does not exist: " + jarPath);
        }
        try {
            URL url = jarPath.toUri().toURL();
            log("Loading viewer from " + jarPath);
            return new URLClassLoader(new URL[]{url}, parent);
        } catch (MalformedURLException e) {
            throw new ViewerBridgeException("Invalid View5D jar path: " + jarPath, e);
        }
    }

    private static void log(String message) {
        System.err.println("View5D: " + message);
    }
}
