package io.github.view5d.app;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ViewerLocator.
 */
class ViewerLocatorTest {

    @TempDir
    Path tempDir;

    @AfterEach
    void tearDown() {
        System.clearProperty(ViewerLocator.PROP_JAR);
        System.clearProperty(ViewerLocator.PROP_CLASS);
    }

    @Test
    void testFromSystemProperties_readsJarAndClass() {
        System.setProperty(ViewerLocator.PROP_JAR, "/opt/view5d/View5D.jar");
        System.setProperty(ViewerLocator.PROP_CLASS, "org.example.Viewer");

        ViewerLocator locator = ViewerLocator.fromSystemProperties();

        assertEquals(Path.of("/opt/view5d/View5D.jar"), locator.getJarPath());
        assertEquals("org.example.Viewer", locator.getClassName());
    }

    @Test
    void testFromSystemProperties_defaultClass() {
        System.setProperty(ViewerLocator.PROP_JAR, "/tmp/v.jar");
        assertEquals("view5d.View5D", ViewerLocator.fromSystemProperties().getClassName());
    }

    @Test
    void testLoadViewerClass_fromClassPath() {
        ViewerLocator locator = new ViewerLocator(null, FakeView5D.class.getName());
        assertSame(FakeView5D.class, locator.loadViewerClass());
    }

    @Test
    void testLoadViewerClass_missingClass() {
        ViewerLocator locator = new ViewerLocator(null, "view5d.DoesNotExist");

        ViewerBridgeException e = assertThrows(ViewerBridgeException.class, locator::loadViewerClass);
        assertTrue(e.getMessage().contains("view5d.DoesNotExist"));
    }

    @Test
    void testLoadViewerClass_missingJar() {
        ViewerLocator locator = new ViewerLocator(tempDir.resolve("missing.jar"), "view5d.View5D");

        ViewerBridgeException e = assertThrows(ViewerBridgeException.class, locator::loadViewerClass);
        assertTrue(e.getMessage().contains("does not exist"));
    }

    @Test
    void testConstructor_emptyClassRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ViewerLocator(null, ""));
    }

    @Test
    void testReflectiveBridgeFromSystemProperties() {
        System.setProperty(ViewerLocator.PROP_CLASS, FakeView5D.class.getName());
        System.setProperty(ViewerLocator.PROP_JAR, "");

        ReflectiveViewerBridge bridge = ReflectiveViewerBridge.fromSystemProperties();

        assertSame(FakeView5D.class, bridge.getViewerClass());
    }
}
