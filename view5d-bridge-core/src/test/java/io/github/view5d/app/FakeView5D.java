package io.github.view5d.app;

import java.util.ArrayList;
import java.util.List;

/**
 * Stand-in for the viewer class, with the method names and signatures the
 * reflective bridge calls.
 */
public class FakeView5D {

    final List<String> calls = new ArrayList<>();
    final int[] sizes;
    Object data;
    int elements;
    int times;
    boolean splitOnAddTime;

    private FakeView5D(Object data, int sx, int sy, int sz, int se, int st) {
        this.data = data;
        this.sizes = new int[]{sx, sy, sz, se, st};
        this.elements = se;
        this.times = st;
    }

    public static FakeView5D Start5DViewer(float[] data, int sx, int sy, int sz, int se, int st) {
        return new FakeView5D(data, sx, sy, sz, se, st);
    }

    public static FakeView5D Start5DViewer(long[] data, int sx, int sy, int sz, int se, int st) {
        return new FakeView5D(data, sx, sy, sz, se, st);
    }

    public static FakeView5D Start5DViewerC(float[] data, int sx, int sy, int sz, int se, int st) {
        FakeView5D viewer = new FakeView5D(data, sx, sy, sz, se, st);
        viewer.calls.add("Start5DViewerC");
        return viewer;
    }

    public void ReplaceData(int element, int time, float[] data) {
        calls.add("ReplaceData " + element + " " + time);
        this.data = data;
    }

    public FakeView5D AddElement(float[] data, int sx, int sy, int sz, int se, int st) {
        calls.add("AddElement " + data.length);
        elements += se;
        return this;
    }

    public FakeView5D AddTime(float[] data, int sx, int sy, int sz, int se, int st) {
        calls.add("AddTime " + data.length);
        if (splitOnAddTime) {
            FakeView5D copy = new FakeView5D(data, sx, sy, sz, elements, times + st);
            return copy;
        }
        times += st;
        return this;
    }

    public void SetGamma(int element, double gamma) {
        calls.add("SetGamma " + element + " " + gamma);
    }

    public void setTime(int time) {
        calls.add("setTime " + time);
    }

    public int getNumElements() {
        return elements;
    }

    public int getNumTime() {
        return times;
    }

    public void SetAxisScalesAndUnits(int element, int time,
                                      double valueScale, double sx, double sy, double sz, double se, double st,
                                      double valueOffset, double ox, double oy, double oz, double oe, double ot,
                                      String valueName, String[] axisNames, String valueUnit, String[] axisUnits) {
        calls.add("SetAxisScalesAndUnits " + valueScale + " " + sx + " " + valueOffset + " " + ox
                + " " + valueName + " " + axisNames[4] + " " + valueUnit + " " + axisUnits[0]);
    }

    public double[][] ExportMarkerLists() {
        return new double[][]{new double[MarkerRecord.FIELD_COUNT]};
    }

    public void ProcessKeyMainWindow(char key) {
        calls.add("key " + key);
    }

    public void UpdatePanels() {
        calls.add("UpdatePanels");
    }

    public void setFontSize(int size) {
        throw new IllegalStateException("font size " + size + " not available");
    }
}
