package io.github.view5d.app.command;

import io.github.view5d.app.MarkerRecord;
import io.github.view5d.app.MarkerTable;
import io.github.view5d.app.Panel;
import io.github.view5d.app.ViewerSession;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link ViewerCommandHandler} that applies commands to the active viewer of
 * a {@link ViewerSession}. See the package documentation for the command
 * list.
 */
public class SessionCommandHandler implements ViewerCommandHandler {

    private final ViewerSession session;

    public SessionCommandHandler(ViewerSession session) {
        this.session = Objects.requireNonNull(session, "session must not be null");
    }

    @Override
    public Map<String, String> handleCommand(String command, Map<String, String> params) {
        Objects.requireNonNull(command, "command must not be null");
        Map<String, String> p = params != null ? params : Collections.<String, String>emptyMap();
        switch (command) {
            case "keys": {
                String keys = required(p, "keys");
                Panel panel = Panel.fromToken(p.getOrDefault("panel", Panel.MAIN.getToken()));
                session.sendKeys(keys, null, panel);
                return result("count", keys.length());
            }
            case "set_gamma":
                session.setGamma(doubleParam(p, "gamma"), intParam(p, "element", 0), null);
                return Collections.emptyMap();
            case "set_time":
                session.setTime(intParam(p, "time"));
                return Collections.emptyMap();
            case "set_element":
                session.setElement(intParam(p, "element"));
                return Collections.emptyMap();
            case "set_element_name":
                session.setElementName(intParam(p, "element"), required(p, "name"));
                return Collections.emptyMap();
            case "set_title":
                session.setTitle(required(p, "title"));
                return Collections.emptyMap();
            case "set_min_max":
                session.setMinMaxThresh(doubleParam(p, "min"), doubleParam(p, "max"),
                        intParam(p, "element", 0), null);
                return Collections.emptyMap();
            case "elements_linked":
                session.setElementsLinked(booleanParam(p, "linked"));
                return Collections.emptyMap();
            case "times_linked":
                session.setTimesLinked(booleanParam(p, "linked"));
                return Collections.emptyMap();
            case "font_size":
                session.setFontSize(intParam(p, "size"));
                return Collections.emptyMap();
            case "display_size":
                session.setDisplaySize(intParam(p, "width"), intParam(p, "height"));
                return Collections.emptyMap();
            case "num_elements":
                return result("count", session.getNumElements());
            case "num_times":
                return result("count", session.getNumTimes());
            case "export_markers": {
                List<MarkerRecord> markers = session.exportMarkerLists();
                Map<String, String> out = new HashMap<>();
                out.put("count", String.valueOf(markers.size()));
                out.put("markers", MarkerTable.format(markers));
                return out;
            }
            case "delete_markers":
                session.deleteAllMarkerLists();
                return Collections.emptyMap();
            case "to_front":
                session.toFront(null);
                return Collections.emptyMap();
            case "hide":
                session.hide(null);
                return Collections.emptyMap();
            default:
                throw new IllegalArgumentException("Unknown command: " + command);
        }
    }

    private static Map<String, String> result(String key, int value) {
        Map<String, String> out = new HashMap<>();
        out.put(key, String.valueOf(value));
        return out;
    }

    private static String required(Map<String, String> params, String name) {
        String value = params.get(name);
        if (value == null) {
            throw new IllegalArgumentException("Missing parameter: " + name);
        }
        return value;
    }

    private static int intParam(Map<String, String> params, String name) {
        String value = required(params, name);
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Parameter " + name + " is not an integer: " + value, e);
        }
    }

    private static int intParam(Map<String, String> params, String name, int defaultValue) {
        return params.containsKey(name) ? intParam(params, name) : defaultValue;
    }

    private static double doubleParam(Map<String, String> params, String name) {
        String value = required(params, name);
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Parameter " + name + " is not a number: " + value, e);
        }
    }

    private static boolean booleanParam(Map<String, String> params, String name) {
        String value = required(params, name).trim();
        if ("true".equalsIgnoreCase(value)) {
            return true;
        }
        if ("false".equalsIgnoreCase(value)) {
            return false;
        }
        throw new IllegalArgumentException("Parameter " + name + " is not a boolean: " + value);
    }
}
