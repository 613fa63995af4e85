package io.github.view5d.app.command;

import java.util.Map;

/**
 * Handler for named viewer commands with string parameters.
 * <p>
 * Lets a host that only speaks strings (a scripting console, a remote
 * control channel) drive a viewer without linking against the typed API.
 *
 * <h2>Example Implementation</h2>
 * <pre>{@code
 * ViewerCommandHandler handler = (command, params) -> {
 *     switch (command) {
 *         case "to_front":
 *             session.toFront(null);
 *             return Collections.emptyMap();
 *         default:
 *             throw new IllegalArgumentException("Unknown command: " + command);
 *     }
 * };
 * }</pre>
 *
 * @see SessionCommandHandler
 */
@FunctionalInterface
public interface ViewerCommandHandler {

    /**
     * Handle a command.
     *
     * @param command the command name (e.g., "set_gamma", "keys")
     * @param params  the command parameters as key-value pairs
     * @return the result as key-value pairs
     * @throws Exception if the command fails
     */
    Map<String, String> handleCommand(String command, Map<String, String> params) throws Exception;
}
