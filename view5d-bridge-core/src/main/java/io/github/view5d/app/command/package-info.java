/**
 * String-keyed command access to a {@link io.github.view5d.app.ViewerSession}.
 *
 * <h2>Commands</h2>
 * <p>All commands act on the session's active viewer.</p>
 * <table>
 *   <caption>Supported commands</caption>
 *   <tr><th>Command</th><th>Parameters</th><th>Result</th></tr>
 *   <tr><td>keys</td><td>keys, panel (main|element, default main)</td><td>count</td></tr>
 *   <tr><td>set_gamma</td><td>gamma, element (default 0)</td><td></td></tr>
 *   <tr><td>set_time</td><td>time</td><td></td></tr>
 *   <tr><td>set_element</td><td>element</td><td></td></tr>
 *   <tr><td>set_element_name</td><td>element, name</td><td></td></tr>
 *   <tr><td>set_title</td><td>title</td><td></td></tr>
 *   <tr><td>set_min_max</td><td>min, max, element (default 0)</td><td></td></tr>
 *   <tr><td>elements_linked</td><td>linked</td><td></td></tr>
 *   <tr><td>times_linked</td><td>linked</td><td></td></tr>
 *   <tr><td>font_size</td><td>size</td><td></td></tr>
 *   <tr><td>display_size</td><td>width, height</td><td></td></tr>
 *   <tr><td>num_elements</td><td></td><td>count</td></tr>
 *   <tr><td>num_times</td><td></td><td>count</td></tr>
 *   <tr><td>export_markers</td><td></td><td>count, markers (tab-separated)</td></tr>
 *   <tr><td>delete_markers</td><td></td><td></td></tr>
 *   <tr><td>to_front</td><td></td><td></td></tr>
 *   <tr><td>hide</td><td></td><td></td></tr>
 * </table>
 */
package io.github.view5d.app.command;
