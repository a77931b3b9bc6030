package org.opentimeline.resolve;

import java.util.List;

/**
 * Thrown when the sub-timeline graph reachable from a root contains a cycle.
 *
 * <p>{@link #path()} runs from the root to the edge that closes the cycle, so its last
 * element appears twice, e.g. {@code [root, a, b, a]}.
 */
public class TimelineCycleException extends ResolutionException {

    private final List<String> path;

    public TimelineCycleException(String rootId, List<String> path) {
        super(rootId, "Sub-timeline cycle: " + String.join(" -> ", path));
        this.path = List.copyOf(path);
    }

    public List<String> path() {
        return path;
    }
}
