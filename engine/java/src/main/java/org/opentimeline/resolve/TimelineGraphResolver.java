package org.opentimeline.resolve;

import org.opentimeline.model.Timeline;
import org.opentimeline.store.TimelineStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Flattens the sub-timeline graph below a root into the set of contributing timelines.
 *
 * <p>Depth-first, with a per-ID state: unvisited, on the current path, or done. Reaching
 * a done node again (a diamond) is skipped; reaching a node that is still on the
 * current path is a cycle and fails the whole root. The walk keeps an explicit stack,
 * so chain length is bounded by memory, not by the thread stack.
 */
public class TimelineGraphResolver {

    private static final Logger logger = LoggerFactory.getLogger(TimelineGraphResolver.class);

    private static final int ON_PATH = 1;
    private static final int DONE = 2;

    /**
     * Contributing timelines of a root, root first, in discovery order.
     *
     * @param timelines Timelines as read during the walk, keyed by ID.
     * @param warnings  Dangling sub-timeline edges that were skipped.
     */
    public record ContributingTimelines(Map<String, Timeline> timelines, List<String> warnings) {
        public ContributingTimelines {
            timelines = Collections.unmodifiableMap(new LinkedHashMap<>(timelines));
            warnings = List.copyOf(warnings);
        }

        public Set<String> ids() {
            return timelines.keySet();
        }
    }

    private record Frame(String id, Iterator<String> children) {}

    private final TimelineStore store;

    public TimelineGraphResolver(TimelineStore store) {
        this.store = store;
    }

    /**
     * @throws TimelineNotFoundException if {@code rootId} is not a timeline
     * @throws TimelineCycleException    if a cycle is reachable from {@code rootId}
     */
    public ContributingTimelines resolveContributing(String rootId) {
        Timeline root = store.getTimeline(rootId)
                .orElseThrow(() -> new TimelineNotFoundException(rootId));
        Map<String, Timeline> order = new LinkedHashMap<>();
        List<String> warnings = new ArrayList<>();
        Map<String, Integer> state = new HashMap<>();
        Deque<Frame> path = new ArrayDeque<>();

        enter(root, state, path, order);
        while (!path.isEmpty()) {
            Frame top = path.peekLast();
            if (!top.children().hasNext()) {
                path.removeLast();
                state.put(top.id(), DONE);
                continue;
            }
            String child = top.children().next();
            int childState = state.getOrDefault(child, 0);
            if (childState == ON_PATH) {
                List<String> cycle = new ArrayList<>();
                path.forEach(frame -> cycle.add(frame.id()));
                cycle.add(child);
                throw new TimelineCycleException(rootId, cycle);
            }
            if (childState == DONE) {
                continue;
            }
            Optional<Timeline> timeline = store.getTimeline(child);
            if (timeline.isEmpty()) {
                String warning = "timeline '" + top.id() + "': sub-timeline '" + child + "' does not exist";
                logger.warn("Skipping dangling edge, {}", warning);
                warnings.add(warning);
                state.put(child, DONE);
                continue;
            }
            enter(timeline.get(), state, path, order);
        }

        logger.debug("Timeline '{}' has {} contributing timeline(s)", rootId, order.size());
        return new ContributingTimelines(order, warnings);
    }

    private void enter(Timeline timeline, Map<String, Integer> state, Deque<Frame> path,
                       Map<String, Timeline> order) {
        state.put(timeline.id(), ON_PATH);
        order.put(timeline.id(), timeline);
        path.addLast(new Frame(timeline.id(), store.listSubtimelineChildren(timeline.id()).iterator()));
    }
}
