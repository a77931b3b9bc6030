package org.opentimeline.resolve;

import org.opentimeline.model.Timeline;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Resolved entity counts for every timeline in a store.
 *
 * @param counts   One entry per timeline that resolved, in store order.
 * @param failures Timeline ID to failure message for timelines that did not resolve.
 */
public record TimelineCounts(List<TimelineCount> counts, Map<String, String> failures) {

    public record TimelineCount(Timeline timeline, int entityCount) {}

    public TimelineCounts {
        counts = List.copyOf(counts);
        failures = Map.copyOf(failures);
    }

    public List<TimelineCount> sortedByCount(boolean descending) {
        Comparator<TimelineCount> byCount = Comparator.comparingInt(TimelineCount::entityCount);
        if (descending) byCount = byCount.reversed();
        return sorted(byCount.thenComparing(c -> c.timeline().name()));
    }

    public List<TimelineCount> sortedByName(boolean ascending) {
        Comparator<TimelineCount> byName = Comparator.comparing(c -> c.timeline().name());
        return sorted(ascending ? byName : byName.reversed());
    }

    private List<TimelineCount> sorted(Comparator<TimelineCount> order) {
        List<TimelineCount> copy = new ArrayList<>(counts);
        copy.sort(order);
        return List.copyOf(copy);
    }
}
