package org.opentimeline.resolve;

import org.opentimeline.model.Timeline;
import org.opentimeline.store.TimelineStore;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything one resolution reads from the store: the contributing timelines, their
 * explicit links, and the entity universe. Captured before any expression is
 * evaluated; the pipeline never goes back to the store afterwards.
 */
public record ResolutionSnapshot(
        Map<String, Timeline> timelines,
        Map<String, List<String>> links,
        EntitySnapshot entities
) {
    public ResolutionSnapshot {
        timelines = Collections.unmodifiableMap(new LinkedHashMap<>(timelines));
        links = Map.copyOf(links);
    }

    /**
     * Pairs the timelines captured while walking the sub-timeline graph with their
     * explicit links. A timeline removed since the walk simply has no links.
     */
    public static ResolutionSnapshot capture(TimelineStore store, Map<String, Timeline> timelines,
                                             EntitySnapshot entities) {
        Map<String, List<String>> links = new LinkedHashMap<>();
        for (String id : timelines.keySet()) {
            links.put(id, List.copyOf(store.listLinkedEntities(id)));
        }
        return new ResolutionSnapshot(timelines, links, entities);
    }

    public List<String> linkedEntities(String timelineId) {
        return links.getOrDefault(timelineId, List.of());
    }
}
