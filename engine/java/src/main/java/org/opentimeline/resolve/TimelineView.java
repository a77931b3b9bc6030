package org.opentimeline.resolve;

import org.opentimeline.model.Entity;
import org.opentimeline.model.Timeline;

import java.util.List;

/**
 * A fully resolved timeline, ready to draw.
 *
 * @param timeline                The root timeline.
 * @param contributingTimelineIds The root and every timeline reachable below it, each once.
 * @param entities                Distinct entities in chronological order.
 * @param warnings                Dangling links and edges skipped while resolving.
 */
public record TimelineView(
        Timeline timeline,
        List<String> contributingTimelineIds,
        List<Entity> entities,
        List<String> warnings
) {
    public TimelineView {
        contributingTimelineIds = List.copyOf(contributingTimelineIds);
        entities = List.copyOf(entities);
        warnings = List.copyOf(warnings);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
