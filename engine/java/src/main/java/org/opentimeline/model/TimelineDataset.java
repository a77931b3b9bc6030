package org.opentimeline.model;

import java.util.List;

/**
 * The root of an OpenTimeline dataset file: every entity and timeline plus the
 * relations between them.
 */
public record TimelineDataset(
        String version,
        String title,
        List<EntityEntry> entities,
        List<TimelineEntry> timelines
) {
    public TimelineDataset {
        entities = entities != null ? List.copyOf(entities) : List.of();
        timelines = timelines != null ? List.copyOf(timelines) : List.of();
    }
}
