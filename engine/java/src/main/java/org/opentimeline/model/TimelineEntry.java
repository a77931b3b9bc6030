package org.opentimeline.model;

import java.util.List;

/**
 * A timeline with its explicit entity links, sub-timeline edges and tags, as stored
 * in a dataset file.
 */
public record TimelineEntry(
        Timeline timeline,
        List<String> entityIds,
        List<String> subtimelineIds,
        List<Tag> tags
) {
    public TimelineEntry {
        entityIds = entityIds != null ? List.copyOf(entityIds) : List.of();
        subtimelineIds = subtimelineIds != null ? List.copyOf(subtimelineIds) : List.of();
        tags = tags != null ? List.copyOf(tags) : List.of();
    }

    public String id() {
        return timeline.id();
    }
}
