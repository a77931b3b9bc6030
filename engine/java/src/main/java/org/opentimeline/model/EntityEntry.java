package org.opentimeline.model;

import java.util.List;

/**
 * An entity together with its tags, as stored in a dataset file.
 */
public record EntityEntry(Entity entity, List<Tag> tags) {
    public EntityEntry {
        tags = tags != null ? List.copyOf(tags) : List.of();
    }

    public String id() {
        return entity.id();
    }
}
