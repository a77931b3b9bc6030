package org.opentimeline.store;

import org.opentimeline.model.Entity;
import org.opentimeline.model.Tag;
import org.opentimeline.model.Timeline;

import java.util.List;
import java.util.Optional;

/**
 * Read-only queries the resolution engine needs from the storage layer.
 *
 * <p>Implementations must tolerate dangling references: a link or edge may name an
 * entity or timeline that no longer exists. Lookups for such IDs return empty.
 */
public interface TimelineStore {

    Optional<Entity> getEntity(String id);

    List<Entity> listEntities();

    /** Tags of one entity. Duplicates and anonymous tags are returned as stored. */
    List<Tag> getTags(String entityId);

    Optional<Timeline> getTimeline(String id);

    List<Timeline> listTimelines();

    /** Direct children of {@code parentId}; may include IDs of missing timelines. */
    List<String> listSubtimelineChildren(String parentId);

    /** Explicitly linked entity IDs; may include IDs of missing entities. */
    List<String> listLinkedEntities(String timelineId);

    List<Tag> getTimelineTags(String timelineId);

    default Optional<Timeline> findTimelineByName(String name) {
        if (name == null) return Optional.empty();
        String trimmed = name.trim();
        return listTimelines().stream()
                .filter(t -> t.name().equals(trimmed))
                .findFirst();
    }
}
