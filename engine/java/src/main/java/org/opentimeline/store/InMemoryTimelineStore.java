package org.opentimeline.store;

import org.opentimeline.model.Entity;
import org.opentimeline.model.EntityEntry;
import org.opentimeline.model.Tag;
import org.opentimeline.model.Timeline;
import org.opentimeline.model.TimelineDataset;
import org.opentimeline.model.TimelineEntry;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable {@link TimelineStore} over records held in memory, typically loaded from a
 * dataset file. Insertion order is preserved for listings.
 *
 * <p>Later records with an already-used ID replace earlier ones; the validator reports
 * such duplicates.
 */
public final class InMemoryTimelineStore implements TimelineStore {

    private final Map<String, Entity> entities;
    private final Map<String, List<Tag>> entityTags;
    private final Map<String, Timeline> timelines;
    private final Map<String, List<Tag>> timelineTags;
    private final Map<String, List<String>> children;
    private final Map<String, List<String>> links;
    private final List<String> entityOrder;
    private final List<String> timelineOrder;

    private InMemoryTimelineStore(Builder b) {
        this.entities = Map.copyOf(b.entities);
        this.entityTags = copyLists(b.entityTags);
        this.timelines = Map.copyOf(b.timelines);
        this.timelineTags = copyLists(b.timelineTags);
        this.children = copyLists(b.children);
        this.links = copyLists(b.links);
        this.entityOrder = List.copyOf(b.entities.keySet());
        this.timelineOrder = List.copyOf(b.timelines.keySet());
    }

    public static InMemoryTimelineStore of(TimelineDataset dataset) {
        Builder b = builder();
        for (EntityEntry e : dataset.entities()) {
            b.entity(e.entity(), e.tags());
        }
        for (TimelineEntry t : dataset.timelines()) {
            b.timeline(t.timeline(), t.tags());
            t.entityIds().forEach(entityId -> b.link(t.id(), entityId));
            t.subtimelineIds().forEach(childId -> b.subtimeline(t.id(), childId));
        }
        return b.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public Optional<Entity> getEntity(String id) {
        return Optional.ofNullable(entities.get(id));
    }

    @Override
    public List<Entity> listEntities() {
        return entityOrder.stream().map(entities::get).toList();
    }

    @Override
    public List<Tag> getTags(String entityId) {
        return entityTags.getOrDefault(entityId, List.of());
    }

    @Override
    public Optional<Timeline> getTimeline(String id) {
        return Optional.ofNullable(timelines.get(id));
    }

    @Override
    public List<Timeline> listTimelines() {
        return timelineOrder.stream().map(timelines::get).toList();
    }

    @Override
    public List<String> listSubtimelineChildren(String parentId) {
        return children.getOrDefault(parentId, List.of());
    }

    @Override
    public List<String> listLinkedEntities(String timelineId) {
        return links.getOrDefault(timelineId, List.of());
    }

    @Override
    public List<Tag> getTimelineTags(String timelineId) {
        return timelineTags.getOrDefault(timelineId, List.of());
    }

    private static <T> Map<String, List<T>> copyLists(Map<String, List<T>> source) {
        Map<String, List<T>> copy = new LinkedHashMap<>();
        source.forEach((k, v) -> copy.put(k, List.copyOf(v)));
        return Map.copyOf(copy);
    }

    /** Mutable collector for an {@link InMemoryTimelineStore}. */
    public static final class Builder {
        private final Map<String, Entity> entities = new LinkedHashMap<>();
        private final Map<String, List<Tag>> entityTags = new LinkedHashMap<>();
        private final Map<String, Timeline> timelines = new LinkedHashMap<>();
        private final Map<String, List<Tag>> timelineTags = new LinkedHashMap<>();
        private final Map<String, List<String>> children = new LinkedHashMap<>();
        private final Map<String, List<String>> links = new LinkedHashMap<>();

        private Builder() {}

        public Builder entity(Entity entity, Tag... tags) {
            return entity(entity, Arrays.asList(tags));
        }

        public Builder entity(Entity entity, List<Tag> tags) {
            entities.put(entity.id(), entity);
            entityTags.put(entity.id(), new ArrayList<>(tags));
            return this;
        }

        public Builder timeline(Timeline timeline, Tag... tags) {
            return timeline(timeline, Arrays.asList(tags));
        }

        public Builder timeline(Timeline timeline, List<Tag> tags) {
            timelines.put(timeline.id(), timeline);
            timelineTags.put(timeline.id(), new ArrayList<>(tags));
            return this;
        }

        public Builder link(String timelineId, String entityId) {
            links.computeIfAbsent(timelineId, k -> new ArrayList<>()).add(entityId);
            return this;
        }

        public Builder subtimeline(String parentId, String childId) {
            children.computeIfAbsent(parentId, k -> new ArrayList<>()).add(childId);
            return this;
        }

        public InMemoryTimelineStore build() {
            return new InMemoryTimelineStore(this);
        }
    }
}
