package org.opentimeline.resolve;

import org.opentimeline.expr.TagIndex;
import org.opentimeline.model.Entity;
import org.opentimeline.store.TimelineStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Every entity in the store with its (implication-expanded) tags, read once so that
 * expression evaluation sees one consistent state even if the store changes meanwhile.
 */
public final class EntitySnapshot {

    private static final Logger logger = LoggerFactory.getLogger(EntitySnapshot.class);

    private final Map<String, Entity> entities;
    private final Map<String, TagIndex> tags;

    private EntitySnapshot(Map<String, Entity> entities, Map<String, TagIndex> tags) {
        this.entities = Collections.unmodifiableMap(entities);
        this.tags = Collections.unmodifiableMap(tags);
    }

    public static EntitySnapshot capture(TimelineStore store, TagImplications implications) {
        Map<String, Entity> entities = new LinkedHashMap<>();
        Map<String, TagIndex> tags = new LinkedHashMap<>();
        for (Entity entity : store.listEntities()) {
            entities.put(entity.id(), entity);
            tags.put(entity.id(), TagIndex.of(implications.apply(store.getTags(entity.id()))));
        }
        logger.debug("Captured {} entities", entities.size());
        return new EntitySnapshot(entities, tags);
    }

    public Optional<Entity> entity(String id) {
        return Optional.ofNullable(entities.get(id));
    }

    public TagIndex tags(String entityId) {
        return tags.getOrDefault(entityId, TagIndex.of(null));
    }

    /** All entities in store order. */
    public Collection<Entity> entities() {
        return entities.values();
    }

    public int size() {
        return entities.size();
    }
}
