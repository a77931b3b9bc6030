package org.opentimeline;

import org.opentimeline.expr.ExpressionCache;
import org.opentimeline.model.Entity;
import org.opentimeline.model.Timeline;
import org.opentimeline.resolve.ChronologicalSorter;
import org.opentimeline.resolve.EntitySetComposer;
import org.opentimeline.resolve.EntitySnapshot;
import org.opentimeline.resolve.EntityTagCounts;
import org.opentimeline.resolve.ResolutionException;
import org.opentimeline.resolve.ResolutionSnapshot;
import org.opentimeline.resolve.TagCounts;
import org.opentimeline.resolve.TimelineCounts;
import org.opentimeline.resolve.TimelineGraphResolver;
import org.opentimeline.resolve.TimelineNotFoundException;
import org.opentimeline.resolve.TimelineView;
import org.opentimeline.store.TimelineStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves timelines into the ordered entity sequences a renderer draws.
 *
 * <p>Each call reads what it needs from the store up front (sub-timeline graph, links,
 * entities and tags), then composes and sorts in memory. Calls share nothing but the
 * expression cache, so one engine can serve concurrent requests.
 */
public class TimelineEngine {

    private static final Logger logger = LoggerFactory.getLogger(TimelineEngine.class);

    private final TimelineStore store;
    private final EngineSettings settings;
    private final TimelineGraphResolver resolver;
    private final EntitySetComposer composer;

    public TimelineEngine(TimelineStore store) {
        this(store, EngineSettings.defaults());
    }

    public TimelineEngine(TimelineStore store, EngineSettings settings) {
        this.store = store;
        this.settings = settings;
        this.resolver = new TimelineGraphResolver(store);
        this.composer = new EntitySetComposer(new ExpressionCache(), settings.parallelComposition());
    }

    /**
     * The entities of {@code rootId} and all its sub-timelines, deduplicated and in
     * chronological order.
     *
     * @throws ResolutionException if the root is missing, its sub-timeline graph has a
     *                             cycle, or a contributing expression is malformed
     */
    public List<Entity> renderTimeline(String rootId) {
        return render(rootId).entities();
    }

    /** Like {@link #renderTimeline} but also reports contributing timelines and warnings. */
    public TimelineView render(String rootId) {
        return render(rootId, EntitySnapshot.capture(store, settings.tagImplications()));
    }

    /**
     * Renders by timeline ID, or by name when no timeline has that ID.
     *
     * @throws TimelineNotFoundException if neither matches
     */
    public TimelineView renderByIdOrName(String idOrName) {
        String id = store.getTimeline(idOrName)
                .or(() -> store.findTimelineByName(idOrName))
                .map(Timeline::id)
                .orElseThrow(() -> new TimelineNotFoundException(idOrName));
        return render(id);
    }

    /**
     * Resolves every timeline in the store and counts its entities. A timeline that
     * fails to resolve is listed under {@link TimelineCounts#failures()} instead of
     * aborting the whole listing.
     */
    public TimelineCounts entityCounts() {
        EntitySnapshot entities = EntitySnapshot.capture(store, settings.tagImplications());
        List<TimelineCounts.TimelineCount> counts = new ArrayList<>();
        Map<String, String> failures = new LinkedHashMap<>();
        for (Timeline timeline : store.listTimelines()) {
            try {
                counts.add(new TimelineCounts.TimelineCount(timeline, render(timeline.id(), entities).entities().size()));
            } catch (ResolutionException e) {
                logger.warn("Cannot count entities of timeline '{}': {}", timeline.id(), e.getMessage());
                failures.put(timeline.id(), e.getMessage());
            }
        }
        return new TimelineCounts(counts, failures);
    }

    /** Distinct stored entity tags and how many times each occurs. */
    public TagCounts entityTagCounts() {
        return TagCounts.of(store.listEntities().stream().map(e -> store.getTags(e.id())).toList());
    }

    /** Distinct stored timeline tags and how many times each occurs. */
    public TagCounts timelineTagCounts() {
        return TagCounts.of(store.listTimelines().stream().map(t -> store.getTimelineTags(t.id())).toList());
    }

    /** Stored tag count of every entity, in store order. */
    public EntityTagCounts tagCountsPerEntity() {
        return new EntityTagCounts(store.listEntities().stream()
                .map(e -> new EntityTagCounts.EntityTagCount(e, store.getTags(e.id()).size()))
                .toList());
    }

    public TimelineStore store() {
        return store;
    }

    public EngineSettings settings() {
        return settings;
    }

    private TimelineView render(String rootId, EntitySnapshot entities) {
        TimelineGraphResolver.ContributingTimelines contributing = resolver.resolveContributing(rootId);
        ResolutionSnapshot snapshot = ResolutionSnapshot.capture(store, contributing.timelines(), entities);
        EntitySetComposer.Composition composition = composer.compose(contributing.ids(), snapshot);

        List<Entity> members = composition.entityIds().stream()
                .map(id -> entities.entity(id).orElseThrow())
                .toList();
        List<Entity> ordered = ChronologicalSorter.sort(members);

        List<String> warnings = new ArrayList<>(contributing.warnings());
        warnings.addAll(composition.warnings());
        logger.debug("Rendered timeline '{}': {} entities, {} warning(s)", rootId, ordered.size(), warnings.size());
        return new TimelineView(snapshot.timelines().get(rootId), List.copyOf(contributing.ids()), ordered, warnings);
    }
}
