package org.opentimeline.resolve;

import org.opentimeline.expr.ExpressionCache;
import org.opentimeline.expr.ExpressionEvaluator;
import org.opentimeline.expr.ExpressionParseException;
import org.opentimeline.expr.Predicate;
import org.opentimeline.model.Entity;
import org.opentimeline.model.Timeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Unions the entities every contributing timeline brings in: its explicit links plus
 * every entity whose tags satisfy its expression.
 *
 * <p>Composition is union-only. No timeline can remove an entity another one added,
 * and an entity selected several times appears once, at its first position.
 */
public class EntitySetComposer {

    private static final Logger logger = LoggerFactory.getLogger(EntitySetComposer.class);

    /**
     * @param entityIds Distinct entity IDs in contributing-timeline order.
     * @param warnings  Dangling links that were skipped.
     */
    public record Composition(Set<String> entityIds, List<String> warnings) {
        public Composition {
            entityIds = Collections.unmodifiableSet(new LinkedHashSet<>(entityIds));
            warnings = List.copyOf(warnings);
        }
    }

    private record Contribution(List<String> entityIds, List<String> warnings) {}

    private final ExpressionCache expressions;
    private final boolean parallel;

    public EntitySetComposer(ExpressionCache expressions, boolean parallel) {
        this.expressions = expressions;
        this.parallel = parallel;
    }

    /**
     * @throws TimelineExpressionException if any contributing timeline's expression is
     *                                     malformed; nothing is evaluated in that case
     */
    public Composition compose(Collection<String> contributingIds, ResolutionSnapshot snapshot) {
        Map<String, Predicate> compiled = compile(contributingIds, snapshot);

        Stream<String> ids = parallel ? contributingIds.parallelStream() : contributingIds.stream();
        List<Contribution> contributions = ids
                .map(id -> contribute(id, compiled.get(id), snapshot))
                .toList();

        Set<String> entityIds = new LinkedHashSet<>();
        List<String> warnings = new ArrayList<>();
        for (Contribution c : contributions) {
            entityIds.addAll(c.entityIds());
            warnings.addAll(c.warnings());
        }
        logger.debug("Composed {} entities from {} timeline(s)", entityIds.size(), contributingIds.size());
        return new Composition(entityIds, warnings);
    }

    private Map<String, Predicate> compile(Collection<String> contributingIds, ResolutionSnapshot snapshot) {
        Map<String, Predicate> compiled = new LinkedHashMap<>();
        for (String id : contributingIds) {
            Timeline timeline = snapshot.timelines().get(id);
            if (timeline == null) {
                throw new TimelineNotFoundException(id);
            }
            if (!timeline.hasExpression()) {
                continue;
            }
            try {
                compiled.put(id, expressions.get(timeline.expression()));
            } catch (ExpressionParseException e) {
                throw new TimelineExpressionException(id, timeline.expression(), e);
            }
        }
        return compiled;
    }

    private static Contribution contribute(String timelineId, Predicate predicate, ResolutionSnapshot snapshot) {
        List<String> entityIds = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        EntitySnapshot entities = snapshot.entities();

        for (String entityId : snapshot.linkedEntities(timelineId)) {
            if (entities.entity(entityId).isPresent()) {
                entityIds.add(entityId);
            } else {
                String warning = "timeline '" + timelineId + "': linked entity '" + entityId + "' does not exist";
                logger.warn("Skipping dangling link, {}", warning);
                warnings.add(warning);
            }
        }

        if (predicate != null) {
            for (Entity entity : entities.entities()) {
                if (ExpressionEvaluator.evaluate(predicate, entities.tags(entity.id()))) {
                    entityIds.add(entity.id());
                }
            }
        }
        return new Contribution(entityIds, warnings);
    }
}
