package org.opentimeline;

import org.opentimeline.expr.ExpressionParseException;
import org.opentimeline.expr.ExpressionParser;
import org.opentimeline.model.EntityEntry;
import org.opentimeline.model.TimelineDataset;
import org.opentimeline.model.TimelineEntry;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Checks a parsed {@link TimelineDataset} for integrity problems before it is served.
 *
 * <p>Errors are conditions that make some timeline unrenderable or the dataset
 * ambiguous. Warnings are tolerated at resolution time (dangling references are
 * skipped) but usually mean curated data has drifted. Tag names and values are not
 * checked against any schema.
 */
public class DatasetValidator {

    private static final Set<String> KNOWN_VERSIONS = Set.of("1");

    /**
     * Immutable result of validating a dataset.
     *
     * @param errors   Conditions that make the dataset invalid (MUST fix).
     * @param warnings Conditions that are permitted but suspicious (SHOULD fix).
     */
    public record ValidationResult(List<String> errors, List<String> warnings) {
        public ValidationResult {
            errors = List.copyOf(errors);
            warnings = List.copyOf(warnings);
        }

        public boolean isValid() { return errors.isEmpty(); }
        public boolean hasWarnings() { return !warnings.isEmpty(); }
    }

    public static ValidationResult validate(TimelineDataset dataset) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        if (dataset.version() == null || dataset.version().isBlank()) {
            warnings.add("dataset: 'opentimeline_version' not declared; assuming 1");
        } else if (!KNOWN_VERSIONS.contains(dataset.version())) {
            warnings.add("dataset: unknown opentimeline_version '" + dataset.version() + "'; processing as 1");
        }

        Set<String> entityIds = new HashSet<>();
        Set<String> entityNames = new HashSet<>();
        for (EntityEntry entry : dataset.entities()) {
            String p = "entity '" + entry.id() + "'";
            if (!entityIds.add(entry.id())) {
                errors.add(p + ": duplicate 'id'");
            }
            if (!entityNames.add(entry.entity().name())) {
                errors.add(p + ": duplicate name '" + entry.entity().name() + "'");
            }
        }

        Set<String> timelineIds = dataset.timelines().stream().map(TimelineEntry::id).collect(Collectors.toSet());
        Set<String> seenTimelineIds = new HashSet<>();
        Set<String> timelineNames = new HashSet<>();
        for (TimelineEntry entry : dataset.timelines()) {
            String p = "timeline '" + entry.id() + "'";
            if (!seenTimelineIds.add(entry.id())) {
                errors.add(p + ": duplicate 'id'");
            }
            if (entityIds.contains(entry.id())) {
                errors.add(p + ": 'id' is also used by an entity");
            }
            if (!timelineNames.add(entry.timeline().name())) {
                errors.add(p + ": duplicate name '" + entry.timeline().name() + "'");
            }

            if (entry.timeline().hasExpression()) {
                try {
                    ExpressionParser.parse(entry.timeline().expression());
                } catch (ExpressionParseException e) {
                    errors.add(p + ": invalid expression '" + entry.timeline().expression() + "' " + e.getMessage());
                }
            }

            for (String entityId : entry.entityIds()) {
                if (!entityIds.contains(entityId)) {
                    warnings.add(p + ": 'entities' references unknown entity '" + entityId + "'");
                }
            }
            for (String childId : entry.subtimelineIds()) {
                if (!timelineIds.contains(childId)) {
                    warnings.add(p + ": 'subtimelines' references unknown timeline '" + childId + "'");
                }
            }

            if (!entry.timeline().hasExpression() && entry.entityIds().isEmpty() && entry.subtimelineIds().isEmpty()) {
                warnings.add(p + ": has no expression, entities or sub-timelines and will always be empty");
            }
        }

        for (List<String> cycle : detectCycles(dataset.timelines(), timelineIds)) {
            errors.add("sub-timeline cycle: " + String.join(" -> ", cycle));
        }

        return new ValidationResult(errors, warnings);
    }

    /**
     * Detect cycles in the sub-timeline graph using DFS.
     *
     * @return One path per edge that closes a cycle, from the cycle's entry node back to
     *         itself, e.g. {@code [a, b, a]}.
     */
    static List<List<String>> detectCycles(List<TimelineEntry> timelines, Set<String> timelineIds) {
        Map<String, List<String>> adj = new HashMap<>();
        for (TimelineEntry timeline : timelines) {
            List<String> children = timeline.subtimelineIds().stream()
                    .filter(timelineIds::contains)
                    .toList();
            adj.put(timeline.id(), children);
        }

        List<List<String>> cycles = new ArrayList<>();
        Map<String, Integer> state = new HashMap<>();
        List<String> path = new ArrayList<>();
        for (TimelineEntry timeline : timelines) {
            if (state.getOrDefault(timeline.id(), 0) == 0) {
                dfs(timeline.id(), adj, state, path, cycles);
            }
        }
        return cycles;
    }

    // Iterative so that long sub-timeline chains cannot exhaust the thread stack.
    private static void dfs(String start, Map<String, List<String>> adj, Map<String, Integer> state,
                            List<String> path, List<List<String>> cycles) {
        Deque<Iterator<String>> pending = new ArrayDeque<>();
        state.put(start, 1);
        path.add(start);
        pending.push(adj.getOrDefault(start, List.of()).iterator());
        while (!pending.isEmpty()) {
            Iterator<String> children = pending.peek();
            if (!children.hasNext()) {
                pending.pop();
                state.put(path.remove(path.size() - 1), 2);
                continue;
            }
            String child = children.next();
            int childState = state.getOrDefault(child, 0);
            if (childState == 1) {
                List<String> cycle = new ArrayList<>(path.subList(path.indexOf(child), path.size()));
                cycle.add(child);
                cycles.add(cycle);
            } else if (childState == 0) {
                state.put(child, 1);
                path.add(child);
                pending.push(adj.getOrDefault(child, List.of()).iterator());
            }
        }
    }
}
