package org.opentimeline.mcp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.modelcontextprotocol.spec.McpSchema;
import org.opentimeline.model.Entity;
import org.opentimeline.model.PartialDate;
import org.opentimeline.model.Tag;
import org.opentimeline.model.Timeline;
import org.opentimeline.resolve.TagCounts;
import org.opentimeline.resolve.TimelineCounts;
import org.opentimeline.resolve.TimelineView;

import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;

/**
 * Pure mapping functions: timeline model → MCP schema types and JSON bodies.
 * No I/O.
 */
public final class TimelineMapper {

    private TimelineMapper() {}

    private static final ObjectMapper JSON = new ObjectMapper();

    public static final String JSON_MIME = "application/json";

    private static final List<McpSchema.Role> BOTH = List.of(McpSchema.Role.ASSISTANT, McpSchema.Role.USER);

    private static final double INDEX_PRIORITY = 1.0;
    private static final double TIMELINE_PRIORITY = 0.8;
    private static final double ENTITY_PRIORITY = 0.5;

    // ── Slug ──────────────────────────────────────────────────────────────────────

    /** Lower-case, hyphenated form of the dataset title; {@code timelines} if there is none. */
    public static String datasetSlug(String title) {
        if (title == null || title.isBlank()) return "timelines";
        String s = title.trim().toLowerCase();
        s = s.replaceAll("\\s+", "-");
        s = s.replaceAll("[^a-z0-9\\-]", "");
        s = s.replaceAll("-{2,}", "-").replaceAll("^-|-$", "");
        return s.isEmpty() ? "timelines" : s;
    }

    // ── URIs ──────────────────────────────────────────────────────────────────────

    public static String indexUri(String slug) {
        return "opentimeline://" + slug + "/index";
    }

    public static String timelineUri(String slug, String timelineId) {
        return "opentimeline://" + slug + "/timelines/" + timelineId;
    }

    public static String entityUri(String slug, String entityId) {
        return "opentimeline://" + slug + "/entities/" + entityId;
    }

    // ── Resource building ─────────────────────────────────────────────────────────

    public static McpSchema.Resource buildIndexResource(String slug, String title) {
        return McpSchema.Resource.builder()
                .uri(indexUri(slug))
                .name("index")
                .description("Every timeline in " + (title != null ? "'" + title + "'" : "this dataset")
                        + " with its entity count")
                .mimeType(JSON_MIME)
                .annotations(new McpSchema.Annotations(BOTH, INDEX_PRIORITY))
                .build();
    }

    public static McpSchema.Resource buildTimelineResource(String slug, Timeline timeline) {
        return McpSchema.Resource.builder()
                .uri(timelineUri(slug, timeline.id()))
                .name(timeline.id())
                .description(buildDescription(timeline))
                .mimeType(JSON_MIME)
                .annotations(new McpSchema.Annotations(BOTH, TIMELINE_PRIORITY))
                .build();
    }

    public static McpSchema.Resource buildEntityResource(String slug, Entity entity) {
        return McpSchema.Resource.builder()
                .uri(entityUri(slug, entity.id()))
                .name(entity.id())
                .description(entity.name() + " (" + entity.span() + ")")
                .mimeType(JSON_MIME)
                .annotations(new McpSchema.Annotations(BOTH, ENTITY_PRIORITY))
                .build();
    }

    public static String buildDescription(Timeline timeline) {
        StringBuilder sb = new StringBuilder(timeline.name());
        if (timeline.hasExpression()) {
            sb.append("\nExpression: ").append(timeline.expression());
        }
        return sb.toString();
    }

    // ── JSON bodies ───────────────────────────────────────────────────────────────

    /** Timelines sorted by name, resolution failures, then stored tag counts largest first. */
    public static String buildIndexJson(String title, String slug, TimelineCounts counts,
                                        TagCounts entityTags, TagCounts timelineTags) {
        ObjectNode root = JSON.createObjectNode();
        root.put("title", title);
        root.put("timeline_count", counts.counts().size() + counts.failures().size());
        ArrayNode timelines = root.putArray("timelines");
        for (TimelineCounts.TimelineCount count : counts.sortedByName(true)) {
            ObjectNode t = timelines.addObject();
            t.put("id", count.timeline().id());
            t.put("name", count.timeline().name());
            t.put("uri", timelineUri(slug, count.timeline().id()));
            t.put("entity_count", count.entityCount());
        }
        ObjectNode failures = root.putObject("failures");
        counts.failures().entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .forEach(e -> failures.put(e.getKey(), e.getValue()));
        putTagCounts(root.putArray("entity_tags"), entityTags);
        putTagCounts(root.putArray("timeline_tags"), timelineTags);
        return write(root);
    }

    public static String buildTimelineJson(TimelineView view, String slug) {
        ObjectNode root = JSON.createObjectNode();
        root.put("id", view.timeline().id());
        root.put("name", view.timeline().name());
        root.put("expression", view.timeline().expression());
        ArrayNode contributing = root.putArray("contributing_timelines");
        view.contributingTimelineIds().forEach(contributing::add);
        root.put("entity_count", view.entities().size());
        ArrayNode entities = root.putArray("entities");
        for (Entity entity : view.entities()) {
            ObjectNode e = entities.addObject();
            putEntity(e, entity);
            e.put("uri", entityUri(slug, entity.id()));
        }
        ArrayNode warnings = root.putArray("warnings");
        view.warnings().forEach(warnings::add);
        return write(root);
    }

    public static String buildEntityJson(Entity entity, List<Tag> tags) {
        ObjectNode root = JSON.createObjectNode();
        putEntity(root, entity);
        ArrayNode tagArray = root.putArray("tags");
        for (Tag tag : tags) {
            ObjectNode t = tagArray.addObject();
            t.put("name", tag.name());
            t.put("value", tag.value());
        }
        return write(root);
    }

    // ── helpers ───────────────────────────────────────────────────────────────────

    private static void putEntity(ObjectNode node, Entity entity) {
        node.put("id", entity.id());
        node.put("name", entity.name());
        node.set("start", date(entity.start()));
        node.set("end", entity.end() != null ? date(entity.end()) : null);
        node.put("span", entity.span());
    }

    private static void putTagCounts(ArrayNode array, TagCounts counts) {
        for (TagCounts.TagCount count : counts.sortedByCount(true)) {
            ObjectNode t = array.addObject();
            t.put("name", count.tag().name());
            t.put("value", count.tag().value());
            t.put("count", count.count());
        }
    }

    private static ObjectNode date(PartialDate date) {
        ObjectNode d = JSON.createObjectNode();
        d.put("year", date.year());
        d.put("month", date.month());
        d.put("day", date.day());
        d.put("text", date.toString());
        d.put("short", date.toShortFormat());
        return d;
    }

    private static String write(ObjectNode node) {
        try {
            return JSON.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }
}
