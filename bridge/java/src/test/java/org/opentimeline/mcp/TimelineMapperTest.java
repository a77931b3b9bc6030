package org.opentimeline.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.spec.McpSchema;
import org.junit.jupiter.api.Test;
import org.opentimeline.model.Entity;
import org.opentimeline.model.PartialDate;
import org.opentimeline.model.Tag;
import org.opentimeline.model.Timeline;
import org.opentimeline.resolve.TagCounts;
import org.opentimeline.resolve.TimelineCounts;
import org.opentimeline.resolve.TimelineView;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/** Pure unit tests for TimelineMapper: no I/O, no MCP transport. */
class TimelineMapperTest {

    private static final ObjectMapper OM = new ObjectMapper();

    private static final Entity SOMME = new Entity("somme", "Battle of the Somme",
            PartialDate.ofMonth(1916, 7), PartialDate.ofMonth(1916, 11));
    private static final Entity SARAJEVO = new Entity("sarajevo", "Sarajevo", PartialDate.of(1914, 6, 28));

    // ── datasetSlug ───────────────────────────────────────────────────────────────

    @Test void slugLowercasesAndHyphenates() {
        assertEquals("the-great-war", TimelineMapper.datasetSlug("The Great War"));
    }

    @Test void slugCollapsesSpacesAndTrims() {
        assertEquals("world-history", TimelineMapper.datasetSlug("  World   History "));
    }

    @Test void slugRemovesSpecialChars() {
        assertEquals("kings-queens", TimelineMapper.datasetSlug("Kings & Queens!"));
    }

    @Test void slugFallsBackWithoutTitle() {
        assertEquals("timelines", TimelineMapper.datasetSlug(null));
        assertEquals("timelines", TimelineMapper.datasetSlug(" "));
        assertEquals("timelines", TimelineMapper.datasetSlug("!!!"));
    }

    // ── URIs ──────────────────────────────────────────────────────────────────────

    @Test void uris() {
        assertEquals("opentimeline://ww1/index", TimelineMapper.indexUri("ww1"));
        assertEquals("opentimeline://ww1/timelines/great-war", TimelineMapper.timelineUri("ww1", "great-war"));
        assertEquals("opentimeline://ww1/entities/somme", TimelineMapper.entityUri("ww1", "somme"));
    }

    // ── Resources ─────────────────────────────────────────────────────────────────

    @Test void indexResourceHasTopPriority() {
        McpSchema.Resource r = TimelineMapper.buildIndexResource("ww1", "The Great War");
        assertEquals("opentimeline://ww1/index", r.uri());
        assertEquals("index", r.name());
        assertEquals("application/json", r.mimeType());
        assertEquals(1.0, r.annotations().priority());
        assertTrue(r.description().contains("'The Great War'"));
    }

    @Test void timelineResourceDescribesExpression() {
        McpSchema.Resource r = TimelineMapper.buildTimelineResource("ww1",
                new Timeline("great-war", "The Great War", "era = \"ww1\""));
        assertEquals("great-war", r.name());
        assertEquals("The Great War\nExpression: era = \"ww1\"", r.description());
        assertTrue(r.annotations().priority() < 1.0);
    }

    @Test void timelineWithoutExpressionHasNameOnly() {
        assertEquals("Picked", TimelineMapper.buildDescription(new Timeline("p", "Picked", null)));
    }

    @Test void entityResourceShowsSpan() {
        McpSchema.Resource r = TimelineMapper.buildEntityResource("ww1", SOMME);
        assertEquals("opentimeline://ww1/entities/somme", r.uri());
        assertEquals("Battle of the Somme (Jul 1916 to Nov 1916)", r.description());
        assertTrue(r.annotations().audience().contains(McpSchema.Role.ASSISTANT));
    }

    // ── JSON ──────────────────────────────────────────────────────────────────────

    @Test void indexJsonListsTimelinesByName() throws Exception {
        TimelineCounts counts = new TimelineCounts(List.of(
                new TimelineCounts.TimelineCount(new Timeline("n", "Nations", null), 4),
                new TimelineCounts.TimelineCount(new Timeline("g", "Great War", null), 6)),
                Map.of("x", "Sub-timeline cycle: x -> x"));
        TagCounts entityTags = TagCounts.of(List.of(
                List.of(Tag.of("era", "ww1"), Tag.anonymous("king")),
                List.of(Tag.of("era", "ww1"))));
        JsonNode body = OM.readTree(TimelineMapper.buildIndexJson("The Great War", "ww1", counts,
                entityTags, TagCounts.of(List.of())));

        assertEquals("The Great War", body.get("title").asText());
        assertEquals(3, body.get("timeline_count").asInt());
        assertEquals("Great War", body.get("timelines").get(0).get("name").asText());
        assertEquals(6, body.get("timelines").get(0).get("entity_count").asInt());
        assertEquals("opentimeline://ww1/timelines/g", body.get("timelines").get(0).get("uri").asText());
        assertEquals("Sub-timeline cycle: x -> x", body.get("failures").get("x").asText());

        JsonNode first = body.get("entity_tags").get(0);
        assertEquals("era", first.get("name").asText());
        assertEquals("ww1", first.get("value").asText());
        assertEquals(2, first.get("count").asInt());
        assertTrue(body.get("entity_tags").get(1).get("name").isNull());
        assertEquals(0, body.get("timeline_tags").size());
    }

    @Test void timelineJsonKeepsRenderedOrder() throws Exception {
        TimelineView view = new TimelineView(new Timeline("g", "Great War", "era exists"),
                List.of("g", "n"), List.of(SARAJEVO, SOMME), List.of("timeline 'n': linked entity 'x' does not exist"));
        JsonNode body = OM.readTree(TimelineMapper.buildTimelineJson(view, "ww1"));

        assertEquals("era exists", body.get("expression").asText());
        assertEquals(2, body.get("entity_count").asInt());
        assertEquals("sarajevo", body.get("entities").get(0).get("id").asText());
        assertEquals("somme", body.get("entities").get(1).get("id").asText());
        assertEquals("n", body.get("contributing_timelines").get(1).asText());
        assertEquals(1, body.get("warnings").size());
    }

    @Test void entityJsonCarriesPartialDatesAndTags() throws Exception {
        JsonNode body = OM.readTree(TimelineMapper.buildEntityJson(SOMME,
                List.of(Tag.of("era", "ww1"), Tag.anonymous("battle"))));

        assertEquals(1916, body.get("start").get("year").asInt());
        assertEquals(7, body.get("start").get("month").asInt());
        assertTrue(body.get("start").get("day").isNull());
        assertEquals("1916-11", body.get("end").get("text").asText());
        assertEquals("- / 11 / 1916", body.get("end").get("short").asText());
        assertEquals("Jul 1916 to Nov 1916", body.get("span").asText());
        assertEquals("era", body.get("tags").get(0).get("name").asText());
        assertTrue(body.get("tags").get(1).get("name").isNull());
        assertEquals("battle", body.get("tags").get(1).get("value").asText());
    }

    @Test void openEndedEntityHasNullEnd() throws Exception {
        JsonNode body = OM.readTree(TimelineMapper.buildEntityJson(SARAJEVO, List.of()));
        assertTrue(body.get("end").isNull());
        assertEquals("28 Jun 1914", body.get("span").asText());
        assertEquals(0, body.get("tags").size());
    }
}
