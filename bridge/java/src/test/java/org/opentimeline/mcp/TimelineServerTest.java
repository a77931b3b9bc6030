package org.opentimeline.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.spec.McpSchema;
import org.junit.jupiter.api.Test;
import org.opentimeline.DatasetParser;
import org.opentimeline.EngineSettings;
import org.opentimeline.TimelineEngine;
import org.opentimeline.model.Entity;
import org.opentimeline.resolve.TimelineCycleException;
import org.opentimeline.store.InMemoryTimelineStore;

import java.net.URL;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for TimelineServer: invoke buildResources() and read handlers
 * directly, without a real MCP transport.
 */
class TimelineServerTest {

    private static final ObjectMapper OM = new ObjectMapper();

    private static Path fixture(String name) {
        URL url = TimelineServerTest.class.getClassLoader()
            .getResource("fixtures/" + name + "/timelines.yaml");
        assertNotNull(url, "fixture not found: " + name);
        return Paths.get(url.getPath());
    }

    private static JsonNode read(TimelineServer.ResourceSet rs, String uri) throws Exception {
        McpSchema.ReadResourceResult result = rs.handlers().get(uri).handle(uri);
        assertEquals(1, result.contents().size());
        McpSchema.TextResourceContents text = (McpSchema.TextResourceContents) result.contents().get(0);
        assertEquals("application/json", text.mimeType());
        assertEquals(uri, text.uri());
        return OM.readTree(text.text());
    }

    // ── list_resources ────────────────────────────────────────────────────────────

    @Test void buildResourcesThrowsOnMissingDataset() {
        assertThrows(Exception.class,
            () -> TimelineServer.buildResources(Path.of("/nonexistent/timelines.yaml")));
    }

    @Test void indexPlusOneResourcePerTimelineAndEntity() throws Exception {
        TimelineServer.ResourceSet rs = TimelineServer.buildResources(fixture("great-war"));
        // index + 3 timelines + 7 entities
        assertEquals(11, rs.resources().size());
        assertEquals(rs.resources().size(), rs.handlers().size());
        assertEquals("opentimeline://the-great-war/index", rs.resources().get(0).uri());
    }

    @Test void everyResourceHasAHandler() throws Exception {
        TimelineServer.ResourceSet rs = TimelineServer.buildResources(fixture("great-war"));
        for (McpSchema.Resource r : rs.resources()) {
            assertNotNull(rs.handlers().get(r.uri()), r.uri());
        }
    }

    // ── read_resource ─────────────────────────────────────────────────────────────

    @Test void readIndexReturnsCounts() throws Exception {
        TimelineServer.ResourceSet rs = TimelineServer.buildResources(fixture("great-war"));
        JsonNode body = read(rs, "opentimeline://the-great-war/index");
        assertEquals("The Great War", body.get("title").asText());
        assertEquals(3, body.get("timeline_count").asInt());

        List<String> names = new ArrayList<>();
        body.get("timelines").forEach(t -> names.add(t.get("name").asText()));
        assertEquals(List.of("Nations", "People", "The Great War"), names);
        assertEquals(2, body.get("timelines").get(1).get("entity_count").asInt());
        assertEquals(6, body.get("timelines").get(2).get("entity_count").asInt());
    }

    @Test void readIndexReturnsTagCounts() throws Exception {
        TimelineServer.ResourceSet rs = TimelineServer.buildResources(fixture("great-war"));
        JsonNode body = read(rs, "opentimeline://the-great-war/index");

        assertEquals(7, body.get("entity_tags").size());
        assertEquals("era", body.get("entity_tags").get(0).get("name").asText());
        assertEquals(3, body.get("entity_tags").get(0).get("count").asInt());
        assertEquals("kind", body.get("timeline_tags").get(0).get("name").asText());
        assertEquals(2, body.get("timeline_tags").get(0).get("count").asInt());
    }

    @Test void readTimelineMatchesEngineOrder() throws Exception {
        Path path = fixture("great-war");
        TimelineServer.ResourceSet rs = TimelineServer.buildResources(path);
        JsonNode body = read(rs, "opentimeline://the-great-war/timelines/great-war");

        List<String> served = new ArrayList<>();
        body.get("entities").forEach(e -> served.add(e.get("id").asText()));

        TimelineEngine engine = new TimelineEngine(
            InMemoryTimelineStore.of(DatasetParser.parse(path)), EngineSettings.defaults());
        List<String> rendered = engine.renderTimeline("great-war").stream().map(Entity::id).toList();

        assertEquals(rendered, served);
        assertEquals("george-v", served.get(0));
        assertEquals("opentimeline://the-great-war/entities/george-v",
            body.get("entities").get(0).get("uri").asText());
    }

    @Test void readEntityReturnsStoredTags() throws Exception {
        TimelineServer.ResourceSet rs = TimelineServer.buildResources(fixture("great-war"));
        JsonNode body = read(rs, "opentimeline://the-great-war/entities/somme");
        assertEquals("Battle of the Somme", body.get("name").asText());
        assertEquals(3, body.get("tags").size());
    }

    @Test void brokenTimelineIsListedButFailsOnRead() throws Exception {
        TimelineServer.ResourceSet rs = TimelineServer.buildResources(fixture("broken"));
        String uri = "opentimeline://broken-data/timelines/loop-a";
        assertNotNull(rs.handlers().get(uri));
        assertThrows(TimelineCycleException.class, () -> rs.handlers().get(uri).handle(uri));

        JsonNode index = read(rs, "opentimeline://broken-data/index");
        assertEquals(1, index.get("timelines").size());
        assertTrue(index.get("failures").has("loop-a"));
        assertTrue(index.get("failures").has("loop-b"));
    }

    @Test void readUnknownHandlerReturnsNull() throws Exception {
        TimelineServer.ResourceSet rs = TimelineServer.buildResources(fixture("great-war"));
        // No handler for unknown URI: map returns null (SDK would reject this)
        assertNull(rs.handlers().get("opentimeline://the-great-war/timelines/nonexistent"));
    }

    // ── create_server ─────────────────────────────────────────────────────────────

    @Test void invalidDatasetIsRejectedBeforeServing() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> TimelineServer.createServer(fixture("broken"), null, false));
        assertTrue(e.getMessage().contains("sub-timeline cycle"));
    }
}
