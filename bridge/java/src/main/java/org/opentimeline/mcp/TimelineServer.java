package org.opentimeline.mcp;

import io.modelcontextprotocol.server.McpServer;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.spec.McpSchema;
import io.modelcontextprotocol.spec.McpServerTransportProvider;
import org.opentimeline.DatasetParser;
import org.opentimeline.DatasetValidator;
import org.opentimeline.EngineSettings;
import org.opentimeline.TimelineEngine;
import org.opentimeline.model.Entity;
import org.opentimeline.model.Timeline;
import org.opentimeline.model.TimelineDataset;
import org.opentimeline.resolve.ResolutionException;
import org.opentimeline.resolve.TimelineView;
import org.opentimeline.store.InMemoryTimelineStore;
import org.opentimeline.store.TimelineStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds and returns a configured MCP server for a timeline dataset.
 */
public final class TimelineServer {

    private static final Logger logger = LoggerFactory.getLogger(TimelineServer.class);

    private TimelineServer() {}

    // ── Internal helpers (package-private for tests) ──────────────────────────────

    /**
     * Holds the static resource list and per-URI read handlers built from a dataset.
     * Package-private so tests can invoke handlers directly without a transport.
     */
    record ResourceSet(
        List<McpSchema.Resource> resources,
        Map<String, ResourceHandler> handlers
    ) {}

    @FunctionalInterface
    interface ResourceHandler {
        McpSchema.ReadResourceResult handle(String uri);
    }

    static ResourceSet buildResources(Path datasetPath) throws IOException {
        return buildResources(DatasetParser.parse(datasetPath), EngineSettings.defaults());
    }

    /**
     * Builds the index, one resource per timeline and one per entity. Timelines are
     * rendered when read, so a timeline that fails to resolve still gets listed and
     * only its read fails.
     */
    static ResourceSet buildResources(TimelineDataset dataset, EngineSettings settings) {
        TimelineStore store = InMemoryTimelineStore.of(dataset);
        TimelineEngine engine = new TimelineEngine(store, settings);
        String slug  = TimelineMapper.datasetSlug(dataset.title());
        String title = dataset.title();

        List<McpSchema.Resource>     resources = new ArrayList<>();
        Map<String, ResourceHandler> handlers  = new LinkedHashMap<>();

        // ── index ─────────────────────────────────────────────────────────────────
        resources.add(TimelineMapper.buildIndexResource(slug, title));
        handlers.put(TimelineMapper.indexUri(slug), uri ->
            json(uri, TimelineMapper.buildIndexJson(title, slug, engine.entityCounts(),
                engine.entityTagCounts(), engine.timelineTagCounts())));

        // ── timelines ─────────────────────────────────────────────────────────────
        for (Timeline timeline : store.listTimelines()) {
            resources.add(TimelineMapper.buildTimelineResource(slug, timeline));
            final String timelineId = timeline.id();
            handlers.put(TimelineMapper.timelineUri(slug, timelineId), uri -> {
                TimelineView view;
                try {
                    view = engine.render(timelineId);
                } catch (ResolutionException e) {
                    logger.warn("Cannot render {}: {}", uri, e.getMessage());
                    throw e;
                }
                return json(uri, TimelineMapper.buildTimelineJson(view, slug));
            });
        }

        // ── entities ──────────────────────────────────────────────────────────────
        for (Entity entity : store.listEntities()) {
            resources.add(TimelineMapper.buildEntityResource(slug, entity));
            handlers.put(TimelineMapper.entityUri(slug, entity.id()), uri ->
                json(uri, TimelineMapper.buildEntityJson(entity, store.getTags(entity.id()))));
        }

        return new ResourceSet(resources, handlers);
    }

    private static McpSchema.ReadResourceResult json(String uri, String body) {
        return new McpSchema.ReadResourceResult(
            List.of(new McpSchema.TextResourceContents(uri, TimelineMapper.JSON_MIME, body)));
    }

    // ── Public factory ────────────────────────────────────────────────────────────

    /**
     * Parses and validates the dataset at {@code datasetPath} and returns a configured
     * MCP sync server ready to accept connections.
     *
     * @param datasetPath      path to the dataset YAML
     * @param transport        MCP transport provider (e.g. StdioServerTransportProvider)
     * @param warnOnValidation if true, log validation warnings
     * @throws IllegalArgumentException if the dataset has validation errors
     */
    public static McpSyncServer createServer(
            Path datasetPath,
            McpServerTransportProvider transport,
            boolean warnOnValidation) throws IOException {

        TimelineDataset dataset = DatasetParser.parse(datasetPath);
        DatasetValidator.ValidationResult validation = DatasetValidator.validate(dataset);
        if (warnOnValidation) {
            validation.warnings().forEach(w -> logger.warn("{}: {}", datasetPath, w));
        }
        if (!validation.isValid()) {
            throw new IllegalArgumentException(datasetPath + " is invalid: "
                + String.join("; ", validation.errors()));
        }

        ResourceSet rs = buildResources(dataset, EngineSettings.defaults());
        String slug    = TimelineMapper.datasetSlug(dataset.title());

        System.err.printf("[opentimeline-mcp] Serving '%s': %d timelines, %d entities%n",
            dataset.title() != null ? dataset.title() : slug,
            dataset.timelines().size(), dataset.entities().size());
        System.err.printf("[opentimeline-mcp] Start with: %s%n", TimelineMapper.indexUri(slug));

        McpSyncServer server = McpServer.sync(transport)
            .serverInfo("opentimeline-" + slug, "0.1.0")
            .capabilities(McpSchema.ServerCapabilities.builder()
                .resources(false, false)
                .build())
            .build();

        logger.info("Registering {} resources for {}", rs.resources().size(), datasetPath);
        for (McpSchema.Resource resource : rs.resources()) {
            ResourceHandler handler = rs.handlers().get(resource.uri());
            server.addResource(new McpServerFeatures.SyncResourceSpecification(
                resource,
                (exchange, request) -> handler.handle(request.uri())
            ));
        }

        return server;
    }
}
