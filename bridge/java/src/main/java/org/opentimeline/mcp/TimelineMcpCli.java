package org.opentimeline.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.server.transport.StdioServerTransportProvider;

import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;

/**
 * CLI entry point for opentimeline-mcp.
 *
 * <pre>
 * Usage: opentimeline-mcp [timelines.yaml] [--no-warnings]
 * </pre>
 */
public class TimelineMcpCli {

    public static void main(String[] args) {
        Path    datasetPath      = Path.of("timelines.yaml");
        boolean warnOnValidation = true;

        for (String arg : args) {
            if (arg.equals("--no-warnings")) {
                warnOnValidation = false;
            } else if (!arg.startsWith("-")) {
                datasetPath = Path.of(arg);
            } else {
                System.err.println("[opentimeline-mcp] Unknown option: " + arg);
                System.exit(1);
            }
        }

        if (!datasetPath.toFile().exists()) {
            System.err.println("[opentimeline-mcp] Error: dataset not found at " + datasetPath);
            System.exit(1);
        }

        StdioServerTransportProvider transport = new StdioServerTransportProvider(new ObjectMapper());

        McpSyncServer server;
        try {
            server = TimelineServer.createServer(datasetPath, transport, warnOnValidation);
        } catch (Exception e) {
            System.err.println("[opentimeline-mcp] Startup error: " + e.getMessage());
            System.exit(1);
            return;
        }

        // Block the main thread; transport handles I/O on daemon threads.
        // The process exits when stdin is closed (e.g. MCP client disconnects).
        CountDownLatch latch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            server.close();
            latch.countDown();
        }));
        try {
            latch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
