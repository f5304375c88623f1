package no.cantara.intent.mcp;

import io.modelcontextprotocol.json.McpJsonDefaults;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.server.transport.StdioServerTransportProvider;
import no.cantara.intent.KernelConfigLoader;
import no.cantara.intent.KernelException;
import no.cantara.intent.decompose.DecompositionConfig;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;

/**
 * CLI entry point for intent-kernel-mcp.
 *
 * <pre>
 * Usage: intent-kernel-mcp [intent.yaml | bundle.json] [--config kernel.yaml]
 * </pre>
 */
public class IntentMcpCli {

    public static void main(String[] args) {
        Path source     = Path.of("intent.yaml");
        Path configPath = null;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--config" -> {
                    if (i + 1 < args.length) configPath = Path.of(args[++i]);
                }
                default -> {
                    if (!args[i].startsWith("-")) {
                        source = Path.of(args[i]);
                    }
                }
            }
        }

        if (!source.toFile().exists()) {
            System.err.println("[intent-mcp] Error: " + source + " not found");
            System.exit(1);
        }

        StdioServerTransportProvider transport =
            new StdioServerTransportProvider(McpJsonDefaults.getMapper());

        McpSyncServer server;
        try {
            DecompositionConfig config = configPath != null
                ? KernelConfigLoader.load(configPath)
                : DecompositionConfig.DEFAULTS;
            server = IntentServer.createServer(source, config, transport);
        } catch (KernelException e) {
            System.err.println("[intent-mcp] Intent refused (" + e.code() + "): " + e.getMessage());
            System.exit(1);
            return;
        } catch (IOException | IllegalArgumentException e) {
            System.err.println("[intent-mcp] Startup error: " + e.getMessage());
            System.exit(1);
            return;
        }

        // Block the main thread; transport handles I/O on daemon threads.
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
