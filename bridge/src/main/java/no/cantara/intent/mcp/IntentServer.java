package no.cantara.intent.mcp;

import io.modelcontextprotocol.server.McpServer;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.spec.McpSchema;
import io.modelcontextprotocol.spec.McpServerTransportProvider;
import no.cantara.intent.IntentKernel;
import no.cantara.intent.IntentParser;
import no.cantara.intent.KernelException;
import no.cantara.intent.canonical.ArtifactJson;
import no.cantara.intent.canonical.Canonicalizer;
import no.cantara.intent.decompose.DecompositionConfig;
import no.cantara.intent.model.Bundle;
import no.cantara.intent.verify.VerificationResult;
import no.cantara.intent.verify.Values;
import no.cantara.intent.verify.bundle.BundleSummarizer;
import no.cantara.intent.verify.bundle.BundleVerifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static no.cantara.intent.verify.Values.asList;

/**
 * Builds and returns a configured MCP server for a context bundle, either read
 * from a bundle JSON file or transformed from an intent YAML file at startup.
 */
public final class IntentServer {

    private static final Logger log = LoggerFactory.getLogger(IntentServer.class);

    private IntentServer() {}

    // ── Internal helpers (package-private for tests) ──────────────────────────────

    /**
     * Holds the static resource list and per-URI read handlers built from a bundle.
     * Package-private so tests can invoke handlers directly without a transport.
     */
    record ResourceSet(
        String bundleId,
        String goal,
        List<McpSchema.Resource> resources,
        Map<String, ResourceHandler> handlers
    ) {}

    @FunctionalInterface
    interface ResourceHandler {
        McpSchema.ReadResourceResult handle(String uri);
    }

    /**
     * The bundle in wire form. A {@code .json} source must pass bundle verification;
     * anything else is parsed as an intent and transformed.
     *
     * @throws IllegalArgumentException if a bundle file does not verify
     * @throws KernelException          if the intent is refused
     */
    static Map<String, Object> loadBundle(Path source, DecompositionConfig config)
            throws IOException, KernelException {
        if (source.getFileName().toString().endsWith(".json")) {
            Object raw = ArtifactJson.read(source);
            VerificationResult result = new BundleVerifier().verify(raw);
            if (!result.isValid()) {
                throw new IllegalArgumentException("Bundle does not verify: " + result.violations().size()
                    + " violation(s), first: " + result.violations().get(0));
            }
            return Values.asObject(raw);
        }
        Bundle bundle = new IntentKernel(config).transform(IntentParser.parse(source));
        return Values.asObject(BundleVerifier.wireForm(bundle));
    }

    /**
     * Loads the bundle and builds all resources and their read handlers.
     * Extracted for direct testing without a transport.
     */
    static ResourceSet buildResources(Path source, DecompositionConfig config) throws IOException, KernelException {
        Map<String, Object> bundle = loadBundle(source, config);
        String bundleId = (String) bundle.get("id");
        String status   = (String) bundle.get("status");
        Map<String, Object> root = Values.asObject(bundle.get("root_node"));
        String goal = root != null && root.get("goal") instanceof String g ? g : bundleId;

        List<McpSchema.Resource>     resources = new ArrayList<>();
        Map<String, ResourceHandler> handlers  = new LinkedHashMap<>();

        // ── bundle, summary and questions ─────────────────────────────────────────
        String bundleJson = Canonicalizer.canonicalize(bundle);
        resources.add(IntentMapper.buildBundleResource(bundleId, status));
        handlers.put(IntentMapper.bundleUri(bundleId), uri -> text(uri, "application/json", bundleJson));

        String summaryJson = Canonicalizer.canonicalize(BundleSummarizer.summarize(bundle));
        resources.add(IntentMapper.buildSummaryResource(bundleId));
        handlers.put(IntentMapper.summaryUri(bundleId), uri -> text(uri, "application/json", summaryJson));

        List<Object> questions = asList(bundle.get("unresolved_questions"));
        String questionsText = IntentMapper.buildQuestionsMarkdown(bundle);
        resources.add(IntentMapper.buildQuestionsResource(bundleId, questions == null ? 0 : questions.size()));
        handlers.put(IntentMapper.questionsUri(bundleId), uri -> text(uri, "text/markdown", questionsText));

        // ── output resources ──────────────────────────────────────────────────────
        for (Object item : asList(bundle.get("outputs"))) {
            Map<String, Object> output = Values.asObject(item);
            McpSchema.Resource resource = IntentMapper.buildOutputResource(bundleId, output);
            resources.add(resource);

            final String mime    = resource.mimeType();
            final String content = (String) output.get("content");
            handlers.put(resource.uri(), uri -> text(uri, mime, content));
        }

        return new ResourceSet(bundleId, goal, resources, handlers);
    }

    private static McpSchema.ReadResourceResult text(String uri, String mime, String content) {
        return new McpSchema.ReadResourceResult(
            List.of(new McpSchema.TextResourceContents(uri, mime, content, null)),
            null
        );
    }

    // ── Public factory ────────────────────────────────────────────────────────────

    /**
     * Loads or transforms the bundle at {@code source} and returns a configured
     * MCP sync server ready to accept connections.
     *
     * @param source    bundle JSON or intent YAML
     * @param config    decomposition settings used when transforming an intent
     * @param transport MCP transport provider (e.g. StdioServerTransportProvider)
     */
    public static McpSyncServer createServer(
            Path source,
            DecompositionConfig config,
            McpServerTransportProvider transport) throws IOException, KernelException {

        ResourceSet rs = buildResources(source, config);
        String slug = IntentMapper.goalSlug(rs.goal());

        log.info("Serving bundle {} for '{}' with {} resources", rs.bundleId(), rs.goal(), rs.resources().size());
        log.info("Start with: {}", IntentMapper.summaryUri(rs.bundleId()));

        McpSyncServer server = McpServer.sync(transport)
            .serverInfo("intent-" + slug, Bundle.KERNEL_VERSION)
            .capabilities(McpSchema.ServerCapabilities.builder()
                .resources(null, null)
                .build())
            .build();

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
