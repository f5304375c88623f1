package no.cantara.intent.mcp;

import io.modelcontextprotocol.spec.McpSchema;
import no.cantara.intent.verify.Values;

import java.util.List;
import java.util.Locale;
import java.util.Map;

import static no.cantara.intent.verify.Values.asList;

/**
 * Pure mapping functions: bundle wire form → MCP schema types.
 * No I/O.
 */
public final class IntentMapper {

    private IntentMapper() {}

    // ── MIME tables ───────────────────────────────────────────────────────────────

    private static final Map<String, String> EXT_MIME = Map.ofEntries(
        Map.entry(".md",   "text/markdown"),
        Map.entry(".yaml", "application/yaml"),
        Map.entry(".yml",  "application/yaml"),
        Map.entry(".json", "application/json"),
        Map.entry(".txt",  "text/plain"),
        Map.entry(".sh",   "text/x-shellscript")
    );

    private static final Map<String, String> TYPE_MIME = Map.of(
        "command", "text/x-shellscript",
        "config",  "application/yaml",
        "schema",  "application/json"
    );

    // ── Slug ──────────────────────────────────────────────────────────────────────

    /** Lowercase, dash-separated server name fragment from a goal; at most 40 chars. */
    public static String goalSlug(String goal) {
        String s = goal.toLowerCase(Locale.ROOT);
        s = s.replaceAll("\\s+", "-");
        s = s.replaceAll("[^a-z0-9\\-]", "");
        s = s.replaceAll("-{2,}", "-");
        if (s.length() > 40) s = s.substring(0, 40);
        s = s.replaceAll("^-+|-+$", "");
        return s.isEmpty() ? "intent" : s;
    }

    // ── URIs ──────────────────────────────────────────────────────────────────────

    public static String bundleUri(String bundleId) {
        return "intent://" + bundleId + "/bundle";
    }

    public static String summaryUri(String bundleId) {
        return "intent://" + bundleId + "/summary";
    }

    public static String questionsUri(String bundleId) {
        return "intent://" + bundleId + "/questions";
    }

    public static String outputUri(String bundleId, String outputId) {
        return "intent://" + bundleId + "/outputs/" + outputId;
    }

    // ── MIME ──────────────────────────────────────────────────────────────────────

    public static String resolveMime(Map<String, Object> output) {
        String path = Values.asString(output.get("path"));
        if (path != null) {
            int dot = path.lastIndexOf('.');
            if (dot >= 0) {
                String mime = EXT_MIME.get(path.substring(dot).toLowerCase(Locale.ROOT));
                if (mime != null) return mime;
            }
        }
        String type = Values.asString(output.get("type"));
        if (type != null) {
            String mime = TYPE_MIME.get(type);
            if (mime != null) return mime;
        }
        return "text/plain";
    }

    // ── Resource building ─────────────────────────────────────────────────────────

    public static String buildDescription(Map<String, Object> output) {
        StringBuilder sb = new StringBuilder("Context for a terminal sub-goal");
        List<String> constraints = Values.strings(output.get("source_constraints"));
        if (constraints != null && !constraints.isEmpty()) {
            sb.append("\nConstraints: ").append(String.join("; ", constraints));
        }
        Object confidence = output.get("confidence");
        if (Values.isInteger(confidence)) {
            sb.append("\nConfidence: ").append(Values.longValue(confidence));
        }
        return sb.toString();
    }

    /** Output priority follows its confidence score, 0-100 scaled to 0.0-1.0. */
    public static double outputPriority(Map<String, Object> output) {
        Object confidence = output.get("confidence");
        if (!Values.isInteger(confidence)) return 0.5;
        return Math.max(0, Math.min(100, Values.longValue(confidence))) / 100.0;
    }

    public static McpSchema.Resource buildOutputResource(String bundleId, Map<String, Object> output) {
        McpSchema.Annotations annotations = new McpSchema.Annotations(
            List.of(McpSchema.Role.ASSISTANT), outputPriority(output), null);

        return new McpSchema.Resource(
            outputUri(bundleId, (String) output.get("id")),
            (String) output.get("id"),
            Values.asString(output.get("path")),  // title
            buildDescription(output),              // description
            resolveMime(output),
            null,                                  // size
            annotations,
            null                                   // meta
        );
    }

    public static McpSchema.Resource buildBundleResource(String bundleId, String status) {
        McpSchema.Annotations annotations = new McpSchema.Annotations(
            List.of(McpSchema.Role.ASSISTANT, McpSchema.Role.USER), 1.0, null);
        return new McpSchema.Resource(
            bundleUri(bundleId),
            "bundle",
            "Context bundle (" + status + ")",
            "Canonical bundle: decomposition, terminal nodes, outputs and unresolved questions",
            "application/json",
            null,
            annotations,
            null
        );
    }

    public static McpSchema.Resource buildSummaryResource(String bundleId) {
        McpSchema.Annotations annotations = new McpSchema.Annotations(
            List.of(McpSchema.Role.ASSISTANT, McpSchema.Role.USER), 0.9, null);
        return new McpSchema.Resource(
            summaryUri(bundleId),
            "summary",
            "Bundle summary",
            "Outcome, bundle hash, artifact paths, question ids and terminal node ids",
            "application/json",
            null,
            annotations,
            null
        );
    }

    /** Questions matter most to the user when the bundle cannot complete without answers. */
    public static McpSchema.Resource buildQuestionsResource(String bundleId, int questionCount) {
        McpSchema.Annotations annotations = new McpSchema.Annotations(
            List.of(McpSchema.Role.USER), questionCount > 0 ? 1.0 : 0.3, null);
        return new McpSchema.Resource(
            questionsUri(bundleId),
            "questions",
            "Unresolved questions (" + questionCount + ")",
            "Questions to answer before the goal can be decomposed further, highest priority first",
            "text/markdown",
            null,
            annotations,
            null
        );
    }

    // ── Questions text ────────────────────────────────────────────────────────────

    public static String buildQuestionsMarkdown(Map<String, Object> bundle) {
        List<Object> questions = asList(bundle.get("unresolved_questions"));
        StringBuilder sb = new StringBuilder("# Unresolved Questions\n\n");
        if (questions == null || questions.isEmpty()) {
            return sb.append("_None_\n").toString();
        }
        for (Object item : questions) {
            Map<String, Object> q = Values.asObject(item);
            if (q == null) continue;
            sb.append("- **").append(q.get("text")).append("** (").append(q.get("expected_answer_type"))
              .append(", priority ").append(q.get("priority")).append(")\n");
            List<String> options = Values.strings(q.get("options"));
            if (options != null && !options.isEmpty()) {
                sb.append("  Options: ").append(String.join(", ", options)).append('\n');
            }
            sb.append("  ").append(q.get("why_needed")).append('\n');
        }
        return sb.toString();
    }
}
