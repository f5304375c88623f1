package no.cantara.intent.verify.bundle;

import no.cantara.intent.canonical.ArtifactJson;
import no.cantara.intent.canonical.CanonicalizationException;
import no.cantara.intent.canonical.Canonicalizer;
import no.cantara.intent.model.Bundle;
import no.cantara.intent.verify.ArtifactVerifier;
import no.cantara.intent.verify.Rule;
import no.cantara.intent.verify.RuleCatalogue;
import no.cantara.intent.verify.RuleSink;
import no.cantara.intent.verify.Values;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static no.cantara.intent.verify.Values.asList;
import static no.cantara.intent.verify.Values.asObject;

/**
 * Verifies a decomposition bundle.
 *
 * <ul>
 *   <li>SCHEMA: required top-level fields present</li>
 *   <li>BS1: schema_version is a non-empty string</li>
 *   <li>BS3: outputs sorted by path</li>
 *   <li>BS4: constraint lists sorted (root, terminal nodes, output sources)</li>
 *   <li>BS5: question lists sorted by priority desc, id asc</li>
 *   <li>BS6: terminal_nodes sorted by id</li>
 *   <li>BS7: output paths relative, without {@code ..} or backslashes</li>
 *   <li>BS8: canonical form is stable through a JSON round trip</li>
 *   <li>BS9: bundle id matches its content</li>
 *   <li>BS10: every output content_hash matches its content</li>
 * </ul>
 */
public final class BundleVerifier extends ArtifactVerifier<BundleVerifyOptions> {

    static final List<String> REQUIRED_FIELDS = List.of(
            "id", "schema_version", "kernel_version", "status", "root_node",
            "terminal_nodes", "outputs", "unresolved_questions", "stats");

    public BundleVerifier() {
        super("bundle", RuleCatalogue.<BundleVerifyOptions>of(
                Rule.of("SCHEMA", "Required fields present", BundleVerifier::checkRequiredFields),
                Rule.of("BS1", "Schema version present", BundleVerifier::checkSchemaVersion),
                Rule.of("BS3", "Outputs sorted by path", BundleVerifier::checkOutputsSorted),
                Rule.of("BS4", "Constraints sorted", BundleVerifier::checkConstraintsSorted),
                Rule.of("BS5", "Questions sorted", BundleVerifier::checkQuestionsSorted),
                Rule.of("BS6", "Terminal nodes sorted by id", BundleVerifier::checkTerminalNodesSorted),
                Rule.of("BS7", "Output paths safe", BundleVerifier::checkOutputPaths),
                Rule.of("BS8", "Canonical form idempotent", BundleVerifier::checkCanonicalIdempotent),
                Rule.of("BS9", "Bundle id matches content", BundleVerifier::checkBundleId),
                Rule.of("BS10", "Output hashes match content", BundleVerifier::checkOutputHashes)));
    }

    /** Verify a typed bundle through its wire form. */
    public static Object wireForm(Bundle bundle) {
        return ArtifactJson.parse(Canonicalizer.canonicalize(bundle));
    }

    @Override
    protected BundleVerifyOptions defaultOptions() {
        return BundleVerifyOptions.DEFAULTS;
    }

    /** A bundle has no ephemeral fields; the core is the whole bundle. */
    @Override
    public Map<String, Object> computeCore(Map<String, Object> artifact) {
        return new LinkedHashMap<>(artifact);
    }

    @Override
    protected Map<String, Long> summarize(Map<String, Object> artifact) {
        Map<String, Long> summary = new LinkedHashMap<>();
        summary.put("outputs", size(artifact.get("outputs")));
        summary.put("terminal_nodes", size(artifact.get("terminal_nodes")));
        summary.put("unresolved_questions", size(artifact.get("unresolved_questions")));
        return summary;
    }

    // ── rules ───────────────────────────────────────────────────────────────

    private static void checkRequiredFields(Map<String, Object> bundle, BundleVerifyOptions options, RuleSink sink) {
        for (String field : REQUIRED_FIELDS) {
            if (!bundle.containsKey(field)) {
                sink.add("$." + field, "required field " + field + " is missing");
            }
        }
    }

    private static void checkSchemaVersion(Map<String, Object> bundle, BundleVerifyOptions options, RuleSink sink) {
        Object version = bundle.get("schema_version");
        if (version == null) {
            sink.add("$.schema_version", "schema_version is missing");
        } else if (!(version instanceof String s)) {
            sink.add("$.schema_version", "schema_version must be string, got " + Values.typeName(version));
        } else if (s.isEmpty()) {
            sink.add("$.schema_version", "schema_version cannot be empty");
        }
    }

    private static void checkOutputsSorted(Map<String, Object> bundle, BundleVerifyOptions options, RuleSink sink) {
        List<Object> outputs = asList(bundle.get("outputs"));
        if (outputs == null) return;
        List<String> paths = outputs.stream().map(o -> stringField(o, "path")).toList();
        if (!Values.isSorted(paths)) {
            sink.add("$.outputs", "outputs not sorted by path: " + paths);
        }
    }

    private static void checkConstraintsSorted(Map<String, Object> bundle, BundleVerifyOptions options, RuleSink sink) {
        Map<String, Object> root = asObject(bundle.get("root_node"));
        if (root != null && !sortedStrings(root.get("constraints"))) {
            sink.add("$.root_node.constraints", "root_node.constraints not sorted lexicographically");
        }
        List<Object> nodes = asList(bundle.get("terminal_nodes"));
        if (nodes != null) {
            for (int i = 0; i < nodes.size(); i++) {
                Map<String, Object> node = asObject(nodes.get(i));
                if (node != null && !sortedStrings(node.get("constraints"))) {
                    sink.add("$.terminal_nodes[" + i + "].constraints", "terminal_nodes[" + i + "].constraints not sorted");
                }
            }
        }
        List<Object> outputs = asList(bundle.get("outputs"));
        if (outputs != null) {
            for (int i = 0; i < outputs.size(); i++) {
                Map<String, Object> output = asObject(outputs.get(i));
                if (output != null && !sortedStrings(output.get("source_constraints"))) {
                    sink.add("$.outputs[" + i + "].source_constraints", "outputs[" + i + "].source_constraints not sorted");
                }
            }
        }
    }

    private static void checkQuestionsSorted(Map<String, Object> bundle, BundleVerifyOptions options, RuleSink sink) {
        List<Object> questions = asList(bundle.get("unresolved_questions"));
        if (questions != null && !questionsSorted(questions)) {
            sink.add("$.unresolved_questions", "unresolved_questions not sorted by priority desc, id asc");
        }
        List<Object> nodes = asList(bundle.get("terminal_nodes"));
        if (nodes == null) return;
        for (int i = 0; i < nodes.size(); i++) {
            Map<String, Object> node = asObject(nodes.get(i));
            List<Object> nodeQuestions = node == null ? null : asList(node.get("unresolved_questions"));
            if (nodeQuestions != null && !questionsSorted(nodeQuestions)) {
                sink.add("$.terminal_nodes[" + i + "].unresolved_questions",
                        "terminal_nodes[" + i + "].unresolved_questions not sorted");
            }
        }
    }

    private static void checkTerminalNodesSorted(Map<String, Object> bundle, BundleVerifyOptions options, RuleSink sink) {
        List<Object> nodes = asList(bundle.get("terminal_nodes"));
        if (nodes == null) return;
        if (!Values.isSorted(nodes.stream().map(n -> stringField(n, "id")).toList())) {
            sink.add("$.terminal_nodes", "terminal_nodes not sorted by id");
        }
    }

    private static void checkOutputPaths(Map<String, Object> bundle, BundleVerifyOptions options, RuleSink sink) {
        List<Object> outputs = asList(bundle.get("outputs"));
        if (outputs == null) return;
        for (int i = 0; i < outputs.size(); i++) {
            Map<String, Object> output = asObject(outputs.get(i));
            String path = output == null ? null : Values.asString(output.get("path"));
            if (path != null && (path.startsWith("/") || path.contains("..") || path.contains("\\"))) {
                sink.add("$.outputs[" + i + "].path", "unsafe path: " + path);
            }
        }
    }

    private static void checkCanonicalIdempotent(Map<String, Object> bundle, BundleVerifyOptions options, RuleSink sink) {
        try {
            if (!Canonicalizer.isRoundTripStable(bundle)) {
                sink.add("$", "canonical serialization not idempotent");
            }
        } catch (CanonicalizationException e) {
            sink.add("$", "failed to canonicalize bundle: " + e.getMessage());
        }
    }

    private static void checkBundleId(Map<String, Object> bundle, BundleVerifyOptions options, RuleSink sink) {
        if (options.skipHashVerification() || !(bundle.get("id") instanceof String id)) return;
        Map<String, Object> core = new LinkedHashMap<>(bundle);
        core.remove("id");
        String expected;
        try {
            expected = Canonicalizer.contentId("bundle", core);
        } catch (CanonicalizationException e) {
            return; // BS8 reports it
        }
        if (!expected.equals(id)) {
            sink.add("$.id", "bundle id does not match content, expected " + expected);
        }
    }

    private static void checkOutputHashes(Map<String, Object> bundle, BundleVerifyOptions options, RuleSink sink) {
        List<Object> outputs = asList(bundle.get("outputs"));
        if (options.skipHashVerification() || outputs == null) return;
        for (int i = 0; i < outputs.size(); i++) {
            Map<String, Object> output = asObject(outputs.get(i));
            if (output == null || !(output.get("content") instanceof String content)) continue;
            String expected = Canonicalizer.contentHash(content);
            if (!expected.equals(output.get("content_hash"))) {
                sink.add("$.outputs[" + i + "].content_hash", "content_hash does not match content, expected " + expected);
            }
        }
    }

    // ── helpers ─────────────────────────────────────────────────────────────

    private static String stringField(Object value, String field) {
        Map<String, Object> map = asObject(value);
        Object raw = map == null ? null : map.get(field);
        return raw instanceof String s ? s : "";
    }

    private static boolean sortedStrings(Object value) {
        List<String> strings = Values.strings(value);
        return strings == null || Values.isSorted(strings);
    }

    static boolean questionsSorted(List<Object> questions) {
        for (int i = 1; i < questions.size(); i++) {
            Map<String, Object> prev = asObject(questions.get(i - 1));
            Map<String, Object> curr = asObject(questions.get(i));
            if (prev == null || curr == null) continue;
            long prevPriority = Values.isInteger(prev.get("priority")) ? Values.longValue(prev.get("priority")) : 0;
            long currPriority = Values.isInteger(curr.get("priority")) ? Values.longValue(curr.get("priority")) : 0;
            if (prevPriority < currPriority) return false;
            if (prevPriority == currPriority
                    && stringField(prev, "id").compareTo(stringField(curr, "id")) > 0) return false;
        }
        return true;
    }

    private static long size(Object value) {
        List<Object> list = asList(value);
        return list == null ? 0 : list.size();
    }
}
