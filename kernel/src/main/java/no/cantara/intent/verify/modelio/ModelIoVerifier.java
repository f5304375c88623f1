package no.cantara.intent.verify.modelio;

import no.cantara.intent.canonical.Canonicalizer;
import no.cantara.intent.verify.ArtifactVerifier;
import no.cantara.intent.verify.Rule;
import no.cantara.intent.verify.RuleCatalogue;
import no.cantara.intent.verify.RuleSink;
import no.cantara.intent.verify.Values;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static no.cantara.intent.verify.Values.asList;
import static no.cantara.intent.verify.Values.asObject;

/**
 * Verifies a recorded model session (model IO).
 *
 * <p>The core keeps the schema version, adapter and model ids, mode and, per
 * interaction, {@code i}, both hashes and the response content, sorted by {@code i}.
 * Token counts, latency, timestamps and stats are ephemeral.
 */
public final class ModelIoVerifier extends ArtifactVerifier<ModelIoVerifyOptions> {

    public static final String SCHEMA_VERSION = "1.0.0";
    public static final List<String> MODES = List.of("record", "replay");

    public static final int MAX_INTERACTIONS = 10_000;
    public static final long MAX_RESPONSE_BYTES = 1_000_000;
    public static final long MAX_TOTAL_BYTES = 100_000_000;

    static final List<String> REQUIRED_FIELDS = List.of(
            "model_io_schema_version", "adapter_id", "model_id", "mode", "interactions");

    public ModelIoVerifier() {
        super("session", RuleCatalogue.<ModelIoVerifyOptions>of(
                Rule.of("SCHEMA", "Required fields present", ModelIoVerifier::checkSchema),
                Rule.of("MI1", "Schema version is semver", ModelIoVerifier::checkSchemaVersion),
                Rule.of("MI2", "Adapter and model ids present", ModelIoVerifier::checkIds),
                Rule.of("MI3", "Mode valid", ModelIoVerifier::checkMode),
                Rule.of("MI4", "Interaction count within limit", ModelIoVerifier::checkInteractionCount),
                Rule.of("MI5", "Indices contiguous", ModelIoVerifier::checkIndices),
                Rule.of("MI6", "Prompt hash format", ModelIoVerifier::checkPromptHashes),
                Rule.of("MI7", "Response hash integrity", ModelIoVerifier::checkResponseHashes),
                Rule.of("MI8", "No duplicate interactions", ModelIoVerifier::checkDuplicates),
                Rule.of("MI9", "Interactions sorted by i", ModelIoVerifier::checkSorted),
                Rule.of("MI11", "Response sizes within limits", ModelIoVerifier::checkSizes)));
    }

    /** {@code "sha256:" + hex(sha256(utf8(text)))}, the hash of raw prompt and response text. */
    public static String textHash(String text) {
        return Canonicalizer.HASH_PREFIX + Canonicalizer.sha256Hex(text);
    }

    @Override
    protected ModelIoVerifyOptions defaultOptions() {
        return ModelIoVerifyOptions.DEFAULTS;
    }

    @Override
    public Map<String, Object> computeCore(Map<String, Object> session) {
        List<Map<String, Object>> interactions = new ArrayList<>();
        List<Object> raw = asList(session.get("interactions"));
        if (raw != null) {
            for (Object item : raw) {
                Map<String, Object> interaction = asObject(item);
                if (interaction == null) continue;
                Map<String, Object> core = new LinkedHashMap<>();
                core.put("i", interaction.get("i"));
                core.put("prompt_hash", interaction.get("prompt_hash"));
                core.put("response_hash", interaction.get("response_hash"));
                core.put("response_content", interaction.get("response_content"));
                interactions.add(core);
            }
        }
        interactions.sort(Comparator.comparingLong(m -> Values.isInteger(m.get("i")) ? Values.longValue(m.get("i")) : 0));

        Map<String, Object> core = new LinkedHashMap<>();
        core.put("model_io_schema_version", session.get("model_io_schema_version"));
        core.put("adapter_id", session.get("adapter_id"));
        core.put("model_id", session.get("model_id"));
        core.put("mode", session.get("mode"));
        core.put("interactions", interactions);
        return core;
    }

    @Override
    protected Map<String, Long> summarize(Map<String, Object> session) {
        List<Object> interactions = asList(session.get("interactions"));
        return Map.of("interactions", interactions == null ? 0L : (long) interactions.size());
    }

    // ── rules ───────────────────────────────────────────────────────────────

    private static void checkSchema(Map<String, Object> session, ModelIoVerifyOptions options, RuleSink sink) {
        for (String field : REQUIRED_FIELDS) {
            if (!session.containsKey(field)) {
                sink.add("$." + field, "required field " + field + " is missing");
            }
        }
        if (session.containsKey("interactions") && asList(session.get("interactions")) == null) {
            sink.add("$.interactions", "interactions must be an array");
        }
    }

    private static void checkSchemaVersion(Map<String, Object> session, ModelIoVerifyOptions options, RuleSink sink) {
        Object version = session.get("model_io_schema_version");
        if (version == null) {
            sink.add("$.model_io_schema_version", "model_io_schema_version is missing");
        } else if (!(version instanceof String s)) {
            sink.add("$.model_io_schema_version", "model_io_schema_version must be string, got " + Values.typeName(version));
        } else if (s.isEmpty()) {
            sink.add("$.model_io_schema_version", "model_io_schema_version cannot be empty");
        } else if (!Values.SEMVER.matcher(s).matches()) {
            sink.add("$.model_io_schema_version", "model_io_schema_version must be semver format, got " + s);
        }
    }

    private static void checkIds(Map<String, Object> session, ModelIoVerifyOptions options, RuleSink sink) {
        if (!Values.isNonEmptyString(session.get("adapter_id"))) {
            sink.add("$.adapter_id", "adapter_id must be non-empty string");
        }
        if (!Values.isNonEmptyString(session.get("model_id"))) {
            sink.add("$.model_id", "model_id must be non-empty string");
        }
    }

    private static void checkMode(Map<String, Object> session, ModelIoVerifyOptions options, RuleSink sink) {
        Object mode = session.get("mode");
        if (!(mode instanceof String m) || !MODES.contains(m)) {
            sink.add("$.mode", "mode must be one of " + MODES + ", got " + mode);
        }
    }

    private static void checkInteractionCount(Map<String, Object> session, ModelIoVerifyOptions options, RuleSink sink) {
        List<Object> interactions = asList(session.get("interactions"));
        if (interactions != null && options.enforceSizeLimits() && interactions.size() > MAX_INTERACTIONS) {
            sink.add("$.interactions", "interactions length (" + interactions.size() + ") exceeds limit ("
                    + MAX_INTERACTIONS + ")");
        }
    }

    private static void checkIndices(Map<String, Object> session, ModelIoVerifyOptions options, RuleSink sink) {
        List<Object> interactions = asList(session.get("interactions"));
        if (interactions == null) return;
        for (int i = 0; i < interactions.size(); i++) {
            Object index = field(interactions.get(i), "i");
            String path = "$.interactions[" + i + "].i";
            if (!Values.isInteger(index)) {
                sink.add(path, "index must be an exact integer, got "
                        + (index instanceof Number ? index : Values.typeName(index)));
            } else if (Values.longValue(index) != i) {
                sink.add(path, "index must be " + i + ", got " + index);
            }
        }
    }

    private static void checkPromptHashes(Map<String, Object> session, ModelIoVerifyOptions options, RuleSink sink) {
        List<Object> interactions = asList(session.get("interactions"));
        if (interactions == null) return;
        for (int i = 0; i < interactions.size(); i++) {
            Object hash = field(interactions.get(i), "prompt_hash");
            if (!Values.isHash(hash)) {
                sink.add("$.interactions[" + i + "].prompt_hash",
                        "prompt_hash must be sha256:<64 hex chars>, got " + hash);
            }
        }
    }

    private static void checkResponseHashes(Map<String, Object> session, ModelIoVerifyOptions options, RuleSink sink) {
        List<Object> interactions = asList(session.get("interactions"));
        if (interactions == null || !options.verifyResponseHashes()) return;
        for (int i = 0; i < interactions.size(); i++) {
            Object hash = field(interactions.get(i), "response_hash");
            Object content = field(interactions.get(i), "response_content");
            String base = "$.interactions[" + i + "]";
            if (!Values.isHash(hash)) {
                sink.add(base + ".response_hash", "response_hash must be sha256:<64 hex chars>, got " + hash);
            } else if (!(content instanceof String text)) {
                sink.add(base + ".response_content", "response_content must be a string, got " + Values.typeName(content));
            } else {
                String computed = textHash(text);
                if (!computed.equals(hash)) {
                    sink.add(base + ".response_hash", "response_hash mismatch: expected " + computed + ", got " + hash);
                }
            }
        }
    }

    private static void checkDuplicates(Map<String, Object> session, ModelIoVerifyOptions options, RuleSink sink) {
        List<Object> interactions = asList(session.get("interactions"));
        if (interactions == null) return;
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < interactions.size(); i++) {
            String key = field(interactions.get(i), "prompt_hash") + "|" + field(interactions.get(i), "i");
            if (!seen.add(key)) {
                sink.add("$.interactions[" + i + "]", "duplicate (prompt_hash, i) pair at index " + i);
            }
        }
    }

    private static void checkSorted(Map<String, Object> session, ModelIoVerifyOptions options, RuleSink sink) {
        List<Object> interactions = asList(session.get("interactions"));
        if (interactions == null) return;
        for (int i = 1; i < interactions.size(); i++) {
            Object prev = field(interactions.get(i - 1), "i");
            Object curr = field(interactions.get(i), "i");
            if (Values.isInteger(prev) && Values.isInteger(curr) && Values.longValue(prev) >= Values.longValue(curr)) {
                sink.add("$.interactions[" + i + "]", "interactions not sorted by i: " + prev + " >= " + curr);
            }
        }
    }

    private static void checkSizes(Map<String, Object> session, ModelIoVerifyOptions options, RuleSink sink) {
        List<Object> interactions = asList(session.get("interactions"));
        if (interactions == null || !options.enforceSizeLimits()) return;
        long total = 0;
        for (int i = 0; i < interactions.size(); i++) {
            if (!(field(interactions.get(i), "response_content") instanceof String content)) continue;
            long bytes = content.getBytes(StandardCharsets.UTF_8).length;
            if (bytes > MAX_RESPONSE_BYTES) {
                sink.add("$.interactions[" + i + "].response_content", "response_content size (" + bytes
                        + " bytes) exceeds limit (" + MAX_RESPONSE_BYTES + ")");
            }
            total += bytes;
        }
        if (total > MAX_TOTAL_BYTES) {
            sink.add("$.interactions", "total response bytes (" + total + ") exceeds limit (" + MAX_TOTAL_BYTES + ")");
        }
    }

    private static Object field(Object item, String name) {
        Map<String, Object> map = asObject(item);
        return map == null ? null : map.get(name);
    }
}
