package no.cantara.intent.verify.patch;

import no.cantara.intent.verify.ArtifactVerifier;
import no.cantara.intent.verify.Rule;
import no.cantara.intent.verify.RuleCatalogue;
import no.cantara.intent.verify.RuleSink;
import no.cantara.intent.verify.Values;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static no.cantara.intent.verify.Values.asList;
import static no.cantara.intent.verify.Values.asObject;

/**
 * Verifies a patch set: an ordered list of text file operations (create, modify,
 * delete) under a work root, produced from a proposal. A patch has no ephemeral
 * fields; the whole artifact is its core.
 */
public final class PatchVerifier extends ArtifactVerifier<PatchVerifyOptions> {

    public static final String SCHEMA_VERSION = "1.0.0";

    public static final Set<String> OPERATIONS = Set.of("create", "modify", "delete");

    static final List<String> REQUIRED_FIELDS = List.of(
            "patch_schema_version", "source_proposal_id", "source_proposal_hash", "operations", "total_bytes");

    public PatchVerifier() {
        super("patch", RuleCatalogue.<PatchVerifyOptions>of(
                Rule.of("SCHEMA", "Required fields present", PatchVerifier::checkSchema),
                Rule.of("PS1", "Schema version present", PatchVerifier::checkSchemaVersion),
                Rule.of("PS2", "Operation kind valid", PatchVerifier::checkOpKinds),
                Rule.of("PS3", "Paths relative", PatchVerifier::checkRelative),
                Rule.of("PS4", "Paths safe and normalized", PatchVerifier::checkPathSafety),
                Rule.of("PS5", "No duplicate targets", PatchVerifier::checkDuplicates),
                Rule.of("PS6", "Text content rules", PatchVerifier::checkContent),
                Rule.of("PS7", "Total bytes within limit and accurate", PatchVerifier::checkTotalBytes),
                Rule.of("PS8", "Sorted by order, then path", PatchVerifier::checkOrdering),
                Rule.of("PS9", "No symlinks", PatchVerifier::checkNoSymlinks)));
    }

    @Override
    protected PatchVerifyOptions defaultOptions() {
        return PatchVerifyOptions.DEFAULTS;
    }

    @Override
    public Map<String, Object> computeCore(Map<String, Object> patch) {
        return patch;
    }

    @Override
    protected Map<String, Long> summarize(Map<String, Object> patch) {
        Map<String, Long> counts = new HashMap<>();
        for (String op : OPERATIONS) {
            counts.put(op, 0L);
        }
        for (Operation operation : operations(patch)) {
            if (operation.op() != null) {
                counts.merge(operation.op(), 1L, Long::sum);
            }
        }
        counts.put("total_bytes", Values.longValue(patch.get("total_bytes")));
        return counts;
    }

    /** Content is encodable as UTF-8 text: no NUL and no unpaired surrogate. */
    static boolean isText(String content) {
        for (int i = 0; i < content.length(); i++) {
            char c = content.charAt(i);
            if (c == '\0') return false;
            if (Character.isHighSurrogate(c)) {
                if (i + 1 >= content.length() || !Character.isLowSurrogate(content.charAt(i + 1))) return false;
                i++;
            } else if (Character.isLowSurrogate(c)) {
                return false;
            }
        }
        return true;
    }

    static boolean isNormalized(String path) {
        return !(path.isEmpty() || path.equals(".") || path.startsWith("./") || path.contains("//")
                || path.endsWith("/"));
    }

    /** Control characters other than tab and newline, or surrounding whitespace. */
    static boolean hasForbiddenCharacters(String path) {
        for (int i = 0; i < path.length(); i++) {
            char c = path.charAt(i);
            if (c < 0x20 && c != '\t' && c != '\n') return true;
        }
        return !path.equals(path.strip());
    }

    // ── rules ───────────────────────────────────────────────────────────────

    private static void checkSchema(Map<String, Object> patch, PatchVerifyOptions options, RuleSink sink) {
        for (String field : REQUIRED_FIELDS) {
            if (!patch.containsKey(field)) {
                sink.add("$." + field, "required field " + field + " is missing");
            }
        }
        if (patch.containsKey("operations")) {
            List<Object> operations = asList(patch.get("operations"));
            if (operations == null) {
                sink.add("$.operations", "operations must be an array");
            } else {
                for (int i = 0; i < operations.size(); i++) {
                    Map<String, Object> operation = asObject(operations.get(i));
                    if (operation == null) {
                        sink.add("$.operations[" + i + "]", "operation must be an object");
                    } else if (!(operation.get("path") instanceof String)) {
                        sink.add("$.operations[" + i + "].path", "path must be a string");
                    }
                }
            }
        }
    }

    private static void checkSchemaVersion(Map<String, Object> patch, PatchVerifyOptions options, RuleSink sink) {
        Object version = patch.get("patch_schema_version");
        if (version == null) {
            sink.add("$.patch_schema_version", "patch_schema_version is missing");
        } else if (!(version instanceof String s)) {
            sink.add("$.patch_schema_version", "patch_schema_version must be string, got " + Values.typeName(version));
        } else if (s.isEmpty()) {
            sink.add("$.patch_schema_version", "patch_schema_version cannot be empty");
        }
    }

    private static void checkOpKinds(Map<String, Object> patch, PatchVerifyOptions options, RuleSink sink) {
        for (Operation operation : operations(patch)) {
            if (operation.op() == null || !OPERATIONS.contains(operation.op())) {
                sink.add(operation.path() + ".op", "invalid operation type: " + operation.op());
            }
        }
    }

    private static void checkRelative(Map<String, Object> patch, PatchVerifyOptions options, RuleSink sink) {
        for (Operation operation : operations(patch)) {
            String target = operation.target();
            if (target != null && Values.isAbsolutePath(target)) {
                sink.add(operation.path() + ".path", "absolute path not allowed: " + target);
            }
        }
    }

    private static void checkPathSafety(Map<String, Object> patch, PatchVerifyOptions options, RuleSink sink) {
        for (Operation operation : operations(patch)) {
            String target = operation.target();
            if (target == null) continue;
            String path = operation.path() + ".path";
            if (target.contains("..") || target.contains("\\")) {
                sink.add(path, "path traversal or backslash not allowed: " + target);
            }
            if (hasForbiddenCharacters(target)) {
                sink.add(path, "forbidden characters in path: " + target);
            }
            if (!isNormalized(target)) {
                sink.add(path, "path not normalized: " + target);
            }
        }
    }

    private static void checkDuplicates(Map<String, Object> patch, PatchVerifyOptions options, RuleSink sink) {
        Map<String, Integer> seen = new HashMap<>();
        for (Operation operation : operations(patch)) {
            String target = operation.target();
            if (target == null) continue;
            Integer previous = seen.putIfAbsent(target, operation.index());
            if (previous != null) {
                sink.add(operation.path() + ".path",
                        "duplicate target path: " + target + " (also at index " + previous + ")");
            }
        }
    }

    private static void checkContent(Map<String, Object> patch, PatchVerifyOptions options, RuleSink sink) {
        for (Operation operation : operations(patch)) {
            Map<String, Object> fields = operation.fields();
            String path = operation.path() + ".content";
            boolean hasContent = fields.containsKey("content");
            Object content = fields.get("content");
            if (hasContent && !(content instanceof String)) {
                sink.add(path, "content must be a string, got " + Values.typeName(content));
            } else if (content instanceof String text && !isText(text)) {
                sink.add(path, "content is not valid UTF-8 or contains null bytes");
            }
            if ("delete".equals(operation.op()) && hasContent) {
                sink.add(path, "delete operation must not have content");
            }
            if (("create".equals(operation.op()) || "modify".equals(operation.op())) && !hasContent) {
                sink.add(path, operation.op() + " operation must have content");
            }
        }
    }

    private static void checkTotalBytes(Map<String, Object> patch, PatchVerifyOptions options, RuleSink sink) {
        Object declared = patch.get("total_bytes");
        if (!Values.isInteger(declared)) {
            sink.add("$.total_bytes", "total_bytes is missing or not an exact integer");
            return;
        }
        long total = Values.longValue(declared);
        if (total > options.maxTotalBytes()) {
            sink.add("$.total_bytes", "total_bytes (" + total + ") exceeds limit (" + options.maxTotalBytes() + ")");
        }
        long actual = 0;
        for (Operation operation : operations(patch)) {
            if (operation.fields().get("content") instanceof String content) {
                actual += content.getBytes(StandardCharsets.UTF_8).length;
            }
        }
        if (actual != total) {
            sink.add("$.total_bytes", "total_bytes (" + total + ") does not match actual content size (" + actual + ")");
        }
    }

    private static void checkOrdering(Map<String, Object> patch, PatchVerifyOptions options, RuleSink sink) {
        List<Operation> operations = operations(patch);
        for (int i = 1; i < operations.size(); i++) {
            Operation prev = operations.get(i - 1);
            Operation curr = operations.get(i);
            if (prev.order() > curr.order()) {
                sink.add(curr.path(), "operations not sorted by order: " + prev.order() + " > " + curr.order());
            } else if (prev.order() == curr.order() && prev.target() != null && curr.target() != null
                    && prev.target().compareTo(curr.target()) > 0) {
                sink.add(curr.path(), "operations not sorted by path: " + prev.target() + " > " + curr.target());
            }
        }
    }

    private static void checkNoSymlinks(Map<String, Object> patch, PatchVerifyOptions options, RuleSink sink) {
        for (Operation operation : operations(patch)) {
            if ("symlink".equals(operation.op())) {
                sink.add(operation.path() + ".op", "symlink operations are not allowed");
            }
        }
    }

    /** Object entries of {@code operations}, by array index. */
    private static List<Operation> operations(Map<String, Object> patch) {
        List<Object> raw = asList(patch.get("operations"));
        if (raw == null) return List.of();
        List<Operation> operations = new ArrayList<>();
        for (int i = 0; i < raw.size(); i++) {
            Map<String, Object> fields = asObject(raw.get(i));
            if (fields != null) {
                operations.add(new Operation(i, fields));
            }
        }
        return operations;
    }

    private record Operation(int index, Map<String, Object> fields) {

        String path() {
            return "$.operations[" + index + "]";
        }

        String op() {
            return fields.get("op") instanceof String s ? s : null;
        }

        String target() {
            return fields.get("path") instanceof String s ? s : null;
        }

        /** Ordering priority; absent means 0. */
        long order() {
            Object order = fields.get("order");
            return Values.isInteger(order) ? Values.longValue(order) : 0;
        }
    }
}
