package no.cantara.intent.verify.apply;

import no.cantara.intent.verify.ArtifactVerifier;
import no.cantara.intent.verify.Rule;
import no.cantara.intent.verify.RuleCatalogue;
import no.cantara.intent.verify.RuleSink;
import no.cantara.intent.verify.Values;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import static no.cantara.intent.verify.Values.asList;
import static no.cantara.intent.verify.Values.asObject;

/**
 * Verifies the report of applying a patch to a target directory.
 */
public final class ApplyResultVerifier extends ArtifactVerifier<ApplyVerifyOptions> {

    public static final String SCHEMA_VERSION = "1.0.0";

    public static final Set<String> OUTCOMES = Set.of("SUCCESS", "PARTIAL", "FAILED", "REFUSED");
    public static final Set<String> OPERATIONS = Set.of("create", "modify", "delete");
    public static final Set<String> STATUSES = Set.of("success", "skipped", "error");

    static final List<String> REQUIRED_FIELDS = List.of(
            "apply_schema_version", "outcome", "dry_run", "target_root", "patch_source",
            "operation_results", "summary");

    static final List<String> SUMMARY_FIELDS = List.of(
            "total_operations", "succeeded", "skipped", "failed", "total_bytes_written");

    public ApplyResultVerifier() {
        super("result", RuleCatalogue.<ApplyVerifyOptions>of(
                Rule.of("SCHEMA", "Structure and summary consistency", ApplyResultVerifier::checkSchema),
                Rule.of("AS1", "Schema version present", ApplyResultVerifier::checkSchemaVersion),
                Rule.of("AS2", "Deterministic ordering", ApplyResultVerifier::checkOrdering),
                Rule.of("AS6", "Write set equals patch set", ApplyResultVerifier::checkWriteSet),
                Rule.of("AS7", "Hash formats", ApplyResultVerifier::checkHashes),
                Rule.of("AS9", "Error messages present", ApplyResultVerifier::checkErrors),
                Rule.of("AS12", "No absolute paths", ApplyResultVerifier::checkAbsolutePaths)));
    }

    @Override
    protected ApplyVerifyOptions defaultOptions() {
        return ApplyVerifyOptions.DEFAULTS;
    }

    @Override
    public Map<String, Object> computeCore(Map<String, Object> result) {
        return result;
    }

    @Override
    protected Map<String, Long> summarize(Map<String, Object> result) {
        Map<String, Object> summary = asObject(result.get("summary"));
        Map<String, Long> counts = new LinkedHashMap<>();
        for (String field : SUMMARY_FIELDS) {
            counts.put(field, Values.longValue(summary.get(field)));
        }
        return counts;
    }

    // ── rules ───────────────────────────────────────────────────────────────

    private static void checkSchema(Map<String, Object> result, ApplyVerifyOptions options, RuleSink sink) {
        for (String field : REQUIRED_FIELDS) {
            if (!result.containsKey(field)) {
                sink.add("$." + field, "required field " + field + " is missing");
            }
        }
        if (result.containsKey("outcome")
                && !(result.get("outcome") instanceof String outcome && OUTCOMES.contains(outcome))) {
            sink.add("$.outcome", "invalid outcome: " + result.get("outcome"));
        }
        if (result.containsKey("dry_run") && !(result.get("dry_run") instanceof Boolean)) {
            sink.add("$.dry_run", "dry_run must be boolean, got " + Values.typeName(result.get("dry_run")));
        }
        if (result.containsKey("operation_results") && asList(result.get("operation_results")) == null) {
            sink.add("$.operation_results", "operation_results must be an array");
        }
        if (result.containsKey("patch_source")) {
            Map<String, Object> source = asObject(result.get("patch_source"));
            if (source == null) {
                sink.add("$.patch_source", "patch_source must be an object");
            } else {
                for (String field : List.of("proposal_id", "proposal_hash")) {
                    if (!(source.get(field) instanceof String)) {
                        sink.add("$.patch_source." + field, "patch_source." + field + " must be a string");
                    }
                }
            }
        }
        Map<String, Object> summary = asObject(result.get("summary"));
        if (result.containsKey("summary") && summary == null) {
            sink.add("$.summary", "summary must be an object");
        } else if (summary != null) {
            for (String field : SUMMARY_FIELDS) {
                if (!Values.isInteger(summary.get(field))) {
                    sink.add("$.summary." + field, "summary." + field + " must be an exact integer");
                }
            }
        }

        List<Object> raw = asList(result.get("operation_results"));
        if (raw != null) {
            for (int i = 0; i < raw.size(); i++) {
                String path = "$.operation_results[" + i + "]";
                Map<String, Object> op = asObject(raw.get(i));
                if (op == null) {
                    sink.add(path, "operation result must be an object");
                    continue;
                }
                if (!(op.get("op") instanceof String kind && OPERATIONS.contains(kind))) {
                    sink.add(path + ".op", "invalid op: " + op.get("op"));
                }
                if (!(op.get("path") instanceof String)) {
                    sink.add(path + ".path", "path must be a string");
                }
                if (!(op.get("status") instanceof String status && STATUSES.contains(status))) {
                    sink.add(path + ".status", "invalid status: " + op.get("status"));
                }
                if (!Values.isInteger(op.get("bytes_written"))) {
                    sink.add(path + ".bytes_written", "bytes_written must be an exact integer");
                }
            }
            if (summary != null) {
                checkSummaryConsistency(operationResults(result), raw.size(), summary, sink);
            }
        }
    }

    private static void checkSummaryConsistency(List<OperationResult> ops, int total, Map<String, Object> summary,
                                                RuleSink sink) {
        long succeeded = 0;
        long skipped = 0;
        long failed = 0;
        long bytes = 0;
        for (OperationResult op : ops) {
            switch (String.valueOf(op.fields().get("status"))) {
                case "success" -> succeeded++;
                case "skipped" -> skipped++;
                case "error" -> failed++;
                default -> { }
            }
            if (Values.isInteger(op.fields().get("bytes_written"))) {
                bytes += Values.longValue(op.fields().get("bytes_written"));
            }
        }
        compare(summary, "total_operations", total, "operation_results length", sink);
        compare(summary, "succeeded", succeeded, "actual", sink);
        compare(summary, "skipped", skipped, "actual", sink);
        compare(summary, "failed", failed, "actual", sink);
        compare(summary, "total_bytes_written", bytes, "actual", sink);
    }

    private static void compare(Map<String, Object> summary, String field, long actual, String label, RuleSink sink) {
        Object declared = summary.get(field);
        if (Values.isInteger(declared) && Values.longValue(declared) != actual) {
            sink.add("$.summary." + field, field + " (" + declared + ") does not match " + label + " (" + actual + ")");
        }
    }

    private static void checkSchemaVersion(Map<String, Object> result, ApplyVerifyOptions options, RuleSink sink) {
        Object version = result.get("apply_schema_version");
        if (version == null) {
            sink.add("$.apply_schema_version", "apply_schema_version is missing");
        } else if (!(version instanceof String s)) {
            sink.add("$.apply_schema_version", "apply_schema_version must be string, got " + Values.typeName(version));
        } else if (s.isEmpty()) {
            sink.add("$.apply_schema_version", "apply_schema_version cannot be empty");
        }
    }

    private static void checkOrdering(Map<String, Object> result, ApplyVerifyOptions options, RuleSink sink) {
        List<OperationResult> ops = operationResults(result);
        for (int i = 1; i < ops.size(); i++) {
            String prev = ops.get(i - 1).target();
            String curr = ops.get(i).target();
            if (prev != null && curr != null && prev.compareTo(curr) > 0) {
                sink.add(ops.get(i).path(), "operation_results not sorted by path: " + prev + " > " + curr);
            }
        }

        List<Object> reported = asList(result.get("violations"));
        if (reported == null) return;
        for (int i = 1; i < reported.size(); i++) {
            Map<String, Object> prev = asObject(reported.get(i - 1));
            Map<String, Object> curr = asObject(reported.get(i));
            if (prev == null || curr == null) continue;
            String prevRule = String.valueOf(prev.get("rule_id"));
            String currRule = String.valueOf(curr.get("rule_id"));
            int byRule = prevRule.compareTo(currRule);
            if (byRule > 0) {
                sink.add("$.violations[" + i + "]", "violations not sorted by rule_id: " + prevRule + " > " + currRule);
            } else if (byRule == 0) {
                String prevPath = prev.get("path") instanceof String p ? p : "";
                String currPath = curr.get("path") instanceof String p ? p : "";
                if (prevPath.compareTo(currPath) > 0) {
                    sink.add("$.violations[" + i + "]", "violations not sorted by path: " + prevPath + " > " + currPath);
                }
            }
        }
    }

    private static void checkWriteSet(Map<String, Object> result, ApplyVerifyOptions options, RuleSink sink) {
        if (options.patch() == null || options.skipPatchMatch()) return;
        Set<String> patchPaths = new TreeSet<>();
        List<Object> operations = asList(options.patch().get("operations"));
        if (operations != null) {
            for (Object operation : operations) {
                Map<String, Object> fields = asObject(operation);
                if (fields != null && fields.get("path") instanceof String path) {
                    patchPaths.add(path);
                }
            }
        }
        Set<String> resultPaths = new TreeSet<>();
        for (OperationResult op : operationResults(result)) {
            if (op.target() == null) continue;
            resultPaths.add(op.target());
            if (!patchPaths.contains(op.target())) {
                sink.add(op.path() + ".path", "path in result but not in patch: " + op.target());
            }
        }
        for (String path : patchPaths) {
            if (!resultPaths.contains(path)) {
                sink.add("$.operation_results", "path in patch but not in result: " + path);
            }
        }
    }

    private static void checkHashes(Map<String, Object> result, ApplyVerifyOptions options, RuleSink sink) {
        for (OperationResult op : operationResults(result)) {
            for (String field : List.of("before_hash", "after_hash")) {
                Object hash = op.fields().get(field);
                if (hash != null && !Values.isHash(hash)) {
                    sink.add(op.path() + "." + field, "invalid hash format: " + hash);
                }
            }
        }
    }

    private static void checkErrors(Map<String, Object> result, ApplyVerifyOptions options, RuleSink sink) {
        Object outcome = result.get("outcome");
        if (("FAILED".equals(outcome) || "REFUSED".equals(outcome)) && !Values.isNonEmptyString(result.get("error"))) {
            sink.add("$.error", "outcome is " + outcome + " but no error message provided");
        }
        for (OperationResult op : operationResults(result)) {
            if ("error".equals(op.fields().get("status")) && !Values.isNonEmptyString(op.fields().get("error"))) {
                sink.add(op.path(), "operation status is error but no error message provided");
            }
        }
    }

    private static void checkAbsolutePaths(Map<String, Object> result, ApplyVerifyOptions options, RuleSink sink) {
        if (result.get("target_root") instanceof String root && Values.isAbsolutePath(root)) {
            sink.add("$.target_root", "absolute path in target_root: " + root);
        }
        for (OperationResult op : operationResults(result)) {
            if (op.target() != null && Values.isAbsolutePath(op.target())) {
                sink.add(op.path() + ".path", "absolute path in operation: " + op.target());
            }
        }
    }

    private static List<OperationResult> operationResults(Map<String, Object> result) {
        List<Object> raw = asList(result.get("operation_results"));
        if (raw == null) return List.of();
        List<OperationResult> ops = new ArrayList<>();
        for (int i = 0; i < raw.size(); i++) {
            Map<String, Object> fields = asObject(raw.get(i));
            if (fields != null) {
                ops.add(new OperationResult(i, fields));
            }
        }
        return ops;
    }

    private record OperationResult(int index, Map<String, Object> fields) {

        String path() {
            return "$.operation_results[" + index + "]";
        }

        String target() {
            return fields.get("path") instanceof String s ? s : null;
        }
    }
}
