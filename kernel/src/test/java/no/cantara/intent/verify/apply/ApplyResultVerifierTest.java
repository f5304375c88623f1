package no.cantara.intent.verify.apply;

import no.cantara.intent.canonical.ArtifactJson;
import no.cantara.intent.verify.VerificationResult;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ApplyResultVerifierTest {

    private static final String BEFORE = "sha256:" + "1".repeat(64);
    private static final String AFTER = "sha256:" + "2".repeat(64);

    private final ApplyResultVerifier verifier = new ApplyResultVerifier();

    @SuppressWarnings("unchecked")
    private static Map<String, Object> json(String text) {
        return (Map<String, Object>) ArtifactJson.parse(text);
    }

    private static Map<String, Object> result() {
        return json("""
                {
                  "apply_schema_version": "1.0.0",
                  "outcome": "SUCCESS",
                  "dry_run": false,
                  "target_root": ".",
                  "patch_source": {"proposal_id": "proposal_0123456789abcdef", "proposal_hash": "sha256:%s"},
                  "operation_results": [
                    {"op": "create", "path": "src/App.java", "status": "success", "bytes_written": 13,
                     "after_hash": "%s"},
                    {"op": "delete", "path": "src/Old.java", "status": "success", "bytes_written": 0,
                     "before_hash": "%s"}
                  ],
                  "summary": {"total_operations": 2, "succeeded": 2, "skipped": 0, "failed": 0,
                              "total_bytes_written": 13}
                }
                """.formatted("a".repeat(64), AFTER, BEFORE));
    }

    private static Map<String, Object> patch(String... paths) {
        StringBuilder operations = new StringBuilder("[");
        for (int i = 0; i < paths.length; i++) {
            if (i > 0) operations.append(',');
            operations.append("{\"op\": \"delete\", \"path\": \"").append(paths[i]).append("\"}");
        }
        return json("{\"operations\": " + operations + "]}");
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> operation(Map<String, Object> result, int index) {
        return (Map<String, Object>) ((List<Object>) result.get("operation_results")).get(index);
    }

    private List<String> ruleIds(Map<String, Object> result) {
        return verifier.verify(result).ruleIds();
    }

    // ── valid ────────────────────────────────────────────────────────────────

    @Test void validResultPasses() {
        VerificationResult verified = verifier.verify(result());
        assertTrue(verified.isValid(), () -> verified.violations().toString());
        assertEquals(13L, verified.summary().get("total_bytes_written"));
        assertEquals(2L, verified.summary().get("succeeded"));
    }

    @Test void refusedResultWithErrorPasses() {
        Map<String, Object> result = json("""
                {
                  "apply_schema_version": "1.0.0",
                  "outcome": "REFUSED",
                  "error": "patch failed verification",
                  "dry_run": true,
                  "target_root": "out",
                  "patch_source": {"proposal_id": "proposal_0123456789abcdef", "proposal_hash": "sha256:%s"},
                  "operation_results": [],
                  "summary": {"total_operations": 0, "succeeded": 0, "skipped": 0, "failed": 0,
                              "total_bytes_written": 0},
                  "violations": [
                    {"rule_id": "PS3", "path": "$.operations[0].path", "message": "absolute path"},
                    {"rule_id": "PS4", "path": "$.operations[0].path", "message": "traversal"}
                  ]
                }
                """.formatted("a".repeat(64)));
        assertTrue(verifier.verify(result).isValid());
    }

    // ── schema ───────────────────────────────────────────────────────────────

    @Test void unknownOutcome() {
        Map<String, Object> result = result();
        result.put("outcome", "MAYBE");
        assertEquals(List.of("SCHEMA"), ruleIds(result));
    }

    @Test void summaryMustMatchOperations() {
        Map<String, Object> result = result();
        operation(result, 1).put("status", "skipped");
        VerificationResult verified = verifier.verify(result);
        assertEquals(List.of("SCHEMA"), verified.ruleIds());
        assertEquals(List.of("$.summary.skipped", "$.summary.succeeded"),
                verified.violations().stream().map(v -> v.path()).toList());
    }

    @Test void missingSchemaVersion() {
        Map<String, Object> result = result();
        result.remove("apply_schema_version");
        assertEquals(List.of("AS1", "SCHEMA"), ruleIds(result));
    }

    // ── rules ────────────────────────────────────────────────────────────────

    @Test void unsortedOperationResults() {
        Map<String, Object> result = result();
        operation(result, 0).put("path", "src/Zed.java");
        assertEquals(List.of("AS2"), ruleIds(result));
    }

    @Test void unsortedReportedViolations() {
        Map<String, Object> result = result();
        result.put("violations", List.of(
                Map.of("rule_id", "PS4", "message", "b"),
                Map.of("rule_id", "PS3", "message", "a")));
        VerificationResult verified = verifier.verify(result);
        assertEquals(List.of("AS2"), verified.ruleIds());
        assertEquals("$.violations[1]", verified.violations().get(0).path());
    }

    @Test void writeSetMatchesPatch() {
        VerificationResult verified = verifier.verify(result(),
                ApplyVerifyOptions.against(patch("src/App.java", "src/Old.java")));
        assertTrue(verified.isValid());
    }

    @Test void writeSetDiffersFromPatch() {
        VerificationResult verified = verifier.verify(result(),
                ApplyVerifyOptions.against(patch("src/App.java", "src/New.java")));
        assertEquals(List.of("AS6"), verified.ruleIds());
        assertEquals(2, verified.violations().size());
    }

    @Test void writeSetCheckCanBeSkipped() {
        VerificationResult verified = verifier.verify(result(),
                new ApplyVerifyOptions(patch("src/Other.java"), true));
        assertTrue(verified.isValid());
    }

    @Test void malformedHash() {
        Map<String, Object> result = result();
        operation(result, 0).put("after_hash", "md5:abc");
        VerificationResult verified = verifier.verify(result);
        assertEquals(List.of("AS7"), verified.ruleIds());
        assertEquals("$.operation_results[0].after_hash", verified.violations().get(0).path());
    }

    @Test void failedOutcomeNeedsError() {
        Map<String, Object> result = result();
        result.put("outcome", "FAILED");
        assertEquals(List.of("AS9"), ruleIds(result));
    }

    @Test void erroredOperationNeedsMessage() {
        Map<String, Object> result = result();
        result.put("outcome", "PARTIAL");
        operation(result, 1).put("status", "error");
        Map<String, Object> summary = json("""
                {"total_operations": 2, "succeeded": 1, "skipped": 0, "failed": 1, "total_bytes_written": 13}""");
        result.put("summary", summary);
        VerificationResult verified = verifier.verify(result);
        assertEquals(List.of("AS9"), verified.ruleIds());
        assertEquals("$.operation_results[1]", verified.violations().get(0).path());
    }

    @Test void absoluteTargetRoot() {
        Map<String, Object> result = result();
        result.put("target_root", "C:\\work\\out");
        assertEquals(List.of("AS12"), ruleIds(result));
    }
}
