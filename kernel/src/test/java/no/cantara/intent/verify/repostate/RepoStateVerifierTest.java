package no.cantara.intent.verify.repostate;

import no.cantara.intent.canonical.ArtifactJson;
import no.cantara.intent.verify.VerificationResult;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class RepoStateVerifierTest {

    private final RepoStateVerifier verifier = new RepoStateVerifier();

    @SuppressWarnings("unchecked")
    private static Map<String, Object> state() {
        return (Map<String, Object>) ArtifactJson.parse("""
                {
                  "repo_state_schema_version": "1.0.0",
                  "repo_commit": "0123456789abcdef0123456789abcdef01234567",
                  "repo_dirty": true,
                  "dirty_paths": ["README.md", "src/main/java/App.java"],
                  "java_version": "17.0.9",
                  "build_tool_version": "3.9.6",
                  "os_platform": "linux",
                  "os_arch": "amd64",
                  "dependency_lock_sha256": "sha256:%s",
                  "contracts": {
                    "apply_schema_version": "1.0.0",
                    "bundle_schema_version": "0.1.0",
                    "model_io_schema_version": "1.0.0",
                    "patch_schema_version": "1.0.0",
                    "repo_state_schema_version": "1.0.0",
                    "workspace_schema_version": "1.0.0"
                  },
                  "ephemeral": {"captured_at_utc": "2026-01-01T00:00:00Z"}
                }
                """.formatted("e".repeat(64)));
    }

    private List<String> ruleIds(Map<String, Object> state) {
        return verifier.verify(state).ruleIds();
    }

    // ── valid ────────────────────────────────────────────────────────────────

    @Test void validStatePasses() {
        VerificationResult result = verifier.verify(state());
        assertTrue(result.isValid(), () -> result.violations().toString());
        assertEquals(Map.of("dirty_paths", 2L), result.summary());
    }

    @Test void ephemeralIsNotHashed() {
        Map<String, Object> later = state();
        later.put("ephemeral", Map.of("captured_at_utc", "2030-06-01T00:00:00Z"));
        assertEquals(verifier.verify(state()).contentHash(), verifier.verify(later).contentHash());
    }

    @Test void cleanTreeWithNoPaths() {
        Map<String, Object> state = state();
        state.put("repo_dirty", false);
        state.put("dirty_paths", List.of());
        assertTrue(verifier.verify(state).isValid());
    }

    // ── runtime ──────────────────────────────────────────────────────────────

    @Test void featureReleaseOfVersionStrings() {
        assertEquals("17", RepoStateVerifier.featureRelease("17.0.9"));
        assertEquals("21", RepoStateVerifier.featureRelease("21"));
        assertEquals("8", RepoStateVerifier.featureRelease("1.8.0_392"));
        assertEquals("17", RepoStateVerifier.featureRelease("17-ea"));
    }

    @Test void otherJavaReleaseIsRejected() {
        Map<String, Object> state = state();
        state.put("java_version", "21.0.2");
        assertEquals(List.of("RS2"), ruleIds(state));
    }

    @Test void runtimeCheckCanBeSkipped() {
        Map<String, Object> state = state();
        state.put("java_version", "21.0.2");
        assertTrue(verifier.verify(state, RepoStateVerifyOptions.skipRuntimeCheck()).isValid());
    }

    // ── fields ───────────────────────────────────────────────────────────────

    @Test void wrongSchemaVersion() {
        Map<String, Object> state = state();
        state.put("repo_state_schema_version", "2.0.0");
        assertEquals(List.of("RS1"), ruleIds(state));
    }

    @Test void shortCommit() {
        Map<String, Object> state = state();
        state.put("repo_commit", "abc123");
        assertEquals(List.of("RS3"), ruleIds(state));
    }

    @Test void malformedLockHash() {
        Map<String, Object> state = state();
        state.put("dependency_lock_sha256", "e".repeat(64));
        assertEquals(List.of("RS5"), ruleIds(state));
    }

    @Test void wrongFieldTypes() {
        Map<String, Object> state = state();
        state.put("repo_dirty", "yes");
        state.remove("os_arch");
        assertEquals(List.of("SCHEMA"), ruleIds(state));
        assertEquals(2, verifier.verify(state).violations().size());
    }

    // ── dirty paths ──────────────────────────────────────────────────────────

    @Test void traversalAndDuplicates() {
        Map<String, Object> state = state();
        state.put("dirty_paths", new ArrayList<>(List.of("a/../b", "c", "c")));
        VerificationResult result = verifier.verify(state);
        assertEquals(List.of("RS4"), result.ruleIds());
        assertEquals(List.of("$.dirty_paths[0]", "$.dirty_paths[2]"),
                result.violations().stream().map(v -> v.path()).toList());
    }

    @Test void absoluteDirtyPath() {
        Map<String, Object> state = state();
        state.put("dirty_paths", List.of("/home/me/secret.txt"));
        assertEquals(List.of("RS6"), ruleIds(state));
    }

    @Test void unsortedDirtyPaths() {
        Map<String, Object> state = state();
        state.put("dirty_paths", List.of("b", "a"));
        assertEquals(List.of("RS7"), ruleIds(state));
    }

    @Test void cleanTreeListingPaths() {
        Map<String, Object> state = state();
        state.put("repo_dirty", false);
        assertEquals(List.of("RS8"), ruleIds(state));
    }

    // ── contracts ────────────────────────────────────────────────────────────

    @Test void missingContract() {
        Map<String, Object> state = state();
        Map<String, Object> contracts = new TreeMap<>(RepoStateVerifier.CONTRACT_KEYS.stream()
                .collect(Collectors.toMap(k -> k, k -> (Object) "1.0.0")));
        contracts.remove("patch_schema_version");
        state.put("contracts", contracts);
        VerificationResult result = verifier.verify(state);
        assertEquals(List.of("RS9"), result.ruleIds());
        assertEquals("$.contracts.patch_schema_version", result.violations().get(0).path());
    }

    @SuppressWarnings("unchecked")
    @Test void unsortedContractKeys() {
        Map<String, Object> state = state();
        Map<String, Object> contracts = (Map<String, Object>) state.get("contracts");
        Object apply = contracts.remove("apply_schema_version");
        contracts.put("apply_schema_version", apply);
        assertEquals(List.of("RS9"), ruleIds(state));
    }

    @Test void fractionalNumbersFailTheRoundTrip() {
        Map<String, Object> state = state();
        state.put("ephemeral", Map.of("load", new BigDecimal("0.5")));
        assertEquals(List.of("RS11"), ruleIds(state));
    }

    @Test void nonObjectIsRejected() {
        assertEquals(List.of("SCHEMA"), verifier.verify("repo").ruleIds());
    }
}
