package no.cantara.intent.verify.repostate;

import no.cantara.intent.canonical.CanonicalizationException;
import no.cantara.intent.canonical.Canonicalizer;
import no.cantara.intent.verify.ArtifactVerifier;
import no.cantara.intent.verify.Rule;
import no.cantara.intent.verify.RuleCatalogue;
import no.cantara.intent.verify.RuleSink;
import no.cantara.intent.verify.Values;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import static no.cantara.intent.verify.Values.asList;
import static no.cantara.intent.verify.Values.asObject;

/**
 * Verifies a repository state snapshot: the commit, working tree state and build
 * environment an artifact was produced in, plus the schema versions of every
 * artifact contract. The {@code ephemeral} group is not hashed.
 */
public final class RepoStateVerifier extends ArtifactVerifier<RepoStateVerifyOptions> {

    public static final String SCHEMA_VERSION = "1.0.0";

    public static final List<String> CONTRACT_KEYS = List.of(
            "apply_schema_version",
            "bundle_schema_version",
            "model_io_schema_version",
            "patch_schema_version",
            "repo_state_schema_version",
            "workspace_schema_version");

    static final List<String> CORE_FIELDS = List.of(
            "repo_state_schema_version", "repo_commit", "repo_dirty", "dirty_paths",
            "java_version", "build_tool_version", "os_platform", "os_arch",
            "dependency_lock_sha256", "contracts");

    private static final Pattern COMMIT = Pattern.compile("^[0-9a-f]{40}$");

    public RepoStateVerifier() {
        super("repo state", RuleCatalogue.<RepoStateVerifyOptions>of(
                Rule.of("SCHEMA", "Field types", RepoStateVerifier::checkSchema),
                Rule.of("RS1", "Schema version", RepoStateVerifier::checkSchemaVersion),
                Rule.of("RS2", "Java runtime baseline", RepoStateVerifier::checkRuntime),
                Rule.of("RS3", "Commit hash format", RepoStateVerifier::checkCommit),
                Rule.of("RS4", "Dirty path entries", RepoStateVerifier::checkDirtyPathEntries),
                Rule.of("RS5", "Dependency lock hash format", RepoStateVerifier::checkLockHash),
                Rule.of("RS6", "Dirty paths relative", RepoStateVerifier::checkDirtyPathsRelative),
                Rule.of("RS7", "Dirty paths sorted", RepoStateVerifier::checkDirtyPathsSorted),
                Rule.of("RS8", "Clean tree lists no dirty paths", RepoStateVerifier::checkCleanTree),
                Rule.of("RS9", "Contracts complete", RepoStateVerifier::checkContracts),
                Rule.of("RS11", "Canonical round trip", RepoStateVerifier::checkRoundTrip)));
    }

    @Override
    protected RepoStateVerifyOptions defaultOptions() {
        return RepoStateVerifyOptions.DEFAULTS;
    }

    @Override
    public Map<String, Object> computeCore(Map<String, Object> state) {
        Map<String, Object> core = new LinkedHashMap<>();
        for (String field : CORE_FIELDS) {
            core.put(field, state.get(field));
        }
        return core;
    }

    @Override
    protected Map<String, Long> summarize(Map<String, Object> state) {
        List<Object> dirty = asList(state.get("dirty_paths"));
        return Map.of("dirty_paths", dirty == null ? 0L : (long) dirty.size());
    }

    /** Java feature release of a version string: {@code "17.0.9"} and {@code "17"} give {@code "17"}. */
    static String featureRelease(String version) {
        String v = version.startsWith("1.") ? version.substring(2) : version;
        int end = 0;
        while (end < v.length() && Character.isDigit(v.charAt(end))) end++;
        return v.substring(0, end);
    }

    // ── rules ───────────────────────────────────────────────────────────────

    private static void checkSchema(Map<String, Object> state, RepoStateVerifyOptions options, RuleSink sink) {
        if (!(state.get("repo_dirty") instanceof Boolean)) {
            sink.add("$.repo_dirty", "Missing or invalid repo_dirty: expected boolean");
        }
        if (asList(state.get("dirty_paths")) == null) {
            sink.add("$.dirty_paths", "Missing or invalid dirty_paths: expected array");
        }
        for (String field : List.of("java_version", "build_tool_version", "os_platform", "os_arch")) {
            if (!(state.get(field) instanceof String)) {
                sink.add("$." + field, "Missing or invalid " + field);
            }
        }
        if (state.containsKey("ephemeral") && asObject(state.get("ephemeral")) == null) {
            sink.add("$.ephemeral", "ephemeral must be an object");
        }
    }

    private static void checkSchemaVersion(Map<String, Object> state, RepoStateVerifyOptions options, RuleSink sink) {
        Object version = state.get("repo_state_schema_version");
        if (!(version instanceof String s)) {
            sink.add("$.repo_state_schema_version", "Missing or invalid repo_state_schema_version");
        } else if (!SCHEMA_VERSION.equals(s)) {
            sink.add("$.repo_state_schema_version",
                    "Invalid schema version: expected \"" + SCHEMA_VERSION + "\", got \"" + s + "\"");
        }
    }

    private static void checkRuntime(Map<String, Object> state, RepoStateVerifyOptions options, RuleSink sink) {
        if (options.runtimeBaseline() == null || !(state.get("java_version") instanceof String version)) return;
        if (!options.runtimeBaseline().equals(featureRelease(version))) {
            sink.add("$.java_version", "Java version mismatch: expected feature release \""
                    + options.runtimeBaseline() + "\", got \"" + version + "\"");
        }
    }

    private static void checkCommit(Map<String, Object> state, RepoStateVerifyOptions options, RuleSink sink) {
        Object commit = state.get("repo_commit");
        if (!(commit instanceof String s)) {
            sink.add("$.repo_commit", "Missing or invalid repo_commit");
        } else if (!COMMIT.matcher(s).matches()) {
            sink.add("$.repo_commit", "Invalid repo_commit format: expected 40-char lowercase hex, got \"" + s + "\"");
        }
    }

    private static void checkDirtyPathEntries(Map<String, Object> state, RepoStateVerifyOptions options, RuleSink sink) {
        List<Object> paths = asList(state.get("dirty_paths"));
        if (paths == null) return;
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < paths.size(); i++) {
            String path = "$.dirty_paths[" + i + "]";
            if (!(paths.get(i) instanceof String p)) {
                sink.add(path, "dirty_paths[" + i + "] is not a string");
                continue;
            }
            if (p.contains("..")) {
                sink.add(path, "Path traversal in dirty_paths: " + p);
            }
            if (!seen.add(p)) {
                sink.add(path, "Duplicate entry in dirty_paths: " + p);
            }
        }
    }

    private static void checkLockHash(Map<String, Object> state, RepoStateVerifyOptions options, RuleSink sink) {
        Object hash = state.get("dependency_lock_sha256");
        if (!(hash instanceof String s)) {
            sink.add("$.dependency_lock_sha256", "Missing or invalid dependency_lock_sha256");
        } else if (!Values.isHash(s)) {
            sink.add("$.dependency_lock_sha256",
                    "Invalid dependency_lock_sha256 format: expected \"sha256:<64hex>\", got \"" + s + "\"");
        }
    }

    private static void checkDirtyPathsRelative(Map<String, Object> state, RepoStateVerifyOptions options, RuleSink sink) {
        List<Object> paths = asList(state.get("dirty_paths"));
        if (paths == null) return;
        for (int i = 0; i < paths.size(); i++) {
            if (paths.get(i) instanceof String p && Values.isAbsolutePath(p)) {
                sink.add("$.dirty_paths[" + i + "]", "Absolute path in dirty_paths: " + p);
            }
        }
    }

    private static void checkDirtyPathsSorted(Map<String, Object> state, RepoStateVerifyOptions options, RuleSink sink) {
        List<String> paths = Values.strings(state.get("dirty_paths"));
        if (paths != null && !Values.isSorted(paths)) {
            sink.add("$.dirty_paths", "dirty_paths is not sorted lexicographically");
        }
    }

    private static void checkCleanTree(Map<String, Object> state, RepoStateVerifyOptions options, RuleSink sink) {
        List<Object> paths = asList(state.get("dirty_paths"));
        if (Boolean.FALSE.equals(state.get("repo_dirty")) && paths != null && !paths.isEmpty()) {
            sink.add("$.dirty_paths", "repo_dirty is false but " + paths.size() + " dirty paths are listed");
        }
    }

    private static void checkContracts(Map<String, Object> state, RepoStateVerifyOptions options, RuleSink sink) {
        Map<String, Object> contracts = asObject(state.get("contracts"));
        if (contracts == null) {
            sink.add("$.contracts", "Missing or invalid contracts: expected object");
            return;
        }
        for (String key : CONTRACT_KEYS) {
            Object value = contracts.get(key);
            if (!(value instanceof String s)) {
                sink.add("$.contracts." + key, "Missing contracts." + key);
            } else if (s.isEmpty()) {
                sink.add("$.contracts." + key, "Empty value for contracts." + key);
            }
        }
        List<String> keys = new ArrayList<>(contracts.keySet());
        if (!Values.isSorted(keys)) {
            sink.add("$.contracts", "contracts keys are not sorted lexicographically");
        }
    }

    private static void checkRoundTrip(Map<String, Object> state, RepoStateVerifyOptions options, RuleSink sink) {
        try {
            if (!Canonicalizer.isRoundTripStable(state)) {
                sink.add("$", "Repo state does not round-trip through canonicalization");
            }
        } catch (CanonicalizationException e) {
            sink.add(e.path(), "Failed to canonicalize repo state: " + e.getMessage());
        }
    }
}
