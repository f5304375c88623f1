package no.cantara.intent.verify.workspace;

import no.cantara.intent.canonical.CanonicalizationException;
import no.cantara.intent.canonical.Canonicalizer;
import no.cantara.intent.verify.ArtifactVerifier;
import no.cantara.intent.verify.Rule;
import no.cantara.intent.verify.RuleCatalogue;
import no.cantara.intent.verify.RuleSink;
import no.cantara.intent.verify.Values;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
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
 * Verifies a workspace snapshot: the tool invocation, the files it read (by
 * relative path and hash), the hashed environment allowlist and the safety
 * boundaries a run was held to. Environment values are never stored, only hashed.
 */
public final class WorkspaceVerifier extends ArtifactVerifier<WorkspaceVerifyOptions> {

    public static final String SCHEMA_VERSION = "1.0.0";

    public static final List<String> TOOL_IDS = List.of(
            "patch-apply", "repo-state", "transform", "verify", "workspace-snapshot");

    public static final List<String> DEFAULT_ENV_ALLOWLIST = List.of("JAVA_HOME", "LANG", "LC_ALL", "TZ");

    static final Set<String> FORBIDDEN_ENV_NAMES = Set.of("HOME", "PATH", "USER");
    static final List<String> FORBIDDEN_ENV_PREFIXES = List.of(
            "ANTHROPIC_", "AWS_", "GIT_", "MAVEN_", "OPENAI_", "SSH_");

    /** Ref name to the field holding its hash. */
    static final Map<String, String> REF_HASH_FIELDS = Map.of(
            "intent", "sha256",
            "bundle", "bundle_hash",
            "model_io", "sha256",
            "repo_state", "sha256");

    static final Map<String, List<String>> REQUIRED_REFS = Map.of(
            "transform", List.of("intent"),
            "verify", List.of(),
            "patch-apply", List.of("bundle"),
            "repo-state", List.of(),
            "workspace-snapshot", List.of());

    private static final Pattern ENV_NAME = Pattern.compile("^[A-Z][A-Z0-9_]*$");

    public WorkspaceVerifier() {
        super("workspace snapshot", RuleCatalogue.<WorkspaceVerifyOptions>of(
                Rule.of("SCHEMA", "Structure of args, refs, env, safety and warnings", WorkspaceVerifier::checkSchema),
                Rule.of("WS1", "Schema version", WorkspaceVerifier::checkSchemaVersion),
                Rule.of("WS2", "Tool id", WorkspaceVerifier::checkToolId),
                Rule.of("WS3", "Args canonical", WorkspaceVerifier::checkArgs),
                Rule.of("WS4", "Ref paths relative", WorkspaceVerifier::checkRefPaths),
                Rule.of("WS5", "Hash formats and referenced file hashes", WorkspaceVerifier::checkHashes),
                Rule.of("WS6", "Env allowlist", WorkspaceVerifier::checkAllowlist),
                Rule.of("WS7", "Hashed env entries allowed and sorted", WorkspaceVerifier::checkHashedEnv),
                Rule.of("WS8", "No plaintext env values", WorkspaceVerifier::checkNoPlaintext),
                Rule.of("WS10", "Canonical round trip", WorkspaceVerifier::checkRoundTrip),
                Rule.of("WS12", "Refs required by tool", WorkspaceVerifier::checkRequiredRefs),
                Rule.of("WS13", "Model IO ref for record and replay", WorkspaceVerifier::checkModelIoRef),
                Rule.of("WS14", "No absolute paths", WorkspaceVerifier::checkLeaks)));
    }

    @Override
    protected WorkspaceVerifyOptions defaultOptions() {
        return WorkspaceVerifyOptions.DEFAULTS;
    }

    @Override
    public Map<String, Object> computeCore(Map<String, Object> snapshot) {
        Map<String, Object> core = new LinkedHashMap<>();
        for (String field : List.of("workspace_schema_version", "tool_id", "args", "refs", "env", "safety")) {
            core.put(field, snapshot.get(field));
        }
        if (snapshot.containsKey("warnings")) {
            core.put("warnings", snapshot.get("warnings"));
        }
        return core;
    }

    @Override
    protected Map<String, Long> summarize(Map<String, Object> snapshot) {
        Map<String, Object> refs = asObject(snapshot.get("refs"));
        Map<String, Object> env = asObject(snapshot.get("env"));
        List<Object> hashed = env == null ? null : asList(env.get("hashed"));
        return Map.of(
                "refs", refs == null ? 0L : (long) refs.size(),
                "env_hashed", hashed == null ? 0L : (long) hashed.size());
    }

    /** {@code "sha256:" + hex} of a file's bytes, as recorded in {@code rel_path} refs. */
    public static String fileHash(Path file) throws IOException {
        return Canonicalizer.HASH_PREFIX + Canonicalizer.sha256Hex(Files.readAllBytes(file));
    }

    static boolean isForbiddenEnvName(String name) {
        if (FORBIDDEN_ENV_NAMES.contains(name)) return true;
        return FORBIDDEN_ENV_PREFIXES.stream().anyMatch(name::startsWith);
    }

    // ── rules ───────────────────────────────────────────────────────────────

    private static void checkSchema(Map<String, Object> snapshot, WorkspaceVerifyOptions options, RuleSink sink) {
        if (asObject(snapshot.get("args")) == null) {
            sink.add("$.args", "Missing or invalid args: expected object");
        }

        Map<String, Object> refs = asObject(snapshot.get("refs"));
        if (refs == null) {
            sink.add("$.refs", "Missing or invalid refs: expected object");
        } else {
            REF_HASH_FIELDS.forEach((key, hashField) -> {
                if (!refs.containsKey(key)) return;
                Map<String, Object> ref = asObject(refs.get(key));
                String path = "$.refs." + key;
                if (ref == null) {
                    sink.add(path, "refs." + key + " is not an object");
                    return;
                }
                if (!(ref.get("rel_path") instanceof String)) {
                    sink.add(path + ".rel_path", "refs." + key + ".rel_path is not a string");
                }
                if (!(ref.get(hashField) instanceof String)) {
                    sink.add(path + "." + hashField, "refs." + key + "." + hashField + " is not a string");
                }
            });
            Map<String, Object> policy = asObject(refs.get("policy"));
            if (policy == null) {
                sink.add("$.refs.policy", "Missing refs.policy");
            } else {
                if (!(policy.get("profile") instanceof String)) {
                    sink.add("$.refs.policy.profile", "refs.policy.profile is not a string");
                }
                if (!(policy.get("policy_hash") instanceof String)) {
                    sink.add("$.refs.policy.policy_hash", "refs.policy.policy_hash is not a string");
                }
            }
        }

        Map<String, Object> env = asObject(snapshot.get("env"));
        if (env == null) {
            sink.add("$.env", "Missing or invalid env: expected object");
        } else {
            if (asList(env.get("allowlist")) == null) {
                sink.add("$.env.allowlist", "env.allowlist is not an array");
            }
            List<Object> hashed = asList(env.get("hashed"));
            if (hashed == null) {
                sink.add("$.env.hashed", "env.hashed is not an array");
            } else {
                for (int i = 0; i < hashed.size(); i++) {
                    Map<String, Object> entry = asObject(hashed.get(i));
                    String path = "$.env.hashed[" + i + "]";
                    if (entry == null) {
                        sink.add(path, "env.hashed[" + i + "] is not an object");
                        continue;
                    }
                    if (!(entry.get("name") instanceof String)) {
                        sink.add(path + ".name", "env.hashed[" + i + "].name is not a string");
                    }
                    if (!(entry.get("sha256") instanceof String)) {
                        sink.add(path + ".sha256", "env.hashed[" + i + "].sha256 is not a string");
                    }
                }
            }
        }

        Map<String, Object> safety = asObject(snapshot.get("safety"));
        if (safety == null) {
            sink.add("$.safety", "Missing or invalid safety: expected object");
        } else {
            if (!".".equals(safety.get("work_root_rel"))) {
                sink.add("$.safety.work_root_rel", "safety.work_root_rel must be \".\"");
            }
            if (!Boolean.TRUE.equals(safety.get("denies_absolute"))) {
                sink.add("$.safety.denies_absolute", "safety.denies_absolute must be true");
            }
            if (!Boolean.TRUE.equals(safety.get("denies_traversal"))) {
                sink.add("$.safety.denies_traversal", "safety.denies_traversal must be true");
            }
        }

        if (snapshot.containsKey("warnings")) {
            List<String> warnings = Values.strings(snapshot.get("warnings"));
            if (warnings == null) {
                sink.add("$.warnings", "warnings is not an array");
            } else if (!Values.isSorted(warnings)) {
                sink.add("$.warnings", "warnings is not sorted");
            }
        }
    }

    private static void checkSchemaVersion(Map<String, Object> snapshot, WorkspaceVerifyOptions options, RuleSink sink) {
        Object version = snapshot.get("workspace_schema_version");
        if (!(version instanceof String s)) {
            sink.add("$.workspace_schema_version", "Missing or invalid workspace_schema_version");
        } else if (!SCHEMA_VERSION.equals(s)) {
            sink.add("$.workspace_schema_version",
                    "Invalid schema version: expected \"" + SCHEMA_VERSION + "\", got \"" + s + "\"");
        }
    }

    private static void checkToolId(Map<String, Object> snapshot, WorkspaceVerifyOptions options, RuleSink sink) {
        Object toolId = snapshot.get("tool_id");
        if (!(toolId instanceof String s)) {
            sink.add("$.tool_id", "Missing or invalid tool_id");
        } else if (!TOOL_IDS.contains(s)) {
            sink.add("$.tool_id", "Invalid tool_id: expected one of " + String.join(", ", TOOL_IDS)
                    + ", got \"" + s + "\"");
        }
    }

    private static void checkArgs(Map<String, Object> snapshot, WorkspaceVerifyOptions options, RuleSink sink) {
        Map<String, Object> args = asObject(snapshot.get("args"));
        if (args == null) return;
        if (!Values.isSorted(new ArrayList<>(args.keySet()))) {
            sink.add("$.args", "args keys are not sorted lexicographically");
        }
        args.forEach((key, value) -> {
            String path = "$.args." + key;
            if (value == null) {
                sink.add(path, "args." + key + " contains null");
            } else if (value instanceof List<?> list && Values.allStrings(list)
                    && !Values.isSorted(Values.strings(list))) {
                sink.add(path, "args." + key + " array is not sorted");
            }
        });
    }

    private static void checkRefPaths(Map<String, Object> snapshot, WorkspaceVerifyOptions options, RuleSink sink) {
        Map<String, Object> refs = asObject(snapshot.get("refs"));
        if (refs == null) return;
        for (String key : REF_HASH_FIELDS.keySet()) {
            Map<String, Object> ref = asObject(refs.get(key));
            if (ref == null || !(ref.get("rel_path") instanceof String relPath)) continue;
            String path = "$.refs." + key + ".rel_path";
            if (Values.isAbsolutePath(relPath)) {
                sink.add(path, "Absolute path in refs." + key + ".rel_path");
            }
            if (relPath.contains("..")) {
                sink.add(path, "Path traversal in refs." + key + ".rel_path");
            }
            if (relPath.contains("\\")) {
                sink.add(path, "Backslash in refs." + key + ".rel_path");
            }
        }
    }

    private static void checkHashes(Map<String, Object> snapshot, WorkspaceVerifyOptions options, RuleSink sink) {
        Map<String, Object> refs = asObject(snapshot.get("refs"));
        if (refs != null) {
            REF_HASH_FIELDS.forEach((key, hashField) -> {
                Map<String, Object> ref = asObject(refs.get(key));
                if (ref == null || !(ref.get(hashField) instanceof String hash)) return;
                String path = "$.refs." + key + "." + hashField;
                if (!Values.isHash(hash)) {
                    sink.add(path, "Invalid hash format in refs." + key + "." + hashField);
                } else if ("sha256".equals(hashField) && ref.get("rel_path") instanceof String relPath) {
                    checkReferencedFile(relPath, hash, path, options, sink);
                }
            });
            Map<String, Object> policy = asObject(refs.get("policy"));
            if (policy != null && policy.get("policy_hash") instanceof String hash && !Values.isHash(hash)) {
                sink.add("$.refs.policy.policy_hash", "Invalid hash format in refs.policy.policy_hash");
            }
        }
        for (HashedEntry entry : hashedEntries(snapshot)) {
            if (entry.fields().get("sha256") instanceof String hash && !Values.isHash(hash)) {
                sink.add(entry.path() + ".sha256",
                        "Invalid hash format in env.hashed[" + entry.index() + "].sha256");
            }
        }
    }

    private static void checkReferencedFile(String relPath, String expected, String path,
                                            WorkspaceVerifyOptions options, RuleSink sink) {
        if (options.workRoot() == null || options.skipHashVerification()) return;
        if (Values.isAbsolutePath(relPath) || relPath.contains("..")) return;
        Path file = options.workRoot().resolve(relPath);
        if (!Files.isRegularFile(file)) {
            sink.add(path, "Referenced file not found: " + relPath);
            return;
        }
        try {
            String actual = fileHash(file);
            if (!actual.equals(expected)) {
                sink.add(path, "Hash mismatch for " + relPath + ": expected " + expected + ", got " + actual);
            }
        } catch (IOException e) {
            sink.add(path, "Referenced file not readable: " + relPath + " (" + e.getMessage() + ")");
        }
    }

    private static void checkAllowlist(Map<String, Object> snapshot, WorkspaceVerifyOptions options, RuleSink sink) {
        Map<String, Object> env = asObject(snapshot.get("env"));
        List<Object> allowlist = env == null ? null : asList(env.get("allowlist"));
        if (allowlist == null) return;
        List<String> names = new ArrayList<>();
        for (int i = 0; i < allowlist.size(); i++) {
            String path = "$.env.allowlist[" + i + "]";
            if (!(allowlist.get(i) instanceof String name)) {
                sink.add(path, "env.allowlist[" + i + "] is not a string");
                continue;
            }
            names.add(name);
            if (!ENV_NAME.matcher(name).matches()) {
                sink.add(path, "Invalid env var name format: \"" + name + "\"");
            }
            if (isForbiddenEnvName(name)) {
                sink.add(path, "Forbidden env var name: \"" + name + "\"");
            }
        }
        if (!Values.isSorted(names)) {
            sink.add("$.env.allowlist", "env.allowlist is not sorted lexicographically");
        }
        if (new HashSet<>(names).size() != names.size()) {
            sink.add("$.env.allowlist", "env.allowlist contains duplicates");
        }
    }

    private static void checkHashedEnv(Map<String, Object> snapshot, WorkspaceVerifyOptions options, RuleSink sink) {
        Map<String, Object> env = asObject(snapshot.get("env"));
        List<String> allowlist = env == null ? null : Values.strings(env.get("allowlist"));
        if (allowlist == null || asList(env.get("hashed")) == null) return;
        Set<String> allowed = new HashSet<>(allowlist);
        List<String> names = new ArrayList<>();
        for (HashedEntry entry : hashedEntries(snapshot)) {
            if (!(entry.fields().get("name") instanceof String name)) continue;
            names.add(name);
            if (!allowed.contains(name)) {
                sink.add(entry.path(), "env.hashed entry \"" + name + "\" not in allowlist");
            }
        }
        if (!Values.isSorted(names)) {
            sink.add("$.env.hashed", "env.hashed is not sorted by name");
        }
    }

    private static void checkNoPlaintext(Map<String, Object> snapshot, WorkspaceVerifyOptions options, RuleSink sink) {
        for (HashedEntry entry : hashedEntries(snapshot)) {
            if (entry.fields().containsKey("value")) {
                sink.add(entry.path() + ".value", "Plaintext value detected in env.hashed entry");
            }
        }
    }

    private static void checkRoundTrip(Map<String, Object> snapshot, WorkspaceVerifyOptions options, RuleSink sink) {
        try {
            if (!Canonicalizer.isRoundTripStable(snapshot)) {
                sink.add("$", "Workspace snapshot does not round-trip through canonicalization");
            }
        } catch (CanonicalizationException e) {
            sink.add(e.path(), "Failed to canonicalize workspace snapshot: " + e.getMessage());
        }
    }

    private static void checkRequiredRefs(Map<String, Object> snapshot, WorkspaceVerifyOptions options, RuleSink sink) {
        Map<String, Object> refs = asObject(snapshot.get("refs"));
        if (refs == null || !(snapshot.get("tool_id") instanceof String toolId)) return;
        for (String required : REQUIRED_REFS.getOrDefault(toolId, List.of())) {
            if (!refs.containsKey(required)) {
                sink.add("$.refs." + required,
                        "Missing required ref \"" + required + "\" for tool_id \"" + toolId + "\"");
            }
        }
    }

    private static void checkModelIoRef(Map<String, Object> snapshot, WorkspaceVerifyOptions options, RuleSink sink) {
        Map<String, Object> refs = asObject(snapshot.get("refs"));
        Map<String, Object> args = asObject(snapshot.get("args"));
        if (refs == null || args == null) return;
        Object mode = args.get("model_mode");
        if (("record".equals(mode) || "replay".equals(mode)) && !refs.containsKey("model_io")) {
            sink.add("$.refs.model_io", "refs.model_io required when model_mode is \"" + mode + "\"");
        }
    }

    private static void checkLeaks(Map<String, Object> snapshot, WorkspaceVerifyOptions options, RuleSink sink) {
        snapshot.forEach((key, value) -> {
            if (!"ephemeral".equals(key)) {
                findAbsolutePaths(value, "$." + key, sink);
            }
        });
    }

    private static void findAbsolutePaths(Object value, String path, RuleSink sink) {
        if (value instanceof String s) {
            if (Values.isAbsolutePath(s)) {
                sink.add(path, "Absolute path detected in field");
            }
        } else if (value instanceof List<?> list) {
            for (int i = 0; i < list.size(); i++) {
                findAbsolutePaths(list.get(i), path + "[" + i + "]", sink);
            }
        } else if (value instanceof Map<?, ?> map) {
            map.forEach((k, v) -> findAbsolutePaths(v, path + "." + k, sink));
        }
    }

    /** Object entries of {@code env.hashed} with their array index. */
    private static List<HashedEntry> hashedEntries(Map<String, Object> snapshot) {
        Map<String, Object> env = asObject(snapshot.get("env"));
        List<Object> hashed = env == null ? null : asList(env.get("hashed"));
        if (hashed == null) return List.of();
        List<HashedEntry> entries = new ArrayList<>();
        for (int i = 0; i < hashed.size(); i++) {
            Map<String, Object> entry = asObject(hashed.get(i));
            if (entry != null) {
                entries.add(new HashedEntry(i, entry));
            }
        }
        return entries;
    }

    private record HashedEntry(int index, Map<String, Object> fields) {
        String path() {
            return "$.env.hashed[" + index + "]";
        }
    }
}
