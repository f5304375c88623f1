package no.cantara.intent.verify.bundle;

import no.cantara.intent.canonical.CanonicalValue;
import no.cantara.intent.model.ResultKind;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Deterministic digest of a bundle for callers that only need the outcome.
 *
 * @param bundleHash canonical hash of the bundle, or {@code null} if it cannot be canonicalized
 */
public record BundleSummary(
        String schemaVersion,
        ResultKind outcome,
        String bundleHash,
        List<String> artifactPaths,
        List<String> questionIds,
        List<String> terminalNodeIds
) implements CanonicalValue {
    public BundleSummary {
        artifactPaths = List.copyOf(artifactPaths);
        questionIds = List.copyOf(questionIds);
        terminalNodeIds = List.copyOf(terminalNodeIds);
    }

    @Override
    public Object toCanonicalValue() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("schema_version", schemaVersion);
        map.put("outcome", outcome.name());
        map.put("bundle_hash", bundleHash);
        map.put("artifact_count", artifactPaths.size());
        map.put("artifact_paths", artifactPaths);
        map.put("unresolved_questions_count", questionIds.size());
        map.put("question_ids", questionIds);
        map.put("terminal_nodes_count", terminalNodeIds.size());
        map.put("terminal_node_ids", terminalNodeIds);
        return map;
    }
}
