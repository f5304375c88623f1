package no.cantara.intent.model;

import no.cantara.intent.canonical.CanonicalValue;
import no.cantara.intent.canonical.Canonicalizer;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The content-addressed result of one kernel run.
 *
 * <p>Two runs over the same normalized intent produce bundles whose canonical
 * forms are byte-identical.
 */
public record Bundle(
        String id,
        String schemaVersion,
        String kernelVersion,
        String sourceIntentHash,
        BundleStatus status,
        ContextNode rootNode,
        List<ContextNode> terminalNodes,
        List<Output> outputs,
        List<Question> unresolvedQuestions,
        BundleStats stats
) implements CanonicalValue {

    public static final String SCHEMA_VERSION = "0.1.0";
    public static final String KERNEL_VERSION = "0.1.0";

    public Bundle {
        terminalNodes = terminalNodes.stream().sorted(Comparator.comparing(ContextNode::id)).toList();
        outputs = outputs.stream().sorted(Comparator.comparing(Output::path)).toList();
        unresolvedQuestions = unresolvedQuestions.stream().sorted(Question.ORDER).toList();
    }

    public ResultKind resultKind() {
        return ResultKind.of(status);
    }

    /** Canonical SHA-256 of the whole bundle, in wire format. */
    public String contentHash() {
        return Canonicalizer.contentHash(this);
    }

    /** The bundle without its id; {@code id} is derived from exactly this map. */
    public Map<String, Object> identityCore() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("schema_version", schemaVersion);
        map.put("kernel_version", kernelVersion);
        map.put("source_intent_hash", sourceIntentHash);
        map.put("status", status.wireName());
        map.put("root_node", rootNode);
        map.put("terminal_nodes", terminalNodes);
        map.put("outputs", outputs);
        map.put("unresolved_questions", unresolvedQuestions);
        map.put("stats", stats);
        return map;
    }

    @Override
    public Object toCanonicalValue() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("id", id);
        map.putAll(identityCore());
        return map;
    }
}
