package no.cantara.intent.adapter;

import no.cantara.intent.canonical.CanonicalValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * What a model call is made for. Constraints are kept sorted and metadata keys
 * ordered so that the context canonicalizes identically for identical input.
 */
public record TransformContext(
        String intentId,
        String runId,
        TransformMode mode,
        List<String> constraints,
        Map<String, Object> metadata
) implements CanonicalValue {

    public TransformContext {
        if (intentId == null || intentId.isEmpty()) {
            throw new IllegalArgumentException("intentId is required");
        }
        if (runId == null || runId.isEmpty()) {
            throw new IllegalArgumentException("runId is required");
        }
        if (mode == null) {
            throw new IllegalArgumentException("mode is required");
        }
        constraints = constraints != null ? List.copyOf(new TreeSet<>(constraints)) : List.of();
        metadata = metadata != null ? Collections.unmodifiableMap(new TreeMap<>(metadata)) : Map.of();
    }

    public static TransformContext of(String intentId, String runId, TransformMode mode) {
        return new TransformContext(intentId, runId, mode, List.of(), Map.of());
    }

    @Override
    public Object toCanonicalValue() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("intent_id", intentId);
        map.put("run_id", runId);
        map.put("mode", mode.wireName());
        map.put("constraints", constraints);
        map.put("metadata", metadata);
        return map;
    }
}
