package no.cantara.intent.model;

import no.cantara.intent.canonical.CanonicalValue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An artifact generated at a terminal node.
 */
public record Output(
        String id,
        OutputType type,
        String path,
        String content,
        String contentHash,
        List<String> sourceConstraints,
        int confidence
) implements CanonicalValue {
    public Output {
        sourceConstraints = sourceConstraints != null ? sourceConstraints.stream().sorted().toList() : List.of();
    }

    @Override
    public Object toCanonicalValue() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("id", id);
        map.put("type", type.wireName());
        map.put("path", path);
        map.put("content", content);
        map.put("content_hash", contentHash);
        map.put("source_constraints", sourceConstraints);
        map.put("confidence", confidence);
        return map;
    }
}
