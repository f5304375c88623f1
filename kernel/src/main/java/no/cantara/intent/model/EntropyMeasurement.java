package no.cantara.intent.model;

import no.cantara.intent.canonical.CanonicalValue;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * How uncertain a goal is.
 *
 * @param unresolvedRefs     placeholder and hedging matches, uncapped
 * @param schemaGaps         required topic categories with no match, 0..5
 * @param contradictionCount opposite-concept pairs present together
 * @param branchingFactor    1 plus decision keyword matches, 1..10
 * @param entropyScore       weighted composite, 0..100
 */
public record EntropyMeasurement(
        int unresolvedRefs,
        int schemaGaps,
        int contradictionCount,
        int branchingFactor,
        int entropyScore
) implements CanonicalValue {

    @Override
    public Object toCanonicalValue() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("unresolved_refs", unresolvedRefs);
        map.put("schema_gaps", schemaGaps);
        map.put("contradiction_count", contradictionCount);
        map.put("branching_factor", branchingFactor);
        map.put("entropy_score", entropyScore);
        return map;
    }
}
