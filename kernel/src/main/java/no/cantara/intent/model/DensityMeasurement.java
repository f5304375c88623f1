package no.cantara.intent.model;

import no.cantara.intent.canonical.CanonicalValue;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * How concrete a goal is.
 *
 * @param concreteConstraints constraints with at least one concrete keyword
 * @param specifiedOutputs    output phrase matches over goal and constraints
 * @param constraintDepth     deepest qualifier nesting of a single constraint, 0..10
 * @param densityScore        weighted composite, 0..100
 */
public record DensityMeasurement(
        int concreteConstraints,
        int specifiedOutputs,
        int constraintDepth,
        int densityScore
) implements CanonicalValue {

    @Override
    public Object toCanonicalValue() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("concrete_constraints", concreteConstraints);
        map.put("specified_outputs", specifiedOutputs);
        map.put("constraint_depth", constraintDepth);
        map.put("density_score", densityScore);
        return map;
    }
}
