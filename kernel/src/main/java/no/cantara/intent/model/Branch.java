package no.cantara.intent.model;

import no.cantara.intent.canonical.CanonicalValue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One answer to a splitting question and the constraints it adds to the child.
 */
public record Branch(
        String branchId,
        String answer,
        List<String> addedConstraints
) implements CanonicalValue {
    public Branch {
        addedConstraints = addedConstraints != null ? List.copyOf(addedConstraints) : List.of();
    }

    @Override
    public Object toCanonicalValue() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("branch_id", branchId);
        map.put("answer", answer);
        map.put("added_constraints", addedConstraints);
        return map;
    }
}
