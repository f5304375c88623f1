package no.cantara.intent.model;

import no.cantara.intent.canonical.CanonicalValue;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The question a node was decomposed on. Branches are kept sorted by id.
 */
public record SplittingQuestion(
        Question question,
        List<Branch> branches
) implements CanonicalValue {
    public SplittingQuestion {
        branches = branches.stream().sorted(Comparator.comparing(Branch::branchId)).toList();
    }

    @Override
    public Object toCanonicalValue() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("question", question);
        map.put("branches", branches);
        return map;
    }
}
