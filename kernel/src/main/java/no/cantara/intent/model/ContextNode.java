package no.cantara.intent.model;

import no.cantara.intent.canonical.CanonicalValue;
import no.cantara.intent.canonical.Canonicalizer;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A node of the decomposition tree. Children are referenced by id.
 *
 * <p>The id is derived from {@link #identityCore} and so covers the whole subtree
 * through the child ids; {@code parentId}, {@code status} and the unresolved
 * questions are not part of it.
 */
public record ContextNode(
        String id,
        String parentId,
        NodeStatus status,
        String goal,
        List<String> constraints,
        EntropyMeasurement entropy,
        DensityMeasurement density,
        SplittingQuestion splittingQuestion,
        List<String> children,
        List<Question> unresolvedQuestions
) implements CanonicalValue {
    public ContextNode {
        constraints = constraints.stream().sorted().toList();
        children = children != null ? children.stream().sorted().toList() : List.of();
        unresolvedQuestions = unresolvedQuestions != null
                ? unresolvedQuestions.stream().sorted(Question.ORDER).toList()
                : List.of();
    }

    public boolean isTerminal() {
        return status == NodeStatus.TERMINAL;
    }

    /**
     * The hashed projection of a node: goal, constraints, measurements, sorted child
     * ids and the splitting question when present.
     */
    public static Map<String, Object> identityCore(String goal, List<String> constraints,
                                                   EntropyMeasurement entropy, DensityMeasurement density,
                                                   List<String> childIds, SplittingQuestion splittingQuestion) {
        Map<String, Object> core = new LinkedHashMap<>();
        core.put("goal", goal);
        core.put("constraints", constraints.stream().sorted().toList());
        core.put("entropy", entropy);
        core.put("density", density);
        core.put("children", childIds.stream().sorted().toList());
        if (splittingQuestion != null) {
            core.put("splitting_question", splittingQuestion);
        }
        return core;
    }

    public static String idFor(String goal, List<String> constraints,
                               EntropyMeasurement entropy, DensityMeasurement density,
                               List<String> childIds, SplittingQuestion splittingQuestion) {
        return Canonicalizer.contentId("node",
                identityCore(goal, constraints, entropy, density, childIds, splittingQuestion));
    }

    @Override
    public Object toCanonicalValue() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("id", id);
        map.put("parent_id", parentId);
        map.put("status", status.wireName());
        map.put("goal", goal);
        map.put("constraints", constraints);
        map.put("entropy", entropy);
        map.put("density", density);
        if (splittingQuestion != null) {
            map.put("splitting_question", splittingQuestion);
        }
        map.put("children", children);
        map.put("unresolved_questions", unresolvedQuestions);
        return map;
    }
}
