package no.cantara.intent.verify;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A fixed list of rules with unique ids. Evaluation order has no effect on the
 * result, which is always sorted by {@link Violation#ORDER}.
 */
public record RuleCatalogue<O>(List<Rule<O>> rules) {

    public RuleCatalogue {
        rules = rules.stream().sorted(Comparator.comparing(Rule::id)).toList();
        Set<String> ids = new HashSet<>();
        for (Rule<O> rule : rules) {
            if (!ids.add(rule.id())) {
                throw new IllegalArgumentException("duplicate rule id " + rule.id());
            }
        }
    }

    @SafeVarargs
    public static <O> RuleCatalogue<O> of(Rule<O>... rules) {
        return new RuleCatalogue<>(List.of(rules));
    }

    public List<String> ids() {
        return rules.stream().map(Rule::id).toList();
    }

    /**
     * Run every rule. A rule that fails with an unexpected runtime exception is
     * reported as a violation of that rule rather than propagated.
     */
    public List<Violation> evaluate(Map<String, Object> artifact, O options) {
        List<Violation> violations = new ArrayList<>();
        for (Rule<O> rule : rules) {
            RuleSink sink = new RuleSink(rule.id(), violations);
            try {
                rule.check().apply(artifact, options, sink);
            } catch (RuntimeException e) {
                sink.add("$", "rule could not be evaluated: " + e);
            }
        }
        violations.sort(Violation.ORDER);
        return violations;
    }
}
