package no.cantara.intent.verify;

import java.util.List;

/**
 * Collects the violations of one rule; every violation it records carries that rule's id.
 */
public final class RuleSink {

    private final String ruleId;
    private final List<Violation> out;

    RuleSink(String ruleId, List<Violation> out) {
        this.ruleId = ruleId;
        this.out = out;
    }

    public void add(String path, String message) {
        out.add(new Violation(ruleId, path, message));
    }

    public String ruleId() {
        return ruleId;
    }
}
