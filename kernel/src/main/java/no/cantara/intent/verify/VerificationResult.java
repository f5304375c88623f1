package no.cantara.intent.verify;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Outcome of verifying one artifact: either the content hash of its core plus
 * summary counts, or a sorted list of violations.
 */
public record VerificationResult(List<Violation> violations, String contentHash, Map<String, Long> summary) {

    public VerificationResult {
        violations = violations.stream().sorted(Violation.ORDER).toList();
        summary = summary != null ? Collections.unmodifiableMap(new TreeMap<>(summary)) : Map.of();
    }

    public static VerificationResult passed(String contentHash, Map<String, Long> summary) {
        return new VerificationResult(List.of(), contentHash, summary);
    }

    public static VerificationResult failed(List<Violation> violations) {
        if (violations.isEmpty()) {
            throw new IllegalArgumentException("a failed result needs at least one violation");
        }
        return new VerificationResult(violations, null, Map.of());
    }

    public boolean isValid() { return violations.isEmpty(); }

    /** Distinct rule ids that fired, in violation order. */
    public List<String> ruleIds() {
        return violations.stream().map(Violation::ruleId).distinct().toList();
    }
}
