package no.cantara.intent.verify;

import java.util.Map;

/**
 * A named invariant over a raw artifact.
 *
 * <p>The check sees the untrusted input as parsed, and must not assume that any
 * other rule passed: fields may be missing or of the wrong type.
 *
 * @param <O> options type of the verifier the rule belongs to
 */
public record Rule<O>(String id, String description, Check<O> check) {

    @FunctionalInterface
    public interface Check<O> {
        void apply(Map<String, Object> artifact, O options, RuleSink sink);
    }

    public static <O> Rule<O> of(String id, String description, Check<O> check) {
        return new Rule<>(id, description, check);
    }
}
