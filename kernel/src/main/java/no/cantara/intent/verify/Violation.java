package no.cantara.intent.verify;

import no.cantara.intent.canonical.CanonicalValue;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One failed invariant.
 *
 * @param ruleId  stable rule identifier, e.g. {@code MI7} or {@code SCHEMA}
 * @param path    {@code $}-rooted JSON path of the offending value, or {@code null}
 * @param message human-readable detail; not meant for matching
 */
public record Violation(String ruleId, String path, String message) implements CanonicalValue {

    /** Total order: rule id, then path ({@code null} as empty), then message. */
    public static final Comparator<Violation> ORDER = Comparator
            .comparing(Violation::ruleId)
            .thenComparing(v -> v.path() == null ? "" : v.path())
            .thenComparing(Violation::message);

    @Override
    public Object toCanonicalValue() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("rule_id", ruleId);
        if (path != null) {
            map.put("path", path);
        }
        map.put("message", message);
        return map;
    }

    @Override
    public String toString() {
        return path == null ? ruleId + ": " + message : ruleId + " " + path + ": " + message;
    }
}
