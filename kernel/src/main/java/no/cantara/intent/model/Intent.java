package no.cantara.intent.model;

import no.cantara.intent.canonical.CanonicalValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The raw goal plus constraints handed to the kernel.
 *
 * <p>A normalized intent (see {@code IntentNormalizer}) has a trimmed NFC goal and
 * a sorted, de-duplicated constraint list, and a context that is canonicalizable
 * and key-sorted. {@code context} is otherwise carried through untouched and takes
 * part in the intent hash.
 */
public record Intent(
        String goal,
        List<String> constraints,
        Map<String, Object> context
) implements CanonicalValue {
    public Intent {
        constraints = constraints != null ? List.copyOf(constraints) : List.of();
        context = context != null ? Collections.unmodifiableMap(new LinkedHashMap<>(context)) : Map.of();
    }

    public static Intent of(String goal, String... constraints) {
        return new Intent(goal, List.of(constraints), Map.of());
    }

    @Override
    public Object toCanonicalValue() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("goal", goal);
        map.put("constraints", constraints);
        map.put("context", context);
        return map;
    }
}
