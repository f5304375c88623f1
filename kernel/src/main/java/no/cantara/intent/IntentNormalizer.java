package no.cantara.intent;

import no.cantara.intent.canonical.CanonicalizationException;
import no.cantara.intent.canonical.Canonicalizer;
import no.cantara.intent.model.Intent;

import java.text.Normalizer;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Brings an intent into the form every hash is computed over.
 *
 * <p>Strings lose a leading BOM, get LF line endings and are NFC-normalized.
 * Constraints are trimmed, have runs of spaces and tabs collapsed and runs of
 * three or more newlines reduced to two; empty ones are dropped and the rest are
 * de-duplicated and sorted. The context must be canonicalizable, so it can take
 * part in the intent hash; its keys come out sorted.
 */
public final class IntentNormalizer {

    private static final Pattern HORIZONTAL_RUN = Pattern.compile("[ \\t]+");
    private static final Pattern BLANK_LINE_RUN = Pattern.compile("\\n{3,}");

    private IntentNormalizer() {}

    /**
     * @throws IllegalArgumentException if the goal is missing or blank after normalization,
     *                                  or the context has no canonical form
     */
    public static Intent normalize(Intent intent) {
        if (intent.goal() == null) {
            throw new IllegalArgumentException("Intent goal must be a string");
        }
        String goal = normalizeString(intent.goal()).trim();
        if (goal.isEmpty()) {
            throw new IllegalArgumentException("Intent goal cannot be empty");
        }
        return new Intent(goal, normalizeConstraints(intent.constraints()), normalizeContext(intent.context()));
    }

    /**
     * @throws IllegalArgumentException if a key is not a string or a value has no canonical form
     */
    public static Map<String, Object> normalizeContext(Map<String, Object> context) {
        Map<String, Object> sorted = new TreeMap<>();
        for (Map.Entry<?, ?> entry : context.entrySet()) {
            if (!(entry.getKey() instanceof String key)) {
                throw new IllegalArgumentException("Intent context keys must be strings, got " + entry.getKey());
            }
            sorted.put(key, entry.getValue());
        }
        try {
            Canonicalizer.canonicalize(sorted);
        } catch (CanonicalizationException e) {
            throw new IllegalArgumentException("Intent context is not canonicalizable: " + e.getMessage(), e);
        }
        return sorted;
    }

    public static String normalizeString(String s) {
        String result = s;
        if (result.startsWith("\uFEFF")) {
            result = result.substring(1);
        }
        result = result.replace("\r\n", "\n").replace('\r', '\n');
        return Normalizer.normalize(result, Normalizer.Form.NFC);
    }

    public static String normalizeConstraint(String constraint) {
        String result = normalizeString(constraint).trim();
        result = HORIZONTAL_RUN.matcher(result).replaceAll(" ");
        return BLANK_LINE_RUN.matcher(result).replaceAll("\n\n");
    }

    public static List<String> normalizeConstraints(List<String> constraints) {
        TreeSet<String> unique = new TreeSet<>();
        for (String constraint : constraints) {
            if (constraint == null) {
                throw new IllegalArgumentException("Intent constraints must be strings");
            }
            String normalized = normalizeConstraint(constraint);
            if (!normalized.isEmpty()) {
                unique.add(normalized);
            }
        }
        return List.copyOf(unique);
    }
}
