package no.cantara.intent;

import no.cantara.intent.canonical.CanonicalizationException;
import no.cantara.intent.canonical.Canonicalizer;
import no.cantara.intent.model.Intent;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses an intent file (YAML, or JSON as a YAML subset) into an {@link Intent}.
 *
 * <pre>
 * goal: Create a user authentication system
 * constraints:
 *   - Must use JWT
 *   - Session timeout 24h
 * context:
 *   team: platform
 * </pre>
 */
public final class IntentParser {

    // SafeConstructor: YAML tags never instantiate arbitrary Java types.
    private static final Yaml YAML = new Yaml(new SafeConstructor(new LoaderOptions()));

    private IntentParser() {}

    public static Intent parse(Path path) throws IOException {
        try (InputStream is = Files.newInputStream(path)) {
            return parse(is);
        }
    }

    public static Intent parse(InputStream is) {
        Object data = YAML.load(is);
        if (!(data instanceof Map<?, ?> map)) {
            throw new IllegalArgumentException("Intent document must be a mapping");
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> typed = (Map<String, Object>) map;
        return fromMap(typed);
    }

    public static Intent fromMap(Map<String, Object> data) {
        if (!(data.get("goal") instanceof String goal)) {
            throw new IllegalArgumentException("Intent goal must be a string");
        }
        return new Intent(goal, parseConstraints(data.get("constraints")), parseContext(data.get("context")));
    }

    private static List<String> parseConstraints(Object raw) {
        if (raw == null) return List.of();
        if (raw instanceof String single) return List.of(single);
        if (!(raw instanceof List<?> list)) {
            throw new IllegalArgumentException("Intent constraints must be a list of strings");
        }
        List<String> constraints = new ArrayList<>();
        for (Object item : list) {
            if (!(item instanceof String s)) {
                throw new IllegalArgumentException("Intent constraints must be a list of strings, found " + item);
            }
            constraints.add(s);
        }
        return constraints;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> parseContext(Object raw) {
        if (raw == null) return Map.of();
        if (!(raw instanceof Map<?, ?>)) {
            throw new IllegalArgumentException("Intent context must be a mapping");
        }
        Map<String, Object> context = (Map<String, Object>) plain(raw);
        try {
            Canonicalizer.canonicalize(context);
        } catch (CanonicalizationException e) {
            throw new IllegalArgumentException("Intent context is not hashable: " + e.getMessage(), e);
        }
        return context;
    }

    /** YAML timestamps become ISO-8601 UTC strings; everything else is copied as is. */
    private static Object plain(Object value) {
        if (value instanceof Date d) {
            return DateTimeFormatter.ISO_INSTANT.format(d.toInstant().atOffset(ZoneOffset.UTC));
        }
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(k, plain(v)));
            return copy;
        }
        if (value instanceof List<?> list) {
            return list.stream().map(IntentParser::plain).toList();
        }
        return value;
    }
}
