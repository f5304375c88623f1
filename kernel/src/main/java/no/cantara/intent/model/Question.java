package no.cantara.intent.model;

import no.cantara.intent.canonical.CanonicalValue;
import no.cantara.intent.canonical.Canonicalizer;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A clarifying question. The id depends only on text, answer type and rationale,
 * so the same question raised at different nodes has the same id.
 *
 * @param options sorted answer options, or {@code null} when the answer is open
 */
public record Question(
        String id,
        String text,
        AnswerType expectedAnswerType,
        String whyNeeded,
        int informationGain,
        int priority,
        List<String> options
) implements CanonicalValue {

    /** Priority descending, then id ascending. */
    public static final Comparator<Question> ORDER =
            Comparator.comparingInt(Question::priority).reversed().thenComparing(Question::id);

    public Question {
        options = options != null ? options.stream().sorted().toList() : null;
    }

    public static Question create(String text, AnswerType type, String whyNeeded,
                                  int informationGain, int priority, List<String> options) {
        return new Question(idFor(text, type, whyNeeded), text, type, whyNeeded,
                informationGain, priority, options);
    }

    public static String idFor(String text, AnswerType type, String whyNeeded) {
        Map<String, Object> core = new LinkedHashMap<>();
        core.put("text", text);
        core.put("expected_answer_type", type.wireName());
        core.put("why_needed", whyNeeded);
        return Canonicalizer.contentId("q", core);
    }

    @Override
    public Object toCanonicalValue() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("id", id);
        map.put("text", text);
        map.put("expected_answer_type", expectedAnswerType.wireName());
        map.put("why_needed", whyNeeded);
        map.put("information_gain", informationGain);
        map.put("priority", priority);
        if (options != null) {
            map.put("options", options);
        }
        return map;
    }
}
