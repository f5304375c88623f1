package no.cantara.intent.decompose;

import no.cantara.intent.model.AnswerType;
import no.cantara.intent.model.EntropyMeasurement;

import java.util.List;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * A question the kernel knows how to ask, and how an answer feeds back into a child node.
 *
 * @param key               short label used when refining a child goal, e.g. {@code stack}
 * @param textTrigger       pattern over goal and constraints, or {@code null}
 * @param measureTrigger    condition over the node's entropy, or {@code null}
 * @param options           closed answer set for choice questions; empty otherwise
 * @param resolvesCategory  required topic category an answer supplies, or {@code null}
 * @param constraintFormat  added constraint, {@code %s} replaced by the answer
 */
public record QuestionTemplate(
        String key,
        Pattern textTrigger,
        Predicate<EntropyMeasurement> measureTrigger,
        String text,
        AnswerType answerType,
        String whyNeeded,
        List<String> options,
        String resolvesCategory,
        String constraintFormat
) {
    public QuestionTemplate {
        options = options != null ? options.stream().sorted().toList() : List.of();
        if (answerType == AnswerType.CHOICE && options.isEmpty()) {
            throw new IllegalArgumentException("choice question '" + key + "' needs options");
        }
        if (answerType.isEnumerable() && constraintFormat == null) {
            throw new IllegalArgumentException("question '" + key + "' can split a node and needs a constraint format");
        }
    }

    public boolean appliesTo(String text, EntropyMeasurement entropy) {
        if (textTrigger != null && textTrigger.matcher(text).find()) {
            return true;
        }
        return measureTrigger != null && measureTrigger.test(entropy);
    }

    /** The answers a branch is created for: options for choice, yes/no for boolean. */
    public List<String> answers() {
        return switch (answerType) {
            case CHOICE -> options;
            case BOOLEAN -> List.of("Yes", "No");
            default -> List.of();
        };
    }

    public String constraintFor(String answer) {
        return String.format(constraintFormat, answer);
    }

    /** Child goal: the parent goal with {@code " (key: answer)"} appended. */
    public String refineGoal(String parentGoal, String answer) {
        return parentGoal + " (" + key + ": " + answer + ")";
    }
}
