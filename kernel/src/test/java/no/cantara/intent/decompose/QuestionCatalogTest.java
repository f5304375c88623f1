package no.cantara.intent.decompose;

import no.cantara.intent.model.AnswerType;
import no.cantara.intent.model.EntropyMeasurement;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

class QuestionCatalogTest {

    private static final EntropyMeasurement CALM = new EntropyMeasurement(0, 0, 0, 1, 0);

    private static QuestionTemplate template(String key) {
        return QuestionCatalog.standard().templates().stream()
                .filter(t -> t.key().equals(key)).findFirst().orElseThrow();
    }

    @Test void standardFallbackIsOpen() {
        assertFalse(QuestionCatalog.standard().fallback().answerType().isEnumerable());
    }

    @Test void enumerableFallbackIsRejected() {
        QuestionTemplate stack = template("stack");
        assertThrows(IllegalArgumentException.class, () -> new QuestionCatalog(List.of(), stack));
    }

    @Test void choiceOptionsAreSorted() {
        List<String> options = template("api").options();
        assertEquals(options.stream().sorted().toList(), options);
        assertEquals(options, template("api").answers());
    }

    @Test void choiceWithoutOptionsIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new QuestionTemplate("x", null, null, "Which?",
                AnswerType.CHOICE, "why", List.of(), null, "Use %s"));
    }

    @Test void enumerableWithoutConstraintFormatIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new QuestionTemplate("x", null, null, "Cache?",
                AnswerType.BOOLEAN, "why", null, null, null));
    }

    @Test void booleanAnswersAreYesNo() {
        QuestionTemplate cache = new QuestionTemplate("cache", Pattern.compile("cache"), null, "Cache results?",
                AnswerType.BOOLEAN, "Affects latency", null, null, "Caching enabled: %s");
        assertEquals(List.of("Yes", "No"), cache.answers());
        assertEquals("Caching enabled: Yes", cache.constraintFor("Yes"));
    }

    @Test void openQuestionsHaveNoAnswers() {
        assertTrue(template("users").answers().isEmpty());
    }

    @Test void refineGoalAppendsKeyAndAnswer() {
        assertEquals("Build a tool (stack: Rust)", template("stack").refineGoal("Build a tool", "Rust"));
    }

    @Test void textTriggerIsCaseInsensitive() {
        assertTrue(template("stack").appliesTo("BUILD a web APPLICATION", CALM));
        assertFalse(template("stack").appliesTo("Write a poem", CALM));
    }

    @Test void measureTriggerFiresOnPlaceholders() {
        EntropyMeasurement placeholders = new EntropyMeasurement(2, 0, 0, 1, 6);
        assertTrue(template("placeholders").appliesTo("anything", placeholders));
        assertFalse(template("placeholders").appliesTo("anything", CALM));
    }
}
