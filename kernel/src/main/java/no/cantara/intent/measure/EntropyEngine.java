package no.cantara.intent.measure;

import no.cantara.intent.model.EntropyMeasurement;

import java.util.List;

import static no.cantara.intent.measure.DetectorTables.BRANCHING_KEYWORDS;
import static no.cantara.intent.measure.DetectorTables.CONTRADICTION_PAIRS;
import static no.cantara.intent.measure.DetectorTables.REQUIRED_CATEGORIES;
import static no.cantara.intent.measure.DetectorTables.UNRESOLVED_REFERENCES;

/**
 * Scores how uncertain a goal plus its constraints is.
 *
 * <p>Four independent detectors run over {@code goal + " " + constraints}: unresolved
 * references, missing topic categories, contradicting constraint pairs and decision
 * keywords. Each raw count is normalized against a fixed ceiling and the composite
 * uses weights 30/25/25/20.
 */
public final class EntropyEngine {

    static final int UNRESOLVED_CEILING = 10;
    static final int GAP_CEILING = 5;
    static final int CONTRADICTION_CEILING = 5;
    static final int MAX_BRANCHING = 10;
    private static final int[] WEIGHTS = {30, 25, 25, 20};

    private EntropyEngine() {}

    public static EntropyMeasurement measure(String goal, List<String> constraints) {
        String text = combinedText(goal, constraints);
        int unresolved = countUnresolvedRefs(text);
        int gaps = missingCategories(text).size();
        int contradictions = countContradictions(constraints);
        int branching = branchingFactor(text);

        int score = Scores.weighted(new int[]{
                Scores.normalize(unresolved, UNRESOLVED_CEILING),
                Scores.normalize(gaps, GAP_CEILING),
                Scores.normalize(contradictions, CONTRADICTION_CEILING),
                Scores.normalize(branching - 1, MAX_BRANCHING - 1)
        }, WEIGHTS);
        return new EntropyMeasurement(unresolved, gaps, contradictions, branching, score);
    }

    public static int countUnresolvedRefs(String text) {
        return DetectorTables.countMatches(UNRESOLVED_REFERENCES, text);
    }

    /** Names of the required categories with no match, in table order. */
    public static List<String> missingCategories(String text) {
        return REQUIRED_CATEGORIES.stream()
                .filter(c -> !c.isPresentIn(text))
                .map(DetectorTables.Category::name)
                .toList();
    }

    /** Contradictions are only looked for among the constraints, not in the goal. */
    public static int countContradictions(List<String> constraints) {
        String text = String.join(" ", constraints);
        return (int) CONTRADICTION_PAIRS.stream().filter(p -> p.isPresentIn(text)).count();
    }

    public static int branchingFactor(String text) {
        return Math.min(1 + DetectorTables.countMatches(BRANCHING_KEYWORDS, text), MAX_BRANCHING);
    }

    static String combinedText(String goal, List<String> constraints) {
        return goal + " " + String.join(" ", constraints);
    }
}
