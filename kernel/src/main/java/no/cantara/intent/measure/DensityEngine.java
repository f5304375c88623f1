package no.cantara.intent.measure;

import no.cantara.intent.model.DensityMeasurement;

import java.util.List;

import static no.cantara.intent.measure.DetectorTables.CONCRETE_KEYWORDS;
import static no.cantara.intent.measure.DetectorTables.OUTPUT_PHRASES;
import static no.cantara.intent.measure.DetectorTables.QUALIFIERS;

/**
 * Scores how concrete a goal plus its constraints is: concrete constraints,
 * specified outputs and constraint depth, weighted 40/30/30.
 */
public final class DensityEngine {

    static final int CONCRETE_CEILING = 20;
    static final int OUTPUT_CEILING = 10;
    static final int MAX_DEPTH = 10;
    private static final int[] WEIGHTS = {40, 30, 30};

    private DensityEngine() {}

    public static DensityMeasurement measure(String goal, List<String> constraints) {
        int concrete = countConcreteConstraints(constraints);
        int outputs = countSpecifiedOutputs(EntropyEngine.combinedText(goal, constraints));
        int depth = constraintDepth(constraints);

        int score = Scores.weighted(new int[]{
                Scores.normalize(concrete, CONCRETE_CEILING),
                Scores.normalize(outputs, OUTPUT_CEILING),
                Scores.normalize(depth, MAX_DEPTH)
        }, WEIGHTS);
        return new DensityMeasurement(concrete, outputs, depth, score);
    }

    /** Constraints containing at least one concrete keyword; each counts once. */
    public static int countConcreteConstraints(List<String> constraints) {
        return (int) constraints.stream()
                .filter(c -> DetectorTables.anyMatch(CONCRETE_KEYWORDS, c))
                .count();
    }

    public static int countSpecifiedOutputs(String text) {
        return DetectorTables.countMatches(OUTPUT_PHRASES, text);
    }

    /** Max over constraints of 1 + distinct qualifiers present, capped; 0 without constraints. */
    public static int constraintDepth(List<String> constraints) {
        int max = 0;
        for (String constraint : constraints) {
            max = Math.max(max, 1 + DetectorTables.countMatchingPatterns(QUALIFIERS, constraint));
        }
        return Math.min(max, MAX_DEPTH);
    }
}
