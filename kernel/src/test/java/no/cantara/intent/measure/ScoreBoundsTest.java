package no.cantara.intent.measure;

import no.cantara.intent.assemble.OutputGenerator;
import no.cantara.intent.model.ContextNode;
import no.cantara.intent.model.DensityMeasurement;
import no.cantara.intent.model.EntropyMeasurement;
import no.cantara.intent.model.NodeStatus;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Every score stays in [0,100] for arbitrary goals and constraints, including
 * ones that overshoot every ceiling.
 */
class ScoreBoundsTest {

    private static final long SEED = 20261019L;
    private static final int ROUNDS = 500;

    private static final String[] WORDS = {
            "TODO", "TBD", "FIXME", "???", "[name]", "{id}", "<value>", "unknown", "to be determined",
            "must", "must not", "shall", "will", "requires", "use", "create", "return", "validate", "limit",
            "at least", "no more than", "exactly", "synchronous", "asynchronous", "always", "never",
            "required", "optional", "stateful", "stateless", "public", "private", "or", "either", "maybe",
            "might", "could", "if", "then", "when", "unless", "except", "specifically", "for", "each",
            "where", "such that", "output", "generate", "produce", "write", "to", "file", "named",
            "json", "class", "format", "as", "user", "admin", "store", "data", "database", "error",
            "REST", "API", "Java", "service", "42", "3.14", "", "\n", "\t", "é", "数据"
    };

    private static String phrase(Random random, int maxWords) {
        int count = random.nextInt(maxWords + 1);
        List<String> words = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            words.add(WORDS[random.nextInt(WORDS.length)]);
        }
        return String.join(" ", words);
    }

    private static List<String> constraints(Random random) {
        int count = random.nextInt(12);
        List<String> constraints = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            constraints.add(phrase(random, 20));
        }
        return constraints;
    }

    private static void assertScore(int score, String what, String goal) {
        assertTrue(score >= Scores.MIN && score <= Scores.MAX, () -> what + " = " + score + " for goal: " + goal);
    }

    @Test void scoresStayWithinBoundsForGeneratedIntents() {
        Random random = new Random(SEED);
        for (int round = 0; round < ROUNDS; round++) {
            String goal = phrase(random, round % 10 == 0 ? 200 : 30);
            List<String> constraints = constraints(random);

            EntropyMeasurement entropy = EntropyEngine.measure(goal, constraints);
            DensityMeasurement density = DensityEngine.measure(goal, constraints);

            assertScore(entropy.entropyScore(), "entropy", goal);
            assertTrue(entropy.unresolvedRefs() >= 0, goal);
            assertTrue(entropy.schemaGaps() >= 0 && entropy.schemaGaps() <= EntropyEngine.GAP_CEILING, goal);
            assertTrue(entropy.contradictionCount() >= 0, goal);
            assertTrue(entropy.branchingFactor() >= 1 && entropy.branchingFactor() <= EntropyEngine.MAX_BRANCHING, goal);

            assertScore(density.densityScore(), "density", goal);
            assertTrue(density.concreteConstraints() >= 0 && density.concreteConstraints() <= constraints.size(), goal);
            assertTrue(density.specifiedOutputs() >= 0, goal);
            assertTrue(density.constraintDepth() >= 0 && density.constraintDepth() <= DensityEngine.MAX_DEPTH, goal);

            assertScore(TerminationPolicy.informationGain(entropy, density), "information gain", goal);

            ContextNode node = new ContextNode("node_0000000000000000", null, NodeStatus.TERMINAL, goal,
                    constraints, entropy, density, null, List.of(), List.of());
            assertScore(OutputGenerator.confidence(node), "confidence", goal);
        }
    }

    @Test void extremeScoresStayWithinBounds() {
        for (int entropy : new int[]{Scores.MIN, 50, Scores.MAX}) {
            for (int density : new int[]{Scores.MIN, 50, Scores.MAX}) {
                assertScore(TerminationPolicy.informationGain(entropy, density), "information gain", "");
            }
        }
        assertEquals(100, TerminationPolicy.informationGain(100, 0));
        assertEquals(0, TerminationPolicy.informationGain(0, 100));
    }
}
