package no.cantara.intent.measure;

import no.cantara.intent.model.EntropyMeasurement;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EntropyEngineTest {

    @Test void countsPlaceholders() {
        assertEquals(2, EntropyEngine.countUnresolvedRefs("Implement TODO with TBD values"));
    }

    @Test void placeholderMatchingIsCaseInsensitive() {
        assertEquals(1, EntropyEngine.countUnresolvedRefs("the format is to be determined"));
        assertEquals(1, EntropyEngine.countUnresolvedRefs("The Format Is To Be Determined"));
    }

    @Test void everyCategoryMissingFromBareGoal() {
        assertEquals(List.of("technology", "actors", "actions", "data", "errors"),
                EntropyEngine.missingCategories("Build it"));
    }

    @Test void contradictionBetweenSyncAndAsync() {
        assertEquals(1, EntropyEngine.countContradictions(List.of("Must be synchronous", "Must be asynchronous")));
    }

    @Test void contradictionsIgnoreTheGoal() {
        EntropyMeasurement m = EntropyEngine.measure("Always or never", List.of());
        assertEquals(0, m.contradictionCount());
    }

    @Test void branchingCountsDecisionKeywords() {
        assertEquals(3, EntropyEngine.branchingFactor("Use REST or gRPC, maybe GraphQL"));
        assertEquals(1, EntropyEngine.branchingFactor("Use REST"));
    }

    @Test void branchingIsCapped() {
        String text = "or ".repeat(20);
        assertEquals(EntropyEngine.MAX_BRANCHING, EntropyEngine.branchingFactor(text));
    }

    @Test void fullyCoveredGoalHasZeroEntropy() {
        EntropyMeasurement m = EntropyEngine.measure(
                "The system must store data using a database and report an error", List.of());
        assertEquals(0, m.unresolvedRefs());
        assertEquals(0, m.schemaGaps());
        assertEquals(1, m.branchingFactor());
        assertEquals(0, m.entropyScore());
    }

    @Test void gapsAloneContributeTheirWeight() {
        EntropyMeasurement m = EntropyEngine.measure("Build it", List.of());
        assertEquals(5, m.schemaGaps());
        assertEquals(25, m.entropyScore());
    }

    @Test void constraintsCountTowardsCoverage() {
        int bare = EntropyEngine.measure("Build a user service that stores data", List.of()).entropyScore();
        int constrained = EntropyEngine.measure("Build a user service that stores data",
                List.of("Must be implemented in Go")).entropyScore();
        assertEquals(15, bare);
        assertEquals(5, constrained);
    }

    @Test void placeholdersInAShortGoalRaiseEntropy() {
        EntropyMeasurement m = EntropyEngine.measure("Build a TODO app with TBD auth", List.of());
        assertEquals(2, m.unresolvedRefs());
        assertEquals(1, m.branchingFactor());
        assertEquals(6 + 5 * m.schemaGaps(), m.entropyScore());
        assertTrue(m.entropyScore() > 0);
    }

    @Test void measurementIsDeterministic() {
        List<String> constraints = List.of("TBD: pick a database", "Must be synchronous", "Must be asynchronous");
        assertEquals(EntropyEngine.measure("Create an API or a CLI", constraints),
                EntropyEngine.measure("Create an API or a CLI", constraints));
    }
}
