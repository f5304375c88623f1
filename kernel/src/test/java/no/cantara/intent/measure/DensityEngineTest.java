package no.cantara.intent.measure;

import no.cantara.intent.model.DensityMeasurement;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DensityEngineTest {

    @Test void countsConstraintsWithConcreteKeywords() {
        assertEquals(2, DensityEngine.countConcreteConstraints(
                List.of("Must use JWT", "Sessions expire", "Return JSON")));
    }

    @Test void constraintCountsOnceWhateverItsKeywords() {
        assertEquals(1, DensityEngine.countConcreteConstraints(List.of("Must use at least 3 and at most 5 workers")));
    }

    @Test void countsOutputPhrases() {
        assertEquals(2, DensityEngine.countSpecifiedOutputs("Generate a report and write it to disk"));
    }

    @Test void depthIsDistinctQualifiersPlusOne() {
        assertEquals(3, DensityEngine.constraintDepth(List.of("Return JSON for each request when authenticated")));
        assertEquals(1, DensityEngine.constraintDepth(List.of("Use JWT")));
    }

    @Test void depthWithoutConstraintsIsZero() {
        assertEquals(0, DensityEngine.constraintDepth(List.of()));
    }

    @Test void bareGoalHasZeroDensity() {
        DensityMeasurement m = DensityEngine.measure("Do something", List.of());
        assertEquals(new DensityMeasurement(0, 0, 0, 0), m);
    }

    @Test void outputsAloneContributeTheirWeight() {
        DensityMeasurement m = DensityEngine.measure("Generate output", List.of());
        assertEquals(2, m.specifiedOutputs());
        assertEquals(6, m.densityScore());
    }

    @Test void moreConcreteConstraintsNeverLowerDensity() {
        int fewer = DensityEngine.measure("Build a service", List.of("Must use JWT")).densityScore();
        int more = DensityEngine.measure("Build a service",
                List.of("Must use JWT", "Return JSON for each request", "Limit requests to 100 per minute")).densityScore();
        assertTrue(more >= fewer);
    }
}
