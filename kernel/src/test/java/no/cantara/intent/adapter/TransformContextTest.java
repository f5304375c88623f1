package no.cantara.intent.adapter;

import no.cantara.intent.canonical.Canonicalizer;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TransformContextTest {

    // ── context ──────────────────────────────────────────────────────────────

    @Test void constraintsAreSortedAndDeduplicated() {
        TransformContext context = new TransformContext("intent_1", "run-1", TransformMode.CLARIFY,
                List.of("b", "a", "b"), null);
        assertEquals(List.of("a", "b"), context.constraints());
        assertEquals(Map.of(), context.metadata());
    }

    @Test void canonicalFormIgnoresInputOrder() {
        TransformContext first = new TransformContext("intent_1", "run-1", TransformMode.PLAN_ONLY,
                List.of("x", "y"), Map.of("team", "platform", "budget", 3));
        TransformContext second = new TransformContext("intent_1", "run-1", TransformMode.PLAN_ONLY,
                List.of("y", "x"), Map.of("budget", 3, "team", "platform"));
        assertEquals(Canonicalizer.canonicalize(first), Canonicalizer.canonicalize(second));
        assertEquals("{\"constraints\":[\"x\",\"y\"],\"intent_id\":\"intent_1\",\"metadata\":{\"budget\":3,"
                + "\"team\":\"platform\"},\"mode\":\"plan-only\",\"run_id\":\"run-1\"}",
                Canonicalizer.canonicalize(first));
    }

    @Test void requiredFields() {
        assertThrows(IllegalArgumentException.class, () -> TransformContext.of("", "run-1", TransformMode.EXECUTE));
        assertThrows(IllegalArgumentException.class, () -> TransformContext.of("intent_1", null, TransformMode.EXECUTE));
        assertThrows(IllegalArgumentException.class, () -> TransformContext.of("intent_1", "run-1", null));
    }

    // ── result ───────────────────────────────────────────────────────────────

    @Test void resultRejectsNegativeUsage() {
        assertThrows(IllegalArgumentException.class, () -> new TransformResult("x", -1, 0, 0, "m", false));
        assertThrows(IllegalArgumentException.class, () -> new TransformResult(null, 0, 0, 0, "m", false));
    }

    // ── errors ───────────────────────────────────────────────────────────────

    @Test void retryableDefaultsFollowTheCode() {
        assertTrue(new AdapterException(AdapterException.Code.RATE_LIMITED, "slow down").isRetryable());
        assertTrue(new AdapterException(AdapterException.Code.TIMEOUT, "timed out").isRetryable());
        assertFalse(new AdapterException(AdapterException.Code.REPLAY_MISS, "miss").isRetryable());
        assertFalse(new AdapterException(AdapterException.Code.NETWORK_ERROR, "down", false).isRetryable());
    }

    @Test void exceptionToStringNamesTheCode() {
        AdapterException e = new AdapterException(AdapterException.Code.TIMEOUT, "timed out");
        assertEquals("AdapterException[TIMEOUT, retryable]: timed out", e.toString());
    }
}
