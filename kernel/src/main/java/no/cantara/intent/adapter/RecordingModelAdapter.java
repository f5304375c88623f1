package no.cantara.intent.adapter;

import no.cantara.intent.canonical.Canonicalizer;
import no.cantara.intent.verify.modelio.ModelIoVerifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Wraps another adapter and records every successful call as a model IO
 * interaction. {@link #exportSession()} produces an artifact that
 * {@link ModelIoVerifier} accepts; its timestamps come from the injected clock and
 * are ephemeral.
 */
public final class RecordingModelAdapter implements ModelAdapter {

    private static final Logger log = LoggerFactory.getLogger(RecordingModelAdapter.class);

    private final ModelAdapter delegate;
    private final String adapterId;
    private final int maxInteractions;
    private final Clock clock;
    private final List<Interaction> interactions = new ArrayList<>();
    private Instant startedAt;

    public RecordingModelAdapter(ModelAdapter delegate) {
        this(delegate, ModelIoVerifier.MAX_INTERACTIONS, Clock.systemUTC());
    }

    public RecordingModelAdapter(ModelAdapter delegate, int maxInteractions, Clock clock) {
        if (maxInteractions < 1 || maxInteractions > ModelIoVerifier.MAX_INTERACTIONS) {
            throw new IllegalArgumentException("maxInteractions must be between 1 and "
                    + ModelIoVerifier.MAX_INTERACTIONS + ", got " + maxInteractions);
        }
        this.delegate = delegate;
        this.adapterId = "recording_" + Canonicalizer.sha256Hex(delegate.adapterId()).substring(0, 8);
        this.maxInteractions = maxInteractions;
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    @Override
    public String adapterId() {
        return adapterId;
    }

    @Override
    public String modelId() {
        return delegate.modelId();
    }

    @Override
    public boolean isReady() {
        return delegate.isReady();
    }

    @Override
    public synchronized TransformResult transform(String prompt, TransformContext context) throws AdapterException {
        if (interactions.size() >= maxInteractions) {
            throw new AdapterException(AdapterException.Code.ADAPTER_ERROR,
                    "Recording limit reached (" + maxInteractions + " interactions)", false);
        }
        TransformResult result = delegate.transform(prompt, context);
        interactions.add(new Interaction(interactions.size(), ModelIoVerifier.textHash(prompt), result, clock.instant()));
        log.debug("Recorded interaction {} for run {}", interactions.size() - 1, context.runId());
        return result;
    }

    public synchronized int interactionCount() {
        return interactions.size();
    }

    /** The recording so far as a model IO session artifact (mode {@code record}). */
    public synchronized Map<String, Object> exportSession() {
        List<Map<String, Object>> recorded = new ArrayList<>();
        long tokensIn = 0;
        long tokensOut = 0;
        long latency = 0;
        for (Interaction interaction : interactions) {
            TransformResult result = interaction.result();
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("i", interaction.index());
            map.put("prompt_hash", interaction.promptHash());
            map.put("response_hash", ModelIoVerifier.textHash(result.content()));
            map.put("response_content", result.content());
            map.put("tokens_input", result.tokensInput());
            map.put("tokens_output", result.tokensOutput());
            map.put("latency_ms", result.latencyMs());
            map.put("recorded_at_utc", interaction.recordedAt().toString());
            recorded.add(map);
            tokensIn += result.tokensInput();
            tokensOut += result.tokensOutput();
            latency += result.latencyMs();
        }

        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("total_interactions", (long) interactions.size());
        stats.put("total_tokens_input", tokensIn);
        stats.put("total_tokens_output", tokensOut);
        stats.put("total_latency_ms", latency);

        Map<String, Object> session = new LinkedHashMap<>();
        session.put("model_io_schema_version", ModelIoVerifier.SCHEMA_VERSION);
        session.put("adapter_id", adapterId);
        session.put("model_id", delegate.modelId());
        session.put("mode", "record");
        session.put("interactions", recorded);
        session.put("created_at_utc", startedAt.toString());
        session.put("ended_at_utc", clock.instant().toString());
        session.put("stats", stats);
        return session;
    }

    public synchronized void clear() {
        interactions.clear();
        startedAt = clock.instant();
    }

    private record Interaction(int index, String promptHash, TransformResult result, Instant recordedAt) {}
}
