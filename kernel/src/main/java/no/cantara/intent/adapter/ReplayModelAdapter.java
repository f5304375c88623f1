package no.cantara.intent.adapter;

import no.cantara.intent.canonical.ArtifactJson;
import no.cantara.intent.canonical.Canonicalizer;
import no.cantara.intent.verify.VerificationResult;
import no.cantara.intent.verify.Values;
import no.cantara.intent.verify.modelio.ModelIoVerifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static no.cantara.intent.verify.Values.asList;
import static no.cantara.intent.verify.Values.asObject;

/**
 * Serves responses from a verified model IO session without calling any model.
 *
 * <p>By default a response is looked up by prompt hash. In sequential mode the
 * n-th call must carry the n-th recorded prompt. A strict adapter fails a call
 * it has no recording for with {@link AdapterException.Code#REPLAY_MISS}; a
 * lenient one returns empty content.
 */
public final class ReplayModelAdapter implements ModelAdapter {

    private static final Logger log = LoggerFactory.getLogger(ReplayModelAdapter.class);

    private final String adapterId;
    private final String modelId;
    private final boolean strict;
    private final boolean sequential;
    private final Map<String, Recorded> byPromptHash = new HashMap<>();
    private final List<Recorded> inOrder = new ArrayList<>();
    private int next;

    private ReplayModelAdapter(String sourceAdapterId, String modelId, List<Recorded> recorded,
                               boolean strict, boolean sequential) {
        this.adapterId = "replay_" + Canonicalizer.sha256Hex(sourceAdapterId).substring(0, 8);
        this.modelId = modelId;
        this.strict = strict;
        this.sequential = sequential;
        for (Recorded r : recorded) {
            byPromptHash.put(r.promptHash(), r);
            inOrder.add(r);
        }
    }

    /** Strict, by-hash replay of a session. */
    public static ReplayModelAdapter of(Map<String, Object> session) {
        return of(session, true, false);
    }

    /**
     * @throws IllegalArgumentException if the session does not verify
     */
    public static ReplayModelAdapter of(Map<String, Object> session, boolean strict, boolean sequential) {
        VerificationResult result = new ModelIoVerifier().verify(session);
        if (!result.isValid()) {
            throw new IllegalArgumentException("Not a valid model IO session: " + result.violations().get(0));
        }
        List<Recorded> recorded = new ArrayList<>();
        for (Object item : asList(session.get("interactions"))) {
            Map<String, Object> interaction = asObject(item);
            recorded.add(new Recorded(
                    (String) interaction.get("prompt_hash"),
                    (String) interaction.get("response_content"),
                    count(interaction.get("tokens_input")),
                    count(interaction.get("tokens_output"))));
        }
        return new ReplayModelAdapter((String) session.get("adapter_id"), (String) session.get("model_id"),
                recorded, strict, sequential);
    }

    public static ReplayModelAdapter load(Path file, boolean strict, boolean sequential) throws IOException {
        Map<String, Object> session = asObject(ArtifactJson.read(file));
        if (session == null) {
            throw new IllegalArgumentException("Model IO session must be a JSON object: " + file);
        }
        return of(session, strict, sequential);
    }

    @Override
    public String adapterId() {
        return adapterId;
    }

    @Override
    public String modelId() {
        return modelId;
    }

    @Override
    public synchronized TransformResult transform(String prompt, TransformContext context) throws AdapterException {
        String promptHash = ModelIoVerifier.textHash(prompt);
        Recorded recorded;
        if (sequential) {
            recorded = next < inOrder.size() ? inOrder.get(next) : null;
            if (recorded != null && !recorded.promptHash().equals(promptHash)) {
                throw new AdapterException(AdapterException.Code.REPLAY_MISS, "Sequential replay mismatch at index "
                        + next + ": expected " + recorded.promptHash() + ", got " + promptHash);
            }
            next++;
        } else {
            recorded = byPromptHash.get(promptHash);
        }

        if (recorded == null) {
            if (strict) {
                throw new AdapterException(AdapterException.Code.REPLAY_MISS,
                        "No recorded response for prompt hash " + promptHash);
            }
            log.warn("No recorded response for prompt hash {} in run {}, returning empty content",
                    promptHash, context.runId());
            return new TransformResult("", 0, 0, 0, modelId + "-replay", true);
        }
        return new TransformResult(recorded.content(), recorded.tokensInput(), recorded.tokensOutput(), 0,
                modelId + "-replay", true);
    }

    public int recordingCount() {
        return inOrder.size();
    }

    public boolean hasRecording(String promptHash) {
        return byPromptHash.containsKey(promptHash);
    }

    public synchronized void resetSequence() {
        next = 0;
    }

    private static long count(Object value) {
        return Values.isInteger(value) ? Math.max(0, Values.longValue(value)) : 0;
    }

    private record Recorded(String promptHash, String content, long tokensInput, long tokensOutput) {}
}
