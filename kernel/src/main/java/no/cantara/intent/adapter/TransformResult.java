package no.cantara.intent.adapter;

/**
 * A model response with its usage metrics. Only {@code content} is part of any
 * hashed artifact; token counts and latency are ephemeral.
 */
public record TransformResult(
        String content,
        long tokensInput,
        long tokensOutput,
        long latencyMs,
        String modelVersion,
        boolean fromCache
) {

    public TransformResult {
        if (content == null) {
            throw new IllegalArgumentException("content is required");
        }
        if (tokensInput < 0 || tokensOutput < 0 || latencyMs < 0) {
            throw new IllegalArgumentException("token counts and latency must be >= 0");
        }
    }
}
