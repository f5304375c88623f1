package no.cantara.intent.verify.patch;

/**
 * @param maxTotalBytes upper bound for {@code total_bytes}, from the policy in force
 */
public record PatchVerifyOptions(long maxTotalBytes) {

    public static final long DEFAULT_MAX_TOTAL_BYTES = 50L * 1024 * 1024;

    public static final PatchVerifyOptions DEFAULTS = new PatchVerifyOptions(DEFAULT_MAX_TOTAL_BYTES);

    public PatchVerifyOptions {
        if (maxTotalBytes < 0) {
            throw new IllegalArgumentException("maxTotalBytes must be >= 0, got " + maxTotalBytes);
        }
    }
}
