package no.cantara.intent.verify.modelio;

/**
 * @param verifyResponseHashes recompute every response hash from its content (MI7)
 * @param enforceSizeLimits    apply the interaction count and byte limits (MI4, MI11)
 */
public record ModelIoVerifyOptions(boolean verifyResponseHashes, boolean enforceSizeLimits) {

    public static final ModelIoVerifyOptions DEFAULTS = new ModelIoVerifyOptions(true, true);
}
