package no.cantara.intent.verify.bundle;

/**
 * @param skipHashVerification skip recomputing the bundle id and output content hashes
 */
public record BundleVerifyOptions(boolean skipHashVerification) {

    public static final BundleVerifyOptions DEFAULTS = new BundleVerifyOptions(false);
}
