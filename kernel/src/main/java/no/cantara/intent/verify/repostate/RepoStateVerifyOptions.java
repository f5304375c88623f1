package no.cantara.intent.verify.repostate;

/**
 * @param runtimeBaseline expected Java feature release (e.g. {@code "17"}), or {@code null} to skip RS2
 */
public record RepoStateVerifyOptions(String runtimeBaseline) {

    public static final String JAVA_BASELINE = "17";

    public static final RepoStateVerifyOptions DEFAULTS = new RepoStateVerifyOptions(JAVA_BASELINE);

    public static RepoStateVerifyOptions skipRuntimeCheck() {
        return new RepoStateVerifyOptions(null);
    }
}
