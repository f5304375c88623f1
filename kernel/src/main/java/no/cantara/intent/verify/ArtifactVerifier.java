package no.cantara.intent.verify;

import no.cantara.intent.canonical.CanonicalizationException;
import no.cantara.intent.canonical.Canonicalizer;

import java.util.List;
import java.util.Map;

/**
 * Verifies one kind of artifact against its rule catalogue.
 *
 * <p>Only the record gate short-circuits: input that is not a JSON object yields a
 * single {@code SCHEMA} violation at {@code $}. Otherwise every rule runs. When no
 * rule fires, the result carries the content hash of {@link #computeCore}.
 * {@code verify} never throws for malformed input.
 *
 * @param <O> options record of the artifact kind
 */
public abstract class ArtifactVerifier<O> implements CoreProjectable {

    public static final String SCHEMA_RULE = "SCHEMA";

    private final String artifactName;
    private final RuleCatalogue<O> catalogue;

    protected ArtifactVerifier(String artifactName, RuleCatalogue<O> catalogue) {
        this.artifactName = artifactName;
        this.catalogue = catalogue;
    }

    protected abstract O defaultOptions();

    /** Counts reported with a passing result. */
    protected abstract Map<String, Long> summarize(Map<String, Object> artifact);

    public RuleCatalogue<O> catalogue() {
        return catalogue;
    }

    public VerificationResult verify(Object raw) {
        return verify(raw, defaultOptions());
    }

    public VerificationResult verify(Object raw, O options) {
        Map<String, Object> artifact = Values.asObject(raw);
        if (artifact == null) {
            return VerificationResult.failed(List.of(new Violation(SCHEMA_RULE, "$",
                    artifactName + " must be object, got " + Values.typeName(raw))));
        }
        List<Violation> violations = catalogue.evaluate(artifact, options == null ? defaultOptions() : options);
        if (!violations.isEmpty()) {
            return VerificationResult.failed(violations);
        }
        try {
            return VerificationResult.passed(Canonicalizer.contentHash(computeCore(artifact)), summarize(artifact));
        } catch (CanonicalizationException e) {
            return VerificationResult.failed(List.of(new Violation(SCHEMA_RULE, e.path(),
                    "core is not canonicalizable: " + e.getMessage())));
        }
    }

    /** Content hash of the core of an artifact that is known to be well formed. */
    public String contentHash(Map<String, Object> artifact) {
        return Canonicalizer.contentHash(computeCore(artifact));
    }
}
