package no.cantara.intent;

import no.cantara.intent.assemble.BundleAssembler;
import no.cantara.intent.decompose.DecompositionConfig;
import no.cantara.intent.decompose.DecompositionEngine;
import no.cantara.intent.decompose.DecompositionTree;
import no.cantara.intent.model.Bundle;
import no.cantara.intent.model.Intent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns an intent into a content-addressed bundle.
 *
 * <p>A kernel holds only immutable configuration; {@link #transform} is a pure
 * function of its argument and may be called from several threads at once.
 */
public final class IntentKernel {

    private static final Logger log = LoggerFactory.getLogger(IntentKernel.class);

    private final DecompositionEngine engine;

    public IntentKernel() {
        this(DecompositionConfig.DEFAULTS);
    }

    public IntentKernel(DecompositionConfig config) {
        this.engine = new DecompositionEngine(config);
    }

    /**
     * Normalize, decompose and assemble.
     *
     * @throws KernelException {@code INVALID_INTENT} for a missing or empty goal or a context
     *                         with no canonical form,
     *                         {@code NON_CONVERGENT} when a decomposition bound was hit
     */
    public Bundle transform(Intent intent) throws KernelException {
        Intent normalized;
        try {
            normalized = IntentNormalizer.normalize(intent);
        } catch (IllegalArgumentException e) {
            throw new KernelException(KernelException.Code.INVALID_INTENT, e.getMessage(), e);
        }

        DecompositionTree tree = engine.decompose(normalized.goal(), normalized.constraints());
        if (tree.truncated()) {
            throw new KernelException(KernelException.Code.NON_CONVERGENT,
                    "Decomposition did not converge within its bounds (" + tree.size() + " nodes, depth "
                            + tree.maxDepth() + ")");
        }
        Bundle bundle = BundleAssembler.assemble(normalized, tree);
        log.info("Bundle {} {} ({} nodes, {} outputs, {} unresolved questions)", bundle.id(),
                bundle.status().wireName(), bundle.stats().totalNodes(), bundle.stats().totalOutputs(),
                bundle.stats().unresolvedCount());
        return bundle;
    }

    /** Like {@link #transform} but reports refusal as a result instead of an exception. */
    public KernelResult run(Intent intent) {
        try {
            return KernelResult.of(transform(intent));
        } catch (KernelException e) {
            log.info("Refused intent: {} ({})", e.getMessage(), e.code());
            return KernelResult.refused(e);
        }
    }
}
