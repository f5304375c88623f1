package no.cantara.intent.decompose;

import no.cantara.intent.measure.TerminationConfig;

/**
 * Bounds and thresholds for one decomposition.
 *
 * @param termination thresholds deciding terminal nodes
 * @param maxDepth    deepest level a node may be split at; the root is level 0
 * @param maxNodes    total number of nodes the tree may hold
 */
public record DecompositionConfig(TerminationConfig termination, int maxDepth, int maxNodes) {

    public static final int DEFAULT_MAX_DEPTH = 12;
    public static final int DEFAULT_MAX_NODES = 1024;

    public static final DecompositionConfig DEFAULTS =
            new DecompositionConfig(TerminationConfig.DEFAULTS, DEFAULT_MAX_DEPTH, DEFAULT_MAX_NODES);

    public DecompositionConfig {
        if (termination == null) {
            throw new IllegalArgumentException("termination config is required");
        }
        if (maxDepth < 0) {
            throw new IllegalArgumentException("max_depth must be >= 0, got " + maxDepth);
        }
        if (maxNodes < 1) {
            throw new IllegalArgumentException("max_nodes must be >= 1, got " + maxNodes);
        }
    }
}
