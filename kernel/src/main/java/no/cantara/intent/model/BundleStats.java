package no.cantara.intent.model;

import no.cantara.intent.canonical.CanonicalValue;

import java.util.LinkedHashMap;
import java.util.Map;

public record BundleStats(
        int totalNodes,
        int terminalNodes,
        int blockedNodes,
        int maxDepth,
        int totalOutputs,
        int unresolvedCount,
        int avgTerminalEntropy,
        int avgTerminalDensity
) implements CanonicalValue {

    @Override
    public Object toCanonicalValue() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("total_nodes", totalNodes);
        map.put("terminal_nodes", terminalNodes);
        map.put("blocked_nodes", blockedNodes);
        map.put("max_depth", maxDepth);
        map.put("total_outputs", totalOutputs);
        map.put("unresolved_count", unresolvedCount);
        map.put("avg_terminal_entropy", avgTerminalEntropy);
        map.put("avg_terminal_density", avgTerminalDensity);
        return map;
    }
}
