package no.cantara.intent.assemble;

import no.cantara.intent.canonical.Canonicalizer;
import no.cantara.intent.decompose.DecompositionTree;
import no.cantara.intent.model.Bundle;
import no.cantara.intent.model.BundleStats;
import no.cantara.intent.model.BundleStatus;
import no.cantara.intent.model.ContextNode;
import no.cantara.intent.model.Intent;
import no.cantara.intent.model.NodeStatus;
import no.cantara.intent.model.Output;
import no.cantara.intent.model.Question;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Folds a finished decomposition tree into a content-addressed {@link Bundle}.
 */
public final class BundleAssembler {

    /** Same id: keep the higher priority, then the higher gain. */
    private static final Comparator<Question> DEDUPE_PREFERENCE =
            Comparator.comparingInt(Question::priority).thenComparingInt(Question::informationGain);

    private BundleAssembler() {}

    public static Bundle assemble(Intent intent, DecompositionTree tree) {
        List<ContextNode> nodes = materialize(tree);

        List<ContextNode> terminal = nodes.stream().filter(ContextNode::isTerminal)
                .sorted(Comparator.comparing(ContextNode::id)).toList();
        List<Output> outputs = terminal.stream().map(OutputGenerator::forTerminal)
                .sorted(Comparator.comparing(Output::path)).toList();
        List<Question> unresolved = collectUnresolved(nodes);

        BundleStatus status;
        if (tree.truncated()) {
            status = BundleStatus.ERROR;
        } else if (!unresolved.isEmpty()) {
            status = BundleStatus.INCOMPLETE;
        } else {
            status = BundleStatus.COMPLETE;
        }

        BundleStats stats = new BundleStats(
                nodes.size(),
                terminal.size(),
                (int) nodes.stream().filter(n -> n.status() == NodeStatus.BLOCKED).count(),
                tree.maxDepth(),
                outputs.size(),
                unresolved.size(),
                average(terminal.stream().mapToInt(n -> n.entropy().entropyScore()).toArray()),
                average(terminal.stream().mapToInt(n -> n.density().densityScore()).toArray()));

        Bundle unsigned = new Bundle(null, Bundle.SCHEMA_VERSION, Bundle.KERNEL_VERSION,
                Canonicalizer.contentHash(intent), status, nodes.get(0), terminal, outputs, unresolved, stats);
        String id = Canonicalizer.contentId("bundle", unsigned.identityCore());
        return new Bundle(id, unsigned.schemaVersion(), unsigned.kernelVersion(), unsigned.sourceIntentHash(),
                status, unsigned.rootNode(), terminal, outputs, unresolved, stats);
    }

    /**
     * Compute every node's id bottom-up and return the nodes in arena order.
     *
     * <p>Walking the arena backwards visits every child before its parent, so each
     * node's id can fold in the already-computed ids of its children. Parent ids are
     * filled in afterwards and take no part in hashing.
     */
    public static List<ContextNode> materialize(DecompositionTree tree) {
        int size = tree.size();
        String[] ids = new String[size];
        for (int i = size - 1; i >= 0; i--) {
            DecompositionTree.Entry entry = tree.entry(i);
            List<String> childIds = entry.childIndices().stream().map(c -> ids[c]).toList();
            ids[i] = ContextNode.idFor(entry.goal(), entry.constraints(), entry.entropy(), entry.density(),
                    childIds, entry.splittingQuestion());
        }

        List<ContextNode> nodes = new ArrayList<>(size);
        for (DecompositionTree.Entry entry : tree.entries()) {
            String parentId = entry.parentIndex() == DecompositionTree.NO_PARENT ? null : ids[entry.parentIndex()];
            nodes.add(new ContextNode(
                    ids[entry.index()],
                    parentId,
                    entry.status(),
                    entry.goal(),
                    entry.constraints(),
                    entry.entropy(),
                    entry.density(),
                    entry.splittingQuestion(),
                    entry.childIndices().stream().map(c -> ids[c]).toList(),
                    entry.unresolvedQuestions()));
        }
        return nodes;
    }

    static List<Question> collectUnresolved(List<ContextNode> nodes) {
        Map<String, Question> byId = new TreeMap<>();
        for (ContextNode node : nodes) {
            for (Question question : node.unresolvedQuestions()) {
                byId.merge(question.id(), question,
                        (a, b) -> DEDUPE_PREFERENCE.compare(a, b) >= 0 ? a : b);
            }
        }
        return byId.values().stream().sorted(Question.ORDER).toList();
    }

    private static int average(int[] values) {
        if (values.length == 0) {
            return 0;
        }
        return (int) Math.round((double) Arrays.stream(values).sum() / values.length);
    }
}
