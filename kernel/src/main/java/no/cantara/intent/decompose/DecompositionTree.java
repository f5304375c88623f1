package no.cantara.intent.decompose;

import no.cantara.intent.model.DensityMeasurement;
import no.cantara.intent.model.EntropyMeasurement;
import no.cantara.intent.model.NodeStatus;
import no.cantara.intent.model.Question;
import no.cantara.intent.model.SplittingQuestion;

import java.util.ArrayList;
import java.util.List;

/**
 * The finished decomposition, stored as an arena of entries addressed by index.
 *
 * <p>Entries reference their parent and children by arena index; content ids are
 * computed later, bottom-up, by the assembler. Every child has a larger index than
 * its parent, so walking the arena backwards visits children before parents.
 *
 * @param truncated true when a depth or node bound stopped a node that could still have been split
 */
public record DecompositionTree(List<Entry> entries, boolean truncated) {

    /** Root is at index 0 and has no parent ({@link #NO_PARENT}). */
    public static final int NO_PARENT = -1;

    public record Entry(
            int index,
            int parentIndex,
            int depth,
            NodeStatus status,
            String goal,
            List<String> constraints,
            EntropyMeasurement entropy,
            DensityMeasurement density,
            SplittingQuestion splittingQuestion,
            List<Integer> childIndices,
            List<Question> unresolvedQuestions
    ) {
        public Entry {
            constraints = constraints.stream().sorted().toList();
            childIndices = List.copyOf(childIndices);
            unresolvedQuestions = unresolvedQuestions.stream().sorted(Question.ORDER).toList();
        }

        public boolean isLeaf() {
            return childIndices.isEmpty();
        }
    }

    public DecompositionTree {
        entries = List.copyOf(entries);
        if (entries.isEmpty()) {
            throw new IllegalArgumentException("a decomposition tree has at least a root");
        }
        for (Entry entry : entries) {
            for (int child : entry.childIndices()) {
                if (child <= entry.index() || child >= entries.size()) {
                    throw new IllegalArgumentException("child " + child + " of node " + entry.index()
                            + " must come after its parent in the arena");
                }
            }
        }
    }

    public Entry root() {
        return entries.get(0);
    }

    public Entry entry(int index) {
        return entries.get(index);
    }

    public int size() {
        return entries.size();
    }

    public int maxDepth() {
        return entries.stream().mapToInt(Entry::depth).max().orElse(0);
    }

    public List<Entry> withStatus(NodeStatus status) {
        List<Entry> result = new ArrayList<>();
        for (Entry entry : entries) {
            if (entry.status() == status) result.add(entry);
        }
        return result;
    }
}
