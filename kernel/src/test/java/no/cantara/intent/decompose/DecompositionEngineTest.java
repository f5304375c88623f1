package no.cantara.intent.decompose;

import no.cantara.intent.measure.TerminationConfig;
import no.cantara.intent.measure.TerminationPolicy;
import no.cantara.intent.model.AnswerType;
import no.cantara.intent.model.NodeStatus;
import no.cantara.intent.model.Question;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DecompositionEngineTest {

    private static final String SERVICE_GOAL = "Build a user service that stores data";
    private static final DecompositionConfig EVERYTHING_TERMINAL =
            new DecompositionConfig(new TerminationConfig(0, 100, 0.0), 12, 1024);

    // ── shapes ───────────────────────────────────────────────────────────────

    @Test void vagueGoalBlocksWithFallbackQuestion() {
        DecompositionTree tree = new DecompositionEngine().decompose("Do something", List.of());
        assertEquals(1, tree.size());
        assertFalse(tree.truncated());
        DecompositionTree.Entry root = tree.root();
        assertEquals(NodeStatus.BLOCKED, root.status());
        assertNull(root.splittingQuestion());
        assertEquals(1, root.unresolvedQuestions().size());
        assertEquals(QuestionCatalog.standard().fallback().text(), root.unresolvedQuestions().get(0).text());
    }

    @Test void permissiveThresholdsMakeRootTerminal() {
        DecompositionTree tree = new DecompositionEngine(EVERYTHING_TERMINAL).decompose(SERVICE_GOAL, List.of());
        assertEquals(1, tree.size());
        assertEquals(NodeStatus.TERMINAL, tree.root().status());
        assertTrue(tree.root().unresolvedQuestions().isEmpty());
    }

    @Test void splitsOnTechnologyStackFirst() {
        DecompositionTree tree = new DecompositionEngine().decompose(SERVICE_GOAL, List.of());
        DecompositionTree.Entry root = tree.root();
        assertNotNull(root.splittingQuestion());
        assertEquals("What technology stack should be used?", root.splittingQuestion().question().text());
        assertEquals(5, root.splittingQuestion().branches().size());
        assertEquals(5, root.childIndices().size());
        assertEquals(6, tree.size());
        assertFalse(tree.truncated());
    }

    @Test void childInheritsConstraintsAndRefinedGoal() {
        DecompositionTree tree = new DecompositionEngine().decompose(SERVICE_GOAL, List.of("Expose metrics"));
        for (int childIndex : tree.root().childIndices()) {
            DecompositionTree.Entry child = tree.entry(childIndex);
            assertTrue(child.goal().startsWith(SERVICE_GOAL + " (stack: "), child.goal());
            assertTrue(child.constraints().contains("Expose metrics"));
            assertTrue(child.constraints().stream().anyMatch(c -> c.startsWith("Must be implemented in ")));
            assertEquals(child.constraints().stream().sorted().toList(), child.constraints());
            assertEquals(1, child.depth());
            assertEquals(0, child.parentIndex());
        }
    }

    @Test void otherCandidatesBecomeUnresolvedAtTheSplitNode() {
        DecompositionTree tree = new DecompositionEngine().decompose(SERVICE_GOAL, List.of());
        List<String> texts = tree.root().unresolvedQuestions().stream().map(Question::text).toList();
        assertTrue(texts.contains("Who are the primary users of this system?"));
        assertTrue(texts.contains("What type of data storage is needed?"));
        assertFalse(texts.contains("What technology stack should be used?"));
    }

    // ── invariants ───────────────────────────────────────────────────────────

    @Test void decompositionIsDeterministic() {
        List<String> constraints = List.of("Handle invalid input", "TBD: retention");
        DecompositionTree first = new DecompositionEngine().decompose(SERVICE_GOAL, constraints);
        DecompositionTree second = new DecompositionEngine().decompose(SERVICE_GOAL, constraints);
        assertEquals(first, second);
    }

    @Test void nonTerminalChildrenHaveStrictlyLowerEntropy() {
        DecompositionTree tree = new DecompositionEngine().decompose(
                "Create an API service where users store data and retry on error", List.of("TBD: limits"));
        for (DecompositionTree.Entry entry : tree.entries()) {
            if (entry.parentIndex() == DecompositionTree.NO_PARENT) continue;
            DecompositionTree.Entry parent = tree.entry(entry.parentIndex());
            boolean terminal = TerminationPolicy.isTerminal(entry.entropy(), entry.density());
            assertTrue(terminal || entry.entropy().entropyScore() < parent.entropy().entropyScore(),
                    "node " + entry.index() + " does not lower entropy");
        }
    }

    @Test void noQuestionIsAskedTwiceOnAPath() {
        DecompositionTree tree = new DecompositionEngine().decompose(
                "Create an API service where users store data and retry on error", List.of());
        for (DecompositionTree.Entry entry : tree.entries()) {
            Set<String> seen = new HashSet<>();
            for (DecompositionTree.Entry node = entry; ; node = tree.entry(node.parentIndex())) {
                if (node.splittingQuestion() != null) {
                    assertTrue(seen.add(node.splittingQuestion().question().id()),
                            "question repeated on path to node " + entry.index());
                }
                if (node.parentIndex() == DecompositionTree.NO_PARENT) break;
            }
        }
    }

    @Test void leavesAreTerminalOrBlocked() {
        DecompositionTree tree = new DecompositionEngine().decompose(
                "Create an API service where users store data and retry on error", List.of());
        for (DecompositionTree.Entry entry : tree.entries()) {
            if (entry.isLeaf()) {
                assertTrue(entry.status() == NodeStatus.TERMINAL || entry.status() == NodeStatus.BLOCKED);
            }
        }
    }

    // ── bounds ───────────────────────────────────────────────────────────────

    @Test void depthBoundTruncates() {
        DecompositionConfig config = new DecompositionConfig(TerminationConfig.DEFAULTS, 0, 1024);
        DecompositionTree tree = new DecompositionEngine(config).decompose(SERVICE_GOAL, List.of());
        assertTrue(tree.truncated());
        assertEquals(1, tree.size());
        assertEquals(NodeStatus.BLOCKED, tree.root().status());
        assertFalse(tree.root().unresolvedQuestions().isEmpty());
    }

    @Test void nodeBoundTruncates() {
        DecompositionConfig config = new DecompositionConfig(TerminationConfig.DEFAULTS, 12, 3);
        DecompositionTree tree = new DecompositionEngine(config).decompose(SERVICE_GOAL, List.of());
        assertTrue(tree.truncated());
        assertTrue(tree.size() <= 3);
    }

    @Test void boundsDoNotTruncateWhenNothingCanSplit() {
        DecompositionConfig config = new DecompositionConfig(TerminationConfig.DEFAULTS, 0, 1);
        DecompositionTree tree = new DecompositionEngine(config).decompose("Do something", List.of());
        assertFalse(tree.truncated());
    }

    @Test void configRejectsInvalidBounds() {
        assertThrows(IllegalArgumentException.class,
                () -> new DecompositionConfig(TerminationConfig.DEFAULTS, -1, 10));
        assertThrows(IllegalArgumentException.class,
                () -> new DecompositionConfig(TerminationConfig.DEFAULTS, 3, 0));
    }

    // ── branch ids ───────────────────────────────────────────────────────────

    @Test void branchIdIsEightHex() {
        Question q = Question.create("Cache results?", AnswerType.BOOLEAN, "Affects latency", 10, 10, null);
        assertTrue(DecompositionEngine.branchId(q, AnswerType.BOOLEAN, "Yes").matches("[0-9a-f]{8}"));
    }

    @Test void booleanBranchIdIgnoresAnswerCase() {
        Question q = Question.create("Cache results?", AnswerType.BOOLEAN, "Affects latency", 10, 10, null);
        assertEquals(DecompositionEngine.branchId(q, AnswerType.BOOLEAN, "Yes"),
                DecompositionEngine.branchId(q, AnswerType.BOOLEAN, "yes"));
        assertNotEquals(DecompositionEngine.branchId(q, AnswerType.BOOLEAN, "Yes"),
                DecompositionEngine.branchId(q, AnswerType.BOOLEAN, "No"));
    }

    @Test void choiceBranchIdKeepsAnswerCase() {
        Question q = Question.create("Pick one", AnswerType.CHOICE, "Matters", 10, 10, List.of("a", "A"));
        assertNotEquals(DecompositionEngine.branchId(q, AnswerType.CHOICE, "a"),
                DecompositionEngine.branchId(q, AnswerType.CHOICE, "A"));
    }
}
