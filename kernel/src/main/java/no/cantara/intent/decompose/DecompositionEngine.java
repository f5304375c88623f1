package no.cantara.intent.decompose;

import no.cantara.intent.canonical.Canonicalizer;
import no.cantara.intent.measure.DensityEngine;
import no.cantara.intent.measure.EntropyEngine;
import no.cantara.intent.measure.Scores;
import no.cantara.intent.measure.TerminationPolicy;
import no.cantara.intent.model.AnswerType;
import no.cantara.intent.model.Branch;
import no.cantara.intent.model.DensityMeasurement;
import no.cantara.intent.model.EntropyMeasurement;
import no.cantara.intent.model.NodeStatus;
import no.cantara.intent.model.Question;
import no.cantara.intent.model.SplittingQuestion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Builds the decomposition tree for a normalized goal, breadth first.
 *
 * <p>A node is terminal when {@link TerminationPolicy} says so. Otherwise the
 * catalogue questions not yet asked on the path from the root are ranked, and the
 * best choice or boolean question whose every branch either terminates or lowers
 * entropy becomes the splitting question. Every other candidate is recorded as an
 * unresolved question. A node with no such split is blocked.
 *
 * <p>The strictly decreasing entropy requirement bounds every path by the entropy
 * score of the root; {@code maxDepth} and {@code maxNodes} bound it further. A node
 * stopped by one of those bounds while it still had a split marks the tree truncated.
 */
public final class DecompositionEngine {

    private static final Logger log = LoggerFactory.getLogger(DecompositionEngine.class);

    /** Priority bonus for a question whose answer fills a currently missing topic category. */
    static final int GAP_BONUS = 10;

    private final DecompositionConfig config;
    private final QuestionCatalog catalog;

    public DecompositionEngine() {
        this(DecompositionConfig.DEFAULTS, QuestionCatalog.standard());
    }

    public DecompositionEngine(DecompositionConfig config) {
        this(config, QuestionCatalog.standard());
    }

    public DecompositionEngine(DecompositionConfig config, QuestionCatalog catalog) {
        this.config = config;
        this.catalog = catalog;
    }

    public DecompositionTree decompose(String goal, List<String> constraints) {
        List<Draft> arena = new ArrayList<>();
        arena.add(new Draft(0, DecompositionTree.NO_PARENT, 0, goal, sortedUnique(constraints), Set.of()));

        boolean truncated = false;
        Deque<Integer> queue = new ArrayDeque<>();
        queue.add(0);
        while (!queue.isEmpty()) {
            Draft node = arena.get(queue.poll());
            if (expand(node, arena)) {
                truncated = true;
            }
            queue.addAll(node.childIndices);
        }

        log.debug("Decomposed '{}' into {} nodes (truncated={})", goal, arena.size(), truncated);
        return new DecompositionTree(arena.stream().map(Draft::freeze).toList(), truncated);
    }

    /**
     * Settle one node and append its children, if any, to the arena.
     *
     * @return true if a bound stopped a split that was otherwise available
     */
    private boolean expand(Draft node, List<Draft> arena) {
        node.status = NodeStatus.EXPANDING;
        if (TerminationPolicy.isTerminal(node.entropy, node.density, config.termination())) {
            node.status = NodeStatus.TERMINAL;
            log.debug("Node {} terminal (entropy={}, density={})",
                    node.index, node.entropy.entropyScore(), node.density.densityScore());
            return false;
        }

        List<Candidate> candidates = candidates(node);
        for (Candidate candidate : candidates) {
            if (!candidate.template().answerType().isEnumerable()) {
                continue;
            }
            List<ChildPlan> plans = planChildren(node, candidate);
            if (!lowersEntropy(node, plans)) {
                continue;
            }
            if (node.depth >= config.maxDepth() || arena.size() + plans.size() > config.maxNodes()) {
                node.status = NodeStatus.BLOCKED;
                node.unresolved = questions(candidates);
                log.info("Node {} at depth {} stopped by decomposition bounds (max_depth={}, max_nodes={})",
                        node.index, node.depth, config.maxDepth(), config.maxNodes());
                return true;
            }
            split(node, candidate, plans, candidates, arena);
            return false;
        }

        node.status = NodeStatus.BLOCKED;
        node.unresolved = candidates.isEmpty()
                ? List.of(question(catalog.fallback(), node))
                : questions(candidates);
        log.debug("Node {} blocked with {} unresolved questions", node.index, node.unresolved.size());
        return false;
    }

    private void split(Draft node, Candidate chosen, List<ChildPlan> plans, List<Candidate> candidates,
                       List<Draft> arena) {
        List<Question> unresolved = new ArrayList<>();
        for (Candidate candidate : candidates) {
            if (candidate != chosen) unresolved.add(candidate.question());
        }
        Set<String> asked = new HashSet<>(node.askedOnPath);
        asked.add(chosen.question().id());
        unresolved.forEach(q -> asked.add(q.id()));

        node.splitting = new SplittingQuestion(chosen.question(), plans.stream().map(ChildPlan::branch).toList());
        node.unresolved = unresolved;
        for (ChildPlan plan : plans.stream().sorted(Comparator.comparing(p -> p.branch().branchId())).toList()) {
            Draft child = new Draft(arena.size(), node.index, node.depth + 1, plan.goal(), plan.constraints(), asked,
                    plan.entropy(), plan.density());
            arena.add(child);
            node.childIndices.add(child.index);
        }
        log.debug("Node {} split on '{}' into {} branches",
                node.index, chosen.question().text(), plans.size());
    }

    private List<Candidate> candidates(Draft node) {
        String text = node.goal + " " + String.join(" ", node.constraints);
        List<Candidate> candidates = new ArrayList<>();
        for (QuestionTemplate template : catalog.templates()) {
            if (!template.appliesTo(text, node.entropy)) {
                continue;
            }
            Question question = question(template, node);
            if (!node.askedOnPath.contains(question.id())) {
                candidates.add(new Candidate(template, question));
            }
        }
        candidates.sort(Comparator.comparing(Candidate::question, Question.ORDER));
        return candidates;
    }

    private Question question(QuestionTemplate template, Draft node) {
        int gain = TerminationPolicy.informationGain(node.entropy, node.density);
        String text = node.goal + " " + String.join(" ", node.constraints);
        boolean fillsGap = template.resolvesCategory() != null
                && EntropyEngine.missingCategories(text).contains(template.resolvesCategory());
        int priority = fillsGap ? Scores.clamp(gain + GAP_BONUS) : gain;
        return Question.create(template.text(), template.answerType(), template.whyNeeded(), gain, priority,
                template.options().isEmpty() ? null : template.options());
    }

    private List<ChildPlan> planChildren(Draft node, Candidate candidate) {
        QuestionTemplate template = candidate.template();
        List<ChildPlan> plans = new ArrayList<>();
        for (String answer : template.answers()) {
            String added = template.constraintFor(answer);
            List<String> constraints = new ArrayList<>(node.constraints);
            constraints.add(added);
            constraints = sortedUnique(constraints);
            String goal = template.refineGoal(node.goal, answer);
            Branch branch = new Branch(branchId(candidate.question(), template.answerType(), answer), answer,
                    List.of(added));
            plans.add(new ChildPlan(branch, goal, constraints,
                    EntropyEngine.measure(goal, constraints), DensityEngine.measure(goal, constraints)));
        }
        return plans;
    }

    private boolean lowersEntropy(Draft node, List<ChildPlan> plans) {
        if (plans.isEmpty()) {
            return false;
        }
        for (ChildPlan plan : plans) {
            boolean terminal = TerminationPolicy.isTerminal(plan.entropy(), plan.density(), config.termination());
            if (!terminal && plan.entropy().entropyScore() >= node.entropy.entropyScore()) {
                return false;
            }
        }
        return true;
    }

    /** First 8 hex chars of the canonical hash of {@code {question_id, answer}}. */
    static String branchId(Question question, AnswerType type, String answer) {
        Map<String, Object> core = new LinkedHashMap<>();
        core.put("question_id", question.id());
        core.put("answer", type == AnswerType.BOOLEAN ? answer.toLowerCase(Locale.ROOT) : answer);
        return Canonicalizer.sha256Hex(Canonicalizer.canonicalBytes(core)).substring(0, 8);
    }

    private static List<Question> questions(List<Candidate> candidates) {
        return candidates.stream().map(Candidate::question).toList();
    }

    private static List<String> sortedUnique(List<String> values) {
        return List.copyOf(new TreeSet<>(values));
    }

    private record Candidate(QuestionTemplate template, Question question) {}

    private record ChildPlan(Branch branch, String goal, List<String> constraints,
                             EntropyMeasurement entropy, DensityMeasurement density) {}

    /** Mutable while its node is being settled; frozen into an arena entry at the end. */
    private static final class Draft {
        final int index;
        final int parentIndex;
        final int depth;
        final String goal;
        final List<String> constraints;
        final Set<String> askedOnPath;
        final EntropyMeasurement entropy;
        final DensityMeasurement density;
        final List<Integer> childIndices = new ArrayList<>();
        NodeStatus status = NodeStatus.PENDING;
        SplittingQuestion splitting;
        List<Question> unresolved = List.of();

        Draft(int index, int parentIndex, int depth, String goal, List<String> constraints, Set<String> askedOnPath) {
            this(index, parentIndex, depth, goal, constraints, askedOnPath,
                    EntropyEngine.measure(goal, constraints), DensityEngine.measure(goal, constraints));
        }

        Draft(int index, int parentIndex, int depth, String goal, List<String> constraints, Set<String> askedOnPath,
              EntropyMeasurement entropy, DensityMeasurement density) {
            this.index = index;
            this.parentIndex = parentIndex;
            this.depth = depth;
            this.goal = goal;
            this.constraints = constraints;
            this.askedOnPath = Set.copyOf(askedOnPath);
            this.entropy = entropy;
            this.density = density;
        }

        DecompositionTree.Entry freeze() {
            return new DecompositionTree.Entry(index, parentIndex, depth, status, goal, constraints,
                    entropy, density, splitting, childIndices, unresolved);
        }
    }
}
