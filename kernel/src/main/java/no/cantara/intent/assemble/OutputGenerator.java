package no.cantara.intent.assemble;

import no.cantara.intent.canonical.Canonicalizer;
import no.cantara.intent.measure.Scores;
import no.cantara.intent.model.ContextNode;
import no.cantara.intent.model.Output;
import no.cantara.intent.model.OutputType;
import no.cantara.intent.model.Question;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Generates the outputs of terminal nodes: one markdown instruction per node at
 * {@code context/<node id>.md}.
 */
public final class OutputGenerator {

    private OutputGenerator() {}

    public static Output forTerminal(ContextNode node) {
        String path = "context/" + node.id() + ".md";
        String content = instructionMarkdown(node);

        Map<String, Object> identity = new LinkedHashMap<>();
        identity.put("type", OutputType.INSTRUCTION.wireName());
        identity.put("path", path);
        identity.put("content", content);

        return new Output(
                Canonicalizer.contentId("out", identity),
                OutputType.INSTRUCTION,
                path,
                content,
                Canonicalizer.contentHash(content),
                node.constraints(),
                confidence(node));
    }

    /** {@code 0.6*density + 0.4*(100 - entropy)}, clamped. */
    public static int confidence(ContextNode node) {
        return Scores.clamp(0.6 * node.density().densityScore()
                + 0.4 * (Scores.MAX - node.entropy().entropyScore()));
    }

    static String instructionMarkdown(ContextNode node) {
        List<String> lines = new ArrayList<>();
        lines.add("# Context: " + node.goal());
        lines.add("");
        lines.add("## Constraints");
        lines.add("");
        if (node.constraints().isEmpty()) {
            lines.add("_None_");
        }
        for (String constraint : node.constraints()) {
            lines.add("- " + constraint);
        }
        lines.add("");
        lines.add("## Metrics");
        lines.add("");
        lines.add("- Entropy Score: " + node.entropy().entropyScore() + "/100");
        lines.add("- Density Score: " + node.density().densityScore() + "/100");
        lines.add("- Unresolved References: " + node.entropy().unresolvedRefs());
        lines.add("- Schema Gaps: " + node.entropy().schemaGaps());
        lines.add("- Contradictions: " + node.entropy().contradictionCount());
        if (!node.unresolvedQuestions().isEmpty()) {
            lines.add("");
            lines.add("## Unresolved Questions");
            lines.add("");
            for (Question question : node.unresolvedQuestions()) {
                lines.add("- " + question.text() + " (priority: " + question.priority() + ")");
            }
        }
        return String.join("\n", lines);
    }
}
