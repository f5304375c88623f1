package no.cantara.intent.mcp;

import io.modelcontextprotocol.spec.McpSchema;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class IntentMapperTest {

    private static Map<String, Object> output(String path, String type, Object confidence) {
        Map<String, Object> output = new HashMap<>();
        output.put("id", "out_0123456789abcdef");
        if (path != null) output.put("path", path);
        if (type != null) output.put("type", type);
        if (confidence != null) output.put("confidence", confidence);
        output.put("source_constraints", List.of("Must use JWT tokens", "Passwords must be hashed with bcrypt"));
        return output;
    }

    // ── goalSlug ──────────────────────────────────────────────────────────────────

    @Test void slugFromGoal() {
        assertEquals("create-a-user-authentication-system", IntentMapper.goalSlug("Create a user authentication system"));
    }

    @Test void slugTrimsDashesAndCollapsesWhitespace() {
        assertEquals("build-api", IntentMapper.goalSlug("  Build   API  "));
    }

    @Test void slugDropsPunctuation() {
        assertEquals("build-a-cli-tool", IntentMapper.goalSlug("Build a CLI (tool)!"));
    }

    @Test void slugIsCappedAt40() {
        assertEquals(40, IntentMapper.goalSlug("a".repeat(60)).length());
    }

    @Test void slugFallsBackWhenNothingRemains() {
        assertEquals("intent", IntentMapper.goalSlug("!!!"));
    }

    // ── URIs ──────────────────────────────────────────────────────────────────────

    @Test void urisUseIntentScheme() {
        assertEquals("intent://bundle_1/bundle", IntentMapper.bundleUri("bundle_1"));
        assertEquals("intent://bundle_1/summary", IntentMapper.summaryUri("bundle_1"));
        assertEquals("intent://bundle_1/questions", IntentMapper.questionsUri("bundle_1"));
        assertEquals("intent://bundle_1/outputs/out_2", IntentMapper.outputUri("bundle_1", "out_2"));
    }

    // ── resolveMime ───────────────────────────────────────────────────────────────

    @Test void mimeFromExtension() {
        assertEquals("text/markdown", IntentMapper.resolveMime(output("context/abc.md", "instruction", 70)));
        assertEquals("text/markdown", IntentMapper.resolveMime(output("context/ABC.MD", "instruction", 70)));
        assertEquals("text/x-shellscript", IntentMapper.resolveMime(output("scripts/run.sh", "command", 70)));
    }

    @Test void mimeFromTypeWhenExtensionUnknown() {
        assertEquals("application/json", IntentMapper.resolveMime(output("schemas/user", "schema", 70)));
        assertEquals("application/yaml", IntentMapper.resolveMime(output(null, "config", 70)));
    }

    @Test void mimeDefaultsToPlainText() {
        assertEquals("text/plain", IntentMapper.resolveMime(output("notes", "instruction", 70)));
    }

    // ── priority and description ──────────────────────────────────────────────────

    @Test void priorityFollowsConfidence() {
        assertEquals(0.68, IntentMapper.outputPriority(output("a.md", "instruction", 68)), 1e-9);
        assertEquals(1.0, IntentMapper.outputPriority(output("a.md", "instruction", 150)));
        assertEquals(0.5, IntentMapper.outputPriority(output("a.md", "instruction", null)));
    }

    @Test void descriptionListsConstraintsAndConfidence() {
        String description = IntentMapper.buildDescription(output("a.md", "instruction", 68));
        assertEquals("Context for a terminal sub-goal\n"
            + "Constraints: Must use JWT tokens; Passwords must be hashed with bcrypt\n"
            + "Confidence: 68", description);
    }

    // ── resources ─────────────────────────────────────────────────────────────────

    @Test void outputResource() {
        McpSchema.Resource r = IntentMapper.buildOutputResource("bundle_1", output("context/abc.md", "instruction", 80));
        assertEquals("intent://bundle_1/outputs/out_0123456789abcdef", r.uri());
        assertEquals("out_0123456789abcdef", r.name());
        assertEquals("text/markdown", r.mimeType());
        assertEquals(0.8, r.annotations().priority(), 1e-9);
        assertEquals(List.of(McpSchema.Role.ASSISTANT), r.annotations().audience());
    }

    @Test void bundleResourceHasPriority1() {
        McpSchema.Resource r = IntentMapper.buildBundleResource("bundle_1", "complete");
        assertEquals("bundle", r.name());
        assertEquals("application/json", r.mimeType());
        assertEquals(1.0, r.annotations().priority());
    }

    @Test void questionsPriorityDependsOnCount() {
        assertEquals(1.0, IntentMapper.buildQuestionsResource("bundle_1", 2).annotations().priority());
        assertEquals(0.3, IntentMapper.buildQuestionsResource("bundle_1", 0).annotations().priority());
    }

    // ── questions markdown ────────────────────────────────────────────────────────

    @Test void questionsMarkdown() {
        Map<String, Object> question = Map.of(
            "text", "What API style should be used?",
            "expected_answer_type", "choice",
            "priority", 70,
            "options", List.of("REST", "GraphQL"),
            "why_needed", "Interface shape depends on it");
        String markdown = IntentMapper.buildQuestionsMarkdown(Map.of("unresolved_questions", List.of(question)));
        assertEquals("# Unresolved Questions\n\n"
            + "- **What API style should be used?** (choice, priority 70)\n"
            + "  Options: REST, GraphQL\n"
            + "  Interface shape depends on it\n", markdown);
    }

    @Test void noQuestions() {
        assertEquals("# Unresolved Questions\n\n_None_\n",
            IntentMapper.buildQuestionsMarkdown(Map.of("unresolved_questions", List.of())));
    }
}
