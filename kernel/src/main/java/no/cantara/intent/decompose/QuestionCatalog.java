package no.cantara.intent.decompose;

import no.cantara.intent.measure.DetectorTables;
import no.cantara.intent.model.AnswerType;

import java.util.List;
import java.util.regex.Pattern;

/**
 * The fixed set of question templates, in evaluation order.
 *
 * <p>Choice questions carry a constraint phrase that supplies one of the required
 * topic categories, so answering them lowers entropy. Open questions (list, text,
 * structured) are never used to split a node; they are collected as unresolved.
 */
public record QuestionCatalog(List<QuestionTemplate> templates, QuestionTemplate fallback) {

    public QuestionCatalog {
        templates = List.copyOf(templates);
        if (fallback == null || fallback.answerType().isEnumerable()) {
            throw new IllegalArgumentException("fallback question must be an open question");
        }
    }

    private static final QuestionCatalog STANDARD = new QuestionCatalog(List.of(
            new QuestionTemplate("stack",
                    trigger("\\b(build|create|implement|develop)\\b.*\\b(system|application|app|service|tool|platform|server|api)\\b"),
                    null,
                    "What technology stack should be used?",
                    AnswerType.CHOICE,
                    "Technology choice affects architecture, performance, and maintainability",
                    List.of("Go", "Java", "JavaScript/Node.js", "Python", "Rust"),
                    DetectorTables.TECHNOLOGY,
                    "Must be implemented in %s"),
            new QuestionTemplate("users",
                    trigger("\\b(user|customer|client|actor)s?\\b"),
                    null,
                    "Who are the primary users of this system?",
                    AnswerType.LIST,
                    "User types determine access patterns, permissions, and UI requirements",
                    null, null, null),
            new QuestionTemplate("storage",
                    trigger("\\b(store|save|persist|database|data)\\b"),
                    null,
                    "What type of data storage is needed?",
                    AnswerType.CHOICE,
                    "Data storage choice affects query patterns, scalability, and consistency",
                    List.of("File storage", "In-memory", "NoSQL database", "SQL database"),
                    DetectorTables.DATA,
                    "Data must be stored in %s"),
            new QuestionTemplate("auth",
                    trigger("\\b(auth|login|user|account|permission|access)\\b"),
                    null,
                    "What authentication method is required?",
                    AnswerType.CHOICE,
                    "Authentication affects security model and integration requirements",
                    List.of("API keys", "JWT tokens", "OAuth", "Session-based"),
                    DetectorTables.ACTORS,
                    "Each user must authenticate with %s"),
            new QuestionTemplate("scale",
                    trigger("\\b(scale|performance|load|concurrent|traffic)\\b"),
                    null,
                    "What are the expected scale requirements?",
                    AnswerType.STRUCTURED,
                    "Scale requirements affect architecture, caching, and infrastructure",
                    null, null, null),
            new QuestionTemplate("api",
                    trigger("\\b(api|endpoint|interface|integration)\\b"),
                    null,
                    "What API style should be used?",
                    AnswerType.CHOICE,
                    "API style affects client integration and versioning strategy",
                    List.of("GraphQL", "REST", "WebSocket", "gRPC"),
                    DetectorTables.ACTORS,
                    "The service must expose a %s interface"),
            new QuestionTemplate("errors",
                    trigger("\\b(error|fail|exception|invalid|retry)\\b"),
                    null,
                    "How should errors be handled?",
                    AnswerType.CHOICE,
                    "Error handling strategy affects reliability and user experience",
                    List.of("Circuit breaker", "Fail fast", "Graceful degradation", "Retry with backoff"),
                    DetectorTables.ERRORS,
                    "On error the system must apply %s"),
            new QuestionTemplate("placeholders",
                    null,
                    entropy -> entropy.unresolvedRefs() > 0,
                    "What concrete values should replace the placeholders and open markers?",
                    AnswerType.TEXT,
                    "Unresolved references leave the goal open to incompatible interpretations",
                    null, null, null),
            new QuestionTemplate("precedence",
                    null,
                    entropy -> entropy.contradictionCount() > 0,
                    "Which of the conflicting constraints takes precedence?",
                    AnswerType.TEXT,
                    "Contradictory constraints cannot all be satisfied",
                    null, null, null)),
            new QuestionTemplate("completion",
                    null,
                    null,
                    "What concrete outputs and acceptance criteria define completion of this goal?",
                    AnswerType.TEXT,
                    "The goal is not specific enough to decompose or act on",
                    null, null, null));

    public static QuestionCatalog standard() {
        return STANDARD;
    }

    private static Pattern trigger(String regex) {
        return Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }
}
