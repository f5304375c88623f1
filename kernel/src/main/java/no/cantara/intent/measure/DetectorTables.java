package no.cantara.intent.measure;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pattern vocabularies behind the entropy and density engines.
 *
 * <p>All patterns are case-insensitive. Tables are immutable and shared.
 */
public final class DetectorTables {

    /** A required topic category; found when any of its patterns matches. */
    public record Category(String name, List<Pattern> patterns) {
        public Category {
            patterns = List.copyOf(patterns);
        }

        public boolean isPresentIn(String text) {
            return patterns.stream().anyMatch(p -> p.matcher(text).find());
        }
    }

    /** Two opposite concepts; a contradiction when both are present. */
    public record ContradictionPair(String name, Pattern first, Pattern second) {
        public boolean isPresentIn(String text) {
            return first.matcher(text).find() && second.matcher(text).find();
        }
    }

    private DetectorTables() {}

    // ── entropy ─────────────────────────────────────────────────────────────

    public static final List<Pattern> UNRESOLVED_REFERENCES = patterns(
            "\\bTBD\\b",
            "\\bTODO\\b",
            "\\bFIXME\\b",
            "\\bXXX\\b",
            "\\bTBA\\b",
            "\\?\\?\\?",
            "\\[.*?\\]",
            "\\{.*?\\}",
            "<.*?>",
            "\\bplaceholder\\b",
            "\\bunknown\\b",
            "\\bundefined\\b",
            "\\bTBC\\b",
            "\\bTBR\\b",
            "\\bto be determined\\b",
            "\\bto be defined\\b",
            "\\bnot yet decided\\b",
            "\\bwill be provided\\b",
            "\\bneeds clarification\\b",
            "\\brequires input\\b");

    public static final String TECHNOLOGY = "technology";
    public static final String ACTORS = "actors";
    public static final String ACTIONS = "actions";
    public static final String DATA = "data";
    public static final String ERRORS = "errors";

    public static final List<Category> REQUIRED_CATEGORIES = List.of(
            new Category(TECHNOLOGY, patterns(
                    "\\b(language|framework|library|database|platform)\\b",
                    "\\b(using|built with|implemented in)\\b")),
            new Category(ACTORS, patterns(
                    "\\b(user|admin|system|service|client|customer)\\b",
                    "\\b(who|actor|role)\\b")),
            new Category(ACTIONS, patterns(
                    "\\b(should|must|will|can|shall)\\b",
                    "\\b(create|read|update|delete|get|set|send|receive)\\b")),
            new Category(DATA, patterns(
                    "\\b(data|field|property|attribute|column|table)\\b",
                    "\\b(type|schema|structure|format)\\b")),
            new Category(ERRORS, patterns(
                    "\\b(error|exception|failure|invalid|missing)\\b",
                    "\\b(if|when|unless|otherwise)\\b")));

    public static final List<ContradictionPair> CONTRADICTION_PAIRS = List.of(
            pair("must-not/must", "\\bmust\\b.*\\bnot\\b", "\\bmust\\b(?!.*\\bnot\\b)"),
            pair("required/optional", "\\brequired\\b", "\\boptional\\b"),
            pair("always/never", "\\balways\\b", "\\bnever\\b"),
            pair("all/none", "\\ball\\b", "\\bnone\\b"),
            pair("synchronous/asynchronous", "\\bsynchronous\\b", "\\basynchronous\\b"),
            pair("blocking/non-blocking", "\\bblocking\\b", "\\bnon-blocking\\b"),
            pair("stateful/stateless", "\\bstateful\\b", "\\bstateless\\b"),
            pair("mutable/immutable", "\\bmutable\\b", "\\bimmutable\\b"),
            pair("public/private", "\\bpublic\\b", "\\bprivate\\b"),
            pair("read-only/writable", "\\bread-only\\b", "\\bwritable\\b"));

    public static final List<Pattern> BRANCHING_KEYWORDS = patterns(
            "\\bor\\b",
            "\\beither\\b",
            "\\balternatively\\b",
            "\\boption\\b",
            "\\bchoice\\b",
            "\\bcould\\b",
            "\\bmight\\b",
            "\\bmaybe\\b",
            "\\bpossibly\\b",
            "\\bdepends\\b",
            "\\bif\\b.*\\bthen\\b",
            "\\bwhen\\b.*\\bthen\\b");

    // ── density ─────────────────────────────────────────────────────────────

    public static final List<Pattern> CONCRETE_KEYWORDS = patterns(
            "\\bmust\\b",
            "\\bshall\\b",
            "\\bwill\\b",
            "\\brequires?\\b",
            "\\bneeds?\\b",
            "\\buse\\b",
            "\\bimplement\\b",
            "\\bcreate\\b",
            "\\breturn\\b",
            "\\baccept\\b",
            "\\breject\\b",
            "\\bvalidate\\b",
            "\\bformat\\b",
            "\\blimit\\b",
            "\\bmax(imum)?\\b",
            "\\bmin(imum)?\\b",
            "\\bexactly\\b",
            "\\bat least\\b",
            "\\bat most\\b",
            "\\bno more than\\b",
            "\\bno less than\\b");

    public static final List<Pattern> OUTPUT_PHRASES = patterns(
            "\\bfile\\b.*\\bnamed?\\b",
            "\\boutput\\b",
            "\\bgenerate\\b",
            "\\bproduce\\b",
            "\\bwrite\\b.*\\bto\\b",
            "\\bcreate\\b.*\\b(file|class|function|component)\\b",
            "\\breturn\\b.*\\b(json|string|number|array|object)\\b",
            "\\bformat\\b.*\\b(as|in)\\b");

    public static final List<Pattern> QUALIFIERS = patterns(
            "\\bspecifically\\b",
            "\\bin particular\\b",
            "\\bwhen\\b",
            "\\bif\\b",
            "\\bexcept\\b",
            "\\bunless\\b",
            "\\bfor\\b.*\\b(each|every|all)\\b",
            "\\bwhere\\b",
            "\\bsuch that\\b");

    // ── matching ────────────────────────────────────────────────────────────

    /** Total number of non-overlapping matches of every pattern in the text. */
    public static int countMatches(List<Pattern> table, String text) {
        int count = 0;
        for (Pattern pattern : table) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                count++;
            }
        }
        return count;
    }

    /** Number of patterns that match the text at least once. */
    public static int countMatchingPatterns(List<Pattern> table, String text) {
        int count = 0;
        for (Pattern pattern : table) {
            if (pattern.matcher(text).find()) {
                count++;
            }
        }
        return count;
    }

    public static boolean anyMatch(List<Pattern> table, String text) {
        return countMatchingPatterns(table, text) > 0;
    }

    static Pattern compile(String regex) {
        return Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }

    private static List<Pattern> patterns(String... regexes) {
        return Arrays.stream(regexes).map(DetectorTables::compile).toList();
    }

    private static ContradictionPair pair(String name, String first, String second) {
        return new ContradictionPair(name, compile(first), compile(second));
    }
}
