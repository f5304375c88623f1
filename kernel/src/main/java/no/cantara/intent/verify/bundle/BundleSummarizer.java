package no.cantara.intent.verify.bundle;

import no.cantara.intent.canonical.CanonicalizationException;
import no.cantara.intent.canonical.Canonicalizer;
import no.cantara.intent.model.BundleStatus;
import no.cantara.intent.model.ResultKind;
import no.cantara.intent.verify.Values;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static no.cantara.intent.verify.Values.asList;
import static no.cantara.intent.verify.Values.asObject;

/**
 * Builds a {@link BundleSummary} from a bundle in wire form. Tolerates missing
 * sections; an unknown status maps to {@code REFUSE}.
 */
public final class BundleSummarizer {

    private static final Logger log = LoggerFactory.getLogger(BundleSummarizer.class);

    private BundleSummarizer() {}

    public static BundleSummary summarize(Map<String, Object> bundle) {
        BundleStatus status = BundleStatus.fromWireName(bundle.get("status"));
        ResultKind outcome = status == null ? ResultKind.REFUSE : ResultKind.of(status);

        List<String> paths = fieldValues(bundle.get("outputs"), "path").stream().sorted().toList();
        List<String> nodeIds = fieldValues(bundle.get("terminal_nodes"), "id").stream().sorted().toList();
        List<String> questionIds = questionIds(bundle.get("unresolved_questions"));

        return new BundleSummary(Values.asString(bundle.get("schema_version")), outcome, hash(bundle),
                paths, questionIds, nodeIds);
    }

    private static String hash(Map<String, Object> bundle) {
        try {
            return Canonicalizer.contentHash(bundle);
        } catch (CanonicalizationException e) {
            log.warn("Bundle is not canonicalizable, summary has no hash: {}", e.getMessage());
            return null;
        }
    }

    private static List<String> fieldValues(Object rawList, String field) {
        List<Object> list = asList(rawList);
        if (list == null) return List.of();
        return list.stream()
                .map(Values::asObject)
                .filter(Objects::nonNull)
                .map(m -> m.get(field))
                .filter(String.class::isInstance)
                .map(String.class::cast)
                .toList();
    }

    private static List<String> questionIds(Object rawList) {
        List<Object> list = asList(rawList);
        if (list == null) return List.of();
        Comparator<Map<String, Object>> order = Comparator
                .comparingLong((Map<String, Object> q) -> -priority(q))
                .thenComparing(q -> q.get("id") instanceof String s ? s : "");
        return list.stream()
                .map(Values::asObject)
                .filter(Objects::nonNull)
                .filter(q -> q.get("id") instanceof String)
                .sorted(order)
                .map(q -> (String) q.get("id"))
                .toList();
    }

    private static long priority(Map<String, Object> question) {
        Object raw = question.get("priority");
        return Values.isInteger(raw) ? Values.longValue(raw) : 0;
    }
}
