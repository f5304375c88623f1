package no.cantara.intent;

import no.cantara.intent.model.Bundle;
import no.cantara.intent.model.Question;
import no.cantara.intent.model.ResultKind;

import java.util.List;

/**
 * Outcome of a kernel run as a value: a bundle, a bundle with questions to answer,
 * or a refusal.
 *
 * @param bundle       present for {@code BUNDLE} and {@code CLARIFY}
 * @param refusal      present for {@code REFUSE}
 */
public record KernelResult(ResultKind kind, Bundle bundle, KernelException.Code refusal, String message) {

    public static KernelResult of(Bundle bundle) {
        return new KernelResult(bundle.resultKind(), bundle, null, null);
    }

    public static KernelResult refused(KernelException e) {
        return new KernelResult(ResultKind.REFUSE, null, e.code(), e.getMessage());
    }

    /** Questions the caller should answer before re-running; empty unless {@code CLARIFY}. */
    public List<Question> questions() {
        return kind == ResultKind.CLARIFY ? bundle.unresolvedQuestions() : List.of();
    }
}
