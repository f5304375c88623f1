package no.cantara.intent.model;

/**
 * The three disjoint outcomes of a kernel run.
 */
public enum ResultKind {
    /** Decomposition completed with nothing left to ask. */
    BUNDLE,
    /** Answers are needed before the intent can be re-run with more constraints. */
    CLARIFY,
    /** The intent could not be processed at all. */
    REFUSE;

    public static ResultKind of(BundleStatus status) {
        return switch (status) {
            case COMPLETE -> BUNDLE;
            case INCOMPLETE -> CLARIFY;
            case ERROR -> REFUSE;
        };
    }
}
