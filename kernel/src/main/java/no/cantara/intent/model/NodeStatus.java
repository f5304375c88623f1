package no.cantara.intent.model;

import java.util.Locale;

/**
 * Lifecycle of a context node: {@code pending -> expanding -> terminal | blocked}.
 */
public enum NodeStatus {
    PENDING,
    EXPANDING,
    TERMINAL,
    BLOCKED;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
