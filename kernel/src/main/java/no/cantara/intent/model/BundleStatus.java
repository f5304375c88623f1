package no.cantara.intent.model;

import java.util.Locale;

/**
 * {@code complete}: every leaf terminal and nothing unresolved.
 * {@code incomplete}: questions remain. {@code error}: decomposition hit a bound.
 */
public enum BundleStatus {
    COMPLETE,
    INCOMPLETE,
    ERROR;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Inverse of {@link #wireName()}, or {@code null} for anything else. */
    public static BundleStatus fromWireName(Object value) {
        for (BundleStatus status : values()) {
            if (status.wireName().equals(value)) return status;
        }
        return null;
    }
}
