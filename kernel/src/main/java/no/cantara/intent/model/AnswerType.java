package no.cantara.intent.model;

import java.util.Locale;

/** The kind of answer a question expects. */
public enum AnswerType {
    BOOLEAN,
    CHOICE,
    TEXT,
    NUMBER,
    LIST,
    STRUCTURED;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Choice and boolean questions have a closed answer set and can split a node. */
    public boolean isEnumerable() {
        return this == BOOLEAN || this == CHOICE;
    }
}
