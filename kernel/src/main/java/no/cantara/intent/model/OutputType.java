package no.cantara.intent.model;

import java.util.Locale;

public enum OutputType {
    FILE,
    COMMAND,
    CONFIG,
    INSTRUCTION,
    SCHEMA;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
