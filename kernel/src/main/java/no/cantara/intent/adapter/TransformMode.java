package no.cantara.intent.adapter;

public enum TransformMode {
    PLAN_ONLY("plan-only"),
    EXECUTE("execute"),
    CLARIFY("clarify");

    private final String wireName;

    TransformMode(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
