package io.hireflow.forms.quota;

public enum CounterKind {
    INVITATIONS_SENT("form invitations"),
    AI_SUGGESTIONS("AI form suggestions");

    private final String label;

    CounterKind(final String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
