package ru.aritmos.discharge.safety;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Флаги безопасности. Сериализуются строковым видом ({@link #kind()}).
 * Прикреплённый флаг никогда не отбрасывается.
 */
public enum SafetyFlag {
    POSSIBLE_HALLUCINATION("possible-hallucination"),
    CONTRAINDICATED_ADVICE("contraindicated-advice"),
    MISSING_DISCLAIMER("missing-disclaimer"),
    OUT_OF_SCOPE_REQUEST("out-of-scope-request"),
    LOW_CONFIDENCE("low-confidence");

    private final String kind;

    SafetyFlag(String kind) {
        this.kind = kind;
    }

    @JsonValue
    public String kind() {
        return kind;
    }
}
