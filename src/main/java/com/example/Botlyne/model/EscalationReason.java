package com.example.Botlyne.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

/**
 * Why a turn was handed to a human. Declaration order is the reporting precedence.
 */
@Getter
public enum EscalationReason {
    DEPENDENCY_UNAVAILABLE("dependency_unavailable", "a required service is unavailable"),
    POLICY_VIOLATION("policy_violation", "the answer was rejected by the review policy"),
    EXPLICIT_REQUEST("explicit_request", "the user asked for a human"),
    REPEATED_QUESTION("repeated_question", "repeated unresolved question"),
    NO_KNOWLEDGE("no_knowledge", "no relevant knowledge base content"),
    LOW_CONFIDENCE("low_confidence", "answer confidence below threshold");

    private final String code;
    private final String description;

    EscalationReason(String code, String description) {
        this.code = code;
        this.description = description;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
