package com.example.Botlyne.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ConversationStatus {
    ONGOING,
    RESOLVED_AI,
    RESOLVED_HUMAN,
    ESCALATED;

    public boolean isTerminal() {
        return this == RESOLVED_AI || this == RESOLVED_HUMAN;
    }

    /**
     * Allowed edges: ongoing to resolved_ai or escalated, escalated to resolved_human.
     */
    public boolean canTransitionTo(ConversationStatus target) {
        switch (this) {
            case ONGOING:
                return target == RESOLVED_AI || target == ESCALATED;
            case ESCALATED:
                return target == RESOLVED_HUMAN;
            default:
                return false;
        }
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
