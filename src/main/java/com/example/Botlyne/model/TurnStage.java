package com.example.Botlyne.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Stages a turn reports while it runs. Event names on the stream are the lower-case names.
 */
public enum TurnStage {
    ROUTING,
    RETRIEVAL,
    DRAFTING,
    REVIEWING,
    FINAL;

    @JsonValue
    public String eventName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
