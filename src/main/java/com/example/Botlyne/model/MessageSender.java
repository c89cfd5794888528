package com.example.Botlyne.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum MessageSender {
    USER,
    AI,
    AGENT;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
