package com.example.Botlyne.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum QueryRoute {
    CONVERSATIONAL,
    KB_QUERY,
    MATH_QUERY,
    ESCALATION_REQUEST,
    CONTACT_EMAIL;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
