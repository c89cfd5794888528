package com.example.Botlyne.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ReviewVerdict {
    PASS,
    REWRITE,
    REJECT;

    /**
     * Lenient parse of a reviewer's verdict. Anything unrecognised is treated as a rejection.
     */
    @JsonCreator
    public static ReviewVerdict parse(String raw) {
        if (raw == null) {
            return REJECT;
        }
        switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "pass":
                return PASS;
            case "rewrite":
                return REWRITE;
            default:
                return REJECT;
        }
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
