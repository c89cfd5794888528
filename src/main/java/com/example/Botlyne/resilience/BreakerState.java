package com.example.Botlyne.resilience;

import com.fasterxml.jackson.annotation.JsonValue;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;

import java.util.Locale;

public enum BreakerState {
    CLOSED,
    OPEN,
    HALF_OPEN;

    static BreakerState from(CircuitBreaker.State state) {
        switch (state) {
            case OPEN:
            case FORCED_OPEN:
                return OPEN;
            case HALF_OPEN:
                return HALF_OPEN;
            default:
                return CLOSED;
        }
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
