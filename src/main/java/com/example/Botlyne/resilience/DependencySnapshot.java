package com.example.Botlyne.resilience;

import java.time.Instant;

/**
 * Point-in-time view of one dependency's circuit.
 *
 * @param failureCount failed calls currently held in the breaker's window
 * @param lastTransitionAt process start for a breaker that never changed state
 */
public record DependencySnapshot(
        String dependency,
        BreakerState state,
        int failureCount,
        Instant lastTransitionAt
) {
}
