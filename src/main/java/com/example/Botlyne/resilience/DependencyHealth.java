package com.example.Botlyne.resilience;

import java.util.List;

/**
 * Aggregated circuit health: healthy when every circuit is closed, unhealthy when every
 * circuit is open, degraded otherwise.
 */
public record DependencyHealth(String status, List<DependencySnapshot> dependencies) {

    public static final String HEALTHY = "healthy";
    public static final String DEGRADED = "degraded";
    public static final String UNHEALTHY = "unhealthy";

    public static DependencyHealth of(List<DependencySnapshot> snapshots) {
        boolean allClosed = snapshots.stream().allMatch(s -> s.state() == BreakerState.CLOSED);
        if (allClosed) {
            return new DependencyHealth(HEALTHY, snapshots);
        }
        boolean allOpen = snapshots.stream().allMatch(s -> s.state() == BreakerState.OPEN);
        return new DependencyHealth(allOpen ? UNHEALTHY : DEGRADED, snapshots);
    }
}
