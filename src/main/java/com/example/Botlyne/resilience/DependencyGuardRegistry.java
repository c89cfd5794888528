package com.example.Botlyne.resilience;

import com.example.Botlyne.config.BotlyneProperties;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;

/**
 * Process-wide home of the per-dependency guards. Guards are created once, at startup,
 * and shared by every request.
 */
public class DependencyGuardRegistry {

    private static final Logger log = LoggerFactory.getLogger(DependencyGuardRegistry.class);

    private final BotlyneProperties.Resilience resilience;
    private final Executor executor;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final Map<String, DependencyGuard> guards = new LinkedHashMap<>();

    public DependencyGuardRegistry(BotlyneProperties.Resilience resilience,
                                   Executor executor,
                                   MeterRegistry meterRegistry,
                                   Clock clock) {
        this.resilience = resilience;
        this.executor = executor;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    public synchronized DependencyGuard register(String name, Duration timeout) {
        DependencyGuard existing = guards.get(name);
        if (existing != null) {
            return existing;
        }
        DependencyGuard guard = new DependencyGuard(name, resilience, timeout, executor, meterRegistry, clock);
        guards.put(name, guard);
        log.info("Registered dependency guard '{}' (timeout={}, threshold={}, cooldown={})",
                name, timeout, resilience.getFailureThreshold(), resilience.getCooldown());
        return guard;
    }

    public synchronized DependencyGuard guard(String name) {
        DependencyGuard guard = guards.get(name);
        if (guard == null) {
            throw new IllegalArgumentException("No dependency guard registered for '" + name + "'");
        }
        return guard;
    }

    public synchronized List<DependencySnapshot> snapshot() {
        List<DependencySnapshot> snapshots = new ArrayList<>(guards.size());
        for (DependencyGuard guard : guards.values()) {
            snapshots.add(guard.snapshot());
        }
        return snapshots;
    }

    public DependencyHealth health() {
        return DependencyHealth.of(snapshot());
    }
}
