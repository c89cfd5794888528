package com.example.Botlyne.resilience;

import com.example.Botlyne.config.BotlyneProperties;
import com.example.Botlyne.exception.DependencyUnavailableException;
import com.example.Botlyne.exception.TransientDependencyException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DependencyGuardRegistryTest {

    private DependencyGuardRegistry registry() {
        BotlyneProperties.Resilience cfg = new BotlyneProperties.Resilience();
        cfg.setMaxAttempts(1);
        cfg.setBaseDelay(Duration.ofMillis(1));
        cfg.setJitter(0.0);
        cfg.setFailureThreshold(1);
        return new DependencyGuardRegistry(cfg, Runnable::run, new SimpleMeterRegistry(), Clock.systemUTC());
    }

    @Test
    void registeringTwiceReturnsTheSameGuard() {
        DependencyGuardRegistry registry = registry();

        DependencyGuard first = registry.register(DependencyNames.EMBEDDING, Duration.ofSeconds(1));
        DependencyGuard second = registry.register(DependencyNames.EMBEDDING, Duration.ofSeconds(5));

        assertThat(second).isSameAs(first);
        assertThat(registry.guard(DependencyNames.EMBEDDING)).isSameAs(first);
    }

    @Test
    void unknownDependencyIsRejected() {
        assertThatThrownBy(() -> registry().guard("nope")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void healthReflectsBreakerStates() {
        DependencyGuardRegistry registry = registry();
        DependencyGuard embedding = registry.register(DependencyNames.EMBEDDING, Duration.ofSeconds(1));
        DependencyGuard generation = registry.register(DependencyNames.GENERATION, Duration.ofSeconds(1));

        assertThat(registry.health().status()).isEqualTo(DependencyHealth.HEALTHY);

        fail(embedding);
        assertThat(registry.health().status()).isEqualTo(DependencyHealth.DEGRADED);

        fail(generation);
        assertThat(registry.health().status()).isEqualTo(DependencyHealth.UNHEALTHY);
        assertThat(registry.health().dependencies())
                .extracting(DependencySnapshot::state)
                .containsOnly(BreakerState.OPEN);
    }

    @Test
    void healthOfNoDependenciesIsHealthy() {
        assertThat(DependencyHealth.of(List.of()).status()).isEqualTo(DependencyHealth.HEALTHY);
        assertThat(DependencyHealth.of(List.of(
                new DependencySnapshot("a", BreakerState.HALF_OPEN, 0, Instant.EPOCH))).status())
                .isEqualTo(DependencyHealth.DEGRADED);
    }

    private static void fail(DependencyGuard guard) {
        assertThatThrownBy(() -> guard.call(() -> {
            throw new TransientDependencyException("down");
        })).isInstanceOf(DependencyUnavailableException.class);
    }
}
