package com.example.Botlyne.resilience;

import com.example.Botlyne.config.BotlyneProperties;
import com.example.Botlyne.exception.DependencyUnavailableException;
import com.example.Botlyne.exception.OrchestrationException;
import com.example.Botlyne.exception.PermanentDependencyException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Wraps calls to one external dependency with a per-attempt timeout, classification-aware
 * retry and a circuit breaker, composed as breaker(retry(timeLimiter(call))).
 * <p>
 * A logical call is a single breaker sample no matter how many attempts it took. Only
 * transient failures are recorded by the breaker; permanent ones pass through untouched.
 */
public class DependencyGuard {

    private static final Logger log = LoggerFactory.getLogger(DependencyGuard.class);

    static final String METRIC_NAME = "botlyne.dependency.calls";

    private final String name;
    private final CircuitBreaker circuitBreaker;
    private final Retry retry;
    private final TimeLimiter timeLimiter;
    private final Executor executor;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private volatile Instant lastTransitionAt;

    public DependencyGuard(String name,
                           BotlyneProperties.Resilience cfg,
                           Duration timeout,
                           Executor executor,
                           MeterRegistry meterRegistry,
                           Clock clock) {
        this.name = name;
        this.executor = executor;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.lastTransitionAt = clock.instant();

        int threshold = Math.max(1, cfg.getFailureThreshold());
        CircuitBreakerConfig breakerConfig = CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(threshold)
                .minimumNumberOfCalls(threshold)
                .failureRateThreshold(100.0f)
                .waitDurationInOpenState(cfg.getCooldown())
                .permittedNumberOfCallsInHalfOpenState(1)
                .recordException(ErrorClassifier::isTransient)
                .ignoreException(ErrorClassifier::isPermanent)
                .build();
        this.circuitBreaker = CircuitBreaker.of(name, breakerConfig);

        RetryConfig retryConfig = RetryConfig.custom()
                .maxAttempts(Math.max(1, cfg.getMaxAttempts()))
                .intervalFunction(IntervalFunction.ofExponentialRandomBackoff(
                        cfg.getBaseDelay(), cfg.getMultiplier(), cfg.getJitter()))
                .retryOnException(ErrorClassifier::isTransient)
                .build();
        this.retry = Retry.of(name, retryConfig);

        // A caller that gives up must not interrupt the attempt already in flight.
        this.timeLimiter = TimeLimiter.of(name, TimeLimiterConfig.custom()
                .timeoutDuration(timeout)
                .cancelRunningFuture(false)
                .build());

        circuitBreaker.getEventPublisher().onStateTransition(event -> {
            lastTransitionAt = clock.instant();
            log.warn("Circuit '{}' transitioned {}", name, event.getStateTransition());
        });
        retry.getEventPublisher().onRetry(event -> {
            record("retry");
            log.debug("Retrying '{}' (attempt {}) after {}: {}", name,
                    event.getNumberOfRetryAttempts(), event.getWaitInterval(),
                    String.valueOf(event.getLastThrowable()));
        });
    }

    /**
     * Execute {@code action} under the guard.
     *
     * @throws DependencyUnavailableException when the circuit is open or transient failures exhausted retries
     * @throws PermanentDependencyException   when the dependency failed in a way retrying cannot fix;
     *                                        other {@link OrchestrationException}s raised by the call pass through
     */
    public <T> T call(Callable<T> action) {
        Callable<T> timed = () -> timeLimiter.executeFutureSupplier(
                () -> CompletableFuture.supplyAsync(asSupplier(action), executor));
        Callable<T> retrying = Retry.decorateCallable(retry, timed);
        try {
            T result = circuitBreaker.executeCallable(retrying);
            record("success");
            return result;
        } catch (CallNotPermittedException e) {
            record("rejected");
            log.debug("Call to '{}' rejected, circuit is {}", name, circuitBreaker.getState());
            throw new DependencyUnavailableException(name, "Dependency '" + name + "' is unavailable (circuit open)", e);
        } catch (Exception e) {
            Throwable cause = ErrorClassifier.unwrap(e);
            if (ErrorClassifier.isTransient(cause)) {
                record("failure_transient");
                log.warn("Dependency '{}' failed after retries: {}", name, cause.toString());
                throw new DependencyUnavailableException(name, "Dependency '" + name + "' is unavailable", cause);
            }
            record("failure_permanent");
            log.warn("Dependency '{}' failed permanently: {}", name, cause.toString());
            if (cause instanceof OrchestrationException) {
                throw (OrchestrationException) cause;
            }
            throw new PermanentDependencyException("Dependency '" + name + "' failed: " + cause.getMessage(), cause);
        }
    }

    public DependencySnapshot snapshot() {
        return new DependencySnapshot(
                name,
                BreakerState.from(circuitBreaker.getState()),
                circuitBreaker.getMetrics().getNumberOfFailedCalls(),
                lastTransitionAt
        );
    }

    CircuitBreaker circuitBreaker() {
        return circuitBreaker;
    }

    private void record(String outcome) {
        meterRegistry.counter(METRIC_NAME, "dependency", name, "outcome", outcome).increment();
    }

    private static <T> Supplier<T> asSupplier(Callable<T> action) {
        return () -> {
            try {
                return action.call();
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new CompletionException(e);
            }
        };
    }
}
