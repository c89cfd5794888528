package com.example.Botlyne.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Tunable knobs of the orchestration engine.
 * Thresholds are product decisions, so every number here can be overridden per deployment.
 */
@Data
@ConfigurationProperties(prefix = "botlyne")
public class BotlyneProperties {

    private Retrieval retrieval = new Retrieval();

    private Context context = new Context();

    private Generation generation = new Generation();

    private Resilience resilience = new Resilience();

    private Escalation escalation = new Escalation();

    private Ticket ticket = new Ticket();

    private Memory memory = new Memory();

    private Executor executor = new Executor();

    @Data
    public static class Retrieval {
        /** Default number of chunks requested from the vector store. */
        private int topK = 5;

        /** Per-call timeout for embedding and vector search calls. */
        private Duration timeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Context {
        /** Hard upper bound on the formatted context handed to generation. */
        private int maxChars = 8000;
    }

    @Data
    public static class Generation {
        /** Per-call timeout for the drafting and review calls. */
        private Duration timeout = Duration.ofSeconds(20);

        /** Number of most recent messages passed as history. */
        private int historyWindow = 10;
    }

    @Data
    public static class Resilience {
        private int maxAttempts = 3;

        private Duration baseDelay = Duration.ofSeconds(1);

        private double multiplier = 2.0;

        /** Randomization factor applied to each backoff interval (0.2 = ±20%). */
        private double jitter = 0.2;

        /** Consecutive failures that open a dependency's circuit. */
        private int failureThreshold = 5;

        /** How long an open circuit waits before allowing a trial call. */
        private Duration cooldown = Duration.ofSeconds(60);
    }

    @Data
    public static class Escalation {
        private double confidenceThreshold = 0.5;

        /** Stricter threshold for knowledge base questions that found nothing. */
        private double noContextConfidenceThreshold = 0.65;

        /** How many near-identical asks count as an unresolved repeat. */
        private int repeatThreshold = 3;

        /** How many recent user messages are scanned for repeats. */
        private int repeatWindow = 20;

        /** Token-set Jaccard similarity at which two questions are treated as the same. */
        private double duplicateSimilarity = 0.8;
    }

    @Data
    public static class Ticket {
        private int length = 8;

        private int maxAttempts = 10;
    }

    @Data
    public static class Memory {
        /** Max number of messages kept per conversation in Redis. */
        private int window = 20;

        /** Rolling TTL, refreshed on each append. */
        private Duration ttl = Duration.ofDays(7);
    }

    @Data
    public static class Executor {
        private int dependencyPoolSize = 16;

        private int notificationPoolSize = 2;

        private int queueCapacity = 500;
    }
}
