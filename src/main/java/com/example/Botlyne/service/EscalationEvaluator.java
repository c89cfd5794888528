package com.example.Botlyne.service;

import com.example.Botlyne.config.BotlyneProperties;
import com.example.Botlyne.model.EscalationDecision;
import com.example.Botlyne.model.EscalationReason;
import com.example.Botlyne.model.QueryRoute;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Confidence scoring and escalation policy for a finished turn.
 * When several triggers hold, the reason reported is the first in this order: dependency
 * unavailable, policy violation, explicit request, repeated question, no knowledge, low confidence.
 */
@Service
@RequiredArgsConstructor
public class EscalationEvaluator {

    private final BotlyneProperties properties;

    /**
     * @param recentUserMessages the conversation's most recent user messages, current one included
     * @param contactEmailOnFile whether the conversation already has a contact email
     */
    public EscalationDecision evaluate(TurnOutcome outcome, List<String> recentUserMessages, boolean contactEmailOnFile) {
        EscalationReason reason = reason(outcome, recentUserMessages);
        if (reason == null) {
            return EscalationDecision.noEscalation();
        }
        return EscalationDecision.escalate(reason, !contactEmailOnFile);
    }

    public double confidence(TurnOutcome outcome) {
        if (outcome.degraded() || outcome.rejected()) {
            return 0.0;
        }
        return outcome.candidate().confidence();
    }

    private EscalationReason reason(TurnOutcome outcome, List<String> recentUserMessages) {
        BotlyneProperties.Escalation cfg = properties.getEscalation();
        double confidence = confidence(outcome);

        if (outcome.degraded()) {
            return EscalationReason.DEPENDENCY_UNAVAILABLE;
        }
        if (outcome.rejected()) {
            return EscalationReason.POLICY_VIOLATION;
        }
        if (outcome.route() == QueryRoute.ESCALATION_REQUEST) {
            return EscalationReason.EXPLICIT_REQUEST;
        }
        if (outcome.route() == QueryRoute.CONTACT_EMAIL) {
            // Already escalated; this turn only completes the handoff.
            return null;
        }
        if (outcome.route() == QueryRoute.KB_QUERY && isRepeated(recentUserMessages, cfg)) {
            return EscalationReason.REPEATED_QUESTION;
        }
        if (outcome.route() == QueryRoute.KB_QUERY && outcome.retrieved().isEmpty()
                && confidence < cfg.getNoContextConfidenceThreshold()) {
            return EscalationReason.NO_KNOWLEDGE;
        }
        if (confidence < cfg.getConfidenceThreshold()) {
            return EscalationReason.LOW_CONFIDENCE;
        }
        return null;
    }

    /**
     * True when the newest message has at least {@code repeatThreshold} near duplicates
     * (itself included) within the last {@code repeatWindow} user messages.
     *
     * @param recentUserMessages newest first
     */
    boolean isRepeated(List<String> recentUserMessages, BotlyneProperties.Escalation cfg) {
        if (recentUserMessages == null || recentUserMessages.isEmpty()) {
            return false;
        }
        List<String> window = recentUserMessages.subList(0, Math.min(cfg.getRepeatWindow(), recentUserMessages.size()));
        String current = normalize(window.get(0));
        if (current.isEmpty()) {
            return false;
        }
        Set<String> currentTokens = tokens(current);
        long matches = window.stream()
                .map(EscalationEvaluator::normalize)
                .filter(m -> m.equals(current) || jaccard(currentTokens, tokens(m)) >= cfg.getDuplicateSimilarity())
                .count();
        return matches >= cfg.getRepeatThreshold();
    }

    static String normalize(String message) {
        if (message == null) {
            return "";
        }
        return message.toLowerCase(Locale.ROOT)
                .replaceAll("[^\\p{L}\\p{N}\\s]", " ")
                .replaceAll("\\s+", " ")
                .trim();
    }

    private static Set<String> tokens(String normalized) {
        if (normalized.isEmpty()) {
            return Set.of();
        }
        return Arrays.stream(normalized.split(" ")).collect(Collectors.toSet());
    }

    static double jaccard(Set<String> a, Set<String> b) {
        if (a.isEmpty() && b.isEmpty()) {
            return 1.0;
        }
        long intersection = a.stream().filter(b::contains).count();
        long union = a.size() + b.size() - intersection;
        return union == 0 ? 0.0 : (double) intersection / union;
    }
}
