package com.example.Botlyne.model;

import java.util.List;

/**
 * A drafted or reviewed answer.
 *
 * @param verdict null until the review agent has looked at the draft
 */
public record AnswerCandidate(
        String text,
        double confidence,
        ReviewVerdict verdict,
        List<ToolInvocation> toolInvocations,
        List<String> citedChunkIds
) {

    public AnswerCandidate {
        text = text == null ? "" : text;
        confidence = clamp(confidence);
        toolInvocations = toolInvocations == null ? List.of() : List.copyOf(toolInvocations);
        citedChunkIds = citedChunkIds == null ? List.of() : List.copyOf(citedChunkIds);
    }

    public static AnswerCandidate fixed(String text, double confidence) {
        return new AnswerCandidate(text, confidence, null, List.of(), List.of());
    }

    public AnswerCandidate withText(String value) {
        return new AnswerCandidate(value, confidence, verdict, toolInvocations, citedChunkIds);
    }

    public AnswerCandidate withConfidence(double value) {
        return new AnswerCandidate(text, value, verdict, toolInvocations, citedChunkIds);
    }

    public AnswerCandidate withVerdict(ReviewVerdict value) {
        return new AnswerCandidate(text, confidence, value, toolInvocations, citedChunkIds);
    }

    public AnswerCandidate withCitedChunkIds(List<String> value) {
        return new AnswerCandidate(text, confidence, verdict, toolInvocations, value);
    }

    public AnswerCandidate withToolInvocations(List<ToolInvocation> value) {
        return new AnswerCandidate(text, confidence, verdict, value, citedChunkIds);
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
