package com.example.Botlyne.model;

/**
 * Outcome of evaluating an arithmetic expression. Failures carry a reason instead of throwing.
 */
public record EvaluationResult(String expression, boolean success, Double value, String formatted, String error) {

    public static EvaluationResult ok(String expression, double value, String formatted) {
        return new EvaluationResult(expression, true, value, formatted, null);
    }

    public static EvaluationResult failure(String expression, String error) {
        return new EvaluationResult(expression, false, null, null, error);
    }
}
