package com.example.Botlyne.exception;

/**
 * The review agent rejected a draft. Never retried.
 */
public class PolicyViolationException extends OrchestrationException {

    public PolicyViolationException(String message) {
        super(message);
    }
}
