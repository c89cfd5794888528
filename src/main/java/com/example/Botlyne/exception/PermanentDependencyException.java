package com.example.Botlyne.exception;

/**
 * A failure that will not go away on retry (validation, auth, malformed output).
 */
public class PermanentDependencyException extends OrchestrationException {

    public PermanentDependencyException(String message) {
        super(message);
    }

    public PermanentDependencyException(String message, Throwable cause) {
        super(message, cause);
    }
}
