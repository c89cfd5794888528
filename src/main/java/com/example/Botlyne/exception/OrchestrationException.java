package com.example.Botlyne.exception;

/**
 * Root of the engine's error taxonomy. All subclasses are unchecked so that collaborators
 * can surface them through Spring AI and JDBC callbacks unchanged.
 */
public abstract class OrchestrationException extends RuntimeException {

    protected OrchestrationException(String message) {
        super(message);
    }

    protected OrchestrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
