package com.example.Botlyne.exception;

/**
 * A failure worth retrying: timeouts, 5xx, dropped connections.
 */
public class TransientDependencyException extends OrchestrationException {

    public TransientDependencyException(String message) {
        super(message);
    }

    public TransientDependencyException(String message, Throwable cause) {
        super(message, cause);
    }
}
