package com.example.Botlyne.exception;

import lombok.Getter;

/**
 * Raised when a dependency's circuit is open or its retries are exhausted.
 */
@Getter
public class DependencyUnavailableException extends OrchestrationException {

    private final String dependency;

    public DependencyUnavailableException(String dependency, String message) {
        super(message);
        this.dependency = dependency;
    }

    public DependencyUnavailableException(String dependency, String message, Throwable cause) {
        super(message, cause);
        this.dependency = dependency;
    }
}
