package com.example.Botlyne.exception;

/**
 * The caller named a knowledge base or conversation it does not own.
 */
public class AccessDeniedException extends RuntimeException {

    public AccessDeniedException(String message) {
        super(message);
    }
}
