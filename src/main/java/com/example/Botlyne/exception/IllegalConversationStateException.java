package com.example.Botlyne.exception;

/**
 * A requested status change or append is not allowed from the conversation's current status.
 */
public class IllegalConversationStateException extends RuntimeException {

    public IllegalConversationStateException(String message) {
        super(message);
    }
}
