package com.example.Botlyne.model;

import java.util.UUID;

/**
 * Inbound user turn. A missing conversation id starts a new conversation.
 */
public record QueryTurnRequest(
        UUID conversationId,
        String kbId,
        String userId,
        String message
) {
}
