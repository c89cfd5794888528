package com.example.Botlyne.model;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Read model of a conversation. {@code messages} is empty in list views.
 */
public record ConversationView(
        UUID conversationId,
        String ticketNumber,
        String kbId,
        String userId,
        ConversationStatus status,
        Instant startedAt,
        Instant resolvedAt,
        EscalationReason escalationReason,
        Instant escalatedAt,
        String escalatedBy,
        String contactEmail,
        Integer satisfactionScore,
        int messageCount,
        List<MessageView> messages
) {

    public static ConversationView of(Conversation c, List<Message> messages) {
        return new ConversationView(
                c.getId(),
                c.getTicketNumber(),
                c.getKbId(),
                c.getUserId(),
                c.getStatus(),
                c.getStartedAt(),
                c.getResolvedAt(),
                c.getEscalationReason(),
                c.getEscalatedAt(),
                c.getEscalatedBy(),
                c.getContactEmail(),
                c.getSatisfactionScore(),
                c.getMessageCount(),
                messages.stream().map(MessageView::of).toList()
        );
    }
}
