package com.example.Botlyne.model;

import java.time.Instant;

public record MessageView(int sequenceNo, MessageSender sender, String content, String agentId, Instant sentAt) {

    public static MessageView of(Message message) {
        return new MessageView(message.getSequenceNo(), message.getSender(), message.getContent(),
                message.getAgentId(), message.getSentAt());
    }
}
