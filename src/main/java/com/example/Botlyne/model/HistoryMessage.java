package com.example.Botlyne.model;

import java.time.Instant;

public record HistoryMessage(MessageSender sender, String content, Instant sentAt) {

    public static HistoryMessage of(Message message) {
        return new HistoryMessage(message.getSender(), message.getContent(), message.getSentAt());
    }
}
