package com.example.Botlyne.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.Getter;
import org.hibernate.annotations.Immutable;

import java.time.Instant;
import java.util.UUID;

/**
 * One delivered message. Append-only: there are no setters and Hibernate never issues updates.
 */
@Entity
@Immutable
@Table(
        name = "messages",
        uniqueConstraints = @UniqueConstraint(name = "uk_message_sequence", columnNames = {"conversation_id", "sequence_no"})
)
@Getter
public class Message {

    public static final int MAX_CONTENT_LENGTH = 10_000;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "conversation_id", nullable = false)
    private UUID conversationId;

    @Column(name = "sequence_no", nullable = false)
    private int sequenceNo;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private MessageSender sender;

    @Column(nullable = false, length = MAX_CONTENT_LENGTH)
    private String content;

    private String agentId;

    @Column(name = "sent_at", nullable = false)
    private Instant sentAt;

    protected Message() {
    }

    public Message(UUID conversationId, int sequenceNo, MessageSender sender, String content, String agentId, Instant sentAt) {
        this.conversationId = conversationId;
        this.sequenceNo = sequenceNo;
        this.sender = sender;
        this.content = content;
        this.agentId = agentId;
        this.sentAt = sentAt;
    }
}
