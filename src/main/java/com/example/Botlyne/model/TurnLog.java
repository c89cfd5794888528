package com.example.Botlyne.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Lob;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "turn_logs")
@Getter
@Setter
public class TurnLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private UUID conversationId;

    @Enumerated(EnumType.STRING)
    @Column(length = 32)
    private QueryRoute route;

    @Lob
    @Column(columnDefinition = "TEXT")
    private String question;

    @Lob
    @Column(columnDefinition = "TEXT")
    private String answer;

    private double confidence;

    private boolean handoffTriggered;

    @Enumerated(EnumType.STRING)
    @Column(length = 32)
    private EscalationReason escalationReason;

    private long responseTimeMs;

    @Lob
    @Column(name = "sources", columnDefinition = "TEXT")
    private String sourcesJson;

    private Instant createdAt;

    @PrePersist
    public void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
