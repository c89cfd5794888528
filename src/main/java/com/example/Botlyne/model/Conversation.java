package com.example.Botlyne.model;

import com.example.Botlyne.exception.IllegalConversationStateException;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

/**
 * A support conversation. Status only moves through {@link #transitionTo}, which enforces the
 * allowed edges and keeps {@code resolvedAt} in step with the terminal states.
 */
@Entity
@Table(
        name = "conversations",
        uniqueConstraints = @UniqueConstraint(name = "uk_conversation_ticket", columnNames = {"tenant_id", "ticket_number"}),
        indexes = @Index(name = "idx_conversation_tenant_user", columnList = "tenant_id, user_id")
)
@Getter
@Setter
public class Conversation {

    @Id
    @Setter(AccessLevel.NONE)
    private UUID id;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    @Setter(AccessLevel.NONE)
    private String tenantId;

    @Column(name = "kb_id", nullable = false)
    private String kbId;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    @Setter(AccessLevel.NONE)
    private ConversationStatus status;

    @Column(name = "ticket_number", nullable = false, updatable = false, length = 32)
    @Setter(AccessLevel.NONE)
    private String ticketNumber;

    @Column(name = "started_at", nullable = false, updatable = false)
    @Setter(AccessLevel.NONE)
    private Instant startedAt;

    @Setter(AccessLevel.NONE)
    private Instant resolvedAt;

    @Enumerated(EnumType.STRING)
    @Column(length = 32)
    private EscalationReason escalationReason;

    private Instant escalatedAt;

    private String escalatedBy;

    private String contactEmail;

    private boolean pendingContactRequest;

    private Instant handoffNotifiedAt;

    private Integer satisfactionScore;

    private Instant lastMessageAt;

    private int messageCount;

    @Version
    @Setter(AccessLevel.NONE)
    private Long version;

    protected Conversation() {
    }

    public static Conversation open(String tenantId, String kbId, String userId, String ticketNumber, Instant startedAt) {
        Conversation conversation = new Conversation();
        conversation.id = UUID.randomUUID();
        conversation.tenantId = tenantId;
        conversation.kbId = kbId;
        conversation.userId = userId;
        conversation.ticketNumber = ticketNumber;
        conversation.startedAt = startedAt;
        conversation.status = ConversationStatus.ONGOING;
        return conversation;
    }

    public void transitionTo(ConversationStatus target, Instant at) {
        if (!status.canTransitionTo(target)) {
            throw new IllegalConversationStateException(
                    "Conversation " + id + " cannot move from " + status.wireName() + " to " + target.wireName());
        }
        this.status = target;
        if (target.isTerminal()) {
            this.resolvedAt = at;
        }
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public boolean hasContactEmail() {
        return contactEmail != null && !contactEmail.isBlank();
    }
}
