package com.example.Botlyne.service;

import com.example.Botlyne.exception.AccessDeniedException;
import com.example.Botlyne.exception.ConversationNotFoundException;
import com.example.Botlyne.exception.IllegalConversationStateException;
import com.example.Botlyne.exception.InvalidRequestException;
import com.example.Botlyne.model.Conversation;
import com.example.Botlyne.model.ConversationStatus;
import com.example.Botlyne.model.ConversationView;
import com.example.Botlyne.model.EscalationReason;
import com.example.Botlyne.model.HistoryMessage;
import com.example.Botlyne.model.Message;
import com.example.Botlyne.model.MessageSender;
import com.example.Botlyne.repository.ConversationRepository;
import com.example.Botlyne.repository.MessageRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Sole writer of conversation status, resolution and escalation fields, and of the message log.
 * Every operation reloads the conversation by id so callers never write through a stale copy.
 */
@Service
@RequiredArgsConstructor
public class ConversationStateManager {

    private static final Logger log = LoggerFactory.getLogger(ConversationStateManager.class);

    private final ConversationRepository conversationRepository;
    private final MessageRepository messageRepository;
    private final TicketRegistry ticketRegistry;
    private final ConversationMemoryService memoryService;
    private final Clock clock;

    /**
     * Load the tenant's conversation, or start a new one when the id is absent, unknown, belongs
     * to another tenant or knowledge base, or the conversation is already resolved.
     *
     * @throws AccessDeniedException when the tenant's conversation belongs to another user
     */
    @Transactional
    public Conversation openTurn(String tenantId, String kbId, String userId, UUID conversationId) {
        if (conversationId != null) {
            Optional<Conversation> existing = conversationRepository.findByIdAndTenantId(conversationId, tenantId);
            if (existing.isEmpty()) {
                log.info("Conversation {} not found for tenant {}, starting a new one", conversationId, tenantId);
            } else if (!existing.get().getUserId().equals(userId)) {
                throw new AccessDeniedException("Conversation " + conversationId + " does not belong to user " + userId);
            } else if (existing.get().isTerminal()) {
                log.info("Conversation {} is {}, starting a new one", conversationId, existing.get().getStatus().wireName());
            } else if (!existing.get().getKbId().equals(kbId)) {
                log.info("Conversation {} belongs to kb={}, not kb={}; starting a new one",
                        conversationId, existing.get().getKbId(), kbId);
            } else {
                return existing.get();
            }
        }

        String ticket = ticketRegistry.issue(tenantId);
        Conversation created = conversationRepository.save(
                Conversation.open(tenantId, kbId, userId, ticket, clock.instant()));
        log.info("Opened conversation {} (ticket {}) for tenant {}", created.getId(), ticket, tenantId);
        return created;
    }

    /**
     * Append one message. Sequence numbers are 1, 2, 3, ... and timestamps strictly increase
     * within a conversation even when the clock does not.
     */
    @Transactional
    public Message appendMessage(UUID conversationId, MessageSender sender, String content, String agentId) {
        if (content == null || content.isBlank()) {
            throw new InvalidRequestException("Message content must not be empty");
        }
        if (content.length() > Message.MAX_CONTENT_LENGTH) {
            throw new InvalidRequestException("Message content exceeds " + Message.MAX_CONTENT_LENGTH + " characters");
        }
        Conversation conversation = load(conversationId);
        requireOpen(conversation);

        Instant now = clock.instant();
        Instant last = conversation.getLastMessageAt();
        Instant sentAt = last != null && !now.isAfter(last) ? last.plusMillis(1) : now;
        int sequenceNo = conversation.getMessageCount() + 1;

        Message message = messageRepository.save(
                new Message(conversationId, sequenceNo, sender, content, agentId, sentAt));
        conversation.setMessageCount(sequenceNo);
        conversation.setLastMessageAt(sentAt);
        conversationRepository.save(conversation);

        afterCommit(() -> memoryService.append(conversationId, message));
        return message;
    }

    /**
     * Move an ongoing conversation to escalated. Repeated escalation of an already escalated
     * conversation keeps the original reason and only re-arms the contact request if needed.
     */
    @Transactional
    public Conversation escalate(UUID conversationId, EscalationReason reason, String escalatedBy, boolean collectEmail) {
        Conversation conversation = load(conversationId);
        requireOpen(conversation);
        if (conversation.getStatus() == ConversationStatus.ESCALATED) {
            if (collectEmail && !conversation.hasContactEmail()) {
                conversation.setPendingContactRequest(true);
            }
            return conversationRepository.save(conversation);
        }

        Instant now = clock.instant();
        conversation.transitionTo(ConversationStatus.ESCALATED, now);
        conversation.setEscalationReason(reason);
        conversation.setEscalatedAt(now);
        conversation.setEscalatedBy(escalatedBy);
        conversation.setPendingContactRequest(collectEmail && !conversation.hasContactEmail());
        log.info("Conversation {} escalated: reason={}, by={}", conversationId, reason.getCode(), escalatedBy);
        return conversationRepository.save(conversation);
    }

    @Transactional
    public Conversation recordContactEmail(UUID conversationId, String email) {
        Conversation conversation = load(conversationId);
        requireOpen(conversation);
        conversation.setContactEmail(email);
        conversation.setPendingContactRequest(false);
        log.info("Conversation {} contact email recorded", conversationId);
        return conversationRepository.save(conversation);
    }

    @Transactional
    public Conversation markHandoffNotified(UUID conversationId) {
        Conversation conversation = load(conversationId);
        conversation.setHandoffNotifiedAt(clock.instant());
        return conversationRepository.save(conversation);
    }

    /**
     * ongoing to resolved_ai, escalated to resolved_human. Resolving a resolved conversation
     * changes nothing.
     */
    @Transactional
    public Conversation resolve(String tenantId, UUID conversationId, Integer satisfactionScore) {
        if (satisfactionScore != null && (satisfactionScore < 1 || satisfactionScore > 5)) {
            throw new InvalidRequestException("satisfaction_score must be between 1 and 5");
        }
        Conversation conversation = loadForTenant(tenantId, conversationId);
        if (conversation.isTerminal()) {
            log.debug("Conversation {} already {}, resolve is a no-op", conversationId, conversation.getStatus().wireName());
            return conversation;
        }

        ConversationStatus target = conversation.getStatus() == ConversationStatus.ESCALATED
                ? ConversationStatus.RESOLVED_HUMAN
                : ConversationStatus.RESOLVED_AI;
        conversation.transitionTo(target, clock.instant());
        conversation.setPendingContactRequest(false);
        if (satisfactionScore != null) {
            conversation.setSatisfactionScore(satisfactionScore);
        }
        Conversation saved = conversationRepository.save(conversation);
        log.info("Conversation {} resolved as {}", conversationId, target.wireName());
        afterCommit(() -> memoryService.evict(conversationId));
        return saved;
    }

    /**
     * A human agent's reply, only accepted while the conversation is escalated.
     */
    @Transactional
    public Message appendAgentReply(String tenantId, UUID conversationId, String agentId, String content) {
        if (agentId == null || agentId.isBlank()) {
            throw new InvalidRequestException("agent_id is required");
        }
        Conversation conversation = loadForTenant(tenantId, conversationId);
        if (conversation.getStatus() != ConversationStatus.ESCALATED) {
            throw new IllegalConversationStateException("Conversation " + conversationId
                    + " is " + conversation.getStatus().wireName() + "; agent replies need an escalated conversation");
        }
        return appendMessage(conversationId, MessageSender.AGENT, content, agentId);
    }

    @Transactional(readOnly = true)
    public Conversation current(UUID conversationId) {
        return load(conversationId);
    }

    @Transactional(readOnly = true)
    public List<HistoryMessage> history(UUID conversationId, int window) {
        return memoryService.recent(conversationId, window);
    }

    /**
     * Contents of the latest user messages, newest first.
     */
    @Transactional(readOnly = true)
    public List<String> recentUserMessages(UUID conversationId, int window) {
        return messageRepository.findByConversationIdAndSenderOrderBySequenceNoDesc(
                        conversationId, MessageSender.USER, PageRequest.of(0, Math.max(1, window)))
                .stream()
                .map(Message::getContent)
                .toList();
    }

    @Transactional(readOnly = true)
    public ConversationView getConversation(String tenantId, UUID conversationId) {
        Conversation conversation = loadForTenant(tenantId, conversationId);
        return ConversationView.of(conversation, messageRepository.findByConversationIdOrderBySequenceNoAsc(conversationId));
    }

    @Transactional(readOnly = true)
    public List<ConversationView> listConversations(String tenantId, String userId) {
        return conversationRepository.findByTenantIdAndUserIdOrderByStartedAtDesc(tenantId, userId).stream()
                .map(c -> ConversationView.of(c, List.of()))
                .toList();
    }

    private Conversation load(UUID conversationId) {
        return conversationRepository.findById(conversationId)
                .orElseThrow(() -> new ConversationNotFoundException(conversationId));
    }

    private static void requireOpen(Conversation conversation) {
        if (conversation.isTerminal()) {
            throw new IllegalConversationStateException("Conversation " + conversation.getId()
                    + " is " + conversation.getStatus().wireName() + " and accepts no further changes");
        }
    }

    private Conversation loadForTenant(String tenantId, UUID conversationId) {
        return conversationRepository.findByIdAndTenantId(conversationId, tenantId)
                .orElseThrow(() -> new ConversationNotFoundException(conversationId));
    }

    private static void afterCommit(Runnable action) {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    action.run();
                }
            });
        } else {
            action.run();
        }
    }
}
