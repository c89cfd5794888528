package com.example.Botlyne.service;

import com.example.Botlyne.config.BotlyneProperties;
import com.example.Botlyne.exception.AccessDeniedException;
import com.example.Botlyne.exception.IllegalConversationStateException;
import com.example.Botlyne.exception.InvalidRequestException;
import com.example.Botlyne.model.Conversation;
import com.example.Botlyne.model.ConversationStatus;
import com.example.Botlyne.model.EscalationDecision;
import com.example.Botlyne.model.EscalationReason;
import com.example.Botlyne.model.HistoryMessage;
import com.example.Botlyne.model.Message;
import com.example.Botlyne.model.MessageSender;
import com.example.Botlyne.model.QueryRoute;
import com.example.Botlyne.model.QueryTurnRequest;
import com.example.Botlyne.model.QueryTurnResponse;
import com.example.Botlyne.model.SourceReference;
import com.example.Botlyne.model.TurnEvent;
import com.example.Botlyne.model.TurnListener;
import com.example.Botlyne.model.TurnStage;
import com.example.Botlyne.repository.KnowledgeBaseRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.UUID;

/**
 * Entry point for a user turn:
 * - checks the tenant owns the knowledge base
 * - serializes turns per conversation
 * - loads or opens the conversation and records the user message
 * - orchestrates the answer and applies escalation policy
 * - records the reply and returns a well-formed response
 */
@Service
@RequiredArgsConstructor
public class QueryTurnService {

    private static final Logger log = LoggerFactory.getLogger(QueryTurnService.class);

    static final String ESCALATED_BY_USER = "user";
    static final String ESCALATED_BY_SYSTEM = "system";

    private final ConversationLockManager lockManager;
    private final ConversationStateManager stateManager;
    private final GenerationOrchestrator orchestrator;
    private final EscalationEvaluator escalationEvaluator;
    private final EscalationNotifier escalationNotifier;
    private final TurnLogService turnLogService;
    private final KnowledgeBaseRepository knowledgeBaseRepository;
    private final BotlyneProperties properties;

    public QueryTurnResponse handle(String tenantId, QueryTurnRequest request) {
        return handle(tenantId, request, TurnListener.NONE);
    }

    public QueryTurnResponse handle(String tenantId, QueryTurnRequest request, TurnListener listener) {
        validate(tenantId, request);
        authorize(tenantId, request.kbId());
        return execute(tenantId, request, listener);
    }

    /**
     * Streamed variant. Stage events are emitted as they happen and the last event carries the
     * response. Cancelling the subscription drops events; the turn itself still completes.
     */
    public Flux<TurnEvent> streamTurn(String tenantId, QueryTurnRequest request) {
        validate(tenantId, request);
        authorize(tenantId, request.kbId());
        return Flux.<TurnEvent>create(sink -> {
                    try {
                        execute(tenantId, request, sink::next);
                        sink.complete();
                    } catch (RuntimeException e) {
                        log.error("Streamed turn failed for conversation {}", request.conversationId(), e);
                        sink.error(e);
                    }
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    private QueryTurnResponse execute(String tenantId, QueryTurnRequest request, TurnListener listener) {
        long started = System.nanoTime();
        return lockManager.withLock(request.conversationId(), () -> runTurn(tenantId, request, listener, started));
    }

    private QueryTurnResponse runTurn(String tenantId, QueryTurnRequest request, TurnListener listener, long started) {
        Conversation conversation = stateManager.openTurn(tenantId, request.kbId(), request.userId(), request.conversationId());
        UUID conversationId = conversation.getId();

        List<HistoryMessage> history = stateManager.history(conversationId, properties.getGeneration().getHistoryWindow());
        stateManager.appendMessage(conversationId, MessageSender.USER, request.message(), null);

        TurnOutcome outcome = orchestrator.orchestrate(new TurnInput(
                request.message(),
                conversation.getKbId(),
                conversation.getTicketNumber(),
                conversation.isPendingContactRequest(),
                history
        ), listener);

        // The conversation may have been resolved while generation ran; then answer without recording.
        String reply = outcome.candidate().text();
        EscalationDecision decision = EscalationDecision.noEscalation();
        boolean recorded = false;
        if (stateManager.current(conversationId).isTerminal()) {
            log.warn("Conversation {} was closed while its turn ran; reply not recorded", conversationId);
        } else {
            try {
                if (outcome.route() == QueryRoute.CONTACT_EMAIL) {
                    conversation = stateManager.recordContactEmail(conversationId, outcome.routing().payload());
                    conversation = notifyIfDue(conversation, conversation.getEscalationReason());
                }

                List<String> recentUserMessages = stateManager.recentUserMessages(
                        conversationId, properties.getEscalation().getRepeatWindow());
                decision = escalationEvaluator.evaluate(outcome, recentUserMessages, conversation.hasContactEmail());

                if (decision.triggered()) {
                    String escalatedBy = decision.reason() == EscalationReason.EXPLICIT_REQUEST ? ESCALATED_BY_USER : ESCALATED_BY_SYSTEM;
                    conversation = stateManager.escalate(conversationId, decision.reason(), escalatedBy, decision.collectEmail());
                    if (conversation.isPendingContactRequest()) {
                        reply = reply + "\n\n" + ResponseTexts.CONTACT_PROMPT;
                    } else {
                        conversation = notifyIfDue(conversation, decision.reason());
                    }
                }
                stateManager.appendMessage(conversationId, MessageSender.AI, fit(reply), null);
                recorded = true;
            } catch (IllegalConversationStateException e) {
                log.warn("Conversation {} was closed while its turn ran; reply not recorded: {}", conversationId, e.getMessage());
            }
        }

        double confidence = escalationEvaluator.confidence(outcome);
        boolean handoff = recorded && (decision.triggered() || conversation.getStatus() == ConversationStatus.ESCALATED);
        long elapsedMs = (System.nanoTime() - started) / 1_000_000L;
        List<SourceReference> sources = outcome.sources().stream().map(SourceReference::of).toList();

        QueryTurnResponse response = new QueryTurnResponse(
                conversationId,
                conversation.getTicketNumber(),
                fit(reply),
                sources,
                confidence,
                handoff,
                Math.round(elapsedMs / 10.0) / 100.0
        );

        turnLogService.recordTurn(conversationId, outcome.route(), request.message(), response.aiResponse(),
                confidence, handoff, decision.reason(), elapsedMs, sources);
        log.info("Turn completed: conversation={}, route={}, confidence={}, handoff={}, reason={}, {}ms",
                conversationId, outcome.route(), confidence, handoff,
                decision.reason() == null ? "-" : decision.reason().getCode(), elapsedMs);

        listener.onEvent(new TurnEvent(TurnStage.FINAL, "Finalized answer.", response));
        return response;
    }

    /**
     * Sends the handoff notification once per conversation, and only after contact details
     * (when they were asked for) are in.
     */
    private Conversation notifyIfDue(Conversation conversation, EscalationReason reason) {
        if (conversation.getStatus() != ConversationStatus.ESCALATED
                || conversation.isPendingContactRequest()
                || conversation.getHandoffNotifiedAt() != null) {
            return conversation;
        }
        Conversation marked = stateManager.markHandoffNotified(conversation.getId());
        escalationNotifier.dispatch(marked, reason);
        return marked;
    }

    private static String fit(String reply) {
        if (reply.length() <= Message.MAX_CONTENT_LENGTH) {
            return reply;
        }
        return reply.substring(0, Message.MAX_CONTENT_LENGTH);
    }

    private void authorize(String tenantId, String kbId) {
        if (!knowledgeBaseRepository.existsByIdAndTenantId(kbId, tenantId)) {
            throw new AccessDeniedException("Knowledge base " + kbId + " does not belong to tenant " + tenantId);
        }
    }

    private static void validate(String tenantId, QueryTurnRequest request) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new InvalidRequestException("X-Tenant-Id header is required");
        }
        if (request == null) {
            throw new InvalidRequestException("Request body is required");
        }
        if (request.kbId() == null || request.kbId().isBlank()) {
            throw new InvalidRequestException("kb_id is required");
        }
        if (request.userId() == null || request.userId().isBlank()) {
            throw new InvalidRequestException("user_id is required");
        }
        if (request.message() == null || request.message().isBlank()) {
            throw new InvalidRequestException("message is required");
        }
        if (request.message().length() > Message.MAX_CONTENT_LENGTH) {
            throw new InvalidRequestException("message exceeds " + Message.MAX_CONTENT_LENGTH + " characters");
        }
    }
}
