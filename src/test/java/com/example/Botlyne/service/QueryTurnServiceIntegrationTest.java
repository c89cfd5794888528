package com.example.Botlyne.service;

import com.example.Botlyne.exception.AccessDeniedException;
import com.example.Botlyne.exception.InvalidRequestException;
import com.example.Botlyne.exception.TransientDependencyException;
import com.example.Botlyne.model.AnswerCandidate;
import com.example.Botlyne.model.ChunkSource;
import com.example.Botlyne.model.ConversationStatus;
import com.example.Botlyne.model.ConversationView;
import com.example.Botlyne.model.EscalationReason;
import com.example.Botlyne.model.KnowledgeBase;
import com.example.Botlyne.model.MessageSender;
import com.example.Botlyne.model.MessageView;
import com.example.Botlyne.model.QueryTurnRequest;
import com.example.Botlyne.model.QueryTurnResponse;
import com.example.Botlyne.model.RetrievedChunk;
import com.example.Botlyne.model.ReviewVerdict;
import com.example.Botlyne.model.SourceReference;
import com.example.Botlyne.model.TurnEvent;
import com.example.Botlyne.model.TurnStage;
import com.example.Botlyne.provider.EmbeddingProvider;
import com.example.Botlyne.provider.GenerationProvider;
import com.example.Botlyne.provider.NotificationService;
import com.example.Botlyne.provider.VectorStore;
import com.example.Botlyne.repository.KnowledgeBaseRepository;
import com.example.Botlyne.repository.TurnLogRepository;
import com.example.Botlyne.resilience.BreakerState;
import com.example.Botlyne.resilience.DependencyGuardRegistry;
import com.example.Botlyne.resilience.DependencyHealth;
import com.example.Botlyne.resilience.DependencyNames;
import com.example.Botlyne.resilience.DependencySnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@SpringBootTest
@ActiveProfiles("test")
class QueryTurnServiceIntegrationTest {

    private static final String TENANT = "acme";
    private static final String KB = "kb-support";
    private static final float[] VECTOR = {0.3f, 0.1f, 0.7f};

    @Autowired
    private QueryTurnService turnService;

    @Autowired
    private ConversationStateManager stateManager;

    @Autowired
    private ConversationService conversationService;

    @Autowired
    private DependencyGuardRegistry guards;

    @Autowired
    private KnowledgeBaseRepository knowledgeBaseRepository;

    @Autowired
    private TurnLogRepository turnLogRepository;

    @MockitoBean
    private ChatClient chatClient;

    @MockitoBean
    private EmbeddingProvider embeddingProvider;

    @MockitoBean
    private VectorStore vectorStore;

    @MockitoBean(name = "primaryGenerationProvider")
    private GenerationProvider primary;

    @MockitoBean(name = "reviewGenerationProvider")
    private GenerationProvider reviewer;

    @MockitoBean
    private ConversationMemoryService memoryService;

    @MockitoBean
    private NotificationService notificationService;

    @BeforeEach
    void setUp() {
        knowledgeBaseRepository.save(new KnowledgeBase(KB, TENANT, "Support"));
        knowledgeBaseRepository.save(new KnowledgeBase("kb-globex", "globex", "Globex help"));
        when(embeddingProvider.embed(any())).thenReturn(VECTOR);
        when(vectorStore.search(any(), eq(KB), anyInt())).thenReturn(List.of());
    }

    private static QueryTurnRequest ask(String message) {
        return new QueryTurnRequest(null, KB, "user-42", message);
    }

    private static QueryTurnRequest ask(QueryTurnResponse previous, String message) {
        return new QueryTurnRequest(previous.conversationId(), KB, "user-42", message);
    }

    private static RetrievedChunk chunk(String id, double similarity, long seq) {
        return new RetrievedChunk(id, KB, "Support content " + id + ".", similarity,
                new ChunkSource("Help center " + id, id + ".md", null, null), seq);
    }

    private void drafterAnswers(String text, double confidence, List<String> citations) {
        when(primary.generate(any(), anyList()))
                .thenReturn(new AnswerCandidate(text, confidence, null, List.of(), citations));
    }

    /**
     * The drafter signals {@code drafting} and then blocks until {@code release} opens.
     */
    private void drafterBlocks(CountDownLatch drafting, CountDownLatch release, String text, double confidence) {
        when(primary.generate(any(), anyList())).thenAnswer(invocation -> {
            drafting.countDown();
            release.await(5, TimeUnit.SECONDS);
            return new AnswerCandidate(text, confidence, null, List.of(), List.of());
        });
    }

    private void reviewerPasses() {
        when(reviewer.generate(any(), anyList()))
                .thenReturn(new AnswerCandidate("", 1.0, ReviewVerdict.PASS, List.of(), List.of()));
    }

    @Test
    void questionWithoutKnowledgeIsAnsweredConversationally() {
        drafterAnswers("We're open 9am to 5pm, Monday to Friday.", 0.8, List.of());
        reviewerPasses();

        QueryTurnResponse response = turnService.handle(TENANT, ask("What are your hours?"));

        assertThat(response.aiResponse()).isEqualTo("We're open 9am to 5pm, Monday to Friday.");
        assertThat(response.confidence()).isEqualTo(0.8);
        assertThat(response.sources()).isEmpty();
        assertThat(response.handoffTriggered()).isFalse();
        assertThat(response.ticketNumber()).hasSize(8);
        assertThat(response.responseTime()).isGreaterThanOrEqualTo(0.0);

        ConversationView view = stateManager.getConversation(TENANT, response.conversationId());
        assertThat(view.status()).isEqualTo(ConversationStatus.ONGOING);
        assertThat(view.messages()).extracting(MessageView::sender)
                .containsExactly(MessageSender.USER, MessageSender.AI);
        assertThat(turnLogRepository.findByConversationIdOrderByCreatedAtAsc(response.conversationId())).hasSize(1);
    }

    @Test
    void groundedAnswerCitesItsSourcesWithTheirSimilarity() {
        when(vectorStore.search(any(), eq(KB), anyInt()))
                .thenReturn(List.of(chunk("c3", 0.4, 3), chunk("c1", 0.9, 1), chunk("c2", 0.85, 2)));
        drafterAnswers("Refunds are processed within 5 days.", 0.85, List.of("c1", "c2", "c3"));
        reviewerPasses();

        QueryTurnResponse response = turnService.handle(TENANT, ask("How long do refunds take?"));

        assertThat(response.sources()).extracting(SourceReference::title)
                .containsExactly("Help center c1", "Help center c2", "Help center c3");
        assertThat(response.sources()).extracting(SourceReference::similarity)
                .containsExactly(0.9, 0.85, 0.4);
        assertThat(response.confidence()).isGreaterThanOrEqualTo(0.5);
        assertThat(response.handoffTriggered()).isFalse();
    }

    @Test
    void thirdRepeatOfAQuestionEscalatesOnTheSameTicket() {
        when(vectorStore.search(any(), eq(KB), anyInt())).thenReturn(List.of(chunk("c1", 0.9, 1)));
        drafterAnswers("You can reset it from the login page.", 0.9, List.of("c1"));
        reviewerPasses();

        QueryTurnResponse first = turnService.handle(TENANT, ask("How do I reset my password?"));
        QueryTurnResponse second = turnService.handle(TENANT, ask(first, "how do I reset my password"));
        QueryTurnResponse third = turnService.handle(TENANT, ask(second, "How do I reset my password??"));

        assertThat(first.handoffTriggered()).isFalse();
        assertThat(second.handoffTriggered()).isFalse();
        assertThat(third.handoffTriggered()).isTrue();
        assertThat(third.ticketNumber()).isEqualTo(first.ticketNumber());
        assertThat(third.conversationId()).isEqualTo(first.conversationId());

        ConversationView view = stateManager.getConversation(TENANT, first.conversationId());
        assertThat(view.status()).isEqualTo(ConversationStatus.ESCALATED);
        assertThat(view.escalationReason()).isEqualTo(EscalationReason.REPEATED_QUESTION);
        assertThat(view.escalationReason().getDescription()).isEqualTo("repeated unresolved question");
        assertThat(view.escalatedBy()).isEqualTo("system");
    }

    @Test
    @DirtiesContext
    void openGenerationCircuitGivesTheDegradedAnswerAndEscalates() {
        when(primary.generate(any(), anyList())).thenThrow(new TransientDependencyException("503 from provider"));

        for (int i = 0; i < 3; i++) {
            QueryTurnResponse failed = turnService.handle(TENANT, ask("Where is my order?"));
            assertThat(failed.aiResponse()).startsWith(ResponseTexts.DEGRADED_SERVICE);
        }
        assertThat(guards.guard(DependencyNames.GENERATION).snapshot().state()).isEqualTo(BreakerState.OPEN);
        verify(primary, times(9)).generate(any(), anyList());

        QueryTurnResponse response = turnService.handle(TENANT, ask("Where is my order?"));

        verify(primary, times(9)).generate(any(), anyList());
        verify(reviewer, never()).generate(any(), anyList());
        assertThat(response.confidence()).isZero();
        assertThat(response.aiResponse()).startsWith(ResponseTexts.DEGRADED_SERVICE);
        assertThat(response.aiResponse()).endsWith(ResponseTexts.CONTACT_PROMPT);
        assertThat(response.handoffTriggered()).isTrue();
        assertThat(stateManager.getConversation(TENANT, response.conversationId()).status())
                .isEqualTo(ConversationStatus.ESCALATED);

        DependencyHealth health = guards.health();
        assertThat(health.status()).isEqualTo(DependencyHealth.DEGRADED);
        assertThat(health.dependencies()).extracting(DependencySnapshot::dependency)
                .contains(DependencyNames.GENERATION);
    }

    @Test
    void lowConfidenceAsksForEmailThenNotifiesOnce() {
        drafterAnswers("I'm not sure, maybe check your settings.", 0.2, List.of());
        reviewerPasses();

        QueryTurnResponse escalated = turnService.handle(TENANT, ask("Why was my card declined twice?"));

        assertThat(escalated.handoffTriggered()).isTrue();
        assertThat(escalated.aiResponse()).endsWith(ResponseTexts.CONTACT_PROMPT);
        verify(notificationService, never()).notifyEscalation(any(), any());

        QueryTurnResponse confirmed = turnService.handle(TENANT, ask(escalated, "Sure, it's pat@example.com"));

        assertThat(confirmed.aiResponse()).contains(escalated.ticketNumber());
        assertThat(confirmed.handoffTriggered()).isTrue();
        ConversationView view = stateManager.getConversation(TENANT, escalated.conversationId());
        assertThat(view.contactEmail()).isEqualTo("pat@example.com");
        assertThat(view.escalationReason()).isEqualTo(EscalationReason.NO_KNOWLEDGE);
        verify(notificationService, timeout(Duration.ofSeconds(5).toMillis()))
                .notifyEscalation(any(), eq(EscalationReason.NO_KNOWLEDGE));
    }

    @Test
    void explicitHumanRequestIsRecordedAsUserEscalation() {
        QueryTurnResponse response = turnService.handle(TENANT, ask("Can I talk to a human please?"));

        assertThat(response.handoffTriggered()).isTrue();
        assertThat(response.confidence()).isEqualTo(1.0);
        assertThat(response.aiResponse()).startsWith(ResponseTexts.HANDOFF_ACK);
        ConversationView view = stateManager.getConversation(TENANT, response.conversationId());
        assertThat(view.escalatedBy()).isEqualTo("user");
        assertThat(view.escalationReason()).isEqualTo(EscalationReason.EXPLICIT_REQUEST);
        verify(primary, never()).generate(any(), anyList());
    }

    @Test
    void agentCanReplyAndResolveAfterHandoff() {
        QueryTurnResponse response = turnService.handle(TENANT, ask("I need to speak to a real person"));

        stateManager.appendAgentReply(TENANT, response.conversationId(), "agent-7", "Hi, this is Sam from support.");
        stateManager.resolve(TENANT, response.conversationId(), 5);

        ConversationView view = stateManager.getConversation(TENANT, response.conversationId());
        assertThat(view.status()).isEqualTo(ConversationStatus.RESOLVED_HUMAN);
        assertThat(view.satisfactionScore()).isEqualTo(5);
        assertThat(view.messages()).extracting(MessageView::sender)
                .containsExactly(MessageSender.USER, MessageSender.AI, MessageSender.AGENT);

        drafterAnswers("Sure, what else can I help with?", 0.9, List.of());
        reviewerPasses();
        QueryTurnResponse next = turnService.handle(TENANT, ask(response, "One more thing"));
        assertThat(next.conversationId()).isNotEqualTo(response.conversationId());
    }

    @Test
    void arithmeticIsAnsweredDirectly() {
        QueryTurnResponse response = turnService.handle(TENANT, ask("what is (12 + 8) * 3"));

        assertThat(response.aiResponse()).isEqualTo("(12 + 8) * 3 = 60");
        assertThat(response.confidence()).isEqualTo(1.0);
        assertThat(response.handoffTriggered()).isFalse();
        verify(primary, never()).generate(any(), anyList());
    }

    @Test
    void streamedTurnEndsWithTheResponse() {
        drafterAnswers("Hello! How can I help you today?", 0.95, List.of());
        reviewerPasses();

        List<TurnEvent> events = turnService.streamTurn(TENANT, ask("hello"))
                .collectList()
                .block(Duration.ofSeconds(10));

        assertThat(events).extracting(TurnEvent::stage)
                .containsExactly(TurnStage.ROUTING, TurnStage.DRAFTING, TurnStage.REVIEWING, TurnStage.FINAL);
        assertThat(events.get(events.size() - 1).payload()).isInstanceOf(QueryTurnResponse.class);
    }

    @Test
    void resolveWaitsForTheTurnInFlight() throws Exception {
        drafterAnswers("Yes, we ship to most countries.", 0.9, List.of());
        reviewerPasses();
        QueryTurnResponse first = turnService.handle(TENANT, ask("Do you ship abroad?"));

        CountDownLatch drafting = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        drafterBlocks(drafting, release, "I'm not sure about Canada.", 0.2);

        ExecutorService callers = Executors.newFixedThreadPool(2);
        try {
            Future<QueryTurnResponse> turn = callers.submit(() -> turnService.handle(TENANT, ask(first, "Do you ship to Canada?")));
            assertThat(drafting.await(5, TimeUnit.SECONDS)).isTrue();

            Future<ConversationView> resolve = callers.submit(() -> conversationService.resolve(TENANT, first.conversationId(), null));
            Thread.sleep(200);
            assertThat(resolve.isDone()).isFalse();
            release.countDown();

            QueryTurnResponse response = turn.get(5, TimeUnit.SECONDS);
            ConversationView resolved = resolve.get(5, TimeUnit.SECONDS);

            assertThat(response.handoffTriggered()).isTrue();
            assertThat(resolved.status()).isEqualTo(ConversationStatus.RESOLVED_HUMAN);
            assertThat(resolved.messages()).extracting(MessageView::sender)
                    .containsExactly(MessageSender.USER, MessageSender.AI, MessageSender.USER, MessageSender.AI);
        } finally {
            release.countDown();
            callers.shutdownNow();
        }
    }

    @Test
    void turnOnAConversationResolvedMidwayStillAnswersWithoutRecording() throws Exception {
        drafterAnswers("Yes, we ship to most countries.", 0.9, List.of());
        reviewerPasses();
        QueryTurnResponse first = turnService.handle(TENANT, ask("Do you ship abroad?"));

        CountDownLatch drafting = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        drafterBlocks(drafting, release, "I'm not sure about Canada.", 0.2);

        ExecutorService caller = Executors.newSingleThreadExecutor();
        try {
            Future<QueryTurnResponse> turn = caller.submit(() -> turnService.handle(TENANT, ask(first, "Do you ship to Canada?")));
            assertThat(drafting.await(5, TimeUnit.SECONDS)).isTrue();
            stateManager.resolve(TENANT, first.conversationId(), null);
            release.countDown();

            QueryTurnResponse response = turn.get(5, TimeUnit.SECONDS);

            assertThat(response.conversationId()).isEqualTo(first.conversationId());
            assertThat(response.aiResponse()).isEqualTo("I'm not sure about Canada.");
            assertThat(response.handoffTriggered()).isFalse();
            ConversationView view = stateManager.getConversation(TENANT, first.conversationId());
            assertThat(view.status()).isEqualTo(ConversationStatus.RESOLVED_AI);
            assertThat(view.messages()).extracting(MessageView::sender)
                    .containsExactly(MessageSender.USER, MessageSender.AI, MessageSender.USER);
        } finally {
            release.countDown();
            caller.shutdownNow();
        }
    }

    @Test
    void knowledgeBaseOfAnotherTenantIsRefused() {
        assertThatThrownBy(() -> turnService.handle(TENANT, new QueryTurnRequest(null, "kb-globex", "user-42", "Refund policy?")))
                .isInstanceOf(AccessDeniedException.class);
        assertThatThrownBy(() -> turnService.streamTurn("globex", ask("Refund policy?")))
                .isInstanceOf(AccessDeniedException.class);

        verify(embeddingProvider, never()).embed(any());
        verify(vectorStore, never()).search(any(), any(), anyInt());
    }

    @Test
    void conversationOfAnotherUserIsRefused() {
        drafterAnswers("Hello! How can I help?", 0.9, List.of());
        reviewerPasses();
        QueryTurnResponse first = turnService.handle(TENANT, ask("hello"));

        assertThatThrownBy(() -> turnService.handle(TENANT,
                new QueryTurnRequest(first.conversationId(), KB, "user-99", "What did they ask?")))
                .isInstanceOf(AccessDeniedException.class);
        assertThat(stateManager.getConversation(TENANT, first.conversationId()).messages()).hasSize(2);
    }

    @Test
    void rejectsTurnsWithoutTenantOrMessage() {
        assertThatThrownBy(() -> turnService.handle(" ", ask("hi")))
                .isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> turnService.handle(TENANT, ask("   ")))
                .isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> turnService.handle(TENANT, new QueryTurnRequest(null, null, "u", "hi")))
                .isInstanceOf(InvalidRequestException.class);
    }
}
