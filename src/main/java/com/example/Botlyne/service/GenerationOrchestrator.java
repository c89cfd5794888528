package com.example.Botlyne.service;

import com.example.Botlyne.exception.OrchestrationException;
import com.example.Botlyne.exception.PermanentDependencyException;
import com.example.Botlyne.exception.PolicyViolationException;
import com.example.Botlyne.model.AnswerCandidate;
import com.example.Botlyne.model.ContextEntry;
import com.example.Botlyne.model.EvaluationResult;
import com.example.Botlyne.model.FormattedContext;
import com.example.Botlyne.model.GenerationPrompt;
import com.example.Botlyne.model.QueryRoute;
import com.example.Botlyne.model.RetrievedChunk;
import com.example.Botlyne.model.ReviewVerdict;
import com.example.Botlyne.model.RouteDecision;
import com.example.Botlyne.model.SourceReference;
import com.example.Botlyne.model.ToolInvocation;
import com.example.Botlyne.model.TurnEvent;
import com.example.Botlyne.model.TurnListener;
import com.example.Botlyne.model.TurnStage;
import com.example.Botlyne.provider.GenerationProvider;
import com.example.Botlyne.resilience.DependencyGuard;
import com.example.Botlyne.resilience.DependencyGuardRegistry;
import com.example.Botlyne.resilience.DependencyNames;
import com.example.Botlyne.tools.CalculatorToolDefinition;
import com.example.Botlyne.util.ArithmeticEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Drives a turn through routing, drafting, reviewing and finalized.
 * <p>
 * Generated text only reaches the user after the review agent passed or rewrote it. If either
 * generation call is unavailable the degraded reply is returned instead.
 */
@Service
public class GenerationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(GenerationOrchestrator.class);

    private final QueryRouter router;
    private final RetrievalCoordinator retrievalCoordinator;
    private final ContextAssembler contextAssembler;
    private final GenerationProvider primaryProvider;
    private final GenerationProvider reviewProvider;
    private final DependencyGuardRegistry guards;

    public GenerationOrchestrator(QueryRouter router,
                                  RetrievalCoordinator retrievalCoordinator,
                                  ContextAssembler contextAssembler,
                                  @Qualifier("primaryGenerationProvider") GenerationProvider primaryProvider,
                                  @Qualifier("reviewGenerationProvider") GenerationProvider reviewProvider,
                                  DependencyGuardRegistry guards) {
        this.router = router;
        this.retrievalCoordinator = retrievalCoordinator;
        this.contextAssembler = contextAssembler;
        this.primaryProvider = primaryProvider;
        this.reviewProvider = reviewProvider;
        this.guards = guards;
    }

    public TurnOutcome orchestrate(TurnInput input, TurnListener listener) {
        RouteDecision decision = router.route(input.message(), input.contactPending());
        QueryRoute route = decision.route();
        listener.onEvent(new TurnEvent(TurnStage.ROUTING, "Classified the message.", route));
        log.debug("Routed message as {}", route);

        switch (route) {
            case CONTACT_EMAIL:
                return fixed(decision, String.format(ResponseTexts.CONTACT_CONFIRMED, input.ticketNumber()));
            case ESCALATION_REQUEST:
                return fixed(decision, ResponseTexts.HANDOFF_ACK);
            case MATH_QUERY:
                return math(input, decision, listener);
            case KB_QUERY:
                return knowledgeBase(input, decision, listener);
            case CONVERSATIONAL:
            default:
                return draftAndReview(input, decision, List.of(), FormattedContext.EMPTY, List.of(), listener);
        }
    }

    private TurnOutcome math(TurnInput input, RouteDecision decision, TurnListener listener) {
        String expression = decision.payload();
        EvaluationResult result = ArithmeticEvaluator.evaluate(expression);
        ToolInvocation invocation = new ToolInvocation(
                CalculatorToolDefinition.NAME,
                expression,
                result.success() ? result.formatted() : result.error(),
                result.success()
        );
        if (!result.success()) {
            log.debug("Math evaluation failed ({}), drafting conversationally", result.error());
            return draftAndReview(input, decision, List.of(), FormattedContext.EMPTY, List.of(invocation), listener);
        }

        listener.onEvent(new TurnEvent(TurnStage.DRAFTING, "Evaluated the expression.", invocation));
        AnswerCandidate candidate = new AnswerCandidate(
                expression + " = " + result.formatted(), 1.0, null, List.of(invocation), List.of());
        return new TurnOutcome(decision, candidate, List.of(), FormattedContext.EMPTY, List.of(),
                false, false, false);
    }

    private TurnOutcome knowledgeBase(TurnInput input, RouteDecision decision, TurnListener listener) {
        List<RetrievedChunk> chunks = retrievalCoordinator.retrieve(input.message(), input.kbId());
        FormattedContext context = contextAssembler.assemble(chunks);
        listener.onEvent(new TurnEvent(TurnStage.RETRIEVAL, "Searched the knowledge base.",
                context.entries().stream().map(SourceReference::of).toList()));
        return draftAndReview(input, decision, chunks, context, List.of(), listener);
    }

    private TurnOutcome draftAndReview(TurnInput input,
                                       RouteDecision route,
                                       List<RetrievedChunk> retrieved,
                                       FormattedContext context,
                                       List<ToolInvocation> toolResults,
                                       TurnListener listener) {
        DependencyGuard generation = guards.guard(DependencyNames.GENERATION);

        listener.onEvent(new TurnEvent(TurnStage.DRAFTING, "Drafting an answer.", null));
        AnswerCandidate draft;
        try {
            AnswerCandidate raw = generation.call(() ->
                    primaryProvider.generate(GenerationPrompt.draft(input.message(), context, toolResults), input.history()));
            draft = normalizeDraft(raw, context, toolResults);
        } catch (PolicyViolationException e) {
            log.warn("Drafting refused by policy: {}", e.getMessage());
            return rejected(route, retrieved, context, toolResults);
        } catch (OrchestrationException e) {
            log.warn("Drafting unavailable, returning degraded reply: {}", e.getMessage());
            return degraded(route, retrieved, context);
        }

        listener.onEvent(new TurnEvent(TurnStage.REVIEWING, "Reviewing the draft.", null));
        AnswerCandidate review;
        try {
            final AnswerCandidate underReview = draft;
            review = generation.call(() ->
                    reviewProvider.generate(GenerationPrompt.review(input.message(), context, underReview), input.history()));
        } catch (PolicyViolationException e) {
            log.warn("Review refused by policy: {}", e.getMessage());
            return rejected(route, retrieved, context, draft.toolInvocations());
        } catch (OrchestrationException e) {
            log.warn("Review unavailable, returning degraded reply: {}", e.getMessage());
            return degraded(route, retrieved, context);
        }

        ReviewVerdict verdict = review == null || review.verdict() == null ? ReviewVerdict.REJECT : review.verdict();
        AnswerCandidate finalAnswer;
        switch (verdict) {
            case PASS:
                finalAnswer = draft.withVerdict(ReviewVerdict.PASS);
                break;
            case REWRITE:
                finalAnswer = draft.withText(review.text())
                        .withConfidence(Math.min(draft.confidence(), review.confidence()))
                        .withVerdict(ReviewVerdict.REWRITE);
                break;
            case REJECT:
            default:
                log.warn("Review rejected the draft for route {}", route.route());
                return rejected(route, retrieved, context, draft.toolInvocations());
        }

        return new TurnOutcome(route, finalAnswer, retrieved, context, cited(finalAnswer, context),
                false, false, true);
    }

    /**
     * Keeps only citations that point into the assembled context and records tool results
     * the provider did not echo back.
     */
    private static AnswerCandidate normalizeDraft(AnswerCandidate raw, FormattedContext context, List<ToolInvocation> toolResults) {
        if (raw == null) {
            throw new PermanentDependencyException("Drafting returned no answer");
        }
        List<String> cited = raw.citedChunkIds().stream()
                .filter(context::containsChunk)
                .distinct()
                .toList();
        if (cited.size() < raw.citedChunkIds().size()) {
            log.debug("Dropped {} citation(s) outside the assembled context", raw.citedChunkIds().size() - cited.size());
        }
        Set<ToolInvocation> tools = new LinkedHashSet<>(toolResults);
        tools.addAll(raw.toolInvocations());
        return raw.withVerdict(null)
                .withCitedChunkIds(cited)
                .withToolInvocations(new ArrayList<>(tools));
    }

    private static List<ContextEntry> cited(AnswerCandidate answer, FormattedContext context) {
        if (answer.citedChunkIds().isEmpty()) {
            return List.of();
        }
        return context.entries().stream()
                .filter(e -> answer.citedChunkIds().contains(e.chunk().chunkId()))
                .toList();
    }

    private static TurnOutcome fixed(RouteDecision route, String text) {
        return new TurnOutcome(route, AnswerCandidate.fixed(text, 1.0), List.of(), FormattedContext.EMPTY, List.of(),
                false, false, false);
    }

    private static TurnOutcome degraded(RouteDecision route, List<RetrievedChunk> retrieved, FormattedContext context) {
        return new TurnOutcome(route, AnswerCandidate.fixed(ResponseTexts.DEGRADED_SERVICE, 0.0), retrieved, context, List.of(),
                true, false, false);
    }

    private static TurnOutcome rejected(RouteDecision route,
                                        List<RetrievedChunk> retrieved,
                                        FormattedContext context,
                                        List<ToolInvocation> tools) {
        AnswerCandidate refusal = new AnswerCandidate(ResponseTexts.SAFE_REFUSAL, 0.0, ReviewVerdict.REJECT, tools, List.of());
        return new TurnOutcome(route, refusal, retrieved, context, List.of(), false, true, true);
    }
}
