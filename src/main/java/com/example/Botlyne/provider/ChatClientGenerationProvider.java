package com.example.Botlyne.provider;

import com.example.Botlyne.exception.PermanentDependencyException;
import com.example.Botlyne.model.AnswerCandidate;
import com.example.Botlyne.model.GenerationPrompt;
import com.example.Botlyne.model.HistoryMessage;
import com.example.Botlyne.model.ReviewVerdict;
import com.example.Botlyne.model.ToolInvocation;
import com.example.Botlyne.tools.ToolRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link GenerationProvider} over a Spring AI {@link ChatClient}. One class, two roles: the
 * drafting agent (tools enabled) and the review agent (returns a verdict).
 */
public class ChatClientGenerationProvider implements GenerationProvider {

    private static final Logger log = LoggerFactory.getLogger(ChatClientGenerationProvider.class);

    public enum Role {
        PRIMARY,
        REVIEWER
    }

    /**
     * Structured output requested from the model.
     */
    public record GenerationOutput(
            String answer,
            Double confidence,
            String verdict,
            List<String> citedChunkIds,
            List<String> toolsUsed
    ) {
    }

    private final ChatClient chatClient;
    private final ToolRegistry toolRegistry;
    private final Role role;

    public ChatClientGenerationProvider(ChatClient chatClient, ToolRegistry toolRegistry, Role role) {
        this.chatClient = chatClient;
        this.toolRegistry = toolRegistry;
        this.role = role;
    }

    public Role role() {
        return role;
    }

    @Override
    public AnswerCandidate generate(GenerationPrompt prompt, List<HistoryMessage> history) {
        boolean review = role == Role.REVIEWER;
        if (review && prompt.draft() == null) {
            throw new PermanentDependencyException("Review call without a draft");
        }

        ChatClient.ChatClientRequestSpec spec = chatClient.prompt()
                .system(review ? GenerationPrompts.REVIEWER_SYSTEM : GenerationPrompts.DRAFTER_SYSTEM)
                .user(review
                        ? GenerationPrompts.reviewUserPrompt(prompt, history)
                        : GenerationPrompts.draftUserPrompt(prompt, history));

        List<String> toolNames = review ? List.of() : toolRegistry.getFunctionBeanNamesForProfile(prompt.toolProfile());
        if (!toolNames.isEmpty()) {
            spec = spec.toolNames(toolNames.toArray(String[]::new));
        }

        GenerationOutput output = spec.call().entity(GenerationOutput.class);
        if (output == null) {
            throw new PermanentDependencyException("Model returned no structured output");
        }
        log.debug("{} generation: confidence={}, verdict={}, cited={}",
                role, output.confidence(), output.verdict(), output.citedChunkIds());

        return review ? toReview(prompt.draft(), output) : toDraft(prompt, output);
    }

    private AnswerCandidate toDraft(GenerationPrompt prompt, GenerationOutput output) {
        if (output.answer() == null || output.answer().isBlank()) {
            throw new PermanentDependencyException("Model returned an empty answer");
        }
        List<ToolInvocation> tools = new ArrayList<>(prompt.toolResults());
        if (output.toolsUsed() != null) {
            for (String tool : output.toolsUsed()) {
                tools.add(new ToolInvocation(tool, null, null, true));
            }
        }
        return new AnswerCandidate(
                output.answer(),
                output.confidence() == null ? 0.0 : output.confidence(),
                null,
                tools,
                output.citedChunkIds()
        );
    }

    private AnswerCandidate toReview(AnswerCandidate draft, GenerationOutput output) {
        ReviewVerdict verdict = ReviewVerdict.parse(output.verdict());
        String text = verdict == ReviewVerdict.REWRITE ? output.answer() : draft.text();
        if (verdict == ReviewVerdict.REWRITE && (text == null || text.isBlank())) {
            throw new PermanentDependencyException("Reviewer asked for a rewrite without supplying one");
        }
        double confidence = output.confidence() == null ? draft.confidence() : output.confidence();
        return new AnswerCandidate(text, confidence, verdict, draft.toolInvocations(), draft.citedChunkIds());
    }
}
