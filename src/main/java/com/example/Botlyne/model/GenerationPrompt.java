package com.example.Botlyne.model;

import com.example.Botlyne.tools.ToolProfile;

import java.util.List;

/**
 * Everything a generation call needs besides history.
 *
 * @param context   empty for conversational turns
 * @param draft     the answer under review, null for drafting calls
 * @param toolResults tool invocations already performed for this turn
 */
public record GenerationPrompt(
        String question,
        FormattedContext context,
        AnswerCandidate draft,
        ToolProfile toolProfile,
        List<ToolInvocation> toolResults
) {

    public GenerationPrompt {
        context = context == null ? FormattedContext.EMPTY : context;
        toolProfile = toolProfile == null ? ToolProfile.NONE : toolProfile;
        toolResults = toolResults == null ? List.of() : List.copyOf(toolResults);
    }

    public static GenerationPrompt draft(String question, FormattedContext context, List<ToolInvocation> toolResults) {
        return new GenerationPrompt(question, context, null, ToolProfile.ASSISTANT, toolResults);
    }

    public static GenerationPrompt review(String question, FormattedContext context, AnswerCandidate draft) {
        return new GenerationPrompt(question, context, draft, ToolProfile.NONE, List.of());
    }
}
