package com.example.Botlyne.provider;

import com.example.Botlyne.model.AnswerCandidate;
import com.example.Botlyne.model.GenerationPrompt;
import com.example.Botlyne.model.HistoryMessage;

import java.util.List;

/**
 * A language model agent. The same capability backs both the drafting and the review agent;
 * a review call sets {@link GenerationPrompt#draft()} and is expected to return a verdict.
 */
public interface GenerationProvider {

    AnswerCandidate generate(GenerationPrompt prompt, List<HistoryMessage> history);
}
