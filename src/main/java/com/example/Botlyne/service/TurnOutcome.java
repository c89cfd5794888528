package com.example.Botlyne.service;

import com.example.Botlyne.model.AnswerCandidate;
import com.example.Botlyne.model.ContextEntry;
import com.example.Botlyne.model.FormattedContext;
import com.example.Botlyne.model.QueryRoute;
import com.example.Botlyne.model.RetrievedChunk;
import com.example.Botlyne.model.RouteDecision;

import java.util.List;

/**
 * Result of orchestrating one turn.
 *
 * @param routing   router output; the payload carries the captured email on contact turns
 * @param retrieved every chunk retrieval returned, in rank order
 * @param sources   context entries that the final answer cites
 * @param degraded  a generation dependency was unavailable; the candidate is the degraded reply
 * @param rejected  the review agent rejected the draft; the candidate is the safe refusal
 * @param reviewed  the final candidate went through the review agent
 */
public record TurnOutcome(
        RouteDecision routing,
        AnswerCandidate candidate,
        List<RetrievedChunk> retrieved,
        FormattedContext context,
        List<ContextEntry> sources,
        boolean degraded,
        boolean rejected,
        boolean reviewed
) {

    public TurnOutcome {
        retrieved = retrieved == null ? List.of() : List.copyOf(retrieved);
        context = context == null ? FormattedContext.EMPTY : context;
        sources = sources == null ? List.of() : List.copyOf(sources);
    }

    public QueryRoute route() {
        return routing.route();
    }
}
