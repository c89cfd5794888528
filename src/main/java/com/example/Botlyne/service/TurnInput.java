package com.example.Botlyne.service;

import com.example.Botlyne.model.HistoryMessage;

import java.util.List;

/**
 * What the orchestrator needs to know about a turn.
 *
 * @param history recent messages before this one, oldest first
 */
public record TurnInput(
        String message,
        String kbId,
        String ticketNumber,
        boolean contactPending,
        List<HistoryMessage> history
) {

    public TurnInput {
        history = history == null ? List.of() : List.copyOf(history);
    }
}
