package com.example.Botlyne.model;

import java.util.List;
import java.util.UUID;

/**
 * @param responseTime wall-clock seconds for the turn, two decimals
 */
public record QueryTurnResponse(
        UUID conversationId,
        String ticketNumber,
        String aiResponse,
        List<SourceReference> sources,
        double confidence,
        boolean handoffTriggered,
        double responseTime
) {
}
