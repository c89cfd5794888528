package com.example.Botlyne.service;

import com.example.Botlyne.model.EscalationReason;
import com.example.Botlyne.model.QueryRoute;
import com.example.Botlyne.model.SourceReference;
import com.example.Botlyne.model.TurnLog;
import com.example.Botlyne.repository.TurnLogRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

/**
 * One audit row per turn. Failures are logged and never reach the caller.
 */
@Service
@RequiredArgsConstructor
public class TurnLogService {

    private static final Logger log = LoggerFactory.getLogger(TurnLogService.class);

    private final TurnLogRepository turnLogRepository;
    private final ObjectMapper objectMapper;

    public void recordTurn(UUID conversationId,
                           QueryRoute route,
                           String question,
                           String answer,
                           double confidence,
                           boolean handoffTriggered,
                           EscalationReason escalationReason,
                           long responseTimeMs,
                           List<SourceReference> sources) {
        TurnLog turnLog = new TurnLog();
        turnLog.setConversationId(conversationId);
        turnLog.setRoute(route);
        turnLog.setQuestion(question);
        turnLog.setAnswer(answer);
        turnLog.setConfidence(confidence);
        turnLog.setHandoffTriggered(handoffTriggered);
        turnLog.setEscalationReason(escalationReason);
        turnLog.setResponseTimeMs(responseTimeMs);
        turnLog.setSourcesJson(serializeSources(sources));

        try {
            turnLogRepository.save(turnLog);
        } catch (DataAccessException e) {
            log.warn("Failed to record turn log for conversation {}", conversationId, e);
        }
    }

    private String serializeSources(List<SourceReference> sources) {
        if (sources == null || sources.isEmpty()) {
            return "[]";
        }
        try {
            return objectMapper.writeValueAsString(sources);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize sources for turn log", e);
            return "[]";
        }
    }
}
