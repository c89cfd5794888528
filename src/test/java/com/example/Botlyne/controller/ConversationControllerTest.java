package com.example.Botlyne.controller;

import com.example.Botlyne.exception.ConversationNotFoundException;
import com.example.Botlyne.exception.IllegalConversationStateException;
import com.example.Botlyne.exception.InvalidRequestException;
import com.example.Botlyne.model.ConversationStatus;
import com.example.Botlyne.model.ConversationView;
import com.example.Botlyne.model.EscalationReason;
import com.example.Botlyne.model.Message;
import com.example.Botlyne.model.MessageSender;
import com.example.Botlyne.service.ConversationLockManager;
import com.example.Botlyne.service.ConversationService;
import com.example.Botlyne.service.ConversationStateManager;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ConversationController.class)
@Import({ConversationService.class, ConversationLockManager.class})
class ConversationControllerTest {

    private static final UUID ID = UUID.fromString("5b0c2f0e-8a57-4d43-9a35-3c1f1f6f2a10");
    private static final Instant STARTED = Instant.parse("2026-03-01T10:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ConversationStateManager stateManager;

    private static ConversationView view(ConversationStatus status, Integer score) {
        return new ConversationView(ID, "K7PX2QMA", "kb-1", "user-1", status, STARTED,
                status.isTerminal() ? STARTED.plusSeconds(90) : null,
                status == ConversationStatus.ONGOING ? null : EscalationReason.LOW_CONFIDENCE,
                null, null, null, score, 2, List.of());
    }

    @Test
    void resolveReturnsTheResolvedConversation() throws Exception {
        when(stateManager.getConversation("acme", ID)).thenReturn(view(ConversationStatus.RESOLVED_HUMAN, 4));

        mockMvc.perform(post("/api/conversations/{id}/resolve", ID)
                        .header(QueryController.TENANT_HEADER, "acme")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"satisfaction_score\": 4}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("resolved_human"))
                .andExpect(jsonPath("$.ticket_number").value("K7PX2QMA"))
                .andExpect(jsonPath("$.satisfaction_score").value(4))
                .andExpect(jsonPath("$.escalation_reason").value("low_confidence"));

        verify(stateManager).resolve("acme", ID, 4);
    }

    @Test
    void resolveWithoutBodyLeavesTheScoreEmpty() throws Exception {
        when(stateManager.getConversation("acme", ID)).thenReturn(view(ConversationStatus.RESOLVED_AI, null));

        mockMvc.perform(post("/api/conversations/{id}/resolve", ID)
                        .header(QueryController.TENANT_HEADER, "acme"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("resolved_ai"));

        verify(stateManager).resolve("acme", ID, null);
    }

    @Test
    void invalidScoreIsABadRequest() throws Exception {
        when(stateManager.resolve("acme", ID, 9))
                .thenThrow(new InvalidRequestException("satisfaction_score must be between 1 and 5"));

        mockMvc.perform(post("/api/conversations/{id}/resolve", ID)
                        .header(QueryController.TENANT_HEADER, "acme")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"satisfaction_score\": 9}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("satisfaction_score must be between 1 and 5"));
    }

    @Test
    void missingTenantHeaderIsABadRequest() throws Exception {
        mockMvc.perform(get("/api/conversations/{id}", ID))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400));

        verifyNoInteractions(stateManager);
    }

    @Test
    void unknownConversationIsNotFound() throws Exception {
        when(stateManager.getConversation("acme", ID)).thenThrow(new ConversationNotFoundException(ID));

        mockMvc.perform(get("/api/conversations/{id}", ID).header(QueryController.TENANT_HEADER, "acme"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Not Found"));
    }

    @Test
    void malformedIdIsABadRequest() throws Exception {
        mockMvc.perform(get("/api/conversations/{id}", "not-a-uuid").header(QueryController.TENANT_HEADER, "acme"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void listingNeedsAUser() throws Exception {
        when(stateManager.listConversations("acme", "user-1")).thenReturn(List.of(view(ConversationStatus.ONGOING, null)));

        mockMvc.perform(get("/api/conversations").param("user_id", "user-1").header(QueryController.TENANT_HEADER, "acme"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].conversation_id").value(ID.toString()))
                .andExpect(jsonPath("$[0].status").value("ongoing"));

        mockMvc.perform(get("/api/conversations").header(QueryController.TENANT_HEADER, "acme"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void agentReplyOnAnEscalatedConversation() throws Exception {
        Message reply = new Message(ID, 3, MessageSender.AGENT, "Hi, Sam here.", "agent-7", STARTED.plusSeconds(120));
        when(stateManager.appendAgentReply("acme", ID, "agent-7", "Hi, Sam here.")).thenReturn(reply);

        mockMvc.perform(post("/api/conversations/{id}/agent-reply", ID)
                        .header(QueryController.TENANT_HEADER, "acme")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"agent_id\": \"agent-7\", \"message\": \"Hi, Sam here.\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sender").value("agent"))
                .andExpect(jsonPath("$.sequence_no").value(3))
                .andExpect(jsonPath("$.agent_id").value("agent-7"));
    }

    @Test
    void agentReplyOnAnOngoingConversationIsAConflict() throws Exception {
        when(stateManager.appendAgentReply(eq("acme"), eq(ID), any(), any()))
                .thenThrow(new IllegalConversationStateException("Conversation is ongoing"));

        mockMvc.perform(post("/api/conversations/{id}/agent-reply", ID)
                        .header(QueryController.TENANT_HEADER, "acme")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"agent_id\": \"agent-7\", \"message\": \"hello\"}"))
                .andExpect(status().isConflict());
    }
}
