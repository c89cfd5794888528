package com.example.Botlyne.service;

import com.example.Botlyne.model.ConversationView;
import com.example.Botlyne.model.Message;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Operator-side writes. Each runs under the conversation's lock, so it waits for an in-flight
 * turn to record its reply before changing the conversation.
 */
@Service
@RequiredArgsConstructor
public class ConversationService {

    private final ConversationLockManager lockManager;
    private final ConversationStateManager stateManager;

    public ConversationView resolve(String tenantId, UUID conversationId, Integer satisfactionScore) {
        return lockManager.withLock(conversationId, () -> {
            stateManager.resolve(tenantId, conversationId, satisfactionScore);
            return stateManager.getConversation(tenantId, conversationId);
        });
    }

    public Message appendAgentReply(String tenantId, UUID conversationId, String agentId, String content) {
        return lockManager.withLock(conversationId,
                () -> stateManager.appendAgentReply(tenantId, conversationId, agentId, content));
    }
}
