package com.example.Botlyne.controller;

import com.example.Botlyne.exception.InvalidRequestException;
import com.example.Botlyne.model.AgentReplyRequest;
import com.example.Botlyne.model.ConversationView;
import com.example.Botlyne.model.MessageView;
import com.example.Botlyne.model.ResolveRequest;
import com.example.Botlyne.service.ConversationService;
import com.example.Botlyne.service.ConversationStateManager;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

import static com.example.Botlyne.controller.QueryController.TENANT_HEADER;

@RestController
@RequestMapping("/api/conversations")
@RequiredArgsConstructor
public class ConversationController {

    private final ConversationStateManager stateManager;
    private final ConversationService conversationService;

    /**
     * Marks the conversation resolved. Resolving twice returns the same result without changes.
     */
    @PostMapping("/{id}/resolve")
    public ConversationView resolve(@RequestHeader(value = TENANT_HEADER, required = false) String tenantId,
                                    @PathVariable("id") UUID conversationId,
                                    @RequestBody(required = false) ResolveRequest request) {
        requireTenant(tenantId);
        Integer score = request == null ? null : request.satisfactionScore();
        return conversationService.resolve(tenantId, conversationId, score);
    }

    @GetMapping("/{id}")
    public ConversationView get(@RequestHeader(value = TENANT_HEADER, required = false) String tenantId,
                                @PathVariable("id") UUID conversationId) {
        requireTenant(tenantId);
        return stateManager.getConversation(tenantId, conversationId);
    }

    @GetMapping
    public List<ConversationView> list(@RequestHeader(value = TENANT_HEADER, required = false) String tenantId,
                                       @RequestParam("user_id") String userId) {
        requireTenant(tenantId);
        return stateManager.listConversations(tenantId, userId);
    }

    /**
     * Injects a human agent's reply into an escalated conversation.
     */
    @PostMapping("/{id}/agent-reply")
    public MessageView agentReply(@RequestHeader(value = TENANT_HEADER, required = false) String tenantId,
                                  @PathVariable("id") UUID conversationId,
                                  @RequestBody AgentReplyRequest request) {
        requireTenant(tenantId);
        return MessageView.of(conversationService.appendAgentReply(tenantId, conversationId, request.agentId(), request.message()));
    }

    private static void requireTenant(String tenantId) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new InvalidRequestException(TENANT_HEADER + " header is required");
        }
    }
}
