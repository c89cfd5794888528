package com.example.Botlyne.service;

import com.example.Botlyne.model.Conversation;
import com.example.Botlyne.model.EscalationReason;
import com.example.Botlyne.provider.NotificationService;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Dispatches handoff notifications off the request thread.
 */
@Service
@RequiredArgsConstructor
public class EscalationNotifier {

    private static final Logger log = LoggerFactory.getLogger(EscalationNotifier.class);

    private final NotificationService notificationService;

    @Async("notificationExecutor")
    public void dispatch(Conversation conversation, EscalationReason reason) {
        try {
            notificationService.notifyEscalation(conversation, reason);
            log.debug("Handoff notification sent for ticket {}", conversation.getTicketNumber());
        } catch (RuntimeException e) {
            log.error("Handoff notification failed for ticket {} (conversation {})",
                    conversation.getTicketNumber(), conversation.getId(), e);
        }
    }
}
