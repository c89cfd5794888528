package com.example.Botlyne.provider;

import com.example.Botlyne.model.Conversation;
import com.example.Botlyne.model.EscalationReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Default notifier until a mail or chat integration is wired: records the handoff in the log.
 */
@Component
public class LoggingNotificationService implements NotificationService {

    private static final Logger log = LoggerFactory.getLogger(LoggingNotificationService.class);

    @Override
    public void notifyEscalation(Conversation conversation, EscalationReason reason) {
        log.info("Human handoff requested: ticket={}, tenant={}, conversation={}, reason={}, contact={}",
                conversation.getTicketNumber(),
                conversation.getTenantId(),
                conversation.getId(),
                reason == null ? "unknown" : reason.getCode(),
                conversation.hasContactEmail() ? conversation.getContactEmail() : "(none)");
    }
}
