package com.example.Botlyne.provider;

import com.example.Botlyne.model.Conversation;
import com.example.Botlyne.model.EscalationReason;

/**
 * Tells the human support team that a conversation needs them.
 */
public interface NotificationService {

    void notifyEscalation(Conversation conversation, EscalationReason reason);
}
