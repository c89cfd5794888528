package com.example.Botlyne.model;

/**
 * @param collectEmail ask the user for a contact email before handing off
 */
public record EscalationDecision(boolean triggered, EscalationReason reason, boolean collectEmail) {

    public static EscalationDecision escalate(EscalationReason reason, boolean collectEmail) {
        return new EscalationDecision(true, reason, collectEmail);
    }

    public static EscalationDecision noEscalation() {
        return new EscalationDecision(false, null, false);
    }
}
