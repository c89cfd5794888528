package com.example.Botlyne.service;

/**
 * Fixed replies that never go through generation.
 */
public final class ResponseTexts {

    public static final String DEGRADED_SERVICE =
            "I'm having trouble answering right now. I've flagged this conversation so a member of our support team can follow up with you.";

    public static final String SAFE_REFUSAL =
            "I'm sorry, but I can't help with that request. I've passed this conversation to our support team.";

    public static final String HANDOFF_ACK =
            "Of course. I'm connecting you with a member of our support team.";

    public static final String CONTACT_PROMPT =
            "Could you share your email address so our support team can reach you?";

    /** Formatted with the ticket number. */
    public static final String CONTACT_CONFIRMED =
            "Thanks! A member of our support team will contact you by email. Your ticket number is %s.";

    private ResponseTexts() {
    }
}
