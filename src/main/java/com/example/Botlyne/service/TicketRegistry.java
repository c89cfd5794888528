package com.example.Botlyne.service;

import com.example.Botlyne.config.BotlyneProperties;
import com.example.Botlyne.repository.ConversationRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;

/**
 * Issues short human-readable ticket numbers, unique per tenant.
 * The alphabet leaves out I, O, 0 and 1 so codes survive being read over the phone.
 */
@Service
@RequiredArgsConstructor
public class TicketRegistry {

    private static final Logger log = LoggerFactory.getLogger(TicketRegistry.class);

    static final String ALPHABET = "ABCDEFGHJKLMNPQRSTUVWXYZ23456789";

    private final SecureRandom random = new SecureRandom();

    private final ConversationRepository conversationRepository;
    private final BotlyneProperties properties;

    public String issue(String tenantId) {
        BotlyneProperties.Ticket cfg = properties.getTicket();
        for (int attempt = 1; attempt <= cfg.getMaxAttempts(); attempt++) {
            String candidate = generate(cfg.getLength());
            if (!conversationRepository.existsByTenantIdAndTicketNumber(tenantId, candidate)) {
                return candidate;
            }
            log.debug("Ticket {} already taken for tenant {} (attempt {})", candidate, tenantId, attempt);
        }
        throw new IllegalStateException("Could not allocate a unique ticket number after "
                + cfg.getMaxAttempts() + " attempts");
    }

    String generate(int length) {
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return sb.toString();
    }
}
