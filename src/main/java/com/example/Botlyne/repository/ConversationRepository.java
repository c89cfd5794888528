package com.example.Botlyne.repository;

import com.example.Botlyne.model.Conversation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ConversationRepository extends JpaRepository<Conversation, UUID> {

    Optional<Conversation> findByIdAndTenantId(UUID id, String tenantId);

    boolean existsByTenantIdAndTicketNumber(String tenantId, String ticketNumber);

    List<Conversation> findByTenantIdAndUserIdOrderByStartedAtDesc(String tenantId, String userId);
}
