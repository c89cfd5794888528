package com.example.Botlyne.repository;

import com.example.Botlyne.model.TurnLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface TurnLogRepository extends JpaRepository<TurnLog, Long> {

    List<TurnLog> findByConversationIdOrderByCreatedAtAsc(UUID conversationId);
}
