package com.example.Botlyne.repository;

import com.example.Botlyne.model.Message;
import com.example.Botlyne.model.MessageSender;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface MessageRepository extends JpaRepository<Message, Long> {

    List<Message> findByConversationIdOrderBySequenceNoAsc(UUID conversationId);

    /**
     * Newest first; callers reverse for chronological order.
     */
    List<Message> findByConversationIdOrderBySequenceNoDesc(UUID conversationId, Pageable pageable);

    List<Message> findByConversationIdAndSenderOrderBySequenceNoDesc(UUID conversationId, MessageSender sender, Pageable pageable);
}
