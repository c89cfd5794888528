package com.example.Botlyne.service;

import com.example.Botlyne.config.BotlyneProperties;
import com.example.Botlyne.model.HistoryMessage;
import com.example.Botlyne.model.Message;
import com.example.Botlyne.model.MessageSender;
import com.example.Botlyne.repository.MessageRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * Rolling window of recent messages per conversation, kept in a Redis list.
 * The message table stays the source of truth: a missing key is rebuilt from it and any Redis
 * failure falls back to it.
 */
@Service
@RequiredArgsConstructor
public class ConversationMemoryService {

    private static final Logger log = LoggerFactory.getLogger(ConversationMemoryService.class);

    private static final String KEY_PREFIX = "botlyne:conversation:memory:";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final MessageRepository messageRepository;
    private final BotlyneProperties properties;

    /**
     * The latest {@code limit} messages, oldest first.
     */
    public List<HistoryMessage> recent(UUID conversationId, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        String key = buildKey(conversationId);
        try {
            Long size = redisTemplate.opsForList().size(key);
            if (size == null || size == 0L) {
                List<HistoryMessage> loaded = loadFromDatabase(conversationId);
                warm(key, loaded);
                return tail(loaded, limit);
            }
            long start = Math.max(0, size - limit);
            List<String> raw = redisTemplate.opsForList().range(key, start, size - 1);
            if (raw == null) {
                return tail(loadFromDatabase(conversationId), limit);
            }
            List<HistoryMessage> messages = new ArrayList<>(raw.size());
            for (String entry : raw) {
                StoredMessage stored = decode(entry);
                if (stored != null) {
                    messages.add(stored.toHistory());
                }
            }
            return messages;
        } catch (DataAccessException e) {
            log.warn("Conversation memory unavailable for {}, reading history from the database: {}",
                    conversationId, e.getMessage());
            return tail(loadFromDatabase(conversationId), limit);
        }
    }

    /**
     * Append to an already cached window. A cold conversation is left cold; the next read
     * rebuilds it from the database.
     */
    public void append(UUID conversationId, Message message) {
        String key = buildKey(conversationId);
        BotlyneProperties.Memory cfg = properties.getMemory();
        try {
            String encoded = objectMapper.writeValueAsString(StoredMessage.of(message));
            Long size = redisTemplate.opsForList().rightPushIfPresent(key, encoded);
            if (size == null || size == 0L) {
                return;
            }
            if (size > cfg.getWindow()) {
                redisTemplate.opsForList().trim(key, size - cfg.getWindow(), size - 1);
            }
            redisTemplate.expire(key, cfg.getTtl());
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize message {} of conversation {} for memory", message.getSequenceNo(), conversationId, e);
        } catch (DataAccessException e) {
            log.warn("Conversation memory append failed for {}: {}", conversationId, e.getMessage());
            evict(conversationId);
        }
    }

    public void evict(UUID conversationId) {
        try {
            redisTemplate.delete(buildKey(conversationId));
        } catch (DataAccessException e) {
            log.warn("Conversation memory eviction failed for {}: {}", conversationId, e.getMessage());
        }
    }

    private List<HistoryMessage> loadFromDatabase(UUID conversationId) {
        List<Message> newestFirst = messageRepository.findByConversationIdOrderBySequenceNoDesc(
                conversationId, PageRequest.of(0, properties.getMemory().getWindow()));
        List<HistoryMessage> chronological = new ArrayList<>(newestFirst.size());
        for (Message message : newestFirst) {
            chronological.add(HistoryMessage.of(message));
        }
        Collections.reverse(chronological);
        return chronological;
    }

    private void warm(String key, List<HistoryMessage> messages) throws DataAccessException {
        if (messages.isEmpty()) {
            return;
        }
        List<String> encoded = new ArrayList<>(messages.size());
        for (HistoryMessage message : messages) {
            try {
                encoded.add(objectMapper.writeValueAsString(
                        new StoredMessage(message.sender(), message.content(), message.sentAt().toEpochMilli())));
            } catch (JsonProcessingException e) {
                log.warn("Skipping unserializable history entry while warming {}", key, e);
                return;
            }
        }
        redisTemplate.opsForList().rightPushAll(key, encoded);
        redisTemplate.expire(key, properties.getMemory().getTtl());
    }

    private StoredMessage decode(String raw) {
        try {
            return objectMapper.readValue(raw, StoredMessage.class);
        } catch (JsonProcessingException e) {
            log.warn("Skipping malformed memory entry: {}", e.getOriginalMessage());
            return null;
        }
    }

    private static List<HistoryMessage> tail(List<HistoryMessage> messages, int limit) {
        return messages.size() <= limit ? messages : messages.subList(messages.size() - limit, messages.size());
    }

    private String buildKey(UUID conversationId) {
        return KEY_PREFIX + conversationId;
    }

    public record StoredMessage(MessageSender sender, String content, long timestamp) {

        static StoredMessage of(Message message) {
            return new StoredMessage(message.getSender(), message.getContent(), message.getSentAt().toEpochMilli());
        }

        HistoryMessage toHistory() {
            return new HistoryMessage(sender, content, Instant.ofEpochMilli(timestamp));
        }
    }
}
