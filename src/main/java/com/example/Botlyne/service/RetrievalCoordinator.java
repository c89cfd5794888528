package com.example.Botlyne.service;

import com.example.Botlyne.config.BotlyneProperties;
import com.example.Botlyne.exception.OrchestrationException;
import com.example.Botlyne.model.RetrievedChunk;
import com.example.Botlyne.provider.EmbeddingProvider;
import com.example.Botlyne.provider.VectorStore;
import com.example.Botlyne.resilience.DependencyGuardRegistry;
import com.example.Botlyne.resilience.DependencyNames;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Retrieval-only step of a turn:
 * - embeds the question
 * - searches the vector store scoped to one knowledge base
 * - drops anything from another knowledge base
 * - orders by similarity, ties by insertion order
 *
 * Never fails the turn: when either dependency is unavailable the result is empty and the
 * turn continues conversationally.
 */
@Service
@RequiredArgsConstructor
public class RetrievalCoordinator {

    private static final Logger log = LoggerFactory.getLogger(RetrievalCoordinator.class);

    static final Comparator<RetrievedChunk> RANKING = Comparator
            .comparingDouble(RetrievedChunk::similarity).reversed()
            .thenComparingLong(RetrievedChunk::sequence);

    private final EmbeddingProvider embeddingProvider;
    private final VectorStore vectorStore;
    private final DependencyGuardRegistry guards;
    private final BotlyneProperties properties;

    public List<RetrievedChunk> retrieve(String question, String kbId) {
        return retrieve(question, kbId, properties.getRetrieval().getTopK());
    }

    public List<RetrievedChunk> retrieve(String question, String kbId, int topK) {
        if (question == null || question.isBlank() || kbId == null || topK <= 0) {
            return List.of();
        }

        List<RetrievedChunk> found;
        try {
            float[] queryEmbedding = guards.guard(DependencyNames.EMBEDDING)
                    .call(() -> embeddingProvider.embed(question));
            found = guards.guard(DependencyNames.VECTOR_STORE)
                    .call(() -> vectorStore.search(queryEmbedding, kbId, topK));
        } catch (OrchestrationException e) {
            log.warn("Retrieval for kb={} degraded to no context: {}", kbId, e.getMessage());
            return List.of();
        }

        if (found == null || found.isEmpty()) {
            log.debug("Retrieval: no chunks for kb={}", kbId);
            return List.of();
        }

        List<RetrievedChunk> scoped = new ArrayList<>(found.size());
        for (RetrievedChunk chunk : found) {
            if (!kbId.equals(chunk.kbId())) {
                log.error("Vector store returned chunk {} of kb={} for a query scoped to kb={}; discarded",
                        chunk.chunkId(), chunk.kbId(), kbId);
                continue;
            }
            scoped.add(chunk.withSimilarity(clamp(chunk.similarity())));
        }

        List<RetrievedChunk> ranked = scoped.stream()
                .sorted(RANKING)
                .limit(topK)
                .toList();
        log.debug("Retrieval: kb={}, requested={}, returned={}", kbId, topK, ranked.size());
        return ranked;
    }

    private static double clamp(double similarity) {
        if (Double.isNaN(similarity)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, similarity));
    }
}
