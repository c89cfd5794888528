package com.example.Botlyne.repository;

import com.example.Botlyne.model.ChunkSource;
import com.example.Botlyne.model.RetrievedChunk;
import com.example.Botlyne.provider.VectorStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pgvector.PGvector;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;

/**
 * {@link VectorStore} over the {@code kb_chunks} pgvector table, written by the ingestion pipeline.
 */
@Repository
@RequiredArgsConstructor
public class PgVectorChunkRepository implements VectorStore {

    private static final Logger log = LoggerFactory.getLogger(PgVectorChunkRepository.class);

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    /**
     * Cosine distance {@code <=>}; similarity is {@code 1 - distance}. Ties on distance fall
     * back to insertion order ({@code seq}).
     */
    @Override
    public List<RetrievedChunk> search(float[] vector, String kbId, int topK) {
        PGvector queryVector = new PGvector(vector);

        String sql = """
                SELECT id,
                       kb_id,
                       seq,
                       content,
                       metadata,
                       1 - (embedding <=> ?) AS score
                FROM kb_chunks
                WHERE kb_id = ?
                ORDER BY embedding <=> ?, seq
                LIMIT ?
                """;

        return jdbcTemplate.query(sql, ps -> {
            ps.setObject(1, queryVector);
            ps.setString(2, kbId);
            ps.setObject(3, queryVector);
            ps.setInt(4, topK);
        }, new ChunkRowMapper());
    }

    private class ChunkRowMapper implements RowMapper<RetrievedChunk> {
        @Override
        public RetrievedChunk mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new RetrievedChunk(
                    rs.getString("id"),
                    rs.getString("kb_id"),
                    rs.getString("content"),
                    rs.getDouble("score"),
                    parseSource(rs.getString("id"), rs.getString("metadata")),
                    rs.getLong("seq")
            );
        }
    }

    private ChunkSource parseSource(String chunkId, String metadataJson) {
        if (metadataJson == null || metadataJson.isBlank()) {
            return ChunkSource.UNKNOWN;
        }
        try {
            JsonNode node = objectMapper.readTree(metadataJson);
            return new ChunkSource(
                    text(node, "title"),
                    text(node, "filename"),
                    text(node, "locator"),
                    text(node, "url")
            );
        } catch (JsonProcessingException e) {
            // Unreadable metadata only costs the source label.
            log.warn("Chunk {} has malformed metadata: {}", chunkId, e.getOriginalMessage());
            return ChunkSource.UNKNOWN;
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
