package com.example.Botlyne.model;

/**
 * A chunk returned by similarity search for a single turn.
 *
 * @param similarity cosine similarity, clamped into [0,1] by the retrieval coordinator
 * @param sequence   insertion order of the chunk in its knowledge base, used to break ties
 */
public record RetrievedChunk(
        String chunkId,
        String kbId,
        String content,
        double similarity,
        ChunkSource source,
        long sequence
) {

    public RetrievedChunk {
        if (content == null) {
            content = "";
        }
        if (source == null) {
            source = ChunkSource.UNKNOWN;
        }
    }

    public RetrievedChunk withSimilarity(double value) {
        return new RetrievedChunk(chunkId, kbId, content, value, source, sequence);
    }
}
