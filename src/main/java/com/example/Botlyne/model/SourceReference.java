package com.example.Botlyne.model;

public record SourceReference(String title, String excerpt, double similarity, String url) {

    public static final int EXCERPT_LENGTH = 200;

    /**
     * Cites the excerpt as it appeared in the context, shortened for display.
     */
    public static SourceReference of(ContextEntry entry) {
        RetrievedChunk chunk = entry.chunk();
        String used = entry.excerpt();
        String excerpt = used.length() > EXCERPT_LENGTH
                ? used.substring(0, EXCERPT_LENGTH) + "..."
                : used;
        return new SourceReference(chunk.source().label(), excerpt, chunk.similarity(), chunk.source().url());
    }
}
