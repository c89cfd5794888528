package com.example.Botlyne.model;

/**
 * One chunk as placed into the formatted context.
 *
 * @param excerptStart start (inclusive) of the used range within the chunk content
 * @param excerptEnd   end (exclusive) of the used range within the chunk content
 * @param contextStart start (inclusive) of the excerpt inside the context text
 * @param contextEnd   end (exclusive) of the excerpt inside the context text
 */
public record ContextEntry(
        RetrievedChunk chunk,
        int excerptStart,
        int excerptEnd,
        int contextStart,
        int contextEnd
) {

    /**
     * The part of the chunk that went into the context.
     */
    public String excerpt() {
        return chunk.content().substring(excerptStart, excerptEnd);
    }

    public boolean truncated() {
        return excerptStart > 0 || excerptEnd < chunk.content().length();
    }
}
