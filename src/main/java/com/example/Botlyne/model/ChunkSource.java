package com.example.Botlyne.model;

/**
 * Where a chunk came from. Every field may be null.
 */
public record ChunkSource(String title, String filename, String locator, String url) {

    public static final ChunkSource UNKNOWN = new ChunkSource(null, null, null, null);

    public String label() {
        if (title != null && !title.isBlank()) {
            return title;
        }
        if (filename != null && !filename.isBlank()) {
            return filename;
        }
        return "Document";
    }
}
