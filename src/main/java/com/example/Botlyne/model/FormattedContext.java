package com.example.Botlyne.model;

import java.util.List;

public record FormattedContext(String text, List<ContextEntry> entries) {

    public static final FormattedContext EMPTY = new FormattedContext("", List.of());

    public FormattedContext {
        text = text == null ? "" : text;
        entries = entries == null ? List.of() : List.copyOf(entries);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public boolean containsChunk(String chunkId) {
        return entries.stream().anyMatch(e -> e.chunk().chunkId().equals(chunkId));
    }

    public List<RetrievedChunk> chunks() {
        return entries.stream().map(ContextEntry::chunk).toList();
    }
}
