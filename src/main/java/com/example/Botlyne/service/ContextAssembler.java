package com.example.Botlyne.service;

import com.example.Botlyne.config.BotlyneProperties;
import com.example.Botlyne.model.ContextEntry;
import com.example.Botlyne.model.FormattedContext;
import com.example.Botlyne.model.RetrievedChunk;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Formats ranked chunks into a bounded prompt context.
 *
 * Example format:
 *   [chunk=c1 | Refund policy | score=0.873]
 *   chunk content...
 *
 *   [chunk=c2 | faq.pdf | score=0.751]
 *   chunk content...
 */
@Service
@RequiredArgsConstructor
public class ContextAssembler {

    static final String SEPARATOR = "\n\n";

    private final BotlyneProperties properties;

    public FormattedContext assemble(List<RetrievedChunk> chunks) {
        return assemble(chunks, properties.getContext().getMaxChars());
    }

    /**
     * Chunks are taken in the given order until the next one would overflow {@code maxChars}.
     * A first chunk that alone overflows is truncated to fit, so a non-empty input never yields
     * an empty context. Chunks whose normalized content is a prefix or suffix of an included
     * chunk are skipped as duplicates.
     */
    public FormattedContext assemble(List<RetrievedChunk> chunks, int maxChars) {
        if (chunks == null || chunks.isEmpty() || maxChars <= 0) {
            return FormattedContext.EMPTY;
        }

        StringBuilder text = new StringBuilder();
        List<ContextEntry> entries = new ArrayList<>();
        List<String> included = new ArrayList<>();

        for (RetrievedChunk chunk : chunks) {
            String content = chunk.content();
            String normalized = normalize(content);
            if (normalized.isEmpty() || isDuplicate(normalized, included)) {
                continue;
            }

            String separator = entries.isEmpty() ? "" : SEPARATOR;
            String header = header(chunk);
            int needed = separator.length() + header.length() + content.length();

            if (text.length() + needed <= maxChars) {
                text.append(separator).append(header);
                int start = text.length();
                text.append(content);
                entries.add(new ContextEntry(chunk, 0, content.length(), start, text.length()));
                included.add(normalized);
                continue;
            }

            if (entries.isEmpty()) {
                // First chunk alone is over budget: keep as much of it as fits.
                String kept = header.length() < maxChars ? header : "";
                int room = Math.min(maxChars - kept.length(), content.length());
                text.append(kept);
                int start = text.length();
                text.append(content, 0, room);
                entries.add(new ContextEntry(chunk, 0, room, start, text.length()));
                included.add(normalized);
            }
            break;
        }

        if (entries.isEmpty()) {
            return FormattedContext.EMPTY;
        }
        return new FormattedContext(text.toString(), entries);
    }

    static String header(RetrievedChunk chunk) {
        StringBuilder sb = new StringBuilder("[chunk=").append(chunk.chunkId())
                .append(" | ").append(chunk.source().label());
        if (chunk.source().locator() != null && !chunk.source().locator().isBlank()) {
            sb.append(" | ").append(chunk.source().locator());
        }
        sb.append(" | score=").append(String.format(Locale.US, "%.3f", chunk.similarity())).append("]\n");
        return sb.toString();
    }

    private static boolean isDuplicate(String candidate, List<String> included) {
        for (String existing : included) {
            if (existing.startsWith(candidate) || existing.endsWith(candidate)) {
                return true;
            }
        }
        return false;
    }

    private static String normalize(String content) {
        return content.strip().replaceAll("\\s+", " ");
    }
}
