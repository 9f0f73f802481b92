package me.golemcore.engine.domain.system.act;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits text into fixed-size pieces for token events.
 */
public final class ContentChunker {

    public static final int DEFAULT_CHUNK_SIZE = 120;

    private ContentChunker() {
    }

    /**
     * Returns consecutive slices of at most {@code size} characters. Null or empty
     * text yields no chunks; a chunk is never empty.
     */
    public static List<String> chunk(String text, int size) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        int step = size > 0 ? size : DEFAULT_CHUNK_SIZE;
        List<String> chunks = new ArrayList<>((text.length() + step - 1) / step);
        for (int i = 0; i < text.length(); i += step) {
            chunks.add(text.substring(i, Math.min(text.length(), i + step)));
        }
        return chunks;
    }
}
