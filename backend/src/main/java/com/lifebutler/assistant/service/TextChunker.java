package com.lifebutler.assistant.service;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits text into overlapping chunks sized for the embedding model. A token is counted as
 * four characters. Chunks are raw slices of the input, so dropping each chunk's overlap with
 * its predecessor and concatenating gives back the original text.
 */
@Component
public class TextChunker {

    static final int CHARS_PER_TOKEN = 4;
    public static final int DEFAULT_MAX_TOKENS = 512;
    public static final int DEFAULT_OVERLAP_TOKENS = 50;

    public List<String> chunk(String text) {
        return chunk(text, DEFAULT_MAX_TOKENS, DEFAULT_OVERLAP_TOKENS);
    }

    public List<String> chunk(String text, int maxTokens, int overlapTokens) {
        if (maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be positive, got " + maxTokens);
        }
        if (overlapTokens < 0) {
            throw new IllegalArgumentException("overlapTokens must not be negative, got " + overlapTokens);
        }
        if (text == null || text.isEmpty()) {
            return new ArrayList<>();
        }

        int maxChars = maxTokens * CHARS_PER_TOKEN;
        int overlapChars = overlapTokens * CHARS_PER_TOKEN;

        List<String> chunks = new ArrayList<>();
        if (text.length() <= maxChars) {
            chunks.add(text);
            return chunks;
        }

        int start = 0;
        while (start < text.length()) {
            int end = Math.min(start + maxChars, text.length());

            if (end < text.length()) {
                // prefer a sentence or line break in the second half of the window
                int boundary = Math.max(text.lastIndexOf('.', end - 1), text.lastIndexOf('\n', end - 1));
                if (boundary > start + maxChars / 2) {
                    end = boundary + 1;
                }
            }

            String chunk = text.substring(start, end);
            if (!chunk.isBlank()) {
                chunks.add(chunk);
            }
            if (end >= text.length()) {
                break;
            }
            start = Math.max(start + 1, end - overlapChars);
        }
        return chunks;
    }
}
