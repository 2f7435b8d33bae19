package com.lifebutler.assistant.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TextChunkerTest {

    private final TextChunker chunker = new TextChunker();

    @Nested
    @DisplayName("chunk()")
    class Chunk {

        @Test
        @DisplayName("should return nothing for empty text")
        void emptyText() {
            assertThat(chunker.chunk("")).isEmpty();
            assertThat(chunker.chunk(null)).isEmpty();
        }

        @Test
        @DisplayName("should return short text as a single untouched chunk")
        void shortText() {
            String text = "  Lunch at the noodle bar.  ";
            assertThat(chunker.chunk(text, 10, 2)).containsExactly(text);
        }

        @Test
        @DisplayName("should never produce a chunk longer than maxTokens * 4 characters")
        void respectsMaxLength() {
            String text = "word ".repeat(400);
            List<String> chunks = chunker.chunk(text, 20, 5);

            assertThat(chunks).hasSizeGreaterThan(1);
            assertThat(chunks).allSatisfy(chunk -> assertThat(chunk.length()).isLessThanOrEqualTo(80));
        }

        @Test
        @DisplayName("should cut after a sentence end in the second half of the window")
        void cutsAtSentenceBoundary() {
            String first = "a".repeat(30) + ".";
            String text = first + " " + "b".repeat(60);

            List<String> chunks = chunker.chunk(text, 10, 0);

            assertThat(chunks.get(0)).isEqualTo(first);
        }

        @Test
        @DisplayName("should overlap consecutive chunks")
        void overlaps() {
            String text = "0123456789".repeat(10);
            List<String> chunks = chunker.chunk(text, 10, 2);

            assertThat(chunks.get(0)).hasSize(40);
            assertThat(chunks.get(1)).startsWith(chunks.get(0).substring(32));
        }

        @Test
        @DisplayName("should cover the whole text")
        void coversText() {
            String text = "0123456789".repeat(10);
            List<String> chunks = chunker.chunk(text, 10, 2);

            assertThat(chunks.get(chunks.size() - 1)).endsWith("789");
        }

        @Test
        @DisplayName("should rebuild the original text when each chunk's overlap is dropped")
        void reconstructsText() {
            String text = journalText();

            for (int maxTokens = 10; maxTokens <= 195; maxTokens += 5) {
                List<String> chunks = chunker.chunk(text, maxTokens, 2);
                StringBuilder rebuilt = new StringBuilder();
                int previous = -1;
                for (String chunk : chunks) {
                    int position = text.indexOf(chunk, previous + 1);
                    assertThat(position).isBetween(0, rebuilt.length());
                    rebuilt.append(chunk.substring(rebuilt.length() - position));
                    previous = position;
                }
                assertThat(rebuilt.toString()).as("maxTokens=%d", maxTokens).isEqualTo(text);
            }
        }

        @Test
        @DisplayName("should not produce more chunks when the window grows")
        void chunkCountShrinksWithWindow() {
            String text = journalText();

            int previousCount = Integer.MAX_VALUE;
            for (int maxTokens = 10; maxTokens <= 195; maxTokens += 5) {
                int count = chunker.chunk(text, maxTokens, 2).size();
                assertThat(count).as("maxTokens=%d", maxTokens).isLessThanOrEqualTo(previousCount);
                previousCount = count;
            }
            assertThat(chunker.chunk(text, 400, 2)).hasSize(1);
        }

        @Test
        @DisplayName("should reject invalid sizes")
        void rejectsInvalidSizes() {
            assertThatThrownBy(() -> chunker.chunk("text", 0, 0)).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> chunker.chunk("text", 10, -1)).isInstanceOf(IllegalArgumentException.class);
        }
    }

    private static String journalText() {
        StringBuilder text = new StringBuilder();
        for (int i = 0; i < 60; i++) {
            if (i > 0) {
                text.append(' ');
            }
            if (i % 3 == 0) {
                text.append("Sentence number ").append(i).append(" talks about day ").append(i * 7).append(".\n");
            } else {
                text.append("Entry ").append(i).append(" noted.");
            }
        }
        return text.toString();
    }
}
