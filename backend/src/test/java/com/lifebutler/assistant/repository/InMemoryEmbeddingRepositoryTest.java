package com.lifebutler.assistant.repository;

import com.lifebutler.assistant.model.Embedding;
import com.lifebutler.assistant.model.SearchFilters;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryEmbeddingRepositoryTest {

    private InMemoryEmbeddingRepository repository;

    @BeforeEach
    void setUp() {
        repository = new InMemoryEmbeddingRepository();
        repository.save(embedding("fin-1_chunk_0", "finance_records", "fin-1", List.of(1.0, 0.0), LocalDateTime.of(2026, 10, 2, 12, 0)));
        repository.save(embedding("fin-2_chunk_0", "finance_records", "fin-2", List.of(0.8, 0.6), LocalDateTime.of(2026, 9, 20, 12, 0)));
        repository.save(embedding("jrnl-1_chunk_0", "journals", "jrnl-1", List.of(0.0, 1.0), LocalDateTime.of(2026, 10, 6, 23, 0)));
        repository.save(embedding("jrnl-1_chunk_1", "journals", "jrnl-1", List.of(0.6, 0.8), LocalDateTime.of(2026, 10, 6, 23, 0)));
    }

    @Nested
    @DisplayName("findSimilar()")
    class FindSimilar {

        @Test
        @DisplayName("should order by similarity and apply the limit")
        void ordersBySimilarity() {
            List<Embedding> found = repository.findSimilar(List.of(1.0, 0.0), SearchFilters.NONE, 2, 0.0);

            assertThat(found).extracting(Embedding::getId).containsExactly("fin-1_chunk_0", "fin-2_chunk_0");
        }

        @Test
        @DisplayName("should drop candidates below the threshold")
        void appliesThreshold() {
            List<Embedding> found = repository.findSimilar(List.of(1.0, 0.0), SearchFilters.NONE, 10, 0.7);

            assertThat(found).extracting(Embedding::getId).containsExactly("fin-1_chunk_0", "fin-2_chunk_0");
        }

        @Test
        @DisplayName("should filter by object type and half-open date range")
        void filtersByTypeAndDate() {
            SearchFilters filters = SearchFilters.builder()
                    .objectType("finance_records")
                    .startDate(LocalDateTime.of(2026, 10, 1, 0, 0))
                    .endDate(LocalDateTime.of(2026, 10, 2, 12, 0))
                    .build();

            assertThat(repository.findSimilar(List.of(1.0, 0.0), filters, 10, 0.0)).isEmpty();

            SearchFilters wider = SearchFilters.builder()
                    .objectType("finance_records")
                    .startDate(LocalDateTime.of(2026, 10, 1, 0, 0))
                    .endDate(LocalDateTime.of(2026, 11, 1, 0, 0))
                    .build();
            assertThat(repository.findSimilar(List.of(1.0, 0.0), wider, 10, 0.0))
                    .extracting(Embedding::getObjectId).containsExactly("fin-1");
        }

        @Test
        @DisplayName("should return the stored vector intact")
        void roundTripsVector() {
            List<Embedding> found = repository.findSimilar(List.of(0.0, 1.0), SearchFilters.NONE, 1, 0.0);

            assertThat(found.get(0).getVector()).containsExactly(0.0, 1.0);
            assertThat(found.get(0).getChunkText()).isEqualTo("text of jrnl-1_chunk_0");
        }

        @Test
        @DisplayName("should find the best match in a large store")
        void scoresEveryRowInLargeStore() {
            InMemoryEmbeddingRepository large = new InMemoryEmbeddingRepository();
            for (int i = 0; i < 4000; i++) {
                large.save(embedding("noise-" + i + "_chunk_0", "journals", "noise-" + i,
                        List.of(0.2, 1.0), LocalDateTime.of(2026, 10, 1, 8, 0)));
            }
            large.save(embedding("target_chunk_0", "journals", "target",
                    List.of(1.0, 0.0), LocalDateTime.of(2026, 10, 1, 8, 0)));

            List<Embedding> found = large.findSimilar(List.of(1.0, 0.0), SearchFilters.NONE, 3, 0.0);

            assertThat(found).hasSize(3);
            assertThat(found.get(0).getId()).isEqualTo("target_chunk_0");
        }
    }

    @Test
    void deleteByObjectRemovesAllChunks() {
        assertThat(repository.deleteByObject("journals", "jrnl-1")).isEqualTo(2);
        assertThat(repository.count()).isEqualTo(2);
        assertThat(repository.countByObjectType()).containsEntry("finance_records", 2).doesNotContainKey("journals");
    }

    private static Embedding embedding(String id, String type, String objectId, List<Double> vector, LocalDateTime createdAt) {
        return Embedding.builder()
                .id(id)
                .objectType(type)
                .objectId(objectId)
                .chunkText("text of " + id)
                .vector(vector)
                .createdAt(createdAt)
                .build();
    }
}
