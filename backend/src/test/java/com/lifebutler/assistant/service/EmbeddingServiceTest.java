package com.lifebutler.assistant.service;

import com.lifebutler.assistant.client.Embedder;
import com.lifebutler.assistant.config.AssistantProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EmbeddingServiceTest {

    @Mock private Embedder embedder;

    private AssistantProperties properties;

    @BeforeEach
    void setUp() {
        properties = new AssistantProperties();
        properties.getEmbedding().setBatchSize(2);
        properties.getEmbedding().setBatchDelayMs(0);
        lenient().when(embedder.expectedDimension()).thenReturn(3);
    }

    @Nested
    @DisplayName("with a provider")
    class WithProvider {

        @Test
        @DisplayName("should embed in batches and keep input order")
        void batches() {
            when(embedder.embed(anyList())).thenAnswer(invocation -> {
                List<String> texts = invocation.getArgument(0);
                List<List<Double>> vectors = new ArrayList<>();
                for (String text : texts) {
                    vectors.add(List.of((double) text.length(), 0.0, 0.0));
                }
                return vectors;
            });
            EmbeddingService service = new EmbeddingService(Optional.of(embedder), properties);
            List<int[]> progress = new ArrayList<>();

            List<List<Double>> vectors = service.embed(List.of("a", "bb", "ccc"),
                    (done, total) -> progress.add(new int[]{done, total}));

            assertThat(vectors).extracting(v -> v.get(0)).containsExactly(1.0, 2.0, 3.0);
            verify(embedder, times(2)).embed(anyList());
            assertThat(progress).extracting(p -> p[0]).containsExactly(2, 3);
        }

        @Test
        @DisplayName("should zero-fill a batch the provider fails on")
        void failedBatchIsZeroFilled() {
            when(embedder.embed(anyList()))
                    .thenReturn(List.of(List.of(1.0, 1.0, 1.0), List.of(2.0, 2.0, 2.0)))
                    .thenThrow(new RuntimeException("connection refused"));
            EmbeddingService service = new EmbeddingService(Optional.of(embedder), properties);

            List<List<Double>> vectors = service.embed(List.of("a", "b", "c"));

            assertThat(vectors).hasSize(3);
            assertThat(vectors.get(0)).containsExactly(1.0, 1.0, 1.0);
            assertThat(vectors.get(2)).containsExactly(0.0, 0.0, 0.0);
        }

        @Test
        @DisplayName("should zero-fill when the provider returns the wrong count")
        void countMismatchIsZeroFilled() {
            when(embedder.embed(anyList())).thenReturn(List.of(List.of(1.0, 1.0, 1.0)));
            EmbeddingService service = new EmbeddingService(Optional.of(embedder), properties);

            List<List<Double>> vectors = service.embed(List.of("a", "b"));

            assertThat(vectors).containsExactly(List.of(0.0, 0.0, 0.0), List.of(0.0, 0.0, 0.0));
        }
    }

    @Test
    @DisplayName("without a provider every vector is zero at the fallback dimension")
    void withoutProvider() {
        EmbeddingService service = new EmbeddingService(Optional.empty(), properties);

        List<List<Double>> vectors = service.embed(List.of("a"));

        assertThat(service.isProviderAvailable()).isFalse();
        assertThat(vectors.get(0)).hasSize(EmbeddingService.FALLBACK_DIMENSION).containsOnly(0.0);
    }

    @Test
    void emptyInputGivesEmptyOutput() {
        assertThat(new EmbeddingService(Optional.empty(), properties).embed(List.of())).isEmpty();
    }
}
