package com.lifebutler.assistant.service;

import com.lifebutler.assistant.client.Embedder;
import com.lifebutler.assistant.config.AssistantProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.BiConsumer;

/**
 * Batches texts to the configured {@link Embedder}. Always returns one vector per input text:
 * a batch the provider cannot embed is filled with zero vectors instead.
 */
@Service
@Slf4j
public class EmbeddingService {

    static final int FALLBACK_DIMENSION = 768;

    private final Embedder embedder;
    private final int batchSize;
    private final long batchDelayMs;

    public EmbeddingService(Optional<Embedder> embedder, AssistantProperties properties) {
        this.embedder = embedder.orElse(null);
        this.batchSize = Math.max(1, properties.getEmbedding().getBatchSize());
        this.batchDelayMs = Math.max(0, properties.getEmbedding().getBatchDelayMs());
        if (this.embedder == null) {
            log.warn("⚠️ No embedding provider configured, vectors will be zero-filled");
        }
    }

    public List<List<Double>> embed(List<String> texts) {
        return embed(texts, null);
    }

    /**
     * @param onProgress called with (embedded so far, total) after each batch; may be null
     */
    public List<List<Double>> embed(List<String> texts, BiConsumer<Integer, Integer> onProgress) {
        if (texts == null || texts.isEmpty()) {
            return new ArrayList<>();
        }

        List<List<Double>> vectors = new ArrayList<>(texts.size());
        int batches = (texts.size() + batchSize - 1) / batchSize;

        for (int start = 0; start < texts.size(); start += batchSize) {
            int end = Math.min(start + batchSize, texts.size());
            List<String> batch = texts.subList(start, end);
            log.debug("Embedding batch {}/{} ({} texts)", start / batchSize + 1, batches, batch.size());

            vectors.addAll(embedBatch(batch, start, end));

            if (onProgress != null) {
                onProgress.accept(end, texts.size());
            }
            if (end < texts.size()) {
                pauseBetweenBatches();
            }
        }
        return vectors;
    }

    public int dimension() {
        return embedder != null ? embedder.expectedDimension() : FALLBACK_DIMENSION;
    }

    public boolean isProviderAvailable() {
        return embedder != null;
    }

    private List<List<Double>> embedBatch(List<String> batch, int start, int end) {
        if (embedder == null) {
            return zeroVectors(batch.size());
        }
        try {
            List<List<Double>> result = embedder.embed(new ArrayList<>(batch));
            if (result == null || result.size() != batch.size()) {
                throw new IllegalStateException("provider returned "
                        + (result == null ? 0 : result.size()) + " vectors for " + batch.size() + " texts");
            }
            return result;
        } catch (Exception e) {
            log.warn("⚠️ Embedding failed for batch {}-{}, using zero vectors: {}", start, end, e.getMessage());
            return zeroVectors(batch.size());
        }
    }

    private List<List<Double>> zeroVectors(int count) {
        List<List<Double>> vectors = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            vectors.add(new ArrayList<>(Collections.nCopies(dimension(), 0.0)));
        }
        return vectors;
    }

    private void pauseBetweenBatches() {
        if (batchDelayMs == 0 || Thread.currentThread().isInterrupted()) {
            return;
        }
        try {
            Thread.sleep(batchDelayMs);
        } catch (InterruptedException e) {
            log.debug("Batch delay interrupted, continuing without pauses");
            Thread.currentThread().interrupt();
        }
    }
}
