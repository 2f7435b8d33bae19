package com.lifebutler.assistant.repository;

import com.lifebutler.assistant.model.Embedding;
import com.lifebutler.assistant.model.SearchFilters;
import com.lifebutler.assistant.service.VectorMath;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Embedding table kept in memory. Rows hold the vector in its persisted byte form so that the
 * storage layout matches the on-disk table (id, objectType, objectId, chunkText, vectorBytes, createdAt).
 */
@Repository
@Slf4j
public class InMemoryEmbeddingRepository implements EmbeddingRepository {

    private final Map<String, EmbeddingRow> rows = new ConcurrentHashMap<>();

    @Override
    public void save(Embedding embedding) {
        rows.put(embedding.getId(), new EmbeddingRow(
                embedding.getId(),
                embedding.getObjectType(),
                embedding.getObjectId(),
                embedding.getChunkText(),
                VectorCodec.toBytes(embedding.getVector()),
                embedding.getCreatedAt()));
    }

    @Override
    public List<Embedding> findSimilar(List<Double> queryVector, SearchFilters filters, int limit, double threshold) {
        List<Embedding> candidates = rows.values().stream()
                .filter(row -> matches(row, filters))
                .map(EmbeddingRow::toEmbedding)
                .collect(Collectors.toList());

        log.debug("Scoring {} candidate embeddings (limit {}, threshold {})", candidates.size(), limit, threshold);
        if (candidates.isEmpty()) {
            log.warn("No candidate embeddings found for filters {}", filters);
            return List.of();
        }

        List<ScoredEmbedding> scored = new ArrayList<>();
        for (Embedding candidate : candidates) {
            double similarity = VectorMath.cosineSimilarity(queryVector, candidate.getVector());
            if (similarity >= threshold) {
                scored.add(new ScoredEmbedding(candidate, similarity));
            }
        }
        scored.sort(Comparator.comparingDouble(ScoredEmbedding::getSimilarity).reversed());

        return scored.stream()
                .limit(limit)
                .map(ScoredEmbedding::getEmbedding)
                .collect(Collectors.toList());
    }

    @Override
    public int deleteByObject(String objectType, String objectId) {
        List<String> ids = rows.values().stream()
                .filter(row -> row.getObjectType().equals(objectType) && row.getObjectId().equals(objectId))
                .map(EmbeddingRow::getId)
                .collect(Collectors.toList());
        ids.forEach(rows::remove);
        return ids.size();
    }

    @Override
    public Map<String, Integer> countByObjectType() {
        Map<String, Integer> counts = new TreeMap<>();
        for (EmbeddingRow row : rows.values()) {
            counts.merge(row.getObjectType(), 1, Integer::sum);
        }
        return counts;
    }

    @Override
    public int count() {
        return rows.size();
    }

    private boolean matches(EmbeddingRow row, SearchFilters filters) {
        if (filters == null) {
            return true;
        }
        if (!filters.getObjectTypes().isEmpty() && !filters.getObjectTypes().contains(row.getObjectType())) {
            return false;
        }
        LocalDateTime createdAt = row.getCreatedAt();
        if (createdAt != null) {
            if (filters.getStartDate() != null && createdAt.isBefore(filters.getStartDate())) {
                return false;
            }
            if (filters.getEndDate() != null && !createdAt.isBefore(filters.getEndDate())) {
                return false;
            }
        }
        return true;
    }

    @Value
    private static class EmbeddingRow {
        String id;
        String objectType;
        String objectId;
        String chunkText;
        byte[] vectorBytes;
        LocalDateTime createdAt;

        Embedding toEmbedding() {
            return Embedding.builder()
                    .id(id)
                    .objectType(objectType)
                    .objectId(objectId)
                    .chunkText(chunkText)
                    .vector(VectorCodec.fromBytes(vectorBytes))
                    .createdAt(createdAt)
                    .build();
        }
    }

    @Value
    private static class ScoredEmbedding {
        Embedding embedding;
        double similarity;
    }
}
