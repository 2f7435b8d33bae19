package com.lifebutler.assistant.repository;

import com.lifebutler.assistant.model.Embedding;
import com.lifebutler.assistant.model.SearchFilters;

import java.util.List;
import java.util.Map;

/**
 * Storage for chunk embeddings, keyed by embedding id and owned by (objectType, objectId).
 */
public interface EmbeddingRepository {

    /** Insert or replace by id. */
    void save(Embedding embedding);

    /**
     * Embeddings matching the filters, ranked by cosine similarity to {@code queryVector},
     * at most {@code limit} of them and none below {@code threshold}.
     */
    List<Embedding> findSimilar(List<Double> queryVector, SearchFilters filters, int limit, double threshold);

    /** Deletes every embedding owned by the given record. Returns how many were removed. */
    int deleteByObject(String objectType, String objectId);

    Map<String, Integer> countByObjectType();

    int count();
}
