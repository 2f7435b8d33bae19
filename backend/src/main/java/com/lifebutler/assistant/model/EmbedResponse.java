package com.lifebutler.assistant.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Embedding response in either the Ollama shape ({@code embeddings}) or the
 * OpenAI-compatible shape ({@code data[].embedding}).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class EmbedResponse {

    private List<List<Double>> embeddings;

    private List<EmbeddingData> data;

    public List<List<Double>> vectors() {
        if (embeddings != null) {
            return embeddings;
        }
        List<List<Double>> vectors = new ArrayList<>();
        if (data != null) {
            for (EmbeddingData item : data) {
                vectors.add(item.getEmbedding());
            }
        }
        return vectors;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EmbeddingData {
        private List<Double> embedding;
    }
}
