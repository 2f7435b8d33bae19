package com.lifebutler.assistant.service;

import lombok.extern.slf4j.Slf4j;

import java.util.List;

@Slf4j
public final class VectorMath {

    private VectorMath() {
    }

    /**
     * Cosine similarity clamped to [-1, 1]. Returns 0 when the lengths differ or either
     * vector has zero norm.
     */
    public static double cosineSimilarity(List<Double> a, List<Double> b) {
        if (a == null || b == null || a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        if (a.size() != b.size()) {
            log.warn("Vector length mismatch: {} vs {}", a.size(), b.size());
            return 0.0;
        }

        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.size(); i++) {
            double x = a.get(i);
            double y = b.get(i);
            dot += x * y;
            normA += x * x;
            normB += y * y;
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }

        double similarity = dot / (Math.sqrt(normA) * Math.sqrt(normB));
        return Math.max(-1.0, Math.min(1.0, similarity));
    }
}
