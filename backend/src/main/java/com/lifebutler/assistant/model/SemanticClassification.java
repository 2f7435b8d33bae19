package com.lifebutler.assistant.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class SemanticClassification {

    @Singular
    Map<IntentType, Double> scores;

    @Singular
    Map<IntentType, String> bestMatches;

    double margin;

    @Builder.Default
    double dynamicThreshold = 0.53;

    boolean meetsThreshold;

    public double getTopScore() {
        return scores.values().stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
    }

    public IntentType getTopIntent() {
        IntentType top = null;
        double best = Double.NEGATIVE_INFINITY;
        for (Map.Entry<IntentType, Double> entry : scores.entrySet()) {
            if (entry.getValue() > best) {
                best = entry.getValue();
                top = entry.getKey();
            }
        }
        return top;
    }
}
