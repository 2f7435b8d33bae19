package com.lifebutler.assistant.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class RuleClassification {

    @Singular
    Map<IntentType, Double> scores;

    boolean highConfidence;

    boolean mixedQuery;

    @Builder.Default
    String detectedLanguage = "en";

    @Singular
    List<String> queryVariants;

    @Singular
    List<String> matchedKeywords;

    double rawAggregateScore;

    double rawRetrievalScore;
}
