package com.lifebutler.assistant.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rule tables for the first classifier stage, keyed by language ("en", "zh").
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class IntentRuleSet {

    @JsonProperty("aggregate")
    private Map<String, List<WeightedKeyword>> aggregate = new LinkedHashMap<>();

    @JsonProperty("retrieval")
    private Map<String, List<WeightedKeyword>> retrieval = new LinkedHashMap<>();

    @JsonProperty("reminder")
    private Map<String, List<String>> reminder = new LinkedHashMap<>();

    @JsonProperty("translations_zh_en")
    private Map<String, String> translationsZhEn = new LinkedHashMap<>();

    @JsonProperty("translations_en_zh")
    private Map<String, String> translationsEnZh = new LinkedHashMap<>();

    @JsonProperty("mixed_patterns")
    private List<String> mixedPatterns = new ArrayList<>();

    public boolean isEmpty() {
        return aggregate.isEmpty() && retrieval.isEmpty() && reminder.isEmpty();
    }
}
