package com.lifebutler.assistant.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * One entry of a keyword table in intent-rules.json.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class WeightedKeyword {

    public static final String GENERAL_DOMAIN = "general";

    @JsonProperty("keyword")
    private String keyword;

    @JsonProperty("weight")
    private double weight;

    @JsonProperty("domains")
    private List<String> domains = new ArrayList<>();

    /**
     * Keywords tagged "general" describe what kind of answer is wanted rather than the topic.
     */
    public boolean isIntentSignal() {
        return domains != null && domains.contains(GENERAL_DOMAIN);
    }
}
