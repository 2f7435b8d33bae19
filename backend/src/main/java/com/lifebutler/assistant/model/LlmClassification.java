package com.lifebutler.assistant.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class LlmClassification {

    IntentType intent;

    String reason;

    @Singular
    Map<String, Object> slots;

    double confidence;

    /** False when the keyword heuristic answered instead of a model. */
    boolean modelBacked;
}
