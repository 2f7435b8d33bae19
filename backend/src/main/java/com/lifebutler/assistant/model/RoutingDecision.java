package com.lifebutler.assistant.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Fused outcome of the three classifier stages. The stage results are kept for explainability.
 */
@Value
@Builder
public class RoutingDecision {

    IntentType primaryIntent;

    double confidence;

    boolean hybrid;

    boolean mixedQuery;

    Map<IntentType, Double> fusedScores;

    RuleClassification ruleResult;

    SemanticClassification semanticResult;

    /** Null when the LLM stage was short-circuited. */
    LlmClassification llmResult;

    double dataMissingPenalty;
}
