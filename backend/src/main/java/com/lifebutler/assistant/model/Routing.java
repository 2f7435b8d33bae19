package com.lifebutler.assistant.model;

import lombok.Builder;
import lombok.Value;

/**
 * Router output. A calculation path always carries calculation specs, a retrieval path always
 * carries retrieval specs, and a hybrid path carries both.
 */
@Value
@Builder
public class Routing {

    String originalQuery;

    ProcessingPath processingPath;

    CalculationSpecs calculationSpecs;

    RetrievalSpecs retrievalSpecs;

    double confidence;

    QueryContext queryContext;

    RoutingDecision decision;
}
