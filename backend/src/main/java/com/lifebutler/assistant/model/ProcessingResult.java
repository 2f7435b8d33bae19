package com.lifebutler.assistant.model;

import java.time.Duration;

/**
 * Outcome of processing one query. The set of kinds is closed so that every consumer
 * (formatting, HTTP mapping) has to handle all of them.
 */
public sealed interface ProcessingResult permits CalculationResult, RetrievalResult, HybridResult {

    String getQuery();

    Duration getProcessingTime();

    double getConfidence();

    ProcessingPath getProcessingPath();
}
