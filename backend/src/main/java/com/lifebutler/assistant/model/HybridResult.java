package com.lifebutler.assistant.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

@Value
@Builder
public class HybridResult implements ProcessingResult {

    String query;

    Duration processingTime;

    double confidence;

    CalculationResult calculationResult;

    RetrievalResult retrievalResult;

    String synthesis;

    @Override
    public ProcessingPath getProcessingPath() {
        return ProcessingPath.HYBRID;
    }
}
