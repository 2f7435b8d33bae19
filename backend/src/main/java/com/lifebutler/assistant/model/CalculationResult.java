package com.lifebutler.assistant.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.List;
import java.util.Map;

@Value
@Builder(toBuilder = true)
public class CalculationResult implements ProcessingResult {

    String query;

    Duration processingTime;

    double confidence;

    /** Ordered: Total, Average, Count, ... in the order they were requested. */
    @Singular
    Map<String, Object> calculations;

    @Singular
    Map<String, Object> aggregations;

    @Singular
    List<DataPoint> dataPoints;

    /** Natural-language explanation of the numbers, generated or rule-based. */
    String explanation;

    @Override
    public ProcessingPath getProcessingPath() {
        return ProcessingPath.CALCULATION;
    }
}
