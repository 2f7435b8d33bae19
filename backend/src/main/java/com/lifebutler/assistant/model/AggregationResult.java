package com.lifebutler.assistant.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class AggregationResult {

    double value;

    @Singular
    List<DataPoint> dataPoints;

    @Singular("metadataEntry")
    Map<String, Object> metadata;

    public static AggregationResult empty(String aggregationType) {
        return AggregationResult.builder()
                .value(0.0)
                .metadataEntry("aggregation_type", aggregationType)
                .metadataEntry("record_count", 0)
                .build();
    }
}
