package com.lifebutler.assistant.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class CalculationSpecs {

    @Singular
    List<CalculationOperation> operations;

    @Singular
    List<AggregationType> aggregations;

    @Singular
    Map<String, Object> filters;

    TimeRange timeRange;

    @Singular("groupByKey")
    List<String> groupBy;
}
