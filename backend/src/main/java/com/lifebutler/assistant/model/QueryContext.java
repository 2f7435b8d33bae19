package com.lifebutler.assistant.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Planner output for one query. Read-only input to the classifier and spec builders.
 */
@Value
@Builder(toBuilder = true)
public class QueryContext {

    String originalQuery;

    @Builder.Default
    QueryIntent intent = QueryIntent.SEARCH;

    @Singular
    List<String> keywords;

    TimeRange timeRange;

    @Singular
    Map<String, Object> filters;

    @Singular
    List<String> targetDomains;

    public boolean isAdviceQuery() {
        return intent == QueryIntent.ADVICE;
    }

    public boolean isCrossDomain() {
        return targetDomains.size() > 1;
    }
}
