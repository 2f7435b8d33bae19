package com.lifebutler.assistant.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.List;

@Value
@Builder
public class SearchFilters {

    public static final SearchFilters NONE = SearchFilters.builder().build();

    @Singular
    List<String> objectTypes;

    LocalDateTime startDate;

    LocalDateTime endDate;

    public static SearchFilters of(List<String> objectTypes, TimeRange timeRange) {
        SearchFiltersBuilder builder = SearchFilters.builder();
        if (objectTypes != null) {
            builder.objectTypes(objectTypes);
        }
        if (timeRange != null) {
            builder.startDate(timeRange.getStart()).endDate(timeRange.getEffectiveEnd());
        }
        return builder.build();
    }
}
