package com.lifebutler.assistant.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * One record's contribution to an aggregation. Built per call, never persisted.
 */
@Value
@Builder
public class DataPoint {

    String id;

    double value;

    String description;

    LocalDateTime timestamp;

    String category;

    Map<String, Object> metadata;
}
