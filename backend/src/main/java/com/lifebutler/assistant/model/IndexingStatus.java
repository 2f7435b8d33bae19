package com.lifebutler.assistant.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class IndexingStatus {

    int totalEmbeddings;

    Map<String, Integer> embeddingsByType;

    Map<String, Integer> domainDataCounts;

    boolean indexingComplete;

    EmbeddingState state;
}
