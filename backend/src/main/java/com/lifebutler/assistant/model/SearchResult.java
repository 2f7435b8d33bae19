package com.lifebutler.assistant.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SearchResult {

    String id;

    String text;

    String objectType;

    String objectId;

    /** Cosine similarity in [-1, 1]. */
    double similarity;
}
