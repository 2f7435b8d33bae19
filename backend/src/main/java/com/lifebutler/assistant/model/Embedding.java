package com.lifebutler.assistant.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Vector for one chunk of a record. {@code objectType}/{@code objectId} point back at the owning
 * record; deleting the record deletes its embeddings.
 */
@Value
@Builder
public class Embedding {

    String id;

    String objectType;

    String objectId;

    String chunkText;

    List<Double> vector;

    LocalDateTime createdAt;
}
