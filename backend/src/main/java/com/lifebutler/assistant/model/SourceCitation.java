package com.lifebutler.assistant.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

@Value
@Builder
public class SourceCitation {

    String id;

    String title;

    String type;

    LocalDateTime timestamp;

    Double relevanceScore;

    String snippet;
}
