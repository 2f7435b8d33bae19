package com.lifebutler.assistant.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.List;

@Value
@Builder
public class RetrievalResult implements ProcessingResult {

    String query;

    Duration processingTime;

    double confidence;

    String response;

    @Singular
    List<SourceCitation> sources;

    GenerationType generationType;

    String advice;

    @Override
    public ProcessingPath getProcessingPath() {
        return ProcessingPath.RETRIEVAL;
    }
}
