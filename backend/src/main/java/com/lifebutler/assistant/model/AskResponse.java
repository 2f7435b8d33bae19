package com.lifebutler.assistant.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AskResponse {

    private String answer;

    private String processingPath;

    private Double confidence;

    private Long processingTimeMs;

    private Map<String, Object> calculations;

    private List<SourceCitation> sources;
}
