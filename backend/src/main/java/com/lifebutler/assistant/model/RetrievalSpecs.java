package com.lifebutler.assistant.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class RetrievalSpecs {

    @Singular
    List<String> searchTerms;

    @Builder.Default
    ContextNeeds contextNeeds = ContextNeeds.MODERATE;

    @Builder.Default
    GenerationType generationType = GenerationType.FACTUAL;

    @Singular("focusDomain")
    List<String> domainFocus;

    TimeRange timeRange;
}
