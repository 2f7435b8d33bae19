package com.lifebutler.assistant.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tunables for routing, retrieval and ingestion. Defaults mirror application.yml so that
 * components built by hand in tests behave like the running service.
 */
@Data
@ConfigurationProperties(prefix = "assistant")
public class AssistantProperties {

    private Routing routing = new Routing();
    private Rag rag = new Rag();
    private EmbeddingSettings embedding = new EmbeddingSettings();
    private Processor processor = new Processor();
    private DataSettings data = new DataSettings();

    @Data
    public static class Routing {
        private double ruleWeight = 0.4;
        private double semanticWeight = 0.3;
        private double llmWeight = 0.3;
        private double dataMissingWeight = 0.2;
        private double hybridThreshold = 0.5;
        private double highConfidenceThreshold = 0.8;
        /** Raw (unnormalized) keyword score both sides must exceed to call a query mixed. */
        private double mixedRawScoreThreshold = 1.0;
        private double ruleScoreDivisor = 5.0;
        private double reminderScoreDivisor = 3.0;
        private double semanticBaseThreshold = 0.53;
        private double semanticLengthAdjustment = 0.02;
        private double semanticMinThreshold = 0.4;
        private double semanticMaxThreshold = 0.7;
        private double fallbackConfidence = 0.3;
        private double heuristicLlmConfidence = 0.7;
    }

    @Data
    public static class Rag {
        private int chunkMaxTokens = 512;
        private int chunkOverlapTokens = 50;
        private double minScore = 0.1;
        private int answerSearchLimit = 10;
        private int maxContextChars = 4000;
        private double temperature = 0.7;
        private int fallbackResultCount = 5;
    }

    @Data
    public static class EmbeddingSettings {
        private int batchSize = 5;
        private long batchDelayMs = 100;
        private boolean rebuildOnStartup = false;
    }

    @Data
    public static class Processor {
        private int poolSize = 4;
        private double calculationConfidence = 0.9;
    }

    @Data
    public static class DataSettings {
        /** Classpath or file path of a JSON array of domain records to preload. Empty disables seeding. */
        private String seedFile = "";
    }
}
