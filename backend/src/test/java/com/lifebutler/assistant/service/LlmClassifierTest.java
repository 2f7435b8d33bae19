package com.lifebutler.assistant.service;

import com.lifebutler.assistant.TestRecords;
import com.lifebutler.assistant.client.ChatCompleter;
import com.lifebutler.assistant.config.AssistantProperties;
import com.lifebutler.assistant.model.IntentType;
import com.lifebutler.assistant.model.LlmClassification;
import com.lifebutler.assistant.model.QueryContext;
import com.lifebutler.assistant.model.TimePeriod;
import com.lifebutler.assistant.model.TimeRange;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LlmClassifierTest {

    @Mock private ChatCompleter chatCompleter;

    private final AssistantProperties properties = new AssistantProperties();

    private static QueryContext context(String query) {
        return QueryContext.builder()
                .originalQuery(query)
                .targetDomain("journals")
                .timeRange(TimeRange.forPeriod(TimePeriod.THIS_MONTH, TestRecords.FIXED_CLOCK))
                .build();
    }

    @Nested
    @DisplayName("with a chat provider")
    class WithModel {

        @Test
        @DisplayName("should parse the JSON verdict, ignoring text around it")
        void parsesVerdict() {
            when(chatCompleter.chat(anyList(), anyDouble())).thenReturn(
                    "Sure! {\"intent\": \"Aggregate\", \"confidence\": 0.92, \"reason\": \"asks for a sum\","
                            + " \"slots\": {\"operation\": \"sum\"}} Hope that helps.");
            LlmClassifier classifier = new LlmClassifier(Optional.of(chatCompleter), properties);

            LlmClassification result = classifier.classify("total coffee spend", context("total coffee spend"));

            assertThat(result.getIntent()).isEqualTo(IntentType.AGGREGATE);
            assertThat(result.getConfidence()).isEqualTo(0.92);
            assertThat(result.getSlots()).containsEntry("operation", "sum");
            assertThat(result.isModelBacked()).isTrue();
        }

        @Test
        @DisplayName("should fall back to the heuristic on an unknown intent")
        void unknownIntent() {
            when(chatCompleter.chat(anyList(), anyDouble())).thenReturn("{\"intent\": \"weather\", \"confidence\": 1}");
            LlmClassifier classifier = new LlmClassifier(Optional.of(chatCompleter), properties);

            LlmClassification result = classifier.classify("what is up", context("what is up"));

            assertThat(result.isModelBacked()).isFalse();
            assertThat(result.getIntent()).isEqualTo(IntentType.RETRIEVAL);
        }

        @Test
        @DisplayName("should fall back to the heuristic when the call fails")
        void callFails() {
            when(chatCompleter.chat(anyList(), anyDouble())).thenThrow(new RuntimeException("connection refused"));
            LlmClassifier classifier = new LlmClassifier(Optional.of(chatCompleter), properties);

            LlmClassification result = classifier.classify("how much on coffee", context("how much on coffee"));

            assertThat(result.isModelBacked()).isFalse();
            assertThat(result.getIntent()).isEqualTo(IntentType.AGGREGATE);
        }
    }

    @Nested
    @DisplayName("keyword heuristic")
    class Heuristic {

        private final LlmClassifier classifier = new LlmClassifier(Optional.empty(), properties);

        @Test
        @DisplayName("should read quantity words as a finance sum")
        void quantity() {
            LlmClassification result = classifier.classify("How much was it", context("How much was it"));

            assertThat(result.getIntent()).isEqualTo(IntentType.AGGREGATE);
            assertThat(result.getConfidence()).isEqualTo(0.7);
            assertThat(result.getSlots())
                    .containsEntry("operation", "sum")
                    .containsEntry("domain", "finance")
                    .containsEntry("timeframe", "this month");
        }

        @Test
        @DisplayName("should read explain words as descriptive retrieval")
        void descriptive() {
            LlmClassification result = classifier.classify("Explain my mood", context("Explain my mood"));

            assertThat(result.getIntent()).isEqualTo(IntentType.RETRIEVAL);
            assertThat(result.getSlots())
                    .containsEntry("searchType", "descriptive")
                    .containsEntry("domains", List.of("journals"));
        }

        @Test
        @DisplayName("should default to retrieval")
        void defaultsToRetrieval() {
            LlmClassification result = classifier.classify("hello there", context("hello there"));

            assertThat(result.getIntent()).isEqualTo(IntentType.RETRIEVAL);
            assertThat(result.getReason()).isEqualTo("Default to retrieval for unclear queries");
            assertThat(result.getSlots()).isEmpty();
        }
    }
}
