package com.lifebutler.assistant.service;

import com.lifebutler.assistant.TestRecords;
import com.lifebutler.assistant.model.QueryContext;
import com.lifebutler.assistant.model.QueryIntent;
import com.lifebutler.assistant.model.TimePeriod;
import com.lifebutler.assistant.model.TimeRange;
import com.lifebutler.assistant.repository.DomainRecordRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

class KeywordQueryPlannerTest {

    private final KeywordQueryPlanner planner = new KeywordQueryPlanner(TestRecords.FIXED_CLOCK);

    @Test
    @DisplayName("plan() should fill every part of the context")
    void plansFullContext() {
        QueryContext context = planner.plan("How much did I spend on food this month?");

        assertThat(context.getOriginalQuery()).isEqualTo("How much did I spend on food this month?");
        assertThat(context.getTargetDomains())
                .containsExactly(DomainRecordRepository.MEALS, DomainRecordRepository.FINANCE);
        assertThat(context.getTimeRange().getPeriod()).isEqualTo(TimePeriod.THIS_MONTH);
        assertThat(context.getKeywords()).contains("spend", "food", "month");
        assertThat(context.getIntent()).isEqualTo(QueryIntent.SEARCH);
    }

    @Test
    void unmatchedQueryTargetsAllDomains() {
        assertThat(planner.identifyTargetDomains("Why am I always tired?"))
                .hasSize(DomainRecordRepository.ALL_DOMAINS.size());
    }

    @ParameterizedTest
    @CsvSource({
            "How should I budget better?, ADVICE",
            "Analyze my sleep pattern, ANALYSIS",
            "Coffee versus tea, COMPARISON",
            "Give me a summary of October, SUMMARY",
            "Where did I eat on Friday, SEARCH"
    })
    void identifiesIntent(String query, QueryIntent expected) {
        assertThat(planner.identifyIntent(query)).isEqualTo(expected);
    }

    @Nested
    @DisplayName("extractTimeRange()")
    class TimeRanges {

        @Test
        @DisplayName("should resolve named periods against the clock")
        void namedPeriods() {
            TimeRange lastWeek = planner.extractTimeRange("what did I eat last week");

            assertThat(lastWeek.getStart()).isEqualTo(LocalDateTime.of(2026, 10, 12, 0, 0));
            assertThat(lastWeek.getEffectiveEnd()).isEqualTo(LocalDateTime.of(2026, 10, 19, 0, 0));
        }

        @Test
        @DisplayName("should understand Chinese periods")
        void chinesePeriods() {
            assertThat(planner.extractTimeRange("上个月花了多少钱").getPeriod()).isEqualTo(TimePeriod.LAST_MONTH);
            assertThat(planner.extractTimeRange("这周吃了什么").getPeriod()).isEqualTo(TimePeriod.THIS_WEEK);
        }

        @Test
        @DisplayName("should take a four digit year as the whole year")
        void explicitYear() {
            TimeRange range = planner.extractTimeRange("trips in 2024");

            assertThat(range.getStart()).isEqualTo(LocalDateTime.of(2024, 1, 1, 0, 0));
            assertThat(range.getEnd()).isEqualTo(LocalDateTime.of(2025, 1, 1, 0, 0));
        }

        @Test
        @DisplayName("should treat recent as this month")
        void recent() {
            assertThat(planner.extractTimeRange("how have I slept lately").getPeriod()).isEqualTo(TimePeriod.THIS_MONTH);
        }

        @Test
        @DisplayName("should count back N days from now")
        void pastDays() {
            TimeRange range = planner.extractTimeRange("meals in the past 10 days");

            assertThat(range.getStart()).isEqualTo(LocalDateTime.of(2026, 10, 9, 12, 0));
            assertThat(range.getEnd()).isEqualTo(LocalDateTime.of(2026, 10, 19, 12, 0));
        }

        @Test
        @DisplayName("should leave the range open when no time is mentioned")
        void none() {
            assertThat(planner.extractTimeRange("tell me about my friends")).isNull();
        }
    }

    @Test
    void extractsFilters() {
        assertThat(planner.extractFilters("takeout dinner costs"))
                .containsEntry(DataAggregator.FILTER_MEAL_TYPE, "dinner")
                .containsEntry(DataAggregator.FILTER_CATEGORY, "takeout");
        assertThat(planner.extractFilters("my sleep")).containsEntry(DataAggregator.FILTER_METRIC_TYPE, "sleep");
    }

    @Test
    void keywordsDropShortAndStopWords() {
        assertThat(planner.extractKeywords("What was the cost of my gym?"))
                .containsExactly("cost", "gym");
    }
}
