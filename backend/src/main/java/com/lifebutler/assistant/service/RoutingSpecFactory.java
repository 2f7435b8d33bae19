package com.lifebutler.assistant.service;

import com.lifebutler.assistant.model.AggregationType;
import com.lifebutler.assistant.model.CalculationOperation;
import com.lifebutler.assistant.model.CalculationSpecs;
import com.lifebutler.assistant.model.ContextNeeds;
import com.lifebutler.assistant.model.GenerationType;
import com.lifebutler.assistant.model.QueryContext;
import com.lifebutler.assistant.model.QueryIntent;
import com.lifebutler.assistant.model.RetrievalSpecs;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Turns a routed query into the work orders for the calculation and retrieval paths.
 */
@Component
public class RoutingSpecFactory {

    // whole words only: "summary" is not a sum, "account" is not a count
    private static final Pattern SUM_WORDS =
            anyOf("totals?", "sum", "how much", "spend(?:s|ing)?", "spent", "costs?", "expenses?", "paid");
    private static final Pattern AVERAGE_WORDS = anyOf("average", "mean");
    private static final Pattern COUNT_WORDS = anyOf("counts?", "numbers?");
    private static final Pattern TREND_WORDS = anyOf("trends?", "patterns?", "over time");
    private static final Pattern GROUPING_WORDS = anyOf("by category", "group(?:s|ed)?", "breakdown");

    private static final Pattern BY_CATEGORY = anyOf("by category");
    private static final Pattern BY_DAY = anyOf("by day", "daily");
    private static final Pattern BY_WEEK = anyOf("by week", "weekly");
    private static final Pattern BY_MONTH = anyOf("by month", "monthly");

    private static final List<String> NARRATIVE_PATTERNS = List.of(
            "why am i", "why do i", "why is", "how am i", "how do i",
            "what is causing", "what makes", "explain why", "tell me why");

    public CalculationSpecs calculationSpecs(String query, QueryContext context) {
        String lower = query.toLowerCase(Locale.ROOT);
        CalculationSpecs.CalculationSpecsBuilder specs = CalculationSpecs.builder()
                .filters(context.getFilters())
                .timeRange(context.getTimeRange());

        boolean any = false;
        if (SUM_WORDS.matcher(lower).find()) {
            specs.operation(CalculationOperation.SUM).aggregation(AggregationType.SUM);
            any = true;
        }
        if (AVERAGE_WORDS.matcher(lower).find()) {
            specs.operation(CalculationOperation.AVERAGE).aggregation(AggregationType.AVERAGE);
            any = true;
        }
        if (COUNT_WORDS.matcher(lower).find()) {
            specs.operation(CalculationOperation.COUNT).aggregation(AggregationType.COUNT);
            any = true;
        }
        if (TREND_WORDS.matcher(lower).find()) {
            specs.operation(CalculationOperation.TREND).aggregation(AggregationType.TREND);
            any = true;
        }
        if (GROUPING_WORDS.matcher(lower).find()) {
            specs.operation(CalculationOperation.GROUPING).aggregation(AggregationType.GROUP_BY);
            any = true;
        }
        if (!any) {
            specs.operation(CalculationOperation.SUM).aggregation(AggregationType.SUM);
        }

        if (BY_CATEGORY.matcher(lower).find()) {
            specs.groupByKey("category");
        }
        if (BY_DAY.matcher(lower).find()) {
            specs.groupByKey("day");
        }
        if (BY_WEEK.matcher(lower).find()) {
            specs.groupByKey("week");
        }
        if (BY_MONTH.matcher(lower).find()) {
            specs.groupByKey("month");
        }
        return specs.build();
    }

    public RetrievalSpecs retrievalSpecs(String query, QueryContext context) {
        String lower = query.toLowerCase(Locale.ROOT);
        return RetrievalSpecs.builder()
                .searchTerms(context.getKeywords())
                .contextNeeds(contextNeeds(lower, context.getIntent()))
                .generationType(generationType(lower, context.getIntent()))
                .domainFocus(context.getTargetDomains())
                .timeRange(context.getTimeRange())
                .build();
    }

    ContextNeeds contextNeeds(String lowerQuery, QueryIntent intent) {
        if (intent == QueryIntent.ADVICE || lowerQuery.contains("detail") || lowerQuery.contains("comprehensive")) {
            return ContextNeeds.EXTENSIVE;
        }
        if (intent == QueryIntent.COMPARISON || lowerQuery.contains("compare") || lowerQuery.contains(" vs ")) {
            return ContextNeeds.COMPARATIVE;
        }
        if (lowerQuery.contains("history") || lowerQuery.contains("over time")) {
            return ContextNeeds.HISTORICAL;
        }
        if (intent == QueryIntent.SUMMARY || lowerQuery.contains("summary") || lowerQuery.contains("brief")) {
            return ContextNeeds.MINIMAL;
        }
        return ContextNeeds.MODERATE;
    }

    GenerationType generationType(String lowerQuery, QueryIntent intent) {
        if (intent == QueryIntent.ADVICE) {
            return GenerationType.ADVISORY;
        }
        if (containsAny(lowerQuery, NARRATIVE_PATTERNS)) {
            return GenerationType.NARRATIVE;
        }
        if (intent == QueryIntent.ANALYSIS) {
            return GenerationType.ANALYTICAL;
        }
        if (intent == QueryIntent.SUMMARY) {
            return GenerationType.SUMMARY;
        }
        return GenerationType.FACTUAL;
    }

    private static Pattern anyOf(String... phrases) {
        return Pattern.compile("\\b(?:" + String.join("|", phrases) + ")\\b");
    }

    private static boolean containsAny(String text, List<String> needles) {
        for (String needle : needles) {
            if (text.contains(needle)) {
                return true;
            }
        }
        return false;
    }
}
