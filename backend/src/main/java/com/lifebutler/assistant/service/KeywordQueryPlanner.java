package com.lifebutler.assistant.service;

import com.lifebutler.assistant.model.QueryContext;
import com.lifebutler.assistant.model.QueryIntent;
import com.lifebutler.assistant.model.TimePeriod;
import com.lifebutler.assistant.model.TimeRange;
import com.lifebutler.assistant.repository.DomainRecordRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Keyword-driven planner. Domains, intent, time range and filters are all decided by
 * substring matches on the lowercased question.
 */
@Component
@Slf4j
public class KeywordQueryPlanner implements QueryPlanner {

    private static final Map<String, List<String>> DOMAIN_KEYWORDS = new LinkedHashMap<>();

    static {
        DOMAIN_KEYWORDS.put(DomainRecordRepository.EVENTS, List.of("event", "happened", "occurred", "celebration", "meeting"));
        DOMAIN_KEYWORDS.put(DomainRecordRepository.EDUCATION, List.of("school", "university", "degree", "course", "study", "learn", "education"));
        DOMAIN_KEYWORDS.put(DomainRecordRepository.CAREER, List.of("work", "job", "career", "company", "project", "achievement"));
        DOMAIN_KEYWORDS.put(DomainRecordRepository.MEALS, List.of("eat", "food", "meal", "breakfast", "lunch", "dinner", "restaurant", "cooking"));
        DOMAIN_KEYWORDS.put(DomainRecordRepository.JOURNALS, List.of("journal", "diary", "thought", "reflection", "mood", "feeling"));
        DOMAIN_KEYWORDS.put(DomainRecordRepository.HEALTH, List.of("health", "weight", "exercise", "sleep", "fitness", "wellness"));
        DOMAIN_KEYWORDS.put(DomainRecordRepository.FINANCE, List.of("money", "spend", "cost", "expense", "income", "budget", "financial"));
        DOMAIN_KEYWORDS.put(DomainRecordRepository.TASKS, List.of("task", "habit", "routine", "goal", "todo", "productivity"));
        DOMAIN_KEYWORDS.put(DomainRecordRepository.RELATIONS, List.of("friend", "family", "relationship", "social", "people", "contact"));
        DOMAIN_KEYWORDS.put(DomainRecordRepository.MEDIA, List.of("read", "watch", "movie", "book", "music", "podcast", "media"));
        DOMAIN_KEYWORDS.put(DomainRecordRepository.TRAVEL, List.of("travel", "trip", "vacation", "visit", "journey", "destination"));
    }

    private static final List<String> ADVICE_KEYWORDS = List.of(
            "how should", "what should", "recommend", "suggest", "advice",
            "help me", "plan", "improve", "optimize", "better", "strategy");
    private static final List<String> ANALYSIS_KEYWORDS = List.of(
            "analyze", "pattern", "trend", "correlation", "relationship",
            "compare", "difference", "change", "over time", "statistics");
    private static final List<String> COMPARISON_KEYWORDS = List.of(
            "vs", "versus", "compared to", "difference between",
            "better than", "worse than", "more than", "less than");
    private static final List<String> SUMMARY_KEYWORDS = List.of(
            "summarize", "summary", "overview", "total", "average",
            "most", "least", "top", "bottom");

    private static final Set<String> STOP_WORDS = Set.of(
            "the", "and", "but", "for", "with", "are", "was", "were", "been", "have", "has", "had",
            "does", "did", "will", "would", "could", "should", "may", "might", "can", "this", "that",
            "these", "those", "what", "how", "when", "where", "why", "who", "which", "you", "your",
            "most", "about");

    private static final Pattern YEAR = Pattern.compile("(?:in |during |year )?(\\d{4})");
    private static final Pattern PAST_DAYS = Pattern.compile("(?:past|last) (\\d+) days?");
    private static final Pattern PAST_WEEKS = Pattern.compile("(?:past|last) (\\d+) weeks?");
    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}_\\s]");

    private final Clock clock;

    public KeywordQueryPlanner(Clock clock) {
        this.clock = clock;
    }

    @Override
    public QueryContext plan(String query) {
        String text = query != null ? query : "";
        QueryContext context = QueryContext.builder()
                .originalQuery(text)
                .intent(identifyIntent(text))
                .targetDomains(identifyTargetDomains(text))
                .timeRange(extractTimeRange(text))
                .keywords(extractKeywords(text))
                .filters(extractFilters(text))
                .build();
        log.debug("Planned query: intent={}, domains={}, timeRange={}, filters={}",
                context.getIntent(), context.getTargetDomains(), context.getTimeRange(), context.getFilters());
        return context;
    }

    List<String> identifyTargetDomains(String query) {
        String lower = query.toLowerCase(Locale.ROOT);
        List<String> domains = new ArrayList<>();
        DOMAIN_KEYWORDS.forEach((domain, keywords) -> {
            if (containsAny(lower, keywords)) {
                domains.add(domain);
            }
        });
        return domains.isEmpty() ? new ArrayList<>(DOMAIN_KEYWORDS.keySet()) : domains;
    }

    QueryIntent identifyIntent(String query) {
        String lower = query.toLowerCase(Locale.ROOT);
        if (containsAny(lower, ADVICE_KEYWORDS)) {
            return QueryIntent.ADVICE;
        }
        if (containsAny(lower, ANALYSIS_KEYWORDS)) {
            return QueryIntent.ANALYSIS;
        }
        if (containsAny(lower, COMPARISON_KEYWORDS)) {
            return QueryIntent.COMPARISON;
        }
        if (containsAny(lower, SUMMARY_KEYWORDS)) {
            return QueryIntent.SUMMARY;
        }
        return QueryIntent.SEARCH;
    }

    TimeRange extractTimeRange(String query) {
        String lower = query.toLowerCase(Locale.ROOT);

        if (lower.contains("today") || lower.contains("今天")) {
            return TimeRange.forPeriod(TimePeriod.TODAY, clock);
        }
        if (lower.contains("this week") || lower.contains("本周") || lower.contains("这周")) {
            return TimeRange.forPeriod(TimePeriod.THIS_WEEK, clock);
        }
        if (lower.contains("last week") || lower.contains("上周")) {
            return TimeRange.forPeriod(TimePeriod.LAST_WEEK, clock);
        }
        if (lower.contains("this month") || lower.contains("这个月") || lower.contains("本月")) {
            return TimeRange.forPeriod(TimePeriod.THIS_MONTH, clock);
        }
        if (lower.contains("last month") || lower.contains("上个月")) {
            return TimeRange.forPeriod(TimePeriod.LAST_MONTH, clock);
        }
        if (lower.contains("this year") || lower.contains("今年")) {
            return TimeRange.forPeriod(TimePeriod.THIS_YEAR, clock);
        }
        if (lower.contains("last year") || lower.contains("去年")) {
            return TimeRange.forPeriod(TimePeriod.LAST_YEAR, clock);
        }

        Matcher year = YEAR.matcher(lower);
        if (year.find()) {
            int value = Integer.parseInt(year.group(1));
            return TimeRange.between(LocalDate.of(value, 1, 1).atStartOfDay(),
                    LocalDate.of(value + 1, 1, 1).atStartOfDay());
        }

        if (lower.contains("recent") || lower.contains("lately") || lower.contains("最近")) {
            return TimeRange.forPeriod(TimePeriod.THIS_MONTH, clock);
        }

        LocalDateTime now = LocalDateTime.now(clock);
        Matcher days = PAST_DAYS.matcher(lower);
        if (days.find()) {
            return TimeRange.between(now.minusDays(Long.parseLong(days.group(1))), now);
        }
        Matcher weeks = PAST_WEEKS.matcher(lower);
        if (weeks.find()) {
            return TimeRange.between(now.minusWeeks(Long.parseLong(weeks.group(1))), now);
        }
        return null;
    }

    List<String> extractKeywords(String query) {
        List<String> keywords = new ArrayList<>();
        String cleaned = NON_WORD.matcher(query.toLowerCase(Locale.ROOT)).replaceAll(" ");
        for (String word : cleaned.split("\\s+")) {
            if (word.length() > 2 && !STOP_WORDS.contains(word)) {
                keywords.add(word);
            }
        }
        return keywords;
    }

    Map<String, Object> extractFilters(String query) {
        String lower = query.toLowerCase(Locale.ROOT);
        Map<String, Object> filters = new LinkedHashMap<>();

        // dinner over lunch over breakfast when several appear
        for (String mealType : List.of("breakfast", "lunch", "dinner")) {
            if (lower.contains(mealType)) {
                filters.put(DataAggregator.FILTER_MEAL_TYPE, mealType);
            }
        }
        if (lower.contains("外卖") || lower.contains("takeout") || lower.contains("delivery")) {
            filters.put(DataAggregator.FILTER_CATEGORY, "takeout");
        }
        if (lower.contains("weight")) {
            filters.put(DataAggregator.FILTER_METRIC_TYPE, "weight");
        }
        if (lower.contains("sleep")) {
            filters.put(DataAggregator.FILTER_METRIC_TYPE, "sleep");
        }
        return filters;
    }

    private static boolean containsAny(String text, List<String> keywords) {
        for (String keyword : keywords) {
            if (text.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
