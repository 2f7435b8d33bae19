package com.lifebutler.assistant.service;

import com.lifebutler.assistant.model.AggregationResult;
import com.lifebutler.assistant.model.DataPoint;
import com.lifebutler.assistant.model.DomainRecord;
import com.lifebutler.assistant.model.NutritionAnalysis;
import com.lifebutler.assistant.model.SpendingAnalysis;
import com.lifebutler.assistant.model.TimeRange;
import com.lifebutler.assistant.model.TrendPoint;
import com.lifebutler.assistant.repository.DomainRecordRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Numeric aggregations over domain records. Filters are a loose map:
 * <ul>
 *   <li>{@code type}: finance record type to sum; without it only expenses are summed</li>
 *   <li>{@code category}: finance category</li>
 *   <li>{@code include_meals}: also add meal calories to a sum</li>
 *   <li>{@code domains}: what to count (finance, meals, events, journals, health)</li>
 *   <li>{@code meal_type}, {@code metric_type}: meal and health sub-filters</li>
 * </ul>
 */
@Service
@Slf4j
public class DataAggregator {

    public static final String FILTER_TYPE = "type";
    public static final String FILTER_CATEGORY = "category";
    public static final String FILTER_INCLUDE_MEALS = "include_meals";
    public static final String FILTER_DOMAINS = "domains";
    public static final String FILTER_MEAL_TYPE = "meal_type";
    public static final String FILTER_METRIC_TYPE = "metric_type";

    static final String EXPENSE = "expense";
    static final String OTHER_CATEGORY = "other";
    static final List<String> DEFAULT_COUNT_DOMAINS = List.of("finance", "meals", "events", "journals", "health");

    private final DomainRecordRepository repository;

    public DataAggregator(DomainRecordRepository repository) {
        this.repository = repository;
    }

    public AggregationResult calculateSum(Map<String, Object> filters, TimeRange timeRange) {
        Map<String, Object> safeFilters = filters != null ? filters : Map.of();
        String requestedType = stringFilter(safeFilters, FILTER_TYPE);
        String sumType = requestedType != null ? requestedType : EXPENSE;

        double total = 0.0;
        List<DataPoint> dataPoints = new ArrayList<>();

        for (DomainRecord record : financeRecords(safeFilters, timeRange)) {
            String type = record.stringField("type");
            if (!sumType.equals(type)) {
                continue;
            }
            double amount = amountOf(record);
            total += amount;
            dataPoints.add(financePoint(record, amount, amount));
        }

        if (isTrue(safeFilters.get(FILTER_INCLUDE_MEALS))) {
            for (DomainRecord meal : meals(safeFilters, timeRange)) {
                Double calories = meal.numberField("caloriesInt");
                if (calories == null) {
                    continue;
                }
                total += calories;
                dataPoints.add(DataPoint.builder()
                        .id(meal.getId())
                        .value(calories)
                        .description("Meal: " + meal.stringField("name") + " - " + calories.intValue() + " calories")
                        .timestamp(meal.getTimestamp())
                        .category("nutrition")
                        .metadata(metadata("type", "calories", "location", meal.stringField("location")))
                        .build());
            }
        }

        log.debug("Sum over {} data points = {}", dataPoints.size(), total);
        return AggregationResult.builder()
                .value(total)
                .dataPoints(dataPoints)
                .metadataEntry("aggregation_type", "sum")
                .metadataEntry("record_count", dataPoints.size())
                .metadataEntry("time_range", describe(timeRange))
                .build();
    }

    public AggregationResult calculateAverage(Map<String, Object> filters, TimeRange timeRange) {
        AggregationResult sum = calculateSum(filters, timeRange);
        if (sum.getDataPoints().isEmpty()) {
            return AggregationResult.empty("average");
        }
        return AggregationResult.builder()
                .value(sum.getValue() / sum.getDataPoints().size())
                .dataPoints(sum.getDataPoints())
                .metadataEntry("aggregation_type", "average")
                .metadataEntry("total", sum.getValue())
                .metadataEntry("record_count", sum.getDataPoints().size())
                .metadataEntry("time_range", describe(timeRange))
                .build();
    }

    public AggregationResult calculateCount(Map<String, Object> filters, TimeRange timeRange) {
        Map<String, Object> safeFilters = filters != null ? filters : Map.of();
        List<String> domains = domainsFilter(safeFilters);
        List<DataPoint> dataPoints = new ArrayList<>();

        for (String domain : domains) {
            switch (domain) {
                case "finance":
                    for (DomainRecord record : financeRecords(safeFilters, timeRange)) {
                        dataPoints.add(financePoint(record, amountOf(record), 1.0));
                    }
                    break;
                case "meals":
                    for (DomainRecord meal : meals(safeFilters, timeRange)) {
                        dataPoints.add(countPoint(meal, "Meal: " + meal.stringField("name"), "nutrition"));
                    }
                    break;
                case "events":
                    for (DomainRecord event : repository.findByDomain(DomainRecordRepository.EVENTS, start(timeRange), end(timeRange))) {
                        dataPoints.add(countPoint(event, "Event: " + event.stringField("title"), "event"));
                    }
                    break;
                case "journals":
                    for (DomainRecord journal : repository.findByDomain(DomainRecordRepository.JOURNALS, start(timeRange), end(timeRange))) {
                        dataPoints.add(countPoint(journal, "Journal entry", "journal"));
                    }
                    break;
                case "health":
                    for (DomainRecord metric : healthMetrics(safeFilters, timeRange)) {
                        dataPoints.add(countPoint(metric, "Health: " + metric.stringField("metricType") + " - "
                                + metric.stringField("valueNum") + " " + Objects.toString(metric.stringField("unit"), ""), "health"));
                    }
                    break;
                default:
                    log.debug("Ignoring unknown count domain '{}'", domain);
            }
        }

        return AggregationResult.builder()
                .value(dataPoints.size())
                .dataPoints(dataPoints)
                .metadataEntry("aggregation_type", "count")
                .metadataEntry("domains", domains)
                .metadataEntry("record_count", dataPoints.size())
                .build();
    }

    /**
     * Expense totals keyed by category; records without a category count as "other".
     */
    public Map<String, Double> calculateSpendingByCategory(TimeRange timeRange) {
        Map<String, Double> byCategory = new LinkedHashMap<>();
        for (DomainRecord record : financeRecords(Map.of(FILTER_TYPE, EXPENSE), timeRange)) {
            String category = record.stringField("category");
            byCategory.merge(category != null ? category : OTHER_CATEGORY, amountOf(record), Double::sum);
        }
        return byCategory;
    }

    /**
     * {@code daily_spending} and {@code daily_calories}, each averaged over the days between its
     * own first and last record (inclusive). A series with no records is left out.
     */
    public Map<String, Double> calculateDailyAverages(TimeRange timeRange) {
        Map<String, Double> averages = new HashMap<>();

        List<DomainRecord> expenses = financeRecords(Map.of(FILTER_TYPE, EXPENSE), timeRange);
        if (!expenses.isEmpty()) {
            double total = expenses.stream().mapToDouble(this::amountOf).sum();
            averages.put("daily_spending", total / dayCount(expenses));
        }

        List<DomainRecord> mealsWithCalories = meals(Map.of(), timeRange).stream()
                .filter(meal -> meal.numberField("caloriesInt") != null)
                .collect(Collectors.toList());
        if (!mealsWithCalories.isEmpty()) {
            double calories = mealsWithCalories.stream().mapToDouble(meal -> meal.numberField("caloriesInt")).sum();
            averages.put("daily_calories", calories / dayCount(mealsWithCalories));
        }
        return averages;
    }

    /**
     * @param metric "spending" (expense amounts) or "meals" (meal counts)
     * @param period "daily", "weekly" (Monday start) or "monthly"
     */
    public List<TrendPoint> calculateTrends(String metric, String period, TimeRange timeRange) {
        Map<LocalDate, List<Double>> buckets = new TreeMap<>();
        String normalizedMetric = metric != null ? metric.toLowerCase(Locale.ROOT) : "";

        if ("spending".equals(normalizedMetric)) {
            for (DomainRecord record : financeRecords(Map.of(FILTER_TYPE, EXPENSE), timeRange)) {
                if (record.getTimestamp() != null) {
                    buckets.computeIfAbsent(bucketStart(record.getTimestamp(), period), key -> new ArrayList<>())
                            .add(amountOf(record));
                }
            }
        } else if ("meals".equals(normalizedMetric)) {
            for (DomainRecord meal : meals(Map.of(), timeRange)) {
                if (meal.getTimestamp() != null) {
                    buckets.computeIfAbsent(bucketStart(meal.getTimestamp(), period), key -> new ArrayList<>())
                            .add(1.0);
                }
            }
        } else {
            log.warn("⚠️ Unknown trend metric '{}'", metric);
        }

        List<TrendPoint> trend = new ArrayList<>();
        buckets.forEach((bucket, values) -> trend.add(new TrendPoint(bucket,
                values.stream().mapToDouble(Double::doubleValue).sum(), values.size())));
        return trend;
    }

    public SpendingAnalysis analyzeSpending(TimeRange timeRange) {
        Map<String, Object> expenses = Map.of(FILTER_TYPE, EXPENSE);
        AggregationResult total = calculateSum(expenses, timeRange);
        AggregationResult average = calculateAverage(expenses, timeRange);

        return SpendingAnalysis.builder()
                .totalSpent(total.getValue())
                .averagePerTransaction(average.getValue())
                .dailyAverage(calculateDailyAverages(timeRange).getOrDefault("daily_spending", 0.0))
                .categoryBreakdown(calculateSpendingByCategory(timeRange))
                .transactionCount(total.getDataPoints().size())
                .timeRange(timeRange)
                .build();
    }

    public NutritionAnalysis analyzeNutrition(TimeRange timeRange) {
        AggregationResult mealCount = calculateCount(Map.of(FILTER_DOMAINS, List.of("meals")), timeRange);
        double calories = meals(Map.of(), timeRange).stream()
                .map(meal -> meal.numberField("caloriesInt"))
                .filter(Objects::nonNull)
                .mapToDouble(Double::doubleValue)
                .sum();

        return NutritionAnalysis.builder()
                .totalMeals((int) mealCount.getValue())
                .totalCalories((int) calories)
                .dailyCalorieAverage(calculateDailyAverages(timeRange).getOrDefault("daily_calories", 0.0))
                .timeRange(timeRange)
                .build();
    }

    private List<DomainRecord> financeRecords(Map<String, Object> filters, TimeRange timeRange) {
        String type = stringFilter(filters, FILTER_TYPE);
        String category = stringFilter(filters, FILTER_CATEGORY);
        return repository.findByDomain(DomainRecordRepository.FINANCE, start(timeRange), end(timeRange)).stream()
                .filter(record -> type == null || type.equals(record.stringField("type")))
                .filter(record -> category == null || category.equalsIgnoreCase(Objects.toString(record.stringField("category"), "")))
                .collect(Collectors.toList());
    }

    private List<DomainRecord> meals(Map<String, Object> filters, TimeRange timeRange) {
        String mealType = stringFilter(filters, FILTER_MEAL_TYPE);
        return repository.findByDomain(DomainRecordRepository.MEALS, start(timeRange), end(timeRange)).stream()
                .filter(meal -> mealType == null || mealType.equalsIgnoreCase(mealTypeOf(meal)))
                .collect(Collectors.toList());
    }

    private List<DomainRecord> healthMetrics(Map<String, Object> filters, TimeRange timeRange) {
        String metricType = stringFilter(filters, FILTER_METRIC_TYPE);
        return repository.findByDomain(DomainRecordRepository.HEALTH, start(timeRange), end(timeRange)).stream()
                .filter(metric -> metricType == null || metricType.equalsIgnoreCase(metric.stringField("metricType")))
                .collect(Collectors.toList());
    }

    private DataPoint financePoint(DomainRecord record, double amount, double value) {
        String type = record.stringField("type");
        String label = EXPENSE.equals(type) ? "Expense" : "income".equals(type) ? "Income" : Objects.toString(type, "Record");
        return DataPoint.builder()
                .id(record.getId())
                .value(value)
                .description(String.format(Locale.ROOT, "%s: %s - %.2f",
                        label, Objects.toString(record.stringField("notes"), "Unnamed"), amount))
                .timestamp(record.getTimestamp())
                .category(record.stringField("category"))
                .metadata(metadata("type", type, "currency", record.stringField("currency"),
                        "category", record.stringField("category")))
                .build();
    }

    private DataPoint countPoint(DomainRecord record, String description, String category) {
        return DataPoint.builder()
                .id(record.getId())
                .value(1.0)
                .description(description)
                .timestamp(record.getTimestamp())
                .category(category)
                .build();
    }

    private double amountOf(DomainRecord record) {
        Double amount = record.numberField("amount");
        return amount != null ? amount : 0.0;
    }

    private String mealTypeOf(DomainRecord meal) {
        String mealType = meal.stringField("mealType");
        return mealType != null ? mealType : meal.stringField(FILTER_MEAL_TYPE);
    }

    private long dayCount(List<DomainRecord> records) {
        List<LocalDate> days = records.stream()
                .map(DomainRecord::getTimestamp)
                .filter(Objects::nonNull)
                .map(LocalDateTime::toLocalDate)
                .sorted()
                .collect(Collectors.toList());
        if (days.isEmpty()) {
            return 1;
        }
        return ChronoUnit.DAYS.between(days.get(0), days.get(days.size() - 1)) + 1;
    }

    private LocalDate bucketStart(LocalDateTime timestamp, String period) {
        LocalDate date = timestamp.toLocalDate();
        String normalized = period != null ? period.toLowerCase(Locale.ROOT) : "daily";
        switch (normalized) {
            case "weekly":
                return date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
            case "monthly":
                return date.withDayOfMonth(1);
            default:
                return date;
        }
    }

    @SuppressWarnings("unchecked")
    private List<String> domainsFilter(Map<String, Object> filters) {
        Object value = filters.get(FILTER_DOMAINS);
        if (value instanceof Collection && !((Collection<?>) value).isEmpty()) {
            return ((Collection<Object>) value).stream().map(String::valueOf).collect(Collectors.toList());
        }
        if (value instanceof String && !((String) value).isBlank()) {
            return List.of(((String) value).split("\\s*,\\s*"));
        }
        return DEFAULT_COUNT_DOMAINS;
    }

    private static String stringFilter(Map<String, Object> filters, String key) {
        Object value = filters.get(key);
        return value != null ? value.toString() : null;
    }

    private static boolean isTrue(Object value) {
        return Boolean.TRUE.equals(value) || "true".equalsIgnoreCase(String.valueOf(value));
    }

    private static Map<String, Object> metadata(Object... keyValues) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            if (keyValues[i + 1] != null) {
                metadata.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
            }
        }
        return metadata;
    }

    private static LocalDateTime start(TimeRange timeRange) {
        return timeRange != null ? timeRange.getStart() : null;
    }

    private static LocalDateTime end(TimeRange timeRange) {
        return timeRange != null ? timeRange.getEffectiveEnd() : null;
    }

    private static String describe(TimeRange timeRange) {
        return timeRange != null ? timeRange.getDescription() : "all time";
    }
}
