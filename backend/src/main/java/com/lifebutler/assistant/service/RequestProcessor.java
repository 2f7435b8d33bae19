package com.lifebutler.assistant.service;

import com.lifebutler.assistant.config.AssistantProperties;
import com.lifebutler.assistant.model.AggregationResult;
import com.lifebutler.assistant.model.AggregationType;
import com.lifebutler.assistant.model.CalculationResult;
import com.lifebutler.assistant.model.CalculationSpecs;
import com.lifebutler.assistant.model.DataPoint;
import com.lifebutler.assistant.model.GenerationType;
import com.lifebutler.assistant.model.HybridResult;
import com.lifebutler.assistant.model.ProcessingResult;
import com.lifebutler.assistant.model.RetrievalResult;
import com.lifebutler.assistant.model.RetrievalSpecs;
import com.lifebutler.assistant.model.Routing;
import com.lifebutler.assistant.model.SearchFilters;
import com.lifebutler.assistant.model.SearchResult;
import com.lifebutler.assistant.model.SourceCitation;
import com.lifebutler.assistant.model.TrendPoint;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.stream.Collectors;

/**
 * Executes a routed query on the calculation, retrieval or hybrid path.
 */
@Service
@Slf4j
public class RequestProcessor {

    static final int CITATION_TITLE_LENGTH = 50;

    private final DataAggregator dataAggregator;
    private final RagPipeline ragPipeline;
    private final PromptBuilder promptBuilder;
    private final ExecutorService hybridExecutor;
    private final AssistantProperties.Processor settings;
    private final Clock clock;

    public RequestProcessor(DataAggregator dataAggregator,
                            RagPipeline ragPipeline,
                            PromptBuilder promptBuilder,
                            @Qualifier("hybridExecutor") ExecutorService hybridExecutor,
                            AssistantProperties properties,
                            Clock clock) {
        this.dataAggregator = dataAggregator;
        this.ragPipeline = ragPipeline;
        this.promptBuilder = promptBuilder;
        this.hybridExecutor = hybridExecutor;
        this.settings = properties.getProcessor();
        this.clock = clock;
    }

    /**
     * Never throws. Failures on any path come back as a zero-confidence retrieval result.
     */
    public ProcessingResult process(Routing routing) {
        Instant started = clock.instant();
        try {
            switch (routing.getProcessingPath()) {
                case CALCULATION:
                    return executeCalculation(routing.getCalculationSpecs(), routing.getOriginalQuery());
                case HYBRID:
                    return executeHybrid(routing.getCalculationSpecs(), routing.getRetrievalSpecs(),
                            routing.getOriginalQuery());
                case RETRIEVAL:
                default:
                    return executeRetrieval(routing.getRetrievalSpecs(), routing.getOriginalQuery());
            }
        } catch (Exception e) {
            Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
            log.error("❌ Processing failed for '{}': {}", routing.getOriginalQuery(), cause.getMessage(), cause);
            return RetrievalResult.builder()
                    .query(routing.getOriginalQuery())
                    .processingTime(Duration.between(started, clock.instant()))
                    .confidence(0.0)
                    .response("Sorry, I encountered an error while processing your request: " + cause.getMessage())
                    .generationType(GenerationType.FACTUAL)
                    .build();
        }
    }

    public CalculationResult executeCalculation(CalculationSpecs specs, String query) {
        Instant started = clock.instant();
        Map<String, Object> calculations = new LinkedHashMap<>();
        Map<String, Object> aggregations = new LinkedHashMap<>();
        List<DataPoint> dataPoints = new ArrayList<>();

        for (AggregationType aggregation : specs.getAggregations()) {
            switch (aggregation) {
                case SUM: {
                    AggregationResult result = dataAggregator.calculateSum(specs.getFilters(), specs.getTimeRange());
                    calculations.put("Total", result.getValue());
                    dataPoints.addAll(result.getDataPoints());
                    break;
                }
                case AVERAGE: {
                    AggregationResult result = dataAggregator.calculateAverage(specs.getFilters(), specs.getTimeRange());
                    calculations.put("Average", result.getValue());
                    dataPoints.addAll(result.getDataPoints());
                    break;
                }
                case COUNT: {
                    AggregationResult result = dataAggregator.calculateCount(specs.getFilters(), specs.getTimeRange());
                    calculations.put("Count", result.getValue());
                    dataPoints.addAll(result.getDataPoints());
                    break;
                }
                case TREND: {
                    String period = trendPeriod(specs.getGroupBy());
                    List<TrendPoint> trend = dataAggregator.calculateTrends("spending", period, specs.getTimeRange());
                    calculations.put("Trend (" + period + ")", describeTrend(trend));
                    break;
                }
                case GROUP_BY: {
                    dataAggregator.calculateSpendingByCategory(specs.getTimeRange())
                            .forEach((category, total) -> calculations.put("By category: " + category, total));
                    break;
                }
                default:
                    log.debug("No handler for aggregation {}", aggregation);
            }
        }

        if (!dataPoints.isEmpty()) {
            aggregations.put("Data Points", dataPoints.size());
            aggregations.put("Date Range", formatDateRange(dataPoints));
        }

        String summary = promptBuilder.calculationSummary(calculations, aggregations);
        String explanation;
        try {
            explanation = ragPipeline.answer(query, SearchFilters.of(null, specs.getTimeRange()),
                    promptBuilder.calculationTemplate(), summary);
        } catch (Exception e) {
            log.info("⚠️ Calculation explanation failed, using summary: {}", e.getMessage());
            explanation = summary;
        }

        return CalculationResult.builder()
                .query(query)
                .processingTime(Duration.between(started, clock.instant()))
                .confidence(settings.getCalculationConfidence())
                .calculations(calculations)
                .aggregations(aggregations)
                .dataPoints(dataPoints)
                .explanation(explanation)
                .build();
    }

    public RetrievalResult executeRetrieval(RetrievalSpecs specs, String query) {
        Instant started = clock.instant();
        SearchFilters filters = SearchFilters.of(specs.getDomainFocus(), specs.getTimeRange());

        List<SearchResult> results = ragPipeline.search(query, filters, specs.getContextNeeds().getSearchLimit());
        String response = ragPipeline.answer(query, filters, promptBuilder.templateFor(specs.getGenerationType()), null);

        List<SourceCitation> sources = results.stream()
                .map(this::toCitation)
                .collect(Collectors.toList());

        return RetrievalResult.builder()
                .query(query)
                .processingTime(Duration.between(started, clock.instant()))
                .confidence(retrievalConfidence(results))
                .response(response)
                .sources(sources)
                .generationType(specs.getGenerationType())
                .build();
    }

    /**
     * Runs both halves on the hybrid pool and joins them before synthesis.
     */
    public HybridResult executeHybrid(CalculationSpecs calculationSpecs, RetrievalSpecs retrievalSpecs, String query) {
        Instant started = clock.instant();

        CompletableFuture<CalculationResult> calculation =
                CompletableFuture.supplyAsync(() -> executeCalculation(calculationSpecs, query), hybridExecutor);
        CompletableFuture<RetrievalResult> retrieval =
                CompletableFuture.supplyAsync(() -> executeRetrieval(retrievalSpecs, query), hybridExecutor);

        CalculationResult calculationResult = calculation.join();
        RetrievalResult retrievalResult = retrieval.join();

        return HybridResult.builder()
                .query(query)
                .processingTime(Duration.between(started, clock.instant()))
                .confidence((calculationResult.getConfidence() + retrievalResult.getConfidence()) / 2)
                .calculationResult(calculationResult)
                .retrievalResult(retrievalResult)
                .synthesis(synthesize(query, calculationResult, retrievalResult, retrievalSpecs))
                .build();
    }

    private String synthesize(String query, CalculationResult calculation, RetrievalResult retrieval,
                              RetrievalSpecs retrievalSpecs) {
        try {
            String summary = promptBuilder.calculationSummary(calculation.getCalculations(), calculation.getAggregations());
            String synthesis = ragPipeline.answer(query,
                    SearchFilters.of(retrievalSpecs.getDomainFocus(), retrievalSpecs.getTimeRange()),
                    promptBuilder.hybridTemplate(), summary);
            if (synthesis != null && !synthesis.isBlank()) {
                return synthesis;
            }
            log.info("⚠️ Empty synthesis, falling back to rule-based");
        } catch (Exception e) {
            log.info("⚠️ Synthesis failed, falling back to rule-based: {}", e.getMessage());
        }
        return ruleBasedSynthesis(calculation, retrieval);
    }

    String ruleBasedSynthesis(CalculationResult calculation, RetrievalResult retrieval) {
        StringBuilder sb = new StringBuilder();
        if (!calculation.getCalculations().isEmpty()) {
            Map.Entry<String, Object> main = calculation.getCalculations().entrySet().iterator().next();
            sb.append("Based on your data analysis:\n");
            sb.append("• **").append(main.getKey()).append("**: ")
                    .append(PromptBuilder.formatValue(main.getValue())).append("\n\n");
        }
        sb.append("**Analysis**: ").append(retrieval.getResponse()).append("\n\n");
        if (retrieval.getAdvice() != null) {
            sb.append("**Key Insights**: ").append(retrieval.getAdvice()).append('\n');
        }
        return sb.toString();
    }

    private SourceCitation toCitation(SearchResult result) {
        String text = Objects.toString(result.getText(), "");
        String title = text.length() > CITATION_TITLE_LENGTH
                ? text.substring(0, CITATION_TITLE_LENGTH) + "..."
                : text;
        return SourceCitation.builder()
                .id(result.getId())
                .title(title)
                .type(result.getObjectType())
                .timestamp(LocalDateTime.now(clock))
                .relevanceScore(result.getSimilarity())
                .snippet(text)
                .build();
    }

    static double retrievalConfidence(List<SearchResult> results) {
        if (results.isEmpty()) {
            return 0.0;
        }
        double mean = results.stream().mapToDouble(SearchResult::getSimilarity).average().orElse(0.0);
        return Math.max(0.0, Math.min(1.0, mean));
    }

    static String formatDateRange(List<DataPoint> dataPoints) {
        List<LocalDate> dates = dataPoints.stream()
                .map(DataPoint::getTimestamp)
                .filter(Objects::nonNull)
                .map(LocalDateTime::toLocalDate)
                .sorted(Comparator.naturalOrder())
                .collect(Collectors.toList());
        if (dates.isEmpty()) {
            return "No data";
        }
        LocalDate first = dates.get(0);
        LocalDate last = dates.get(dates.size() - 1);
        return first.equals(last) ? first.toString() : first + " to " + last;
    }

    private static String trendPeriod(List<String> groupBy) {
        if (groupBy.contains("day")) {
            return "daily";
        }
        if (groupBy.contains("week")) {
            return "weekly";
        }
        return "monthly";
    }

    private static String describeTrend(List<TrendPoint> trend) {
        if (trend.isEmpty()) {
            return "No data";
        }
        return trend.stream()
                .map(point -> point.getPeriod() + ": " + PromptBuilder.formatValue(point.getValue()))
                .collect(Collectors.joining(", "));
    }
}
