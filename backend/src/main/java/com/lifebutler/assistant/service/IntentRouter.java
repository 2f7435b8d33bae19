package com.lifebutler.assistant.service;

import com.lifebutler.assistant.config.AssistantProperties;
import com.lifebutler.assistant.model.IntentType;
import com.lifebutler.assistant.model.LlmClassification;
import com.lifebutler.assistant.model.ProcessingPath;
import com.lifebutler.assistant.model.QueryContext;
import com.lifebutler.assistant.model.Routing;
import com.lifebutler.assistant.model.RoutingDecision;
import com.lifebutler.assistant.model.RuleClassification;
import com.lifebutler.assistant.model.SemanticClassification;
import com.lifebutler.assistant.model.TimeRange;
import com.lifebutler.assistant.repository.DomainRecordRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Classifies a query with the rule, semantic and (when both are unsure) LLM stages, fuses the
 * three verdicts and picks a processing path.
 */
@Service
@Slf4j
public class IntentRouter {

    private final QueryPlanner queryPlanner;
    private final RuleBasedClassifier ruleClassifier;
    private final SemanticClassifier semanticClassifier;
    private final LlmClassifier llmClassifier;
    private final DomainRecordRepository recordRepository;
    private final RoutingSpecFactory specFactory;
    private final AssistantProperties.Routing settings;

    public IntentRouter(QueryPlanner queryPlanner,
                        RuleBasedClassifier ruleClassifier,
                        SemanticClassifier semanticClassifier,
                        LlmClassifier llmClassifier,
                        DomainRecordRepository recordRepository,
                        RoutingSpecFactory specFactory,
                        AssistantProperties properties) {
        this.queryPlanner = queryPlanner;
        this.ruleClassifier = ruleClassifier;
        this.semanticClassifier = semanticClassifier;
        this.llmClassifier = llmClassifier;
        this.recordRepository = recordRepository;
        this.specFactory = specFactory;
        this.settings = properties.getRouting();
    }

    public Routing route(String query) {
        QueryContext context = queryPlanner.plan(query);
        RoutingDecision decision = classify(query, context);

        ProcessingPath path;
        if (decision.isHybrid()) {
            path = ProcessingPath.HYBRID;
        } else if (decision.getPrimaryIntent() == IntentType.AGGREGATE) {
            path = ProcessingPath.CALCULATION;
        } else {
            path = ProcessingPath.RETRIEVAL;
        }

        Routing.RoutingBuilder routing = Routing.builder()
                .originalQuery(query)
                .processingPath(path)
                .confidence(decision.getConfidence())
                .queryContext(context)
                .decision(decision);
        if (path != ProcessingPath.RETRIEVAL) {
            routing.calculationSpecs(specFactory.calculationSpecs(query, context));
        }
        if (path != ProcessingPath.CALCULATION) {
            routing.retrievalSpecs(specFactory.retrievalSpecs(query, context));
        }

        log.info("🔄 Routed '{}' to {} (intent={}, confidence={})", query, path,
                decision.getPrimaryIntent(), String.format("%.3f", decision.getConfidence()));
        return routing.build();
    }

    public RoutingDecision classify(String query, QueryContext context) {
        RuleClassification rule = ruleClassifier.classify(query);
        SemanticClassification semantic = semanticClassifier.classify(query);
        log.debug("Rule hits: {} -> {}", rule.getMatchedKeywords(), rule.getScores());
        log.debug("Semantic scores: {} (threshold {})", semantic.getScores(), semantic.getDynamicThreshold());

        LlmClassification llm = null;
        if (!rule.isHighConfidence() && !semantic.isMeetsThreshold()) {
            llm = llmClassifier.classify(query, context);
        }

        double penalty = dataMissingPenalty(context);
        Map<IntentType, Double> fused = fuse(rule, semantic, llm, penalty);

        IntentType primary = null;
        double confidence = 0.0;
        for (Map.Entry<IntentType, Double> entry : fused.entrySet()) {
            if (primary == null || entry.getValue() > confidence) {
                primary = entry.getKey();
                confidence = entry.getValue();
            }
        }
        if (primary == null || confidence <= 0.0) {
            if (semantic.isMeetsThreshold() && semantic.getTopIntent() != null) {
                primary = semantic.getTopIntent();
                confidence = semantic.getTopScore();
            } else {
                primary = IntentType.RETRIEVAL;
                confidence = settings.getFallbackConfidence();
            }
        }

        double aggregate = fused.getOrDefault(IntentType.AGGREGATE, 0.0);
        double retrieval = fused.getOrDefault(IntentType.RETRIEVAL, 0.0);
        boolean hybrid = rule.isMixedQuery()
                || (aggregate > settings.getHybridThreshold() && retrieval > settings.getHybridThreshold());

        return RoutingDecision.builder()
                .primaryIntent(primary)
                .confidence(Math.max(0.0, Math.min(1.0, confidence)))
                .hybrid(hybrid)
                .mixedQuery(rule.isMixedQuery())
                .fusedScores(fused)
                .ruleResult(rule)
                .semanticResult(semantic)
                .llmResult(llm)
                .dataMissingPenalty(penalty)
                .build();
    }

    Map<IntentType, Double> fuse(RuleClassification rule, SemanticClassification semantic,
                                 LlmClassification llm, double penalty) {
        Map<IntentType, Double> fused = new EnumMap<>(IntentType.class);
        rule.getScores().forEach((intent, score) ->
                fused.merge(intent, score * settings.getRuleWeight(), Double::sum));
        semantic.getScores().forEach((intent, score) ->
                fused.merge(intent, score * settings.getSemanticWeight(), Double::sum));
        if (llm != null && llm.getIntent() != null) {
            fused.merge(llm.getIntent(), settings.getLlmWeight() * llm.getConfidence(), Double::sum);
        }

        double deduction = settings.getDataMissingWeight() * penalty;
        if (deduction > 0) {
            fused.computeIfPresent(IntentType.AGGREGATE, (intent, score) -> score - deduction);
            fused.computeIfPresent(IntentType.RETRIEVAL, (intent, score) -> score - deduction);
        }
        return fused;
    }

    /**
     * Fraction of the query's target domains with no records in its time range.
     */
    double dataMissingPenalty(QueryContext context) {
        List<String> domains = context.getTargetDomains();
        if (domains.isEmpty()) {
            return 0.0;
        }
        TimeRange timeRange = context.getTimeRange();
        LocalDateTime start = timeRange != null ? timeRange.getStart() : null;
        LocalDateTime end = timeRange != null ? timeRange.getEffectiveEnd() : null;

        int missing = 0;
        for (String domain : domains) {
            if (recordRepository.findByDomain(domain, start, end).isEmpty()) {
                missing++;
            }
        }
        return (double) missing / domains.size();
    }
}
