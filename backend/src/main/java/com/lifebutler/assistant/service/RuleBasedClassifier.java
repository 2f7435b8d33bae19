package com.lifebutler.assistant.service;

import com.lifebutler.assistant.config.AssistantProperties;
import com.lifebutler.assistant.config.IntentRuleConfigLoader;
import com.lifebutler.assistant.model.IntentRuleSet;
import com.lifebutler.assistant.model.IntentType;
import com.lifebutler.assistant.model.RuleClassification;
import com.lifebutler.assistant.model.WeightedKeyword;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * First classifier stage: weighted keyword tables in English and Chinese. The query is scored
 * together with a phrase-translated variant so either language's table can match.
 */
@Component
@Slf4j
public class RuleBasedClassifier {

    static final String ZH = "zh";
    static final String EN = "en";

    private final IntentRuleConfigLoader rules;
    private final AssistantProperties.Routing settings;

    public RuleBasedClassifier(IntentRuleConfigLoader rules, AssistantProperties properties) {
        this.rules = rules;
        this.settings = properties.getRouting();
    }

    public RuleClassification classify(String query) {
        IntentRuleSet ruleSet = rules.getRules();
        String language = detectLanguage(query);
        List<String> variants = queryVariants(query, language, ruleSet);

        List<String> matched = new ArrayList<>();
        KeywordScore aggregate = score(ruleSet.getAggregate(), variants, matched);
        KeywordScore retrieval = score(ruleSet.getRetrieval(), variants, matched);
        double reminderRaw = scoreReminder(ruleSet.getReminder(), variants, matched);

        RuleClassification.RuleClassificationBuilder result = RuleClassification.builder()
                .detectedLanguage(language)
                .queryVariants(variants)
                .matchedKeywords(matched)
                .rawAggregateScore(aggregate.total)
                .rawRetrievalScore(retrieval.total);

        double max = 0.0;
        if (aggregate.total > 0) {
            double normalized = clamp(aggregate.total / settings.getRuleScoreDivisor());
            result.score(IntentType.AGGREGATE, normalized);
            max = Math.max(max, normalized);
        }
        if (retrieval.total > 0) {
            double normalized = clamp(retrieval.total / settings.getRuleScoreDivisor());
            result.score(IntentType.RETRIEVAL, normalized);
            max = Math.max(max, normalized);
        }
        if (reminderRaw > 0) {
            double normalized = clamp(reminderRaw / settings.getReminderScoreDivisor());
            result.score(IntentType.REMINDER, normalized);
            max = Math.max(max, normalized);
        }

        boolean mixed = matchesMixedPattern(query)
                || (aggregate.intentSignal > settings.getMixedRawScoreThreshold()
                && retrieval.intentSignal > settings.getMixedRawScoreThreshold());

        RuleClassification classification = result
                .highConfidence(max > settings.getHighConfidenceThreshold())
                .mixedQuery(mixed)
                .build();

        log.debug("Rule stage: lang={}, scores={}, matches={}, mixed={}",
                language, classification.getScores(), matched, mixed);
        return classification;
    }

    /**
     * "zh" if the text has any CJK unified ideograph, otherwise "en".
     */
    public static String detectLanguage(String query) {
        return PromptBuilder.containsCjk(query) ? ZH : EN;
    }

    List<String> queryVariants(String query, String language, IntentRuleSet ruleSet) {
        String lower = query.toLowerCase(Locale.ROOT);
        Map<String, String> dictionary = ZH.equals(language)
                ? ruleSet.getTranslationsZhEn()
                : ruleSet.getTranslationsEnZh();

        String translated = lower;
        for (Map.Entry<String, String> entry : dictionary.entrySet()) {
            translated = translated.replace(entry.getKey(), entry.getValue());
        }
        return List.of(lower, translated);
    }

    private KeywordScore score(Map<String, List<WeightedKeyword>> tables, List<String> variants, List<String> matched) {
        KeywordScore score = new KeywordScore();
        for (List<WeightedKeyword> table : tables.values()) {
            for (WeightedKeyword keyword : table) {
                String needle = keyword.getKeyword().toLowerCase(Locale.ROOT);
                for (String variant : variants) {
                    if (variant.contains(needle)) {
                        score.total += keyword.getWeight();
                        if (keyword.isIntentSignal()) {
                            score.intentSignal += keyword.getWeight();
                        }
                        matched.add(keyword.getKeyword());
                    }
                }
            }
        }
        return score;
    }

    private double scoreReminder(Map<String, List<String>> tables, List<String> variants, List<String> matched) {
        double total = 0.0;
        for (List<String> table : tables.values()) {
            for (String keyword : table) {
                String needle = keyword.toLowerCase(Locale.ROOT);
                for (String variant : variants) {
                    if (variant.contains(needle)) {
                        total += 1.0;
                        matched.add(keyword);
                    }
                }
            }
        }
        return total;
    }

    private boolean matchesMixedPattern(String query) {
        for (Pattern pattern : rules.getMixedPatterns()) {
            if (pattern.matcher(query).find()) {
                return true;
            }
        }
        return false;
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static final class KeywordScore {
        private double total;
        private double intentSignal;
    }
}
