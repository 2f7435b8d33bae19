package com.lifebutler.assistant.service;

import com.lifebutler.assistant.config.AssistantProperties;
import com.lifebutler.assistant.config.PrototypeConfigLoader;
import com.lifebutler.assistant.model.IntentType;
import com.lifebutler.assistant.model.SemanticClassification;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Second classifier stage: word-overlap similarity against labelled example utterances.
 * The acceptance threshold grows with query length.
 */
@Component
@Slf4j
public class SemanticClassifier {

    private final PrototypeConfigLoader prototypes;
    private final AssistantProperties.Routing settings;

    public SemanticClassifier(PrototypeConfigLoader prototypes, AssistantProperties properties) {
        this.prototypes = prototypes;
        this.settings = properties.getRouting();
    }

    public SemanticClassification classify(String query) {
        int wordCount = query.split(" ").length;
        double threshold = dynamicThreshold(wordCount);

        SemanticClassification.SemanticClassificationBuilder result = SemanticClassification.builder()
                .dynamicThreshold(threshold);
        List<Double> ranked = new ArrayList<>();

        for (Map.Entry<IntentType, List<String>> entry : prototypes.getPrototypes().entrySet()) {
            double best = 0.0;
            String bestMatch = null;
            for (String prototype : entry.getValue()) {
                double similarity = jaccard(query, prototype);
                if (similarity > best) {
                    best = similarity;
                    bestMatch = prototype;
                }
            }
            result.score(entry.getKey(), best);
            if (bestMatch != null) {
                result.bestMatch(entry.getKey(), bestMatch);
            }
            ranked.add(best);
        }

        ranked.sort((a, b) -> Double.compare(b, a));
        double top = ranked.isEmpty() ? 0.0 : ranked.get(0);
        double margin = ranked.size() >= 2 ? top - ranked.get(1) : top;

        SemanticClassification classification = result
                .margin(margin)
                .meetsThreshold(!ranked.isEmpty() && top >= threshold)
                .build();
        log.debug("Semantic stage: scores={}, threshold={}, margin={}",
                classification.getScores(), String.format("%.3f", threshold), String.format("%.3f", margin));
        return classification;
    }

    double dynamicThreshold(int wordCount) {
        double threshold = settings.getSemanticBaseThreshold()
                + (wordCount - 5) * settings.getSemanticLengthAdjustment();
        return Math.max(settings.getSemanticMinThreshold(), Math.min(settings.getSemanticMaxThreshold(), threshold));
    }

    static double jaccard(String first, String second) {
        Set<String> a = words(first);
        Set<String> b = words(second);
        Set<String> union = new HashSet<>(a);
        union.addAll(b);
        if (union.isEmpty()) {
            return 0.0;
        }
        Set<String> intersection = new HashSet<>(a);
        intersection.retainAll(b);
        return (double) intersection.size() / union.size();
    }

    private static Set<String> words(String text) {
        return new HashSet<>(Arrays.asList(text.toLowerCase(Locale.ROOT).split(" ")));
    }
}
