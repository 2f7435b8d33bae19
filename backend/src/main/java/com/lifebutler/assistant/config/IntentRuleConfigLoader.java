package com.lifebutler.assistant.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lifebutler.assistant.model.IntentRuleSet;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Loads the rule-stage keyword tables, phrase translations and mixed-query patterns from
 * intent-rules.json at startup.
 */
@Component
@Slf4j
@Getter
public class IntentRuleConfigLoader {

    static final String RESOURCE = "/intent-rules.json";

    private IntentRuleSet rules = new IntentRuleSet();
    private List<Pattern> mixedPatterns = new ArrayList<>();
    private final ObjectMapper objectMapper = new ObjectMapper();

    @PostConstruct
    public void load() {
        try (InputStream is = getClass().getResourceAsStream(RESOURCE)) {
            if (is == null) {
                log.error("❌ intent-rules.json not found in classpath resources!");
                log.warn("⚠️ Rule-based intent scoring will return zero scores");
                return;
            }

            rules = objectMapper.readValue(is, IntentRuleSet.class);
            mixedPatterns = compile(rules.getMixedPatterns());

            log.info("✅ Loaded intent rules: {} aggregate / {} retrieval languages, {} mixed patterns",
                    rules.getAggregate().size(), rules.getRetrieval().size(), mixedPatterns.size());

        } catch (Exception e) {
            log.error("❌ Error loading intent-rules.json: {}", e.getMessage(), e);
            rules = new IntentRuleSet();
            mixedPatterns = new ArrayList<>();
        }
    }

    public boolean isLoaded() {
        return rules != null && !rules.isEmpty();
    }

    private List<Pattern> compile(List<String> expressions) {
        List<Pattern> patterns = new ArrayList<>();
        for (String expression : expressions) {
            try {
                patterns.add(Pattern.compile(expression, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));
            } catch (PatternSyntaxException e) {
                log.warn("⚠️ Skipping invalid mixed-query pattern '{}': {}", expression, e.getDescription());
            }
        }
        return patterns;
    }
}
