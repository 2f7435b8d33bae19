package com.lifebutler.assistant.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lifebutler.assistant.client.ChatCompleter;
import com.lifebutler.assistant.config.AssistantProperties;
import com.lifebutler.assistant.model.ChatMessage;
import com.lifebutler.assistant.model.IntentType;
import com.lifebutler.assistant.model.LlmClassification;
import com.lifebutler.assistant.model.QueryContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Last classifier stage, consulted only when the rule and semantic stages are both unsure.
 * Asks the chat provider for a JSON verdict and falls back to a keyword heuristic when no
 * provider is configured or its answer cannot be used.
 */
@Component
@Slf4j
public class LlmClassifier {

    static final String SYSTEM_PROMPT = "You classify questions about a person's own life data. "
            + "Answer with a single JSON object and nothing else: "
            + "{\"intent\": \"aggregate|retrieval|reminder\", \"confidence\": 0.0-1.0, "
            + "\"reason\": \"short explanation\", \"slots\": {}}. "
            + "aggregate = numbers computed over records (totals, averages, counts, trends). "
            + "retrieval = descriptive answers drawn from records (what happened, why, advice). "
            + "reminder = scheduling or reminding about something.";

    private final ChatCompleter chatCompleter;
    private final AssistantProperties.Routing settings;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public LlmClassifier(Optional<ChatCompleter> chatCompleter, AssistantProperties properties) {
        this.chatCompleter = chatCompleter.orElse(null);
        this.settings = properties.getRouting();
    }

    public LlmClassification classify(String query, QueryContext context) {
        if (chatCompleter != null) {
            try {
                String reply = chatCompleter.chat(List.of(
                        ChatMessage.system(SYSTEM_PROMPT),
                        ChatMessage.user(query)), 0.0);
                LlmClassification parsed = parse(reply);
                if (parsed != null) {
                    log.debug("LLM stage: {} ({})", parsed.getIntent(), parsed.getConfidence());
                    return parsed;
                }
                log.warn("⚠️ Unusable classification reply, using keyword heuristic");
            } catch (Exception e) {
                log.warn("⚠️ LLM classification failed: {}, using keyword heuristic", e.getMessage());
            }
        }
        return heuristic(query, context);
    }

    LlmClassification parse(String reply) {
        if (reply == null) {
            return null;
        }
        int open = reply.indexOf('{');
        int close = reply.lastIndexOf('}');
        if (open < 0 || close <= open) {
            return null;
        }
        try {
            JsonNode node = objectMapper.readTree(reply.substring(open, close + 1));
            IntentType intent = IntentType.fromName(node.path("intent").asText(null));
            if (intent == null) {
                return null;
            }
            double confidence = Math.max(0.0, Math.min(1.0, node.path("confidence").asDouble(0.5)));

            LlmClassification.LlmClassificationBuilder builder = LlmClassification.builder()
                    .intent(intent)
                    .confidence(confidence)
                    .reason(node.path("reason").asText(""))
                    .modelBacked(true);
            JsonNode slots = node.path("slots");
            if (slots.isObject()) {
                Iterator<Map.Entry<String, JsonNode>> fields = slots.fields();
                while (fields.hasNext()) {
                    Map.Entry<String, JsonNode> field = fields.next();
                    builder.slot(field.getKey(), objectMapper.treeToValue(field.getValue(), Object.class));
                }
            }
            return builder.build();

        } catch (Exception e) {
            log.debug("Could not parse classification reply: {}", e.getMessage());
            return null;
        }
    }

    LlmClassification heuristic(String query, QueryContext context) {
        String lower = query.toLowerCase(Locale.ROOT);
        LlmClassification.LlmClassificationBuilder builder = LlmClassification.builder()
                .confidence(settings.getHeuristicLlmConfidence())
                .modelBacked(false);

        if (lower.contains("much") || lower.contains("total") || lower.contains("spend")) {
            String timeframe = context != null && context.getTimeRange() != null
                    ? context.getTimeRange().getDescription()
                    : "unspecified";
            return builder.intent(IntentType.AGGREGATE)
                    .reason("Query asks for quantitative information")
                    .slot("operation", "sum")
                    .slot("domain", "finance")
                    .slot("timeframe", timeframe)
                    .build();
        }
        if (lower.contains("tell") || lower.contains("explain") || lower.contains("show")) {
            return builder.intent(IntentType.RETRIEVAL)
                    .reason("Query asks for descriptive information")
                    .slot("domains", context != null ? context.getTargetDomains() : List.of())
                    .slot("searchType", "descriptive")
                    .build();
        }
        return builder.intent(IntentType.RETRIEVAL)
                .reason("Default to retrieval for unclear queries")
                .build();
    }
}
