package com.lifebutler.assistant.service;

import com.lifebutler.assistant.config.PromptTemplateConfigLoader;
import com.lifebutler.assistant.model.DataPoint;
import com.lifebutler.assistant.model.GenerationType;
import com.lifebutler.assistant.model.SearchResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Builds the prompts and the deterministic texts used around answer generation: retrieved
 * context, template rendering, the no-data message and the no-model fallback.
 */
@Component
@Slf4j
public class PromptBuilder {

    static final String CONTEXT_HEADER = "## Relevant Information\n\n";
    static final String CALCULATION_TEMPLATE = "calculation";
    static final String HYBRID_TEMPLATE = "hybrid";

    private static final Pattern EXTRA_BLANK_LINES = Pattern.compile("\\n\\s*\\n\\s*\\n");

    private final PromptTemplateConfigLoader templates;

    public PromptBuilder(PromptTemplateConfigLoader templates) {
        this.templates = templates;
    }

    public String templateFor(GenerationType generationType) {
        return templates.getTemplate(generationType.name());
    }

    public String calculationTemplate() {
        return templates.getTemplate(CALCULATION_TEMPLATE);
    }

    public String hybridTemplate() {
        return templates.getTemplate(HYBRID_TEMPLATE);
    }

    /**
     * Numbered list of results with type and relevance. Stops before the entry that would
     * push the context past {@code maxChars}.
     */
    public String assembleContext(List<SearchResult> results, int maxChars) {
        StringBuilder context = new StringBuilder(CONTEXT_HEADER);
        int length = 0;
        for (int i = 0; i < results.size() && length < maxChars; i++) {
            SearchResult result = results.get(i);
            String entry = String.format(Locale.ROOT, "%d. %s\n   (Type: %s, Relevance: %.1f%%)\n\n",
                    i + 1, result.getText(), result.getObjectType(), result.getSimilarity() * 100);
            if (length + entry.length() > maxChars) {
                break;
            }
            context.append(entry);
            length += entry.length();
        }
        return context.toString();
    }

    /**
     * Renders {@code template} when given, otherwise the built-in assistant prompt.
     */
    public String buildPrompt(String query, String context, String template, String calculationSummary) {
        if (template == null || template.isBlank()) {
            log.debug("No prompt template given, using the default answer prompt");
            return defaultPrompt(query, context, calculationSummary);
        }

        String summaryBlock = calculationSummary != null && !calculationSummary.isEmpty()
                ? "\n**Calculation Summary:**\n" + calculationSummary + "\n"
                : "";
        String prompt = template
                .replace("{query}", query)
                .replace("{context}", context)
                .replace("{calculation_summary}", summaryBlock);
        return EXTRA_BLANK_LINES.matcher(prompt).replaceAll("\n\n");
    }

    public String noDataMessage(String query) {
        if (containsCjk(query)) {
            return "我在你的数据中没有找到可以回答“" + query + "”的相关信息。你可能需要添加更多数据，或者换一个问题试试。";
        }
        return "I couldn't find relevant information in your data to answer: \"" + query
                + "\". You may need to add more data or try a different question.";
    }

    /**
     * Answer built from the top results alone, used when no model is available or the call fails.
     */
    public String fallbackAnswer(String query, List<SearchResult> results, int shown) {
        StringBuilder sb = new StringBuilder();
        sb.append("Based on your data, here's what I found regarding \"").append(query).append("\":\n\n");

        int count = Math.min(shown, results.size());
        for (int i = 0; i < count; i++) {
            sb.append(i + 1).append(". ").append(results.get(i).getText()).append('\n');
            if (i < results.size() - 1) {
                sb.append('\n');
            }
        }
        if (results.size() > shown) {
            sb.append("...and ").append(results.size() - shown).append(" more related entries in your data.\n");
        }
        return sb.toString();
    }

    /**
     * Plain-text digest of calculation output, passed into prompts as {calculation_summary}
     * and used as the explanation when generation fails.
     */
    public String calculationSummary(Map<String, Object> calculations, Map<String, Object> aggregations) {
        StringBuilder sb = new StringBuilder();
        if (!calculations.isEmpty()) {
            sb.append("**Calculation Results:**\n");
            calculations.forEach((key, value) -> sb.append("• **").append(key).append("**: ")
                    .append(formatValue(value)).append('\n'));
            sb.append('\n');
        }
        if (!aggregations.isEmpty()) {
            sb.append("**Data Summary:**\n");
            aggregations.forEach((key, value) -> sb.append("• ").append(key).append(": ")
                    .append(formatValue(value)).append('\n'));
        }
        return sb.toString().trim();
    }

    public String dataPointSample(List<DataPoint> dataPoints, int sampleSize) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < Math.min(sampleSize, dataPoints.size()); i++) {
            DataPoint point = dataPoints.get(i);
            sb.append(i + 1).append(". ").append(point.getDescription()).append(": ")
                    .append(formatValue(point.getValue())).append('\n');
        }
        return sb.toString();
    }

    public static String formatValue(Object value) {
        if (value instanceof Double || value instanceof Float) {
            return String.format(Locale.ROOT, "%.2f", ((Number) value).doubleValue());
        }
        return String.valueOf(value);
    }

    public static boolean containsCjk(String text) {
        if (text == null) {
            return false;
        }
        return text.codePoints().anyMatch(cp -> cp >= 0x4E00 && cp <= 0x9FFF);
    }

    private String defaultPrompt(String query, String context, String calculationSummary) {
        StringBuilder sb = new StringBuilder();
        sb.append("You are a helpful personal AI assistant. A user has asked you a question about their personal data.\n\n");
        sb.append("User Question: ").append(query).append("\n\n");
        if (calculationSummary != null && !calculationSummary.isEmpty()) {
            sb.append("Calculation Summary: ").append(calculationSummary).append("\n\n");
        }
        sb.append(context).append("\n\n");
        sb.append("Please provide a helpful, accurate, and natural response based on the user's personal data above.\n");
        sb.append("Be conversational and focus on insights that would be useful to the user.\n");
        return sb.toString();
    }
}
