package com.lifebutler.assistant.service;

import com.lifebutler.assistant.model.CalculationResult;
import com.lifebutler.assistant.model.DataPoint;
import com.lifebutler.assistant.model.HybridResult;
import com.lifebutler.assistant.model.ProcessingResult;
import com.lifebutler.assistant.model.RetrievalResult;
import com.lifebutler.assistant.model.SourceCitation;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Renders a processing result as the markdown text returned to the user.
 */
@Component
public class ResponseFormatter {

    static final int SHOWN_DATA_POINTS = 5;

    public String toResponseText(ProcessingResult result) {
        if (result instanceof CalculationResult) {
            return formatCalculation((CalculationResult) result);
        } else if (result instanceof RetrievalResult) {
            return formatRetrieval((RetrievalResult) result);
        } else if (result instanceof HybridResult) {
            return formatHybrid((HybridResult) result);
        }
        throw new IllegalArgumentException("Unknown result type: " + result);
    }

    private String formatCalculation(CalculationResult result) {
        StringBuilder sb = new StringBuilder();
        if (result.getExplanation() != null && !result.getExplanation().isBlank()) {
            sb.append("🤖 **AI Analysis**\n\n").append(result.getExplanation()).append("\n\n---\n\n");
        }

        sb.append("📊 **Calculation Results**\n\n");
        for (Map.Entry<String, Object> entry : result.getCalculations().entrySet()) {
            sb.append("• **").append(entry.getKey()).append("**: ")
                    .append(PromptBuilder.formatValue(entry.getValue())).append('\n');
        }

        if (!result.getAggregations().isEmpty()) {
            sb.append("\n📈 **Summary Statistics**\n");
            for (Map.Entry<String, Object> entry : result.getAggregations().entrySet()) {
                sb.append("• ").append(entry.getKey()).append(": ")
                        .append(PromptBuilder.formatValue(entry.getValue())).append('\n');
            }
        }

        List<DataPoint> points = result.getDataPoints();
        if (!points.isEmpty()) {
            sb.append("\n🔍 **Key Data Points** (").append(points.size()).append(" records analyzed)\n");
            for (DataPoint point : points.subList(0, Math.min(SHOWN_DATA_POINTS, points.size()))) {
                sb.append("• ").append(point.getDescription()).append('\n');
            }
        }
        return sb.toString();
    }

    private String formatRetrieval(RetrievalResult result) {
        StringBuilder sb = new StringBuilder();
        sb.append(result.getResponse()).append('\n');

        if (result.getAdvice() != null && !result.getAdvice().isEmpty()) {
            sb.append("\n💡 **Recommendations**\n").append(result.getAdvice()).append('\n');
        }

        List<SourceCitation> sources = result.getSources();
        if (!sources.isEmpty()) {
            sb.append("\n📚 **Sources**\n");
            for (int i = 0; i < sources.size(); i++) {
                SourceCitation source = sources.get(i);
                sb.append(i + 1).append(". ").append(source.getTitle())
                        .append(" (").append(source.getType()).append(")\n");
            }
        }
        return sb.toString();
    }

    private String formatHybrid(HybridResult result) {
        StringBuilder sb = new StringBuilder("🔬 **Comprehensive Analysis**\n\n");
        if (result.getSynthesis() != null && !result.getSynthesis().isEmpty()) {
            sb.append(result.getSynthesis()).append("\n\n");
        }

        sb.append("📊 **Quantitative Analysis**\n");
        for (Map.Entry<String, Object> entry : result.getCalculationResult().getCalculations().entrySet()) {
            sb.append("• **").append(entry.getKey()).append("**: ")
                    .append(PromptBuilder.formatValue(entry.getValue())).append('\n');
        }

        sb.append("\n🧠 **Contextual Insights**\n").append(result.getRetrievalResult().getResponse()).append('\n');

        String advice = result.getRetrievalResult().getAdvice();
        if (advice != null) {
            sb.append("\n💡 **Actionable Recommendations**\n").append(advice).append('\n');
        }
        return sb.toString();
    }
}
