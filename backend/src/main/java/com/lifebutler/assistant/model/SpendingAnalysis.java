package com.lifebutler.assistant.model;

import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Value
@Builder
public class SpendingAnalysis {

    double totalSpent;

    double averagePerTransaction;

    double dailyAverage;

    Map<String, Double> categoryBreakdown;

    int transactionCount;

    TimeRange timeRange;

    public String toSummaryText() {
        StringBuilder sb = new StringBuilder();
        sb.append("**Spending Analysis**\n");
        sb.append(String.format("- Total spent: %.2f%n", totalSpent));
        sb.append(String.format("- Average per transaction: %.2f%n", averagePerTransaction));
        sb.append(String.format("- Daily average: %.2f%n", dailyAverage));
        sb.append("- Transactions: ").append(transactionCount).append('\n');

        if (categoryBreakdown != null && !categoryBreakdown.isEmpty()) {
            sb.append("\n**By category:**\n");
            List<Map.Entry<String, Double>> sorted = new ArrayList<>(categoryBreakdown.entrySet());
            sorted.sort(Map.Entry.<String, Double>comparingByValue().reversed());
            for (Map.Entry<String, Double> entry : sorted.subList(0, Math.min(5, sorted.size()))) {
                double share = totalSpent > 0 ? entry.getValue() / totalSpent * 100 : 0.0;
                sb.append(String.format("- %s: %.2f (%.1f%%)%n", entry.getKey(), entry.getValue(), share));
            }
        }

        sb.append("\n**Time range**: ").append(timeRange != null ? timeRange.getDescription() : "all time").append('\n');
        return sb.toString();
    }
}
