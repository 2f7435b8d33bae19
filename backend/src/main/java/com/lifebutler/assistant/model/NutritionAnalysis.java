package com.lifebutler.assistant.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class NutritionAnalysis {

    int totalMeals;

    int totalCalories;

    double dailyCalorieAverage;

    TimeRange timeRange;

    public String toSummaryText() {
        return "**Nutrition Analysis**\n"
                + "- Total meals: " + totalMeals + "\n"
                + "- Total calories: " + totalCalories + " kcal\n"
                + String.format("- Daily average: %.0f kcal%n", dailyCalorieAverage);
    }
}
