package com.lifebutler.assistant.model;

public enum TimePeriod {
    TODAY("today"),
    THIS_WEEK("this week"),
    LAST_WEEK("last week"),
    THIS_MONTH("this month"),
    LAST_MONTH("last month"),
    THIS_YEAR("this year"),
    LAST_YEAR("last year");

    private final String label;

    TimePeriod(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
