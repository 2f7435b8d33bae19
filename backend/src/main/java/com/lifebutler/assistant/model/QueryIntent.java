package com.lifebutler.assistant.model;

public enum QueryIntent {
    SEARCH,
    ANALYSIS,
    ADVICE,
    SUMMARY,
    COMPARISON
}
