package com.lifebutler.assistant.model;

public enum GenerationType {
    FACTUAL,
    ANALYTICAL,
    ADVISORY,
    NARRATIVE,
    SUMMARY
}
