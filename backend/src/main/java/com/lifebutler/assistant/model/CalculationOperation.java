package com.lifebutler.assistant.model;

public enum CalculationOperation {
    SUM,
    AVERAGE,
    COUNT,
    TREND,
    GROUPING
}
