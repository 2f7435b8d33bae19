package com.lifebutler.assistant.model;

public enum AggregationType {
    SUM,
    AVERAGE,
    COUNT,
    TREND,
    GROUP_BY
}
