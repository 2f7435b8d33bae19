package com.lifebutler.assistant.model;

public enum ProcessingPath {
    CALCULATION,
    RETRIEVAL,
    HYBRID
}
