package com.lifebutler.assistant.model;

public enum EmbeddingState {
    NOT_STARTED,
    IN_PROGRESS,
    COMPLETE
}
