package com.lifebutler.assistant.model;

/**
 * Coarse category of a query as seen by the intent classifier.
 */
public enum IntentType {
    AGGREGATE,
    RETRIEVAL,
    REMINDER;

    /**
     * Lenient lookup used when parsing model output ("aggregate", "Retrieval", ...).
     */
    public static IntentType fromName(String name) {
        if (name == null) {
            return null;
        }
        String normalized = name.trim().toUpperCase();
        for (IntentType type : values()) {
            if (type.name().equals(normalized)) {
                return type;
            }
        }
        return null;
    }
}
